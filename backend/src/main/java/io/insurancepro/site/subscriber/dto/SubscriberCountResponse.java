package io.insurancepro.site.subscriber.dto;

public record SubscriberCountResponse(long count) {}
