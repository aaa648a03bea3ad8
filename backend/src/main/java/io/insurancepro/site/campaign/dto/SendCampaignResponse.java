package io.insurancepro.site.campaign.dto;

import io.insurancepro.site.campaign.CampaignStatus;

/** Reply of the send endpoint. {@code status} is the campaign status when the reply was built. */
public record SendCampaignResponse(
    boolean success, String message, int sent, int failed, CampaignStatus status) {}
