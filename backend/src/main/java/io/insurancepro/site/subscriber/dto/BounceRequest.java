package io.insurancepro.site.subscriber.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record BounceRequest(@NotBlank @Email String email) {}
