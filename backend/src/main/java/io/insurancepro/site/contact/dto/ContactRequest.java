package io.insurancepro.site.contact.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ContactRequest(
    @NotBlank @Size(min = 2, max = 100) String name,
    @NotBlank @Email @Size(max = 120) String email,
    @Size(max = 20) String phone,
    @NotBlank @Size(max = 200) String subject,
    @NotBlank @Size(max = 5000) String message) {}
