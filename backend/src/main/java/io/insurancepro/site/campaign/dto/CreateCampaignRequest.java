package io.insurancepro.site.campaign.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * @param templateType {@code default}, {@code promotional} or {@code newsletter}; anything else
 *     falls back to default
 * @param targetSegment {@code all} or {@code active}
 */
public record CreateCampaignRequest(
    @NotBlank @Size(max = 200) String name,
    @NotBlank @Size(max = 200) String subject,
    @NotBlank String content,
    String templateType,
    String targetSegment) {}
