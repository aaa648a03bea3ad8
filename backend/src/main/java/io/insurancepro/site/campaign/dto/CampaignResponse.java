package io.insurancepro.site.campaign.dto;

import io.insurancepro.site.campaign.Campaign;
import io.insurancepro.site.campaign.CampaignStatus;
import io.insurancepro.site.email.template.EmailTemplateVariant;
import io.insurancepro.site.subscriber.TargetSegment;
import java.time.Instant;
import java.util.UUID;

public record CampaignResponse(
    UUID id,
    String name,
    String subject,
    String content,
    EmailTemplateVariant templateType,
    TargetSegment targetSegment,
    CampaignStatus status,
    Instant createdAt,
    Instant sentAt,
    int totalRecipients,
    int sentCount,
    int failedCount,
    int openedCount) {

  public static CampaignResponse from(Campaign campaign) {
    return new CampaignResponse(
        campaign.getId(),
        campaign.getName(),
        campaign.getSubject(),
        campaign.getContent(),
        campaign.getTemplateType(),
        campaign.getTargetSegment(),
        campaign.getStatus(),
        campaign.getCreatedAt(),
        campaign.getSentAt(),
        campaign.getTotalRecipients(),
        campaign.getSentCount(),
        campaign.getFailedCount(),
        campaign.getOpenedCount());
  }
}
