package io.insurancepro.site.dashboard;

import io.insurancepro.site.campaign.dto.CampaignResponse;
import java.util.List;

public record DashboardResponse(
    long totalSubscribers,
    long activeSubscribers,
    long totalCampaigns,
    long sentCampaigns,
    long unreadMessages,
    List<CampaignResponse> recentCampaigns) {}
