package io.insurancepro.site.dashboard;

import io.insurancepro.site.campaign.CampaignService;
import io.insurancepro.site.contact.ContactMessageService;
import io.insurancepro.site.subscriber.SubscriberService;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class DashboardService {

  private final SubscriberService subscriberService;
  private final CampaignService campaignService;
  private final ContactMessageService contactMessageService;

  public DashboardService(
      SubscriberService subscriberService,
      CampaignService campaignService,
      ContactMessageService contactMessageService) {
    this.subscriberService = subscriberService;
    this.campaignService = campaignService;
    this.contactMessageService = contactMessageService;
  }

  @Transactional(readOnly = true)
  public DashboardResponse summary() {
    return new DashboardResponse(
        subscriberService.countAll(),
        subscriberService.countActive(),
        campaignService.countAll(),
        campaignService.countSent(),
        contactMessageService.countUnread(),
        campaignService.recent());
  }
}
