package io.insurancepro.site.campaign.dispatch;

import io.insurancepro.site.campaign.Campaign;
import io.insurancepro.site.campaign.CampaignRepository;
import io.insurancepro.site.exception.ResourceNotFoundException;
import io.insurancepro.site.subscriber.SubscriberService;
import java.time.Instant;
import java.util.Collection;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Transactional steps of a dispatch. Each method commits on its own so that the SENDING state is
 * visible before the first email leaves and progress survives a crash mid-send.
 */
@Service
public class CampaignDispatchService {

  private static final Logger log = LoggerFactory.getLogger(CampaignDispatchService.class);

  private final CampaignRepository campaignRepository;
  private final SubscriberService subscriberService;

  public CampaignDispatchService(
      CampaignRepository campaignRepository, SubscriberService subscriberService) {
    this.campaignRepository = campaignRepository;
    this.subscriberService = subscriberService;
  }

  /**
   * Applies the send guards, snapshots the recipients and commits the campaign as SENDING.
   *
   * @throws ResourceNotFoundException if the campaign does not exist
   */
  @Transactional
  public DispatchPreparation prepare(UUID campaignId) {
    var campaign = findCampaign(campaignId);

    switch (campaign.getStatus()) {
      case SENT -> {
        return DispatchPreparation.rejected(DispatchOutcome.Status.ALREADY_SENT);
      }
      case SENDING -> {
        return DispatchPreparation.rejected(DispatchOutcome.Status.ALREADY_SENDING);
      }
      case FAILED -> {
        return DispatchPreparation.rejected(DispatchOutcome.Status.NOT_SENDABLE);
      }
      default -> {
        // DRAFT and SCHEDULED proceed
      }
    }

    var recipients =
        subscriberService.resolveRecipients(campaign.getTargetSegment()).stream()
            .map(DispatchRecipient::from)
            .toList();
    if (recipients.isEmpty()) {
      log.info("Campaign {} has no eligible recipients; nothing sent", campaignId);
      return DispatchPreparation.rejected(DispatchOutcome.Status.NO_RECIPIENTS);
    }

    campaign.startSending(recipients.size());
    campaignRepository.saveAndFlush(campaign);

    return DispatchPreparation.ready(
        new PreparedDispatch(
            campaign.getId(),
            campaign.getSubject(),
            campaign.getContent(),
            campaign.getTemplateType(),
            recipients));
  }

  @Transactional
  public void recordProgress(
      UUID campaignId, DispatchTally tally, Collection<UUID> deliveredIds, Instant deliveredAt) {
    var campaign = findCampaign(campaignId);
    campaign.recordProgress(tally.sent(), tally.failed());
    subscriberService.recordCampaignDelivered(deliveredIds, deliveredAt);
  }

  @Transactional
  public void complete(
      UUID campaignId, DispatchTally tally, Collection<UUID> deliveredIds, Instant completedAt) {
    var campaign = findCampaign(campaignId);
    subscriberService.recordCampaignDelivered(deliveredIds, completedAt);
    campaign.markSent(tally.sent(), tally.failed(), completedAt);
    log.info(
        "Campaign {} sent: total={}, sent={}, failed={}",
        campaignId,
        campaign.getTotalRecipients(),
        tally.sent(),
        tally.failed());
  }

  @Transactional
  public void fail(UUID campaignId, DispatchTally tally) {
    var campaign = findCampaign(campaignId);
    campaign.markFailed(tally.sent(), tally.failed());
    log.warn(
        "Campaign {} closed out as FAILED: sent={}, failed={}",
        campaignId,
        tally.sent(),
        tally.failed());
  }

  private Campaign findCampaign(UUID campaignId) {
    return campaignRepository
        .findById(campaignId)
        .orElseThrow(() -> new ResourceNotFoundException("Campaign", campaignId));
  }
}
