package io.insurancepro.site.campaign;

import io.insurancepro.site.api.PageResponse;
import io.insurancepro.site.campaign.dispatch.CampaignDispatcher;
import io.insurancepro.site.campaign.dispatch.DispatchOutcome;
import io.insurancepro.site.campaign.dto.CampaignResponse;
import io.insurancepro.site.campaign.dto.CreateCampaignRequest;
import io.insurancepro.site.campaign.dto.SendCampaignResponse;
import io.insurancepro.site.config.CampaignDispatchConfig.DispatchProperties;
import io.insurancepro.site.email.UnsubscribeTokenService;
import io.insurancepro.site.email.template.CampaignEmailRenderer;
import io.insurancepro.site.email.template.EmailTemplateVariant;
import io.insurancepro.site.exception.ResourceConflictException;
import io.insurancepro.site.exception.ResourceNotFoundException;
import io.insurancepro.site.subscriber.TargetSegment;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CampaignService {

  private static final Logger log = LoggerFactory.getLogger(CampaignService.class);

  public static final int PAGE_SIZE = 20;
  static final String PREVIEW_EMAIL = "preview@example.com";

  private final CampaignRepository campaignRepository;
  private final CampaignDispatcher campaignDispatcher;
  private final CampaignEmailRenderer renderer;
  private final UnsubscribeTokenService tokenService;
  private final boolean awaitCompletion;
  private final Clock clock;

  public CampaignService(
      CampaignRepository campaignRepository,
      CampaignDispatcher campaignDispatcher,
      CampaignEmailRenderer renderer,
      UnsubscribeTokenService tokenService,
      DispatchProperties dispatchProperties,
      Clock clock) {
    this.campaignRepository = campaignRepository;
    this.campaignDispatcher = campaignDispatcher;
    this.renderer = renderer;
    this.tokenService = tokenService;
    this.awaitCompletion = dispatchProperties.awaitCompletion();
    this.clock = clock;
  }

  @Transactional
  public CampaignResponse create(CreateCampaignRequest request) {
    var campaign =
        campaignRepository.save(
            new Campaign(
                request.name().trim(),
                request.subject().trim(),
                request.content(),
                EmailTemplateVariant.fromValue(request.templateType()),
                TargetSegment.fromValue(request.targetSegment()),
                clock.instant()));

    log.info(
        "Created campaign: id={}, template={}, segment={}",
        campaign.getId(),
        campaign.getTemplateType(),
        campaign.getTargetSegment());
    return CampaignResponse.from(campaign);
  }

  /** Newest first, {@value #PAGE_SIZE} per page; {@code page} is 1-based. */
  @Transactional(readOnly = true)
  public PageResponse<CampaignResponse> list(int page) {
    var pageable =
        PageRequest.of(Math.max(page, 1) - 1, PAGE_SIZE, Sort.by(Sort.Direction.DESC, "createdAt"));
    return PageResponse.from(campaignRepository.findAll(pageable).map(CampaignResponse::from));
  }

  @Transactional(readOnly = true)
  public CampaignResponse get(UUID id) {
    return CampaignResponse.from(findCampaign(id));
  }

  @Transactional(readOnly = true)
  public List<CampaignResponse> recent() {
    return campaignRepository.findTop5ByOrderByCreatedAtDesc().stream()
        .map(CampaignResponse::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public long countAll() {
    return campaignRepository.count();
  }

  @Transactional(readOnly = true)
  public long countSent() {
    return campaignRepository.countByStatus(CampaignStatus.SENT);
  }

  @Transactional
  public void delete(UUID id) {
    var campaign = findCampaign(id);
    if (!campaign.isDeletable()) {
      String detail =
          campaign.getStatus() == CampaignStatus.SENT
              ? "Cannot delete sent campaigns."
              : "Cannot delete a campaign while it is being sent.";
      throw new ResourceConflictException("Campaign not deletable", detail);
    }
    campaignRepository.delete(campaign);
    log.info("Deleted campaign: id={}", id);
  }

  /** Full HTML email as a recipient would see it, with a placeholder unsubscribe link. */
  @Transactional(readOnly = true)
  public String preview(UUID id) {
    var campaign = findCampaign(id);
    String unsubscribeUrl = tokenService.buildUnsubscribeUrl(PREVIEW_EMAIL);
    return renderer
        .render(campaign.getTemplateType(), campaign.getContent(), unsubscribeUrl)
        .htmlBody();
  }

  /**
   * Starts a send. When the dispatch is configured to await completion the reply carries the final
   * counts; otherwise it reports SENDING and the counts are read back from the campaign later.
   */
  public SendCampaignResponse send(UUID id) {
    var outcome = campaignDispatcher.send(id);
    if (!outcome.isQueued()) {
      var status = findCampaign(id).getStatus();
      return new SendCampaignResponse(false, outcome.message(), 0, 0, status);
    }
    if (!awaitCompletion) {
      return new SendCampaignResponse(true, outcome.message(), 0, 0, CampaignStatus.SENDING);
    }

    var tally = outcome.completion().join();
    var status = findCampaign(id).getStatus();
    return new SendCampaignResponse(
        status == CampaignStatus.SENT,
        DispatchOutcome.completionMessage(tally),
        tally.sent(),
        tally.failed(),
        status);
  }

  private Campaign findCampaign(UUID id) {
    return campaignRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Campaign", id));
  }
}
