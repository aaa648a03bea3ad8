package io.insurancepro.site.subscriber;

import io.insurancepro.site.api.PageResponse;
import io.insurancepro.site.email.UnsubscribeTokenService;
import io.insurancepro.site.exception.ResourceConflictException;
import io.insurancepro.site.exception.ResourceNotFoundException;
import io.insurancepro.site.subscriber.dto.SubscriberResponse;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Subscriber records and their status transitions. */
@Service
public class SubscriberService {

  private static final Logger log = LoggerFactory.getLogger(SubscriberService.class);

  public static final int PAGE_SIZE = 20;

  private final SubscriberRepository subscriberRepository;
  private final UnsubscribeTokenService tokenService;
  private final Clock clock;

  public SubscriberService(
      SubscriberRepository subscriberRepository,
      UnsubscribeTokenService tokenService,
      Clock clock) {
    this.subscriberRepository = subscriberRepository;
    this.tokenService = tokenService;
    this.clock = clock;
  }

  /**
   * Creates a subscriber, reactivates an unsubscribed one, or reports that the address is already
   * on the list. Active and bounced records are left untouched.
   *
   * @throws InvalidEmailException when the address fails syntax validation
   */
  @Transactional
  public SubscribeOutcome subscribe(String email, String name, String insuranceType) {
    if (!EmailAddresses.isValid(email)) {
      throw new InvalidEmailException();
    }
    String normalized = EmailAddresses.normalize(email);
    String trimmedName = trimToNull(name);

    var existing = subscriberRepository.findByEmail(normalized);
    if (existing.isPresent()) {
      var subscriber = existing.get();
      if (subscriber.isUnsubscribed()) {
        subscriber.reactivate(trimmedName);
        log.info("Reactivated subscriber: id={}", subscriber.getId());
        return SubscribeOutcome.REACTIVATED;
      }
      return SubscribeOutcome.ALREADY_SUBSCRIBED;
    }

    try {
      var subscriber =
          subscriberRepository.saveAndFlush(
              new Subscriber(
                  normalized, trimmedName, trimToNull(insuranceType), clock.instant()));
      log.info("Created subscriber: id={}", subscriber.getId());
    } catch (DataIntegrityViolationException ex) {
      throw new ResourceConflictException(
          "Duplicate subscriber", SubscribeOutcome.ALREADY_SUBSCRIBED.message());
    }
    return SubscribeOutcome.SUBSCRIBED;
  }

  @Transactional
  public UnsubscribeOutcome unsubscribe(String email) {
    var subscriber = subscriberRepository.findByEmail(EmailAddresses.normalize(email));
    if (subscriber.isEmpty()) {
      return UnsubscribeOutcome.NOT_FOUND;
    }
    subscriber.get().unsubscribe();
    log.info("Unsubscribed subscriber: id={}", subscriber.get().getId());
    return UnsubscribeOutcome.UNSUBSCRIBED;
  }

  /**
   * Verifies an unsubscribe token and opts its address out.
   *
   * @throws io.insurancepro.site.email.UnsubscribeTokenException when the token is invalid or
   *     expired
   */
  @Transactional
  public UnsubscribeOutcome unsubscribeByToken(String token) {
    return unsubscribe(tokenService.verify(token));
  }

  @Transactional
  public SubscriberResponse markBounced(String email) {
    String normalized = EmailAddresses.normalize(email);
    var subscriber =
        subscriberRepository
            .findByEmail(normalized)
            .orElseThrow(() -> new ResourceNotFoundException("Subscriber", normalized));
    subscriber.markBounced();
    log.warn("Marked subscriber as bounced: id={}", subscriber.getId());
    return SubscriberResponse.from(subscriber);
  }

  @Transactional(readOnly = true)
  public long countActive() {
    return subscriberRepository.countByStatus(SubscriberStatus.ACTIVE);
  }

  @Transactional(readOnly = true)
  public long countAll() {
    return subscriberRepository.count();
  }

  @Transactional(readOnly = true)
  public List<Subscriber> resolveRecipients(TargetSegment segment) {
    var effective = segment != null ? segment : TargetSegment.ALL;
    return subscriberRepository.findByStatusIn(effective.statuses());
  }

  /** Stamps the last-campaign-sent time on every subscriber that received a campaign. */
  @Transactional
  public void recordCampaignDelivered(Collection<UUID> subscriberIds, Instant sentAt) {
    if (subscriberIds.isEmpty()) {
      return;
    }
    subscriberRepository.stampLastCampaignSent(subscriberIds, sentAt);
  }

  /**
   * One page of subscribers, newest first.
   *
   * @param statusFilter {@code all} or a status name, case-insensitive; blank means all
   * @param page 1-based page number; values below 1 are treated as 1
   */
  @Transactional(readOnly = true)
  public PageResponse<SubscriberResponse> list(String statusFilter, int page) {
    var pageable =
        PageRequest.of(
            Math.max(page, 1) - 1, PAGE_SIZE, Sort.by(Sort.Direction.DESC, "subscribedAt"));
    var status = parseStatusFilter(statusFilter);
    var result =
        status == null
            ? subscriberRepository.findAll(pageable)
            : subscriberRepository.findByStatus(status, pageable);
    return PageResponse.from(result.map(SubscriberResponse::from));
  }

  private static SubscriberStatus parseStatusFilter(String statusFilter) {
    if (statusFilter == null || statusFilter.isBlank() || "all".equalsIgnoreCase(statusFilter)) {
      return null;
    }
    try {
      return SubscriberStatus.valueOf(statusFilter.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
