package io.insurancepro.site.campaign;

import io.insurancepro.site.email.template.EmailTemplateVariant;
import io.insurancepro.site.exception.InvalidStateException;
import io.insurancepro.site.subscriber.TargetSegment;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;

/**
 * Email campaign composed by an admin. Tallies are written only by the dispatch pipeline; a SENT
 * campaign is immutable.
 */
@Entity
@Table(name = "campaigns")
public class Campaign {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "subject", nullable = false, length = 200)
  private String subject;

  @Column(name = "content", nullable = false, columnDefinition = "TEXT")
  private String content;

  @Enumerated(EnumType.STRING)
  @Column(name = "template_type", nullable = false, length = 20)
  private EmailTemplateVariant templateType;

  @Enumerated(EnumType.STRING)
  @Column(name = "target_segment", nullable = false, length = 20)
  private TargetSegment targetSegment;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private CampaignStatus status;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "sent_at")
  private Instant sentAt;

  @Column(name = "total_recipients", nullable = false)
  private int totalRecipients;

  @Column(name = "sent_count", nullable = false)
  private int sentCount;

  @Column(name = "failed_count", nullable = false)
  private int failedCount;

  // Reserved for open tracking; nothing increments it yet.
  @Column(name = "opened_count", nullable = false)
  private int openedCount;

  @Version private Long version;

  protected Campaign() {}

  public Campaign(
      String name,
      String subject,
      String content,
      EmailTemplateVariant templateType,
      TargetSegment targetSegment,
      Instant createdAt) {
    this.name = name;
    this.subject = subject;
    this.content = content;
    this.templateType = templateType != null ? templateType : EmailTemplateVariant.DEFAULT;
    this.targetSegment = targetSegment != null ? targetSegment : TargetSegment.ALL;
    this.status = CampaignStatus.DRAFT;
    this.createdAt = createdAt;
  }

  /**
   * Moves the campaign to SENDING for {@code recipientCount} recipients and clears the tallies.
   *
   * @throws InvalidStateException if the campaign is not DRAFT or SCHEDULED
   */
  public void startSending(int recipientCount) {
    requireTransition(CampaignStatus.SENDING);
    this.status = CampaignStatus.SENDING;
    this.totalRecipients = recipientCount;
    this.sentCount = 0;
    this.failedCount = 0;
  }

  public void recordProgress(int sent, int failed) {
    if (status != CampaignStatus.SENDING) {
      throw new InvalidStateException(
          "Invalid campaign status", "Cannot record progress for campaign in status " + status);
    }
    this.sentCount = sent;
    this.failedCount = failed;
  }

  public void markSent(int sent, int failed, Instant completedAt) {
    requireTransition(CampaignStatus.SENT);
    this.status = CampaignStatus.SENT;
    this.sentCount = sent;
    this.failedCount = failed;
    this.sentAt = completedAt;
  }

  public void markFailed(int sent, int failed) {
    requireTransition(CampaignStatus.FAILED);
    this.status = CampaignStatus.FAILED;
    this.sentCount = sent;
    this.failedCount = failed;
  }

  /** SENT campaigns are kept as history; SENDING ones are still owned by the dispatcher. */
  public boolean isDeletable() {
    return status != CampaignStatus.SENT && status != CampaignStatus.SENDING;
  }

  private void requireTransition(CampaignStatus target) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid campaign status",
          "Cannot move campaign from " + status + " to " + target + ".");
    }
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getSubject() {
    return subject;
  }

  public String getContent() {
    return content;
  }

  public EmailTemplateVariant getTemplateType() {
    return templateType;
  }

  public TargetSegment getTargetSegment() {
    return targetSegment;
  }

  public CampaignStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getSentAt() {
    return sentAt;
  }

  public int getTotalRecipients() {
    return totalRecipients;
  }

  public int getSentCount() {
    return sentCount;
  }

  public int getFailedCount() {
    return failedCount;
  }

  public int getOpenedCount() {
    return openedCount;
  }
}
