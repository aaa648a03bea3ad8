package io.insurancepro.site.subscriber;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Newsletter subscriber. The email is the identity: it is stored normalised (trimmed, lower-case)
 * and unique regardless of status. Records are never deleted; opting out only changes the status.
 */
@Entity
@Table(name = "subscribers")
public class Subscriber {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "email", nullable = false, unique = true, length = 120)
  private String email;

  @Column(name = "name", length = 100)
  private String name;

  @Column(name = "phone", length = 20)
  private String phone;

  @Column(name = "insurance_type", length = 50)
  private String insuranceType;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private SubscriberStatus status = SubscriberStatus.ACTIVE;

  @Column(name = "subscribed_at", nullable = false, updatable = false)
  private Instant subscribedAt;

  @Column(name = "last_campaign_sent_at")
  private Instant lastCampaignSentAt;

  protected Subscriber() {}

  public Subscriber(String email, String name, String insuranceType, Instant subscribedAt) {
    this.email = email;
    this.name = name;
    this.insuranceType = insuranceType;
    this.status = SubscriberStatus.ACTIVE;
    this.subscribedAt = subscribedAt;
  }

  /** Back to ACTIVE; the stored name is kept unless a new one is given. */
  public void reactivate(String newName) {
    this.status = SubscriberStatus.ACTIVE;
    if (newName != null && !newName.isBlank()) {
      this.name = newName;
    }
  }

  public void unsubscribe() {
    this.status = SubscriberStatus.UNSUBSCRIBED;
  }

  public void markBounced() {
    this.status = SubscriberStatus.BOUNCED;
  }

  public boolean isUnsubscribed() {
    return status == SubscriberStatus.UNSUBSCRIBED;
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getEmail() {
    return email;
  }

  public String getName() {
    return name;
  }

  public String getPhone() {
    return phone;
  }

  public String getInsuranceType() {
    return insuranceType;
  }

  public SubscriberStatus getStatus() {
    return status;
  }

  public Instant getSubscribedAt() {
    return subscribedAt;
  }

  public Instant getLastCampaignSentAt() {
    return lastCampaignSentAt;
  }
}
