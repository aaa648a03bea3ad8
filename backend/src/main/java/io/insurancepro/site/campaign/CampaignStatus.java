package io.insurancepro.site.campaign;

import java.util.Map;
import java.util.Set;

/** Campaign lifecycle. SENT and FAILED are terminal. */
public enum CampaignStatus {
  DRAFT,
  SCHEDULED,
  SENDING,
  SENT,
  FAILED;

  private static final Map<CampaignStatus, Set<CampaignStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          DRAFT, Set.of(SCHEDULED, SENDING),
          SCHEDULED, Set.of(DRAFT, SENDING),
          SENDING, Set.of(SENT, FAILED),
          SENT, Set.of(),
          FAILED, Set.of());

  public boolean canTransitionTo(CampaignStatus target) {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of()).contains(target);
  }
}
