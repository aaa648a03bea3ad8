package io.insurancepro.site.campaign;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.insurancepro.site.email.template.EmailTemplateVariant;
import io.insurancepro.site.exception.InvalidStateException;
import io.insurancepro.site.subscriber.TargetSegment;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class CampaignTest {

  private static final Instant CREATED_AT = Instant.parse("2026-03-01T09:00:00Z");

  private static Campaign draft() {
    return new Campaign(
        "Spring",
        "Spring offers",
        "<p>Hi</p>",
        EmailTemplateVariant.DEFAULT,
        TargetSegment.ALL,
        CREATED_AT);
  }

  @Test
  void new_campaign_is_draft_with_zero_tallies() {
    var campaign = draft();

    assertThat(campaign.getStatus()).isEqualTo(CampaignStatus.DRAFT);
    assertThat(campaign.getCreatedAt()).isEqualTo(CREATED_AT);
    assertThat(campaign.getTotalRecipients()).isZero();
    assertThat(campaign.isDeletable()).isTrue();
  }

  @Test
  void null_variant_and_segment_default() {
    var campaign = new Campaign("n", "s", "c", null, null, CREATED_AT);

    assertThat(campaign.getTemplateType()).isEqualTo(EmailTemplateVariant.DEFAULT);
    assertThat(campaign.getTargetSegment()).isEqualTo(TargetSegment.ALL);
  }

  @Test
  void full_send_lifecycle_records_counts() {
    var campaign = draft();
    var completedAt = Instant.parse("2026-05-01T09:00:00Z");

    campaign.startSending(3);
    campaign.recordProgress(1, 1);
    campaign.markSent(2, 1, completedAt);

    assertThat(campaign.getStatus()).isEqualTo(CampaignStatus.SENT);
    assertThat(campaign.getTotalRecipients()).isEqualTo(3);
    assertThat(campaign.getSentCount()).isEqualTo(2);
    assertThat(campaign.getFailedCount()).isEqualTo(1);
    assertThat(campaign.getSentAt()).isEqualTo(completedAt);
    assertThat(campaign.isDeletable()).isFalse();
  }

  @Test
  void sent_campaign_cannot_start_sending_again() {
    var campaign = draft();
    campaign.startSending(1);
    campaign.markSent(1, 0, Instant.now());

    assertThatThrownBy(() -> campaign.startSending(1)).isInstanceOf(InvalidStateException.class);
  }

  @Test
  void draft_cannot_be_marked_sent_directly() {
    assertThatThrownBy(() -> draft().markSent(0, 0, Instant.now()))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void sending_campaign_is_not_deletable_but_failed_is() {
    var campaign = draft();
    campaign.startSending(2);
    assertThat(campaign.isDeletable()).isFalse();

    campaign.markFailed(1, 0);
    assertThat(campaign.getStatus()).isEqualTo(CampaignStatus.FAILED);
    assertThat(campaign.isDeletable()).isTrue();
  }

  @Test
  void terminal_statuses_allow_no_transition() {
    for (var target : CampaignStatus.values()) {
      assertThat(CampaignStatus.SENT.canTransitionTo(target)).isFalse();
      assertThat(CampaignStatus.FAILED.canTransitionTo(target)).isFalse();
    }
  }
}
