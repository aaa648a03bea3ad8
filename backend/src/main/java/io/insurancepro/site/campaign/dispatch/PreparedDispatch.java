package io.insurancepro.site.campaign.dispatch;

import io.insurancepro.site.email.template.EmailTemplateVariant;
import java.util.List;
import java.util.UUID;

/**
 * Everything the workers need, detached from the persistence context so no entity crosses a
 * thread boundary.
 */
public record PreparedDispatch(
    UUID campaignId,
    String subject,
    String content,
    EmailTemplateVariant templateVariant,
    List<DispatchRecipient> recipients) {

  public PreparedDispatch {
    recipients = List.copyOf(recipients);
  }

  public int recipientCount() {
    return recipients.size();
  }
}
