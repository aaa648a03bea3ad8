package io.insurancepro.site.campaign.dispatch;

import io.insurancepro.site.email.EmailMessage;
import io.insurancepro.site.email.MailTransport;
import io.insurancepro.site.email.SendResult;
import io.insurancepro.site.email.UnsubscribeTokenService;
import io.insurancepro.site.email.template.CampaignEmailRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sends a campaign to a single recipient: fresh unsubscribe link, rendered body, one transport
 * attempt. Never throws; every failure becomes a failed {@link RecipientResult}.
 */
@Component
public class RecipientDelivery {

  private static final Logger log = LoggerFactory.getLogger(RecipientDelivery.class);

  private final UnsubscribeTokenService tokenService;
  private final CampaignEmailRenderer renderer;
  private final MailTransport mailTransport;

  public RecipientDelivery(
      UnsubscribeTokenService tokenService,
      CampaignEmailRenderer renderer,
      MailTransport mailTransport) {
    this.tokenService = tokenService;
    this.renderer = renderer;
    this.mailTransport = mailTransport;
  }

  public RecipientResult deliver(PreparedDispatch dispatch, DispatchRecipient recipient) {
    try {
      String unsubscribeUrl = tokenService.buildUnsubscribeUrl(recipient.email());
      var rendered =
          renderer.render(dispatch.templateVariant(), dispatch.content(), unsubscribeUrl);
      var message =
          EmailMessage.withUnsubscribe(
              recipient.email(),
              dispatch.subject(),
              rendered.htmlBody(),
              rendered.plainTextBody(),
              unsubscribeUrl);
      var result = mailTransport.deliver(message);
      if (!result.success()) {
        log.warn(
            "Delivery failed: campaign={}, subscriber={}, error={}",
            dispatch.campaignId(),
            recipient.subscriberId(),
            result.errorMessage());
      }
      return new RecipientResult(recipient, result);
    } catch (RuntimeException | LinkageError e) {
      log.error(
          "Unexpected error delivering campaign {} to subscriber {}",
          dispatch.campaignId(),
          recipient.subscriberId(),
          e);
      return new RecipientResult(recipient, SendResult.failed(e.toString()));
    }
  }
}
