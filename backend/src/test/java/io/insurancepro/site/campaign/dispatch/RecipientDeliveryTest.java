package io.insurancepro.site.campaign.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.insurancepro.site.email.EmailMessage;
import io.insurancepro.site.email.MailTransport;
import io.insurancepro.site.email.SendResult;
import io.insurancepro.site.email.UnsubscribeTokenService;
import io.insurancepro.site.email.template.CampaignEmailRenderer;
import io.insurancepro.site.email.template.EmailTemplateVariant;
import io.insurancepro.site.email.template.RenderedEmail;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class RecipientDeliveryTest {

  private static final String LINK = "http://localhost:8080/unsubscribe/tok";

  private UnsubscribeTokenService tokenService;
  private CampaignEmailRenderer renderer;
  private MailTransport transport;
  private RecipientDelivery delivery;

  private final DispatchRecipient recipient =
      new DispatchRecipient(UUID.randomUUID(), "jane@example.com");
  private final PreparedDispatch dispatch =
      new PreparedDispatch(
          UUID.randomUUID(),
          "Spring offers",
          "<p>Hi</p>",
          EmailTemplateVariant.PROMOTIONAL,
          List.of(recipient));

  @BeforeEach
  void setUp() {
    tokenService = mock(UnsubscribeTokenService.class);
    renderer = mock(CampaignEmailRenderer.class);
    transport = mock(MailTransport.class);
    delivery = new RecipientDelivery(tokenService, renderer, transport);
    when(tokenService.buildUnsubscribeUrl("jane@example.com")).thenReturn(LINK);
  }

  @Test
  void deliver_renders_with_recipient_link_and_sends_once() {
    when(renderer.render(EmailTemplateVariant.PROMOTIONAL, "<p>Hi</p>", LINK))
        .thenReturn(new RenderedEmail("<html>Hi</html>", "Hi"));
    when(transport.deliver(any())).thenReturn(SendResult.delivered("<id@test>"));

    var result = delivery.deliver(dispatch, recipient);

    assertThat(result.delivered()).isTrue();
    assertThat(result.recipient()).isEqualTo(recipient);
    var sent = ArgumentCaptor.forClass(EmailMessage.class);
    verify(transport).deliver(sent.capture());
    assertThat(sent.getValue().to()).isEqualTo("jane@example.com");
    assertThat(sent.getValue().subject()).isEqualTo("Spring offers");
    assertThat(sent.getValue().htmlBody()).isEqualTo("<html>Hi</html>");
    assertThat(sent.getValue().headers()).containsEntry("List-Unsubscribe", "<" + LINK + ">");
  }

  @Test
  void transport_failure_is_reported_not_thrown() {
    when(renderer.render(EmailTemplateVariant.PROMOTIONAL, "<p>Hi</p>", LINK))
        .thenReturn(new RenderedEmail("<html>Hi</html>", "Hi"));
    when(transport.deliver(any())).thenReturn(SendResult.failed("connection refused"));

    var result = delivery.deliver(dispatch, recipient);

    assertThat(result.delivered()).isFalse();
    assertThat(result.sendResult().errorMessage()).isEqualTo("connection refused");
  }

  @Test
  void unexpected_exception_becomes_failed_result() {
    when(renderer.render(EmailTemplateVariant.PROMOTIONAL, "<p>Hi</p>", LINK))
        .thenThrow(new IllegalStateException("template missing"));

    var result = delivery.deliver(dispatch, recipient);

    assertThat(result.delivered()).isFalse();
    assertThat(result.sendResult().errorMessage()).contains("template missing");
  }

  @Test
  void linkage_error_while_rendering_becomes_failed_result() {
    when(renderer.render(EmailTemplateVariant.PROMOTIONAL, "<p>Hi</p>", LINK))
        .thenThrow(new NoClassDefFoundError("ognl/PropertyAccessor"));

    var result = delivery.deliver(dispatch, recipient);

    assertThat(result.delivered()).isFalse();
    assertThat(result.recipient()).isEqualTo(recipient);
    assertThat(result.sendResult().errorMessage()).contains("NoClassDefFoundError");
  }
}
