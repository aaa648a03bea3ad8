package io.insurancepro.site.campaign.dispatch;

import io.insurancepro.site.email.SendResult;

public record RecipientResult(DispatchRecipient recipient, SendResult sendResult) {

  public boolean delivered() {
    return sendResult.success();
  }
}
