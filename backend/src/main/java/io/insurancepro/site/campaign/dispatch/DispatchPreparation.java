package io.insurancepro.site.campaign.dispatch;

/** Either a dispatch ready to fan out, or the reason the campaign was not started. */
public record DispatchPreparation(DispatchOutcome.Status rejection, PreparedDispatch dispatch) {

  public static DispatchPreparation ready(PreparedDispatch dispatch) {
    return new DispatchPreparation(null, dispatch);
  }

  public static DispatchPreparation rejected(DispatchOutcome.Status reason) {
    return new DispatchPreparation(reason, null);
  }

  public boolean isReady() {
    return dispatch != null;
  }
}
