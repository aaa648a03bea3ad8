package io.insurancepro.site.campaign.dispatch;

/** Delivery counts of one dispatch. */
public record DispatchTally(int sent, int failed) {

  public static final DispatchTally EMPTY = new DispatchTally(0, 0);
}
