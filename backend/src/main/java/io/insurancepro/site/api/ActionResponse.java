package io.insurancepro.site.api;

/** Plain success/failure reply used by the form-style endpoints. */
public record ActionResponse(boolean success, String message) {

  public static ActionResponse ok(String message) {
    return new ActionResponse(true, message);
  }

  public static ActionResponse rejected(String message) {
    return new ActionResponse(false, message);
  }
}
