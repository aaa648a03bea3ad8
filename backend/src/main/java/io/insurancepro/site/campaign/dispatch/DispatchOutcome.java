package io.insurancepro.site.campaign.dispatch;

import java.util.concurrent.CompletableFuture;

/**
 * Immediate answer to a send request. For a queued dispatch, {@code completion} finishes with the
 * final tally once every recipient has been accounted for; for every other status it is already
 * complete with an empty tally.
 */
public record DispatchOutcome(
    Status status,
    String message,
    int totalRecipients,
    CompletableFuture<DispatchTally> completion) {

  public enum Status {
    QUEUED,
    ALREADY_SENT,
    ALREADY_SENDING,
    NOT_SENDABLE,
    NO_RECIPIENTS
  }

  static final String ALREADY_SENT_MESSAGE = "Campaign has already been sent.";
  static final String ALREADY_SENDING_MESSAGE = "Campaign is already being sent.";
  static final String NOT_SENDABLE_MESSAGE = "Campaign cannot be sent again after a failed send.";
  static final String NO_RECIPIENTS_MESSAGE = "No subscribers found for this campaign.";

  static DispatchOutcome queued(int totalRecipients, CompletableFuture<DispatchTally> completion) {
    return new DispatchOutcome(
        Status.QUEUED,
        "Campaign is being sent to " + totalRecipients + " subscribers.",
        totalRecipients,
        completion);
  }

  static DispatchOutcome rejected(Status status) {
    String message =
        switch (status) {
          case ALREADY_SENT -> ALREADY_SENT_MESSAGE;
          case ALREADY_SENDING -> ALREADY_SENDING_MESSAGE;
          case NOT_SENDABLE -> NOT_SENDABLE_MESSAGE;
          case NO_RECIPIENTS -> NO_RECIPIENTS_MESSAGE;
          case QUEUED -> throw new IllegalArgumentException("QUEUED is not a rejection");
        };
    return new DispatchOutcome(
        status, message, 0, CompletableFuture.completedFuture(DispatchTally.EMPTY));
  }

  public boolean isQueued() {
    return status == Status.QUEUED;
  }

  /** Message reported once the dispatch has finished with {@code tally}. */
  public static String completionMessage(DispatchTally tally) {
    return "Campaign sent! " + tally.sent() + " successful, " + tally.failed() + " failed.";
  }
}
