package io.insurancepro.site.campaign.dispatch;

import io.insurancepro.site.config.CampaignDispatchConfig.DispatchProperties;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

/**
 * Runs campaign sends.
 *
 * <p>{@link #send(UUID)} commits the campaign as SENDING and returns at once. A coordinator task on
 * {@code campaignCoordinatorExecutor} then submits one delivery per recipient to {@code
 * campaignSendExecutor} and takes results from an {@link ExecutorCompletionService} until all of
 * them are in. The coordinator is the only writer of the campaign's tallies; it flushes them every
 * {@code progress-flush-size} results and closes the campaign out as SENT, or as FAILED if it is
 * interrupted or cannot persist.
 */
@Service
public class CampaignDispatcher {

  private static final Logger log = LoggerFactory.getLogger(CampaignDispatcher.class);
  static final String MDC_CAMPAIGN_ID = "campaignId";

  private final CampaignDispatchService dispatchService;
  private final RecipientDelivery recipientDelivery;
  private final Executor sendExecutor;
  private final Executor coordinatorExecutor;
  private final int progressFlushSize;
  private final Clock clock;

  public CampaignDispatcher(
      CampaignDispatchService dispatchService,
      RecipientDelivery recipientDelivery,
      @Qualifier("campaignSendExecutor") Executor sendExecutor,
      @Qualifier("campaignCoordinatorExecutor") Executor coordinatorExecutor,
      DispatchProperties dispatchProperties,
      Clock clock) {
    this.dispatchService = dispatchService;
    this.recipientDelivery = recipientDelivery;
    this.sendExecutor = sendExecutor;
    this.coordinatorExecutor = coordinatorExecutor;
    this.progressFlushSize = Math.max(1, dispatchProperties.progressFlushSize());
    this.clock = clock;
  }

  /**
   * Starts sending a campaign.
   *
   * @throws io.insurancepro.site.exception.ResourceNotFoundException if the campaign does not exist
   */
  public DispatchOutcome send(UUID campaignId) {
    DispatchPreparation preparation;
    try {
      preparation = dispatchService.prepare(campaignId);
    } catch (ObjectOptimisticLockingFailureException e) {
      log.info("Campaign {} was claimed by a concurrent send", campaignId);
      return DispatchOutcome.rejected(DispatchOutcome.Status.ALREADY_SENDING);
    }

    if (!preparation.isReady()) {
      log.info("Campaign {} not dispatched: {}", campaignId, preparation.rejection());
      return DispatchOutcome.rejected(preparation.rejection());
    }

    var dispatch = preparation.dispatch();
    var completion = new CompletableFuture<DispatchTally>();
    try {
      coordinatorExecutor.execute(() -> coordinate(dispatch, completion));
    } catch (RejectedExecutionException e) {
      log.error("No coordinator available for campaign {}", campaignId, e);
      dispatchService.fail(campaignId, DispatchTally.EMPTY);
      throw new IllegalStateException("Campaign dispatch could not be scheduled", e);
    }

    log.info("Campaign {} queued for {} recipients", campaignId, dispatch.recipientCount());
    return DispatchOutcome.queued(dispatch.recipientCount(), completion);
  }

  void coordinate(PreparedDispatch dispatch, CompletableFuture<DispatchTally> completion) {
    UUID campaignId = dispatch.campaignId();
    MDC.put(MDC_CAMPAIGN_ID, campaignId.toString());
    int sent = 0;
    int failed = 0;
    List<UUID> pendingDelivered = new ArrayList<>();
    try {
      var completionService = new ExecutorCompletionService<RecipientResult>(sendExecutor);
      int submitted = 0;
      for (var recipient : dispatch.recipients()) {
        try {
          completionService.submit(() -> recipientDelivery.deliver(dispatch, recipient));
          submitted++;
        } catch (RejectedExecutionException e) {
          log.warn("Send pool rejected subscriber {}", recipient.subscriberId());
          failed++;
        }
      }

      int sinceFlush = 0;
      for (int i = 0; i < submitted; i++) {
        RecipientResult result;
        try {
          result = completionService.take().get();
        } catch (ExecutionException e) {
          log.error("Delivery task for campaign {} failed", campaignId, e.getCause());
          failed++;
          continue;
        }

        if (result.delivered()) {
          sent++;
          pendingDelivered.add(result.recipient().subscriberId());
        } else {
          failed++;
        }

        if (++sinceFlush >= progressFlushSize && i < submitted - 1) {
          dispatchService.recordProgress(
              campaignId,
              new DispatchTally(sent, failed),
              List.copyOf(pendingDelivered),
              clock.instant());
          pendingDelivered.clear();
          sinceFlush = 0;
        }
      }

      var tally = new DispatchTally(sent, failed);
      dispatchService.complete(
          campaignId, tally, List.copyOf(pendingDelivered), clock.instant());
      completion.complete(tally);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Dispatch coordinator interrupted");
      closeOutAsFailed(campaignId, new DispatchTally(sent, failed), completion);
    } catch (RuntimeException e) {
      log.error("Dispatch coordinator failed", e);
      closeOutAsFailed(campaignId, new DispatchTally(sent, failed), completion);
    } finally {
      MDC.remove(MDC_CAMPAIGN_ID);
    }
  }

  private void closeOutAsFailed(
      UUID campaignId, DispatchTally tally, CompletableFuture<DispatchTally> completion) {
    try {
      dispatchService.fail(campaignId, tally);
      completion.complete(tally);
    } catch (RuntimeException e) {
      log.error("Could not mark campaign {} as FAILED", campaignId, e);
      completion.completeExceptionally(e);
    }
  }
}
