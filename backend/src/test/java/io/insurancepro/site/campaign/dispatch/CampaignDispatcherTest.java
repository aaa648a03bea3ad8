package io.insurancepro.site.campaign.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.insurancepro.site.campaign.Campaign;
import io.insurancepro.site.config.CampaignDispatchConfig.DispatchProperties;
import io.insurancepro.site.email.SendResult;
import io.insurancepro.site.email.template.EmailTemplateVariant;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class CampaignDispatcherTest {

  private static final UUID CAMPAIGN_ID = UUID.randomUUID();
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-06-01T08:00:00Z"), ZoneOffset.UTC);
  private static final Executor DIRECT = Runnable::run;

  private CampaignDispatchService dispatchService;
  private RecipientDelivery recipientDelivery;

  @BeforeEach
  void setUp() {
    dispatchService = mock(CampaignDispatchService.class);
    recipientDelivery = mock(RecipientDelivery.class);
  }

  private CampaignDispatcher dispatcher(Executor workers, Executor coordinators, int flushSize) {
    return new CampaignDispatcher(
        dispatchService,
        recipientDelivery,
        workers,
        coordinators,
        new DispatchProperties(2, 1, flushSize, false),
        CLOCK);
  }

  private static PreparedDispatch preparedFor(List<DispatchRecipient> recipients) {
    return new PreparedDispatch(
        CAMPAIGN_ID, "Spring offers", "<p>Hi</p>", EmailTemplateVariant.DEFAULT, recipients);
  }

  private static List<DispatchRecipient> recipients(int count) {
    return IntStream.range(0, count)
        .mapToObj(i -> new DispatchRecipient(UUID.randomUUID(), "user" + i + "@example.com"))
        .toList();
  }

  /** Deliveries to addresses starting with "fail" fail; all others succeed. */
  private void stubDeliveries(PreparedDispatch dispatch) {
    when(recipientDelivery.deliver(eq(dispatch), any(DispatchRecipient.class)))
        .thenAnswer(
            invocation -> {
              DispatchRecipient recipient = invocation.getArgument(1);
              var result =
                  recipient.email().startsWith("fail")
                      ? SendResult.failed("550 mailbox unavailable")
                      : SendResult.delivered("<id@test>");
              return new RecipientResult(recipient, result);
            });
  }

  @Test
  void send_counts_partial_failures_and_closes_out_as_sent() {
    var list = new ArrayList<>(recipients(3));
    list.add(new DispatchRecipient(UUID.randomUUID(), "fail-1@example.com"));
    list.add(new DispatchRecipient(UUID.randomUUID(), "fail-2@example.com"));
    var dispatch = preparedFor(list);
    when(dispatchService.prepare(CAMPAIGN_ID)).thenReturn(DispatchPreparation.ready(dispatch));
    stubDeliveries(dispatch);

    var outcome = dispatcher(DIRECT, DIRECT, 100).send(CAMPAIGN_ID);

    assertThat(outcome.status()).isEqualTo(DispatchOutcome.Status.QUEUED);
    assertThat(outcome.totalRecipients()).isEqualTo(5);
    assertThat(outcome.completion().join()).isEqualTo(new DispatchTally(3, 2));

    @SuppressWarnings("unchecked")
    ArgumentCaptor<Collection<UUID>> delivered = ArgumentCaptor.forClass(Collection.class);
    verify(dispatchService)
        .complete(
            eq(CAMPAIGN_ID), eq(new DispatchTally(3, 2)), delivered.capture(), eq(CLOCK.instant()));
    assertThat(delivered.getValue())
        .containsExactlyInAnyOrderElementsOf(
            list.subList(0, 3).stream().map(DispatchRecipient::subscriberId).toList());
    verify(dispatchService, never()).fail(any(), any());
  }

  @Test
  void send_flushes_progress_every_flush_size_results() {
    var dispatch = preparedFor(recipients(5));
    when(dispatchService.prepare(CAMPAIGN_ID)).thenReturn(DispatchPreparation.ready(dispatch));
    stubDeliveries(dispatch);

    dispatcher(DIRECT, DIRECT, 2).send(CAMPAIGN_ID);

    @SuppressWarnings("unchecked")
    ArgumentCaptor<Collection<UUID>> flushed = ArgumentCaptor.forClass(Collection.class);
    ArgumentCaptor<DispatchTally> tallies = ArgumentCaptor.forClass(DispatchTally.class);
    verify(dispatchService, times(2))
        .recordProgress(eq(CAMPAIGN_ID), tallies.capture(), flushed.capture(), any());
    assertThat(tallies.getAllValues())
        .containsExactly(new DispatchTally(2, 0), new DispatchTally(4, 0));
    assertThat(flushed.getAllValues()).allSatisfy(ids -> assertThat(ids).hasSize(2));

    @SuppressWarnings("unchecked")
    ArgumentCaptor<Collection<UUID>> remaining = ArgumentCaptor.forClass(Collection.class);
    verify(dispatchService)
        .complete(eq(CAMPAIGN_ID), eq(new DispatchTally(5, 0)), remaining.capture(), any());
    assertThat(remaining.getValue()).hasSize(1);
  }

  @Test
  void send_returns_rejection_without_delivering() {
    when(dispatchService.prepare(CAMPAIGN_ID))
        .thenReturn(DispatchPreparation.rejected(DispatchOutcome.Status.ALREADY_SENT));

    var outcome = dispatcher(DIRECT, DIRECT, 25).send(CAMPAIGN_ID);

    assertThat(outcome.status()).isEqualTo(DispatchOutcome.Status.ALREADY_SENT);
    assertThat(outcome.message()).isEqualTo("Campaign has already been sent.");
    assertThat(outcome.completion().join()).isEqualTo(DispatchTally.EMPTY);
    verify(recipientDelivery, never()).deliver(any(), any());
    verify(dispatchService, never()).complete(any(), any(), anyCollection(), any());
  }

  @Test
  void send_with_no_recipients_reports_it() {
    when(dispatchService.prepare(CAMPAIGN_ID))
        .thenReturn(DispatchPreparation.rejected(DispatchOutcome.Status.NO_RECIPIENTS));

    var outcome = dispatcher(DIRECT, DIRECT, 25).send(CAMPAIGN_ID);

    assertThat(outcome.isQueued()).isFalse();
    assertThat(outcome.message()).isEqualTo("No subscribers found for this campaign.");
  }

  @Test
  void concurrent_claim_is_reported_as_already_sending() {
    when(dispatchService.prepare(CAMPAIGN_ID))
        .thenThrow(new ObjectOptimisticLockingFailureException(Campaign.class, CAMPAIGN_ID));

    var outcome = dispatcher(DIRECT, DIRECT, 25).send(CAMPAIGN_ID);

    assertThat(outcome.status()).isEqualTo(DispatchOutcome.Status.ALREADY_SENDING);
    verify(recipientDelivery, never()).deliver(any(), any());
  }

  @Test
  void persistence_failure_closes_campaign_out_as_failed_with_counts_so_far() {
    var dispatch = preparedFor(recipients(3));
    when(dispatchService.prepare(CAMPAIGN_ID)).thenReturn(DispatchPreparation.ready(dispatch));
    stubDeliveries(dispatch);
    doThrow(new IllegalStateException("database down"))
        .when(dispatchService)
        .complete(any(), any(), anyCollection(), any());

    var outcome = dispatcher(DIRECT, DIRECT, 100).send(CAMPAIGN_ID);

    assertThat(outcome.completion().join()).isEqualTo(new DispatchTally(3, 0));
    verify(dispatchService).fail(CAMPAIGN_ID, new DispatchTally(3, 0));
  }

  @Test
  void coordinator_tags_logs_with_campaign_id_and_clears_it() {
    var dispatch = preparedFor(recipients(1));
    when(dispatchService.prepare(CAMPAIGN_ID)).thenReturn(DispatchPreparation.ready(dispatch));
    stubDeliveries(dispatch);
    List<String> seen = new ArrayList<>();
    doAnswer(
            invocation -> {
              seen.add(MDC.get("campaignId"));
              return null;
            })
        .when(dispatchService)
        .complete(any(), any(), anyCollection(), any());

    dispatcher(DIRECT, DIRECT, 25).send(CAMPAIGN_ID);

    assertThat(seen).containsExactly(CAMPAIGN_ID.toString());
    assertThat(MDC.get("campaignId")).isNull();
  }

  @Test
  void send_on_real_pools_accounts_for_every_recipient() throws Exception {
    var workers = pool("test-send-", 4);
    var coordinators = pool("test-dispatch-", 1);
    try {
      var list = new ArrayList<>(recipients(37));
      IntStream.range(0, 5)
          .forEach(
              i ->
                  list.add(
                      new DispatchRecipient(UUID.randomUUID(), "fail-" + i + "@example.com")));
      var dispatch = preparedFor(list);
      when(dispatchService.prepare(CAMPAIGN_ID)).thenReturn(DispatchPreparation.ready(dispatch));
      stubDeliveries(dispatch);

      var outcome = dispatcher(workers, coordinators, 10).send(CAMPAIGN_ID);
      var tally = outcome.completion().get(30, TimeUnit.SECONDS);

      assertThat(tally).isEqualTo(new DispatchTally(37, 5));
      verify(recipientDelivery, times(42)).deliver(eq(dispatch), any());
      verify(dispatchService)
          .complete(eq(CAMPAIGN_ID), eq(new DispatchTally(37, 5)), anyCollection(), any());
    } finally {
      workers.shutdown();
      coordinators.shutdown();
    }
  }

  private static ThreadPoolTaskExecutor pool(String prefix, int size) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(size);
    executor.setMaxPoolSize(size);
    executor.setThreadNamePrefix(prefix);
    executor.initialize();
    return executor;
  }
}
