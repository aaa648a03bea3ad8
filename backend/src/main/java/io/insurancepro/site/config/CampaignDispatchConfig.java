package io.insurancepro.site.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for campaign sends.
 *
 * <ul>
 *   <li><b>campaignSendExecutor</b>: fixed pool that performs one recipient delivery per task.
 *       Its size bounds the number of concurrent SMTP connections.
 *   <li><b>campaignCoordinatorExecutor</b>: one thread per running dispatch; waits for every
 *       recipient result and owns the campaign's tallies.
 * </ul>
 */
@Configuration
@EnableConfigurationProperties(CampaignDispatchConfig.DispatchProperties.class)
public class CampaignDispatchConfig {

  /**
   * @param workerThreads parallel senders
   * @param coordinatorThreads dispatches that can run at the same time
   * @param progressFlushSize results accumulated before tallies are written back
   * @param awaitCompletion when true the send endpoint blocks until the dispatch has finished
   */
  @ConfigurationProperties("insurancepro.campaign.dispatch")
  public record DispatchProperties(
      @DefaultValue("4") int workerThreads,
      @DefaultValue("2") int coordinatorThreads,
      @DefaultValue("25") int progressFlushSize,
      @DefaultValue("false") boolean awaitCompletion) {}

  @Bean(name = "campaignSendExecutor")
  ThreadPoolTaskExecutor campaignSendExecutor(DispatchProperties props) {
    return fixedPool("campaign-send-", props.workerThreads());
  }

  @Bean(name = "campaignCoordinatorExecutor")
  ThreadPoolTaskExecutor campaignCoordinatorExecutor(DispatchProperties props) {
    return fixedPool("campaign-dispatch-", props.coordinatorThreads());
  }

  private static ThreadPoolTaskExecutor fixedPool(String prefix, int size) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(size);
    executor.setMaxPoolSize(size);
    executor.setThreadNamePrefix(prefix);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(60);
    return executor;
  }
}
