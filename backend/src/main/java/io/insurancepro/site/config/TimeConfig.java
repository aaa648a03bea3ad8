package io.insurancepro.site.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }
}
