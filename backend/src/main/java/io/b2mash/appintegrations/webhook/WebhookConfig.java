package io.b2mash.appintegrations.webhook;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WebhookConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }
}
