package com.polybot.mm.events;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods=false)
public class MmEventsConfiguration {

  @Bean
  @ConditionalOnMissingBean(MmEventPublisher.class)
  public MmEventPublisher noopMmEventPublisher() {
    return new NoopMmEventPublisher();
  }
}
