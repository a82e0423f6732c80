package com.polybot.mm.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration(proxyBeanMethods=false)
@EnableConfigurationProperties(MmProperties.class)
public class MmConfiguration {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
