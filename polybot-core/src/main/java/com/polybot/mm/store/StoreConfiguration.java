package com.polybot.mm.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.mm.config.MmProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

@Slf4j
@Configuration(proxyBeanMethods=false)
public class StoreConfiguration {

  @Bean
  public MmStore mmStore(
      MmProperties properties,
      ObjectProvider<JdbcTemplate> jdbcTemplate,
      ObjectMapper objectMapper,
      Clock clock
  ) {
    if (properties.store().mode() == MmProperties.StoreMode.JDBC) {
      JdbcTemplate template = jdbcTemplate.getIfAvailable();
      if (template == null) {
        throw new IllegalStateException("mm.store.mode=JDBC requires a configured DataSource");
      }
      log.info("mm store: jdbc");
      return new JdbcMmStore(template, objectMapper, clock);
    }
    log.info("mm store: in-memory");
    return new InMemoryMmStore(clock, objectMapper);
  }
}
