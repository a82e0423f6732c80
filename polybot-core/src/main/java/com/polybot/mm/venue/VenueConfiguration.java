package com.polybot.mm.venue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.mm.config.MmProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;

@Slf4j
@Configuration(proxyBeanMethods=false)
public class VenueConfiguration {

  @Bean
  public RestClient executorRestClient(MmProperties properties) {
    MmProperties.Venue venue = properties.venue();
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout((int) Math.min(Integer.MAX_VALUE, venue.callTimeoutMillis()));
    requestFactory.setReadTimeout((int) Math.min(Integer.MAX_VALUE, venue.callTimeoutMillis()));
    return RestClient.builder()
        .baseUrl(venue.executorBaseUrl())
        .requestFactory(requestFactory)
        .build();
  }

  @Bean(destroyMethod="close")
  public VenueGateway venueGateway(
      MmProperties properties,
      @Qualifier("executorRestClient") RestClient executorRestClient,
      ObjectMapper objectMapper,
      Clock clock
  ) {
    MmProperties.Venue venue = properties.venue();
    ExecutorVenueOrderApi executor = new ExecutorVenueOrderApi(executorRestClient, objectMapper, clock);
    VenueOrderApi delegate;
    if (properties.mode() == MmProperties.TradingMode.LIVE) {
      log.info("venue mode=LIVE executorBaseUrl={}", venue.executorBaseUrl());
      delegate = executor;
    } else {
      log.info("venue mode=PAPER startingCash={} fillProbability={}", venue.paperStartingCash(), venue.paperFillProbability());
      PaperVenueOrderApi paper = new PaperVenueOrderApi(clock, venue.paperStartingCash(), venue.paperFillProbability(), 1.0);
      paper.useBookSource(executor::getBookSummary);
      delegate = paper;
    }
    return new VenueGateway(delegate, clock, venue.maxConcurrentCalls(), venue.callTimeoutMillis());
  }
}
