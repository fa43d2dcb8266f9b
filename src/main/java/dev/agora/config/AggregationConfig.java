package dev.agora.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.agora.aggregation.ResultFilter;
import dev.agora.result.LegacyResultReader;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default collaborators of the aggregation layer. Each can be replaced by declaring a bean of the
 * same type.
 */
@Configuration
public class AggregationConfig {

  /** Accepts every result unless a plugin layer contributes its own filter. */
  @Bean
  @ConditionalOnMissingBean
  public ResultFilter resultFilter() {
    return ResultFilter.ACCEPT_ALL;
  }

  @Bean
  @ConditionalOnMissingBean
  public ObjectMapper objectMapper() {
    return new ObjectMapper();
  }

  /** Measures engine timings and request deadlines. */
  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public LegacyResultReader legacyResultReader(ObjectMapper objectMapper) {
    return new LegacyResultReader(objectMapper);
  }
}
