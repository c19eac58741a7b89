package io.realtycrm.backend.config;

import java.time.Clock;
import java.util.Random;
import java.util.random.RandomGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PhaseEngineConfig {

  /** All month-boundary and timestamp decisions of the phase engine read this clock (UTC). */
  @Bean
  public Clock phaseEngineClock() {
    return Clock.systemUTC();
  }

  /** Uniform source for the weighted lead draw. {@link Random} is safe for concurrent use. */
  @Bean
  public RandomGenerator leadSelectionRandom() {
    return new Random();
  }
}
