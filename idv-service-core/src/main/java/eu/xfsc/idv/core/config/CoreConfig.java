package eu.xfsc.idv.core.config;

import java.security.SecureRandom;
import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Identity verification core configuration.
 * The host must additionally provide a {@link eu.xfsc.idv.core.service.securestore.SecureStore}
 * bean, or set {@code securestore.impl=memory} to use the in-process store.
 */
@Configuration
@ComponentScan(basePackages = {"eu.xfsc.idv.core.service"})
public class CoreConfig {

  @Bean
  public Clock verificationClock() {
    return Clock.systemUTC();
  }

  @Bean
  public SecureRandom deviceKeyRandom() {
    return new SecureRandom();
  }

}
