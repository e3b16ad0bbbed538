package io.b2mash.sitediary.config;

import io.b2mash.sitediary.storage.local.LocalStorageProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({SiteDiaryProperties.class, LocalStorageProperties.class})
public class SiteDiaryConfig {

  /** Source of "today" for project day counts and report filenames. */
  @Bean
  Clock clock() {
    return Clock.systemDefaultZone();
  }
}
