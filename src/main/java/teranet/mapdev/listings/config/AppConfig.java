package teranet.mapdev.listings.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Application-wide beans that are not tied to a single service.
 */
@Configuration
public class AppConfig {

    /**
     * Clock used for run timestamps and for every "now" the transformation and
     * quality stages compare dates against. Tests replace it with a fixed clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
