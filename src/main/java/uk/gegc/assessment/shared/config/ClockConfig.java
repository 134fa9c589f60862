package uk.gegc.assessment.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Single source of server time for the whole application.
 * <p>
 * The session engine never trusts a client clock: deadlines, completion timestamps and
 * analytics week boundaries are all derived from this bean. The configured zone only matters
 * for calendar computations (the weekly trend starts on the local Sunday); instants are zone-free.
 */
@Configuration
public class ClockConfig {

    @Value("${app.timezone:UTC}")
    private String timezone;

    @Bean
    public Clock clock() {
        String configuredZone = timezone == null || timezone.isBlank()
                ? "UTC"
                : timezone.trim();
        return Clock.system(ZoneId.of(configuredZone));
    }
}
