package uk.gegc.assessment.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Tunables of the timed session engine.
 */
@Configuration
@ConfigurationProperties(prefix = "app.session")
@Data
public class SessionProperties {

    /**
     * How many seconds before the authoritative deadline a client-declared expiry
     * is still classified as a timeout. Absorbs small client clock drift.
     */
    private long expiryGraceSeconds = 5;

    /** Length of the top and bottom performer lists in analytics. */
    private int analyticsPerformerLimit = 5;

    /** Number of calendar weeks in the organization trend. */
    private int analyticsTrendWeeks = 12;
}
