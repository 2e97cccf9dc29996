package taskapp.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link Clock} that stamps {@code dateCreated} on new Users and Tasks.
 *
 * <p>Instants are zone-independent, so the zone only affects how the clock is reported.
 * Tests construct the services with {@link Clock#fixed} instead.
 *
 * <pre>
 * app:
 *   timezone: UTC
 * </pre>
 */
@Configuration
public class ClockConfig {

    /**
     * @param timezone IANA zone id; blank means the JVM default zone
     */
    @Bean
    public Clock clock(@Value("${app.timezone:}") final String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return Clock.systemDefaultZone();
        }
        return Clock.system(ZoneId.of(timezone));
    }
}
