package tasktree.config;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the application-wide {@link Clock}, zoned to the classroom's calendar.
 *
 * <p>Every {@code createdAt}/{@code updatedAt} stamp, question timestamp, and the
 * "today" of a forest view come from this bean. The zone decides where a school day
 * starts and ends, which drives the date filter and the ongoing flag of a view:
 * <pre>
 * tasktree:
 *   classroom:
 *     timezone: America/New_York
 * </pre>
 * If not specified, the JVM default zone is used.
 */
@Configuration
public class ClockConfig {

    private static final Logger LOG = LoggerFactory.getLogger(ClockConfig.class);

    /**
     * @param timezone IANA zone id of the classroom, blank for the system zone
     * @return a clock in that zone
     * @throws IllegalStateException if the zone id is not recognized
     */
    @Bean
    public Clock clock(@Value("${tasktree.classroom.timezone:}") final String timezone) {
        final ZoneId zone = classroomZone(timezone);
        LOG.info("Classroom days follow zone {}", zone);
        return Clock.system(zone);
    }

    static ZoneId classroomZone(final String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException ex) {
            throw new IllegalStateException("tasktree.classroom.timezone is not a valid zone id: " + timezone, ex);
        }
    }
}
