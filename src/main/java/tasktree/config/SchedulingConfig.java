package tasktree.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables {@code @Scheduled} processing for the nightly order normalization pass.
 *
 * <p>The pass itself only runs when {@code tasktree.order.normalizer.enabled} is true.
 *
 * @see tasktree.service.OrderNormalizer#scheduledNormalization()
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {
    // enables @Scheduled annotation processing
}
