package org.Meridian.routing.ch;

import lombok.Builder;
import lombok.Value;

/**
 * Witness search bounds and progress reporting for {@link Contractor}.
 * <p>
 * Tighter bounds contract faster but may add shortcuts a full search would have avoided;
 * distances stay exact either way.
 */
@Value
@Builder
public class ContractionConfig {
    /**
     * Maximum number of arcs on a witness path.
     */
    @Builder.Default
    int maxWitnessHops = 5;

    /**
     * Per-search settle budget. {@link Integer#MAX_VALUE} means unbounded.
     */
    @Builder.Default
    int maxWitnessSettledNodes = Integer.MAX_VALUE;

    /**
     * Number of contracted nodes between two debug progress lines.
     */
    @Builder.Default
    int progressLogInterval = 10_000;

    public static ContractionConfig defaults() {
        return ContractionConfig.builder().build();
    }

    void validate() {
        if (maxWitnessHops <= 0) {
            throw new IllegalArgumentException("maxWitnessHops must be > 0");
        }
        if (maxWitnessSettledNodes <= 0) {
            throw new IllegalArgumentException("maxWitnessSettledNodes must be > 0");
        }
        if (progressLogInterval <= 0) {
            throw new IllegalArgumentException("progressLogInterval must be > 0");
        }
    }
}
