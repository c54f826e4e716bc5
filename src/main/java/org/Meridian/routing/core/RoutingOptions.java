package org.Meridian.routing.core;

import lombok.Builder;
import lombok.Value;

/**
 * Per-request output and cost options.
 */
@Value
@Builder
public class RoutingOptions {
    /** Include the node coordinate sequence in the response. */
    @Builder.Default
    boolean includeGeometry = true;
    /** Add bearing based turn penalties to the reported duration. */
    @Builder.Default
    boolean applyTurnPenalties = false;

    public static RoutingOptions defaults() {
        return RoutingOptions.builder().build();
    }
}
