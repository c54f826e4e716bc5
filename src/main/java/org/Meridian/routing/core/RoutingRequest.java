package org.Meridian.routing.core;

import lombok.Builder;
import lombok.Value;
import org.Meridian.routing.spatial.GeoPoint;

/**
 * Client-facing point-to-point route request in coordinate space.
 *
 * <p>Both endpoints are snapped to their nearest graph node before routing.</p>
 */
@Value
@Builder
public class RoutingRequest {
    /** Route origin. */
    GeoPoint origin;
    /** Route destination. */
    GeoPoint destination;
    /** Output options. */
    @Builder.Default
    RoutingOptions options = RoutingOptions.defaults();
}
