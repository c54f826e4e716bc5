package org.Meridian.routing.core;

/**
 * Public route service contract.
 *
 * <p>Implementations validate input deterministically and throw {@link RoutingException}
 * with a reason code for contract failures.</p>
 */
public interface RouterService {
    /**
     * Executes one point-to-point route request.
     *
     * @param request client route request.
     * @return route response for the requested origin/destination pair.
     * @throws RoutingException {@code INVALID_COORDINATES} when an endpoint cannot be snapped,
     *                          {@code NO_ROUTE_FOUND} when the destination is unreachable.
     */
    RoutingResponse route(RoutingRequest request);
}
