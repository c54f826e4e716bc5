package org.Meridian.routing.core;

import org.Meridian.routing.ch.ChQueryResult;
import org.Meridian.routing.ch.ContractionHierarchies;
import org.Meridian.routing.ch.HierarchyQueryEngine;
import org.Meridian.routing.ch.PathUnpacker;
import org.Meridian.routing.graph.GraphStore;
import org.Meridian.routing.spatial.GeoDistance;
import org.Meridian.routing.spatial.GeoPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Coordinate-to-coordinate router backed by a {@link ContractionHierarchies}.
 *
 * <p>Endpoints are snapped to the nearest node, the hierarchy is queried and the packed path
 * is unpacked into graph edges. The hierarchy is node based and does not see turn
 * restrictions: when the unpacked path crosses one, the route is recomputed with
 * {@link TurnRestrictedDijkstra}. Stateless apart from the shared read-only structures, so one
 * instance serves concurrent requests.</p>
 */
public final class HierarchyRouter implements RouterService {
    private static final Logger log = LoggerFactory.getLogger(HierarchyRouter.class);

    public static final String ALGORITHM = "ContractionHierarchies";
    public static final String FALLBACK_ALGORITHM = "TurnRestrictedDijkstra";

    private final GraphStore graph;
    private final HierarchyQueryEngine queryEngine;
    private final PathUnpacker unpacker;
    private final TurnRestrictedDijkstra fallback;

    /**
     * @throws RoutingException with {@code HIERARCHY_MISMATCH} when the hierarchy was built
     *                          for a different graph.
     */
    public HierarchyRouter(GraphStore graph, ContractionHierarchies hierarchies) {
        this.graph = Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(hierarchies, "hierarchies");
        if (!hierarchies.isCompatibleWith(graph)) {
            throw new RoutingException(
                    RoutingException.REASON_HIERARCHY_MISMATCH,
                    String.format("hierarchy signature %016x does not match graph signature %016x",
                            hierarchies.graphSignature(), graph.signature()));
        }
        this.queryEngine = new HierarchyQueryEngine(hierarchies);
        this.unpacker = new PathUnpacker(hierarchies);
        this.fallback = new TurnRestrictedDijkstra(graph);
    }

    @Override
    public RoutingResponse route(RoutingRequest request) {
        Objects.requireNonNull(request, "request");
        RoutingOptions options = request.getOptions() == null ? RoutingOptions.defaults() : request.getOptions();
        Waypoint origin = snap(request.getOrigin(), "origin");
        Waypoint destination = snap(request.getDestination(), "destination");

        ChQueryResult result = queryEngine.query(origin.nodeId(), destination.nodeId());
        int[] edges = unpacker.unpack(result);
        int settledNodes = result.settledNodes();
        String algorithm = ALGORITHM;
        boolean restrictedFallback = false;

        if (graph.hasTurnRestrictions() && crossesRestriction(edges)) {
            log.debug("Hierarchy route {} -> {} crosses a turn restriction, recomputing edge based",
                    origin.nodeId(), destination.nodeId());
            TurnRestrictedDijkstra.Path path = fallback.route(origin.nodeId(), destination.nodeId());
            edges = path.edges();
            settledNodes += path.settledStates();
            algorithm = FALLBACK_ALGORITHM;
            restrictedFallback = true;
        }

        return buildResponse(edges, origin, destination, options, settledNodes, algorithm, restrictedFallback);
    }

    private Waypoint snap(GeoPoint point, String name) {
        if (point == null || !point.isFinite()) {
            throw new RoutingException(
                    RoutingException.REASON_INVALID_COORDINATES,
                    name + " coordinate is missing or not finite: " + point);
        }
        OptionalInt nearest = graph.nearestNode(point);
        if (nearest.isEmpty()) {
            throw new RoutingException(
                    RoutingException.REASON_INVALID_COORDINATES,
                    "no graph node near " + name + " " + point);
        }
        int nodeId = nearest.getAsInt();
        GeoPoint location = graph.nodeLocation(nodeId);
        return new Waypoint(point, nodeId, location, GeoDistance.haversineMeters(point, location));
    }

    private boolean crossesRestriction(int[] edges) {
        for (int i = 1; i < edges.length; i++) {
            int via = graph.edgeTarget(edges[i - 1]);
            if (graph.isTurnRestricted(edges[i - 1], via, edges[i])) {
                return true;
            }
        }
        return false;
    }

    private RoutingResponse buildResponse(
            int[] edges,
            Waypoint origin,
            Waypoint destination,
            RoutingOptions options,
            int settledNodes,
            String algorithm,
            boolean restrictedFallback
    ) {
        RoutingResponse.RoutingResponseBuilder builder = RoutingResponse.builder()
                .waypoint(origin)
                .waypoint(destination)
                .settledNodes(settledNodes)
                .algorithm(algorithm)
                .turnRestrictionFallback(restrictedFallback);

        if (options.isIncludeGeometry()) {
            builder.geometryPoint(origin.location());
        }
        double distance = 0.0d;
        double duration = 0.0d;
        for (int i = 0; i < edges.length; i++) {
            int edgeId = edges[i];
            int from = graph.edgeSource(edgeId);
            int to = graph.edgeTarget(edgeId);
            double length = graph.edgeDistance(edgeId);
            double weight = graph.edgeWeight(edgeId);
            distance += length;
            duration += weight;
            if (options.isApplyTurnPenalties() && i > 0) {
                duration += graph.turnPenalty(edges[i - 1], edgeId).orElse(0.0d);
            }
            builder.segment(new RouteSegment(edgeId, from, to, length, weight));
            if (options.isIncludeGeometry()) {
                builder.geometryPoint(graph.nodeLocation(to));
            }
        }
        return builder
                .distance(distance)
                .duration(duration)
                .build();
    }
}
