package org.Meridian.routing.spatial;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;
import java.util.Objects;

/**
 * Uniform grid index over node coordinates for nearest-node snapping.
 * <p>
 * The plane (lon = x, lat = y) is partitioned into square cells of {@code cellSizeDegrees}.
 * Nearest lookup inspects only the containing cell and its 8 neighbours, so a node farther
 * than one cell away from the query is never returned. Pick a cell size larger than the
 * expected maximum node spacing when exact snapping matters.
 * <p>
 * Immutable after construction, safe for concurrent reads.
 */
public final class GridSpatialIndex {
    public static final double DEFAULT_CELL_SIZE_DEGREES = 0.01d;
    public static final int NO_NODE = -1;
    private static final double FULL_LONGITUDE_SPAN = 360.0d;

    private static final int[] EMPTY_CELL = new int[0];

    private final double[] nodeLon;
    private final double[] nodeLat;
    private final Long2ObjectOpenHashMap<int[]> cells;
    @Getter
    @Accessors(fluent = true)
    private final double cellSizeDegrees;

    private GridSpatialIndex(double[] nodeLon, double[] nodeLat, Long2ObjectOpenHashMap<int[]> cells, double cellSizeDegrees) {
        this.nodeLon = nodeLon;
        this.nodeLat = nodeLat;
        this.cells = cells;
        this.cellSizeDegrees = cellSizeDegrees;
    }

    /**
     * Builds an index over parallel coordinate arrays. Node ids are array positions.
     *
     * @param nodeLon longitudes, not copied; caller must not mutate afterwards.
     * @param nodeLat latitudes, not copied; caller must not mutate afterwards.
     * @param cellSizeDegrees grid cell edge length in degrees, finite and positive.
     */
    public static GridSpatialIndex build(double[] nodeLon, double[] nodeLat, double cellSizeDegrees) {
        Objects.requireNonNull(nodeLon, "nodeLon");
        Objects.requireNonNull(nodeLat, "nodeLat");
        if (nodeLon.length != nodeLat.length) {
            throw new IllegalArgumentException(
                    "coordinate length mismatch: lon=" + nodeLon.length + ", lat=" + nodeLat.length);
        }
        if (!Double.isFinite(cellSizeDegrees) || cellSizeDegrees <= 0.0d) {
            throw new IllegalArgumentException("cellSizeDegrees must be finite and > 0, got " + cellSizeDegrees);
        }

        Long2ObjectOpenHashMap<IntArrayList> buckets = new Long2ObjectOpenHashMap<>();
        for (int nodeId = 0; nodeId < nodeLon.length; nodeId++) {
            long key = cellKey(cellIndex(nodeLon[nodeId], cellSizeDegrees), cellIndex(nodeLat[nodeId], cellSizeDegrees));
            IntArrayList bucket = buckets.get(key);
            if (bucket == null) {
                bucket = new IntArrayList(4);
                buckets.put(key, bucket);
            }
            bucket.add(nodeId);
        }

        Long2ObjectOpenHashMap<int[]> cells = new Long2ObjectOpenHashMap<>(buckets.size());
        for (Long2ObjectMap.Entry<IntArrayList> entry : buckets.long2ObjectEntrySet()) {
            cells.put(entry.getLongKey(), entry.getValue().toIntArray());
        }
        cells.trim();
        return new GridSpatialIndex(nodeLon, nodeLat, cells, cellSizeDegrees);
    }

    /**
     * Number of non-empty grid cells.
     */
    public int cellCount() {
        return cells.size();
    }

    /**
     * Finds the nearest node within the 3x3 cell neighbourhood of the query point.
     * Tie-break is deterministic: lower node id wins when distances are equal.
     *
     * @return nearest node id, or {@link #NO_NODE} when the neighbourhood is empty
     * or the point is not finite.
     */
    public int nearest(double lon, double lat) {
        if (!Double.isFinite(lon) || !Double.isFinite(lat) || cells.isEmpty()) {
            return NO_NODE;
        }
        int cellX = cellIndex(lon, cellSizeDegrees);
        int cellY = cellIndex(lat, cellSizeDegrees);

        int bestNode = NO_NODE;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int dx = -1; dx <= 1; dx++) {
            for (int dy = -1; dy <= 1; dy++) {
                int[] candidates = cells.getOrDefault(cellKey(cellX + dx, cellY + dy), EMPTY_CELL);
                for (int nodeId : candidates) {
                    double distance = GeoDistance.haversineMeters(lat, lon, nodeLat[nodeId], nodeLon[nodeId]);
                    if (distance < bestDistance || (distance == bestDistance && nodeId < bestNode)) {
                        bestDistance = distance;
                        bestNode = nodeId;
                    }
                }
            }
        }
        return bestNode;
    }

    /**
     * Collects all nodes whose haversine distance to the query point is at most {@code radiusMeters}.
     * <p>
     * The cell window grows with {@code radius / cellSize}. The longitude half-width is the
     * spherical one, {@code asin(sin(r / R) / cos(lat))}; when the circle reaches a pole every
     * longitude is scanned.
     *
     * @return matching node ids in ascending order.
     */
    public int[] withinRadius(double lon, double lat, double radiusMeters) {
        if (!Double.isFinite(lon) || !Double.isFinite(lat)) {
            return EMPTY_CELL;
        }
        if (!Double.isFinite(radiusMeters) || radiusMeters < 0.0d) {
            throw new IllegalArgumentException("radiusMeters must be finite and >= 0, got " + radiusMeters);
        }

        double radiusDegrees = radiusMeters / GeoDistance.METERS_PER_DEGREE;
        long latCells = (long) Math.ceil(radiusDegrees / cellSizeDegrees);
        long lonCells = (long) Math.ceil(longitudeHalfWidthDegrees(lat, radiusMeters) / cellSizeDegrees);

        IntArrayList result = new IntArrayList();
        long windowCells = (2L * lonCells + 1L) * (2L * latCells + 1L);
        if (windowCells > cells.size()) {
            // Window is larger than the populated grid: scan populated cells directly.
            int cellX = cellIndex(lon, cellSizeDegrees);
            int cellY = cellIndex(lat, cellSizeDegrees);
            for (Long2ObjectMap.Entry<int[]> entry : cells.long2ObjectEntrySet()) {
                long key = entry.getLongKey();
                int x = (int) (key >> 32);
                int y = (int) key;
                if (Math.abs((long) x - cellX) <= lonCells && Math.abs((long) y - cellY) <= latCells) {
                    collectWithinRadius(entry.getValue(), lon, lat, radiusMeters, result);
                }
            }
        } else {
            int cellX = cellIndex(lon, cellSizeDegrees);
            int cellY = cellIndex(lat, cellSizeDegrees);
            for (long dx = -lonCells; dx <= lonCells; dx++) {
                for (long dy = -latCells; dy <= latCells; dy++) {
                    int[] candidates = cells.getOrDefault(cellKey((int) (cellX + dx), (int) (cellY + dy)), EMPTY_CELL);
                    collectWithinRadius(candidates, lon, lat, radiusMeters, result);
                }
            }
        }
        int[] nodes = result.toIntArray();
        Arrays.sort(nodes);
        return nodes;
    }

    /**
     * Largest longitude offset of any point within {@code radiusMeters} of latitude {@code lat}.
     */
    static double longitudeHalfWidthDegrees(double lat, double radiusMeters) {
        double angularRadius = radiusMeters / GeoDistance.EARTH_MEAN_RADIUS_METERS;
        double latitudeCosine = Math.abs(Math.cos(Math.toRadians(lat)));
        if (angularRadius >= Math.PI / 2.0d) {
            return FULL_LONGITUDE_SPAN;
        }
        double ratio = Math.sin(angularRadius) / latitudeCosine;
        if (!(ratio < 1.0d)) {
            // circle contains a pole
            return FULL_LONGITUDE_SPAN;
        }
        return Math.toDegrees(Math.asin(ratio));
    }

    private void collectWithinRadius(int[] candidates, double lon, double lat, double radiusMeters, IntArrayList sink) {
        for (int nodeId : candidates) {
            if (GeoDistance.haversineMeters(lat, lon, nodeLat[nodeId], nodeLon[nodeId]) <= radiusMeters) {
                sink.add(nodeId);
            }
        }
    }

    static int cellIndex(double coordinate, double cellSizeDegrees) {
        return (int) Math.floor(coordinate / cellSizeDegrees);
    }

    /**
     * Packs a cell coordinate pair as {@code (x << 32) | y}.
     */
    static long cellKey(int x, int y) {
        return ((long) x << 32) | (y & 0xFFFFFFFFL);
    }

    @Override
    public String toString() {
        return "GridSpatialIndex[cells=" + cells.size() + ", cellSize=" + cellSizeDegrees + "]";
    }
}
