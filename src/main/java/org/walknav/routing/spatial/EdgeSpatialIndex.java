package org.walknav.routing.spatial;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.walknav.routing.geo.BoundingBox;
import org.walknav.routing.geo.Coordinate;
import org.walknav.routing.geo.GeoUtils;
import org.walknav.routing.graph.RoadGraph;

import java.util.Arrays;
import java.util.Objects;

/**
 * Uniform lon/lat grid over edge segments.
 * <p>
 * Each edge is registered in every cell its bounding box touches. Cell membership is stored
 * CSR-style ({@code cellStart[c] .. cellStart[c + 1]} into {@code cellEdges}), so the index is
 * immutable after construction and safe for concurrent reads.
 * </p>
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class EdgeSpatialIndex {
    static final int MAX_CELLS = 1 << 22;
    // Covers the longitude-degree error of the flat radius-to-degrees conversion.
    private static final double SEARCH_PADDING = 1.1d;

    private final double originLon;
    private final double originLat;
    @Getter
    @Accessors(fluent = true)
    private final double cellDegrees;
    @Getter
    @Accessors(fluent = true)
    private final int columns;
    @Getter
    @Accessors(fluent = true)
    private final int rows;
    private final int[] cellStart;
    private final int[] cellEdges;

    /**
     * Builds an index over every edge of {@code graph}.
     *
     * @param graph source graph.
     * @param requestedCellDegrees preferred cell edge length in degrees; grown when the grid
     *                             would exceed {@link #MAX_CELLS}.
     */
    public static EdgeSpatialIndex build(RoadGraph graph, double requestedCellDegrees) {
        Objects.requireNonNull(graph, "graph");
        if (!(requestedCellDegrees > 0.0d)) {
            throw new IllegalArgumentException("requestedCellDegrees must be > 0");
        }
        BoundingBox extent = graph.extent();
        double lonSpan = extent.maxLon() - extent.minLon();
        double latSpan = extent.maxLat() - extent.minLat();

        double cell = requestedCellDegrees;
        while (cellsFor(lonSpan, cell) * cellsFor(latSpan, cell) > MAX_CELLS) {
            cell *= 2.0d;
        }
        int columns = (int) cellsFor(lonSpan, cell);
        int rows = (int) cellsFor(latSpan, cell);

        int cellCount = columns * rows;
        int[] cellStart = new int[cellCount + 1];
        for (int edgeId = 0; edgeId < graph.edgeCount(); edgeId++) {
            int[] range = cellRange(graph, edgeId, extent, cell, columns, rows);
            for (int row = range[2]; row <= range[3]; row++) {
                for (int col = range[0]; col <= range[1]; col++) {
                    cellStart[row * columns + col + 1]++;
                }
            }
        }
        for (int c = 0; c < cellCount; c++) {
            cellStart[c + 1] += cellStart[c];
        }

        int[] cursor = Arrays.copyOf(cellStart, cellCount);
        int[] cellEdges = new int[cellStart[cellCount]];
        for (int edgeId = 0; edgeId < graph.edgeCount(); edgeId++) {
            int[] range = cellRange(graph, edgeId, extent, cell, columns, rows);
            for (int row = range[2]; row <= range[3]; row++) {
                for (int col = range[0]; col <= range[1]; col++) {
                    cellEdges[cursor[row * columns + col]++] = edgeId;
                }
            }
        }

        return new EdgeSpatialIndex(
                extent.minLon(),
                extent.minLat(),
                cell,
                columns,
                rows,
                cellStart,
                cellEdges
        );
    }

    /**
     * Collects ids of edges that may lie within {@code radiusMeters} of {@code point}.
     * Output is sorted ascending and duplicate-free; it may contain edges farther away.
     *
     * @param point query coordinate.
     * @param radiusMeters search radius.
     * @param out cleared, then filled with candidate edge ids.
     */
    public void collectCandidates(Coordinate point, double radiusMeters, IntArrayList out) {
        out.clear();
        double dLat = GeoUtils.metersToLatitudeDegrees(radiusMeters) * SEARCH_PADDING;
        double widestLat = Math.min(89.0d, Math.abs(point.lat()) + dLat);
        double dLon = GeoUtils.metersToLongitudeDegrees(radiusMeters, widestLat) * SEARCH_PADDING;

        int loCol = (int) Math.floor((point.lon() - dLon - originLon) / cellDegrees);
        int hiCol = (int) Math.floor((point.lon() + dLon - originLon) / cellDegrees);
        int loRow = (int) Math.floor((point.lat() - dLat - originLat) / cellDegrees);
        int hiRow = (int) Math.floor((point.lat() + dLat - originLat) / cellDegrees);
        if (hiCol < 0 || loCol >= columns || hiRow < 0 || loRow >= rows) {
            return;
        }
        loCol = Math.max(0, loCol);
        hiCol = Math.min(columns - 1, hiCol);
        loRow = Math.max(0, loRow);
        hiRow = Math.min(rows - 1, hiRow);

        for (int row = loRow; row <= hiRow; row++) {
            for (int col = loCol; col <= hiCol; col++) {
                int cellIndex = row * columns + col;
                for (int i = cellStart[cellIndex]; i < cellStart[cellIndex + 1]; i++) {
                    out.add(cellEdges[i]);
                }
            }
        }
        if (out.size() > 1) {
            int[] sorted = out.toIntArray();
            Arrays.sort(sorted);
            out.clear();
            int previous = -1;
            for (int edgeId : sorted) {
                if (edgeId != previous) {
                    out.add(edgeId);
                    previous = edgeId;
                }
            }
        }
    }

    private static long cellsFor(double span, double cell) {
        return (long) Math.floor(span / cell) + 1L;
    }

    /**
     * Returns {@code [loCol, hiCol, loRow, hiRow]} covered by the edge's bounding box.
     */
    private static int[] cellRange(RoadGraph graph, int edgeId, BoundingBox extent, double cell, int columns, int rows) {
        int from = graph.edgeOrigin(edgeId);
        int to = graph.edgeTarget(edgeId);
        double minLon = Math.min(graph.nodeLon(from), graph.nodeLon(to));
        double maxLon = Math.max(graph.nodeLon(from), graph.nodeLon(to));
        double minLat = Math.min(graph.nodeLat(from), graph.nodeLat(to));
        double maxLat = Math.max(graph.nodeLat(from), graph.nodeLat(to));
        return new int[]{
                clampIndex((int) Math.floor((minLon - extent.minLon()) / cell), columns),
                clampIndex((int) Math.floor((maxLon - extent.minLon()) / cell), columns),
                clampIndex((int) Math.floor((minLat - extent.minLat()) / cell), rows),
                clampIndex((int) Math.floor((maxLat - extent.minLat()) / cell), rows)
        };
    }

    private static int clampIndex(int index, int size) {
        return Math.max(0, Math.min(size - 1, index));
    }
}
