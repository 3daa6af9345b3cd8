package org.walknav.routing.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.walknav.routing.geo.Coordinate;
import org.walknav.routing.geo.GeoUtils;
import org.walknav.routing.testutil.CampusFixtures;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.walknav.routing.testutil.CampusFixtures.ORIGIN;
import static org.walknav.routing.testutil.CampusFixtures.offset;

@DisplayName("GraphBuilder Tests")
class GraphBuilderTest {

    private final GraphBuilder builder = new GraphBuilder();

    @Test
    @DisplayName("Shared endpoints merge into one node by exact equality")
    void testSharedVertexDeduplication() {
        CampusFixtures.Abcd abcd = CampusFixtures.abcd();
        RoadGraph graph = abcd.graph();

        assertEquals(4, graph.nodeCount());
        assertEquals(6, graph.edgeCount());
        int c = graph.findNode(abcd.c());
        assertTrue(c >= 0);
        assertEquals(2, graph.outDegree(c), "C connects back to B and on to D");
        assertEquals(-1, graph.findNode(offset(ORIGIN, 1.0, 1.0)));
    }

    @Test
    @DisplayName("Two-way roads yield equal-weight edges in both directions")
    void testBidirectionalEdges() {
        Coordinate a = ORIGIN;
        Coordinate b = offset(a, 50.0, 0.0);
        RoadGraph graph = builder.build(List.of(RoadSegment.of("Quad", a, b)));

        int nodeA = graph.findNode(a);
        int nodeB = graph.findNode(b);
        int forward = graph.findEdge(nodeA, nodeB);
        int backward = graph.findEdge(nodeB, nodeA);
        assertTrue(forward >= 0 && backward >= 0);
        assertEquals(graph.edgeWeight(forward), graph.edgeWeight(backward), 0.0);
        assertEquals(GeoUtils.distance(a, b), graph.edgeWeight(forward), 1e-9);
        assertEquals(50.0, graph.edgeWeight(forward), 1e-6);
        assertEquals("Quad", graph.edgeRoadName(forward));
        assertEquals(RoadDirection.BOTH, graph.edgeDirection(forward));
    }

    @Test
    @DisplayName("One-way roads respect coordinate order")
    void testDirectionality() {
        Coordinate a = ORIGIN;
        Coordinate b = offset(a, 50.0, 0.0);

        RoadGraph forward = builder.build(List.of(RoadSegment.of("Ramp", RoadDirection.FORWARD, a, b)));
        assertEquals(1, forward.edgeCount());
        assertEquals(forward.findNode(a), forward.edgeOrigin(0));
        assertEquals(forward.findNode(b), forward.edgeTarget(0));

        RoadGraph backward = builder.build(List.of(RoadSegment.of("Ramp", RoadDirection.BACKWARD, a, b)));
        assertEquals(1, backward.edgeCount());
        assertEquals(backward.findNode(b), backward.edgeOrigin(0));
        assertEquals(backward.findNode(a), backward.edgeTarget(0));
        assertEquals(-1, backward.findEdge(backward.findNode(a), backward.findNode(b)));
    }

    @Test
    @DisplayName("Null and blank road names become 'Unnamed Road'")
    void testUnnamedRoads() {
        Coordinate a = ORIGIN;
        Coordinate b = offset(a, 30.0, 0.0);
        Coordinate c = offset(b, 30.0, 0.0);
        RoadGraph graph = builder.build(List.of(
                RoadSegment.of(null, a, b),
                RoadSegment.of("   ", b, c)
        ));
        for (int edgeId = 0; edgeId < graph.edgeCount(); edgeId++) {
            assertEquals(GraphBuilder.UNNAMED_ROAD, graph.edgeRoadName(edgeId));
        }
    }

    @Test
    @DisplayName("Short parts and zero-length pairs are skipped without failing the build")
    void testSkipsDegenerateGeometry() {
        Coordinate a = ORIGIN;
        Coordinate b = offset(a, 40.0, 0.0);
        RoadSegment multi = RoadSegment.builder()
                .name("Ring")
                .part(List.of(a))
                .part(List.of())
                .part(Arrays.asList(a, a, b, b))
                .build();

        RoadGraph graph = builder.build(List.of(multi));
        assertEquals(2, graph.nodeCount());
        assertEquals(2, graph.edgeCount());
    }

    @Test
    @DisplayName("Multi-part features connect only where parts share a vertex")
    void testMultiLineString() {
        Coordinate a = ORIGIN;
        Coordinate b = offset(a, 40.0, 0.0);
        Coordinate c = offset(b, 0.0, 40.0);
        Coordinate far = offset(a, 0.0, 500.0);
        Coordinate farther = offset(far, 40.0, 0.0);
        RoadSegment multi = RoadSegment.builder()
                .name("Campus Loop")
                .part(List.of(a, b))
                .part(List.of(b, c))
                .part(List.of(far, farther))
                .build();

        RoadGraph graph = builder.build(List.of(multi));
        assertEquals(5, graph.nodeCount());
        assertEquals(6, graph.edgeCount());
        assertEquals(2, graph.outDegree(graph.findNode(b)));
        assertEquals(1, graph.outDegree(graph.findNode(far)));
    }

    @Test
    @DisplayName("CSR ranges list exactly the edges leaving each node")
    void testCsrLayout() {
        RoadGraph graph = CampusFixtures.campus().graph();
        RoadGraph.EdgeIterator iterator = graph.iterator();
        int visited = 0;
        for (int node = 0; node < graph.nodeCount(); node++) {
            iterator.resetForNode(node);
            while (iterator.hasNext()) {
                int edgeId = iterator.next();
                assertEquals(node, graph.edgeOrigin(edgeId));
                visited++;
            }
        }
        assertEquals(graph.edgeCount(), visited);

        List<Integer> viaConsumer = new ArrayList<>();
        graph.forEachOutgoingEdge(0, viaConsumer::add);
        assertEquals(graph.outDegree(0), viaConsumer.size());
    }

    @Test
    @DisplayName("Extent covers every node")
    void testExtent() {
        CampusFixtures.Campus campus = CampusFixtures.campus();
        assertTrue(campus.graph().extent().contains(campus.a()));
        assertTrue(campus.graph().extent().contains(campus.c()));
        assertEquals(campus.a().lat(), campus.graph().extent().minLat(), 0.0);
        assertEquals(campus.c().lon(), campus.graph().extent().maxLon(), 0.0);
    }

    @Test
    @DisplayName("Empty datasets are fatal")
    void testEmptyDataset() {
        GraphDataException nullEx = assertThrows(GraphDataException.class, () -> builder.build(null));
        assertEquals(GraphDataException.REASON_EMPTY_DATASET, nullEx.getReasonCode());

        GraphDataException emptyEx = assertThrows(GraphDataException.class, () -> builder.build(List.of()));
        assertEquals(GraphDataException.REASON_EMPTY_DATASET, emptyEx.getReasonCode());
        assertTrue(emptyEx.getMessage().startsWith("[" + GraphDataException.REASON_EMPTY_DATASET + "]"));
    }

    @Test
    @DisplayName("Datasets without any usable pair are fatal")
    void testNoEdges() {
        RoadSegment degenerate = RoadSegment.of("Dot", ORIGIN, ORIGIN);
        GraphDataException ex = assertThrows(GraphDataException.class, () -> builder.build(List.of(degenerate)));
        assertEquals(GraphDataException.REASON_NO_EDGES, ex.getReasonCode());
    }

    @Test
    @DisplayName("Non-finite or out-of-range coordinates are fatal")
    void testMalformedCoordinate() {
        RoadSegment broken = RoadSegment.of("Broken", ORIGIN, new Coordinate(Double.NaN, 9.0));
        GraphDataException ex = assertThrows(GraphDataException.class, () -> builder.build(List.of(broken)));
        assertEquals(GraphDataException.REASON_MALFORMED_COORDINATE, ex.getReasonCode());

        RoadSegment outOfRange = RoadSegment.of("Broken", ORIGIN, new Coordinate(7.4, 91.0));
        assertThrows(GraphDataException.class, () -> builder.build(List.of(outOfRange)));
    }
}
