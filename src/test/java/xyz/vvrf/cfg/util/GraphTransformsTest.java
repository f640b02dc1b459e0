package xyz.vvrf.cfg.util;

import org.junit.jupiter.api.Test;
import xyz.vvrf.cfg.TestGraphs;
import xyz.vvrf.cfg.builder.CfgBuilder;
import xyz.vvrf.cfg.codec.DotDecoder;
import xyz.vvrf.cfg.codec.DotParseException;
import xyz.vvrf.cfg.core.CfgInvariantException;
import xyz.vvrf.cfg.core.Edge;
import xyz.vvrf.cfg.core.Graph;
import xyz.vvrf.cfg.core.Node;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

public class GraphTransformsTest {

    private static Set<String> names(String... names) {
        return new HashSet<>(Arrays.asList(names));
    }

    @Test
    void copy_reproducesSourceGraph() throws DotParseException {
        Graph src = TestGraphs.parse(TestGraphs.SAMPLE);
        Graph dst = new Graph();
        GraphTransforms.copy(dst, src);

        assertEquals(src.toString(), dst.toString());
        assertEquals("sample", dst.getDotId());
        assertSame(src.mustNodeByName("B7"), dst.mustNodeByName("B7"));
        assertSame(src.entry().get(), dst.entry().get());
    }

    @Test
    void copy_overlappingIds_isInvariantViolation() {
        Graph src = new CfgBuilder("src").jump("0", "1").build();
        Graph dst = new CfgBuilder("dst").block("x").build();
        CfgInvariantException e = assertThrows(CfgInvariantException.class, () -> GraphTransforms.copy(dst, src));
        assertEquals(CfgInvariantException.Kind.INVARIANT_VIOLATION, e.getKind());
    }

    @Test
    void merge_entryRegion_matchesGolden() throws DotParseException {
        Graph g = TestGraphs.parse(TestGraphs.SAMPLE);
        Graph merged = GraphTransforms.merge(g, names("B1", "B2", "B3", "B4", "B5"), "I1");
        assertEquals(TestGraphs.read(TestGraphs.SAMPLE_I1), merged.toString());

        Node i1 = merged.mustNodeByName("I1");
        assertTrue(i1.isEntry());
        assertSame(i1, merged.entry().get());
    }

    @Test
    void merge_loopRegion_matchesGolden() throws DotParseException {
        Graph g = TestGraphs.parse(TestGraphs.SAMPLE);
        Graph merged = GraphTransforms.merge(g, names("B13", "B14", "B15"), "I3");
        assertEquals(TestGraphs.read(TestGraphs.SAMPLE_I3), merged.toString());
        assertEquals("B1", merged.entry().get().getName());
    }

    @Test
    void merge_leavesSourceUnchanged() throws DotParseException {
        Graph g = TestGraphs.parse(TestGraphs.SAMPLE);
        String before = g.toString();
        GraphTransforms.merge(g, names("B13", "B14", "B15"), "I3");
        assertEquals(before, g.toString());
        assertEquals(15, g.nodeCount());
        assertFalse(g.nodeByName("I3").isPresent());
    }

    @Test
    void merge_keepsIncomingEdgeAttributes() throws DotParseException {
        Graph g = TestGraphs.parse(TestGraphs.SAMPLE);
        Graph merged = GraphTransforms.merge(g, names("B12", "B13", "B14", "B15"), "loop");

        Node b6 = merged.mustNodeByName("B6");
        Node loop = merged.mustNodeByName("loop");
        Edge in = merged.edge(b6, loop).get();
        assertEquals("true", in.getLabel());
        assertEquals("darkgreen", in.getAttributes().get("color").get());
        // 出边不带属性
        assertTrue(merged.edge(loop, b6).get().getAttributes().isEmpty());
        assertSame(merged.mustNodeByName("B7"), merged.falseTarget(b6));
        assertSame(loop, merged.trueTarget(b6));
    }

    @Test
    void merge_dropsInternalEdges() {
        Graph g = new CfgBuilder("f")
                .jump("a", "b")
                .jump("b", "c")
                .jump("c", "b")
                .jump("c", "d")
                .build();
        Graph merged = GraphTransforms.merge(g, names("b", "c"), "bc");

        Node bc = merged.mustNodeByName("bc");
        assertEquals(3, merged.nodeCount());
        assertEquals(2, merged.edgeCount());
        assertEquals(Collections.singletonList(merged.mustNodeByName("a")), merged.predecessors(bc));
        assertEquals(Collections.singletonList(merged.mustNodeByName("d")), merged.successors(bc));
        assertFalse(merged.edge(bc, bc).isPresent());
    }

    @Test
    void merge_sharesUnmergedNodeObjects() throws DotParseException {
        Graph g = TestGraphs.parse(TestGraphs.SAMPLE);
        Graph merged = GraphTransforms.merge(g, names("B13", "B14", "B15"), "I3");

        Node inSource = g.mustNodeByName("B6");
        assertSame(inSource, merged.mustNodeByName("B6"));
        // 在合并结果上写入的注解对源图可见
        merged.mustNodeByName("B6").setIfFollow("I3");
        assertEquals("I3", inSource.getIfFollow().get());
    }

    @Test
    void merge_resultIsTraversable() throws DotParseException {
        Graph g = TestGraphs.parse(TestGraphs.SAMPLE);
        Graph merged = GraphTransforms.merge(g, names("B1", "B2", "B3", "B4", "B5"), "I1");
        GraphUtils.initDfsOrder(merged);
        assertEquals(0, merged.mustNodeByName("I1").getRevPost());
        assertEquals(1, merged.mustNodeByName("B6").getRevPost());
    }

    @Test
    void merge_unknownName_isError() throws DotParseException {
        Graph g = TestGraphs.parse(TestGraphs.SAMPLE);
        CfgInvariantException e = assertThrows(CfgInvariantException.class,
                () -> GraphTransforms.merge(g, names("B1", "B99"), "I1"));
        assertEquals(CfgInvariantException.Kind.UNKNOWN_NODE, e.getKind());
    }

    @Test
    void merge_newNameClash_isError() throws DotParseException {
        Graph g = TestGraphs.parse(TestGraphs.SAMPLE);
        CfgInvariantException e = assertThrows(CfgInvariantException.class,
                () -> GraphTransforms.merge(g, names("B13", "B14"), "B15"));
        assertEquals(CfgInvariantException.Kind.DUPLICATE_NODE, e.getKind());
    }

    @Test
    void merge_newNameMayReuseMergedName() throws DotParseException {
        Graph g = TestGraphs.parse(TestGraphs.SAMPLE);
        Graph merged = GraphTransforms.merge(g, names("B13", "B14", "B15"), "B13");
        assertEquals(13, merged.nodeCount());
        assertNotSame(g.mustNodeByName("B13"), merged.mustNodeByName("B13"));
    }

    @Test
    void merge_emptyNewName_isInvalid() throws DotParseException {
        Graph g = TestGraphs.parse(TestGraphs.SAMPLE);
        CfgInvariantException e = assertThrows(CfgInvariantException.class,
                () -> GraphTransforms.merge(g, names("B13"), ""));
        assertEquals(CfgInvariantException.Kind.INVALID_NODE, e.getKind());
    }

    @Test
    void merge_sharedPredecessor_keepsOneEdge_withLaterNodeAttributes() throws DotParseException {
        Graph g = TestGraphs.parse(TestGraphs.SAMPLE);
        List<Set<String>> orders = Arrays.asList(
                new LinkedHashSet<>(Arrays.asList("B3", "B4")),
                new LinkedHashSet<>(Arrays.asList("B4", "B3")),
                new TreeSet<>(Collections.reverseOrder()));
        orders.get(2).addAll(Arrays.asList("B3", "B4"));

        String first = null;
        for (Set<String> names : orders) {
            Graph merged = GraphTransforms.merge(g, names, "I2");
            Node b2 = merged.mustNodeByName("B2");
            Node i2 = merged.mustNodeByName("I2");

            assertEquals(Collections.singletonList(i2), merged.successors(b2));
            // B3 (true) 先处理, B4 (false) 后处理, 后者的属性生效
            Edge in = merged.edge(b2, i2).get();
            assertEquals("false", in.getLabel());
            assertEquals("red", in.getAttributes().get("color").get());
            assertEquals(Collections.singletonList(merged.mustNodeByName("B5")), merged.successors(i2));

            String dot = merged.toString();
            if (first == null) {
                first = dot;
            }
            assertEquals(first, dot, names.toString());
        }
    }

    @Test
    void merge_inheritedEntry_isTheGraphEntry() throws DotParseException {
        Graph g = TestGraphs.parse(TestGraphs.SAMPLE);
        Graph merged = GraphTransforms.merge(g, names("B1", "B2"), "head");
        Node head = merged.mustNodeByName("head");
        assertSame(head, merged.entry().get());
        assertEquals(merged.toString(), DotDecoder.parseString(merged.toString()).toString());
        // 源图的入口不受影响
        assertSame(g.mustNodeByName("B1"), g.entry().get());
    }
}
