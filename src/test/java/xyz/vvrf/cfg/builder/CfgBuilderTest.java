package xyz.vvrf.cfg.builder;

import org.junit.jupiter.api.Test;
import xyz.vvrf.cfg.core.CfgInvariantException;
import xyz.vvrf.cfg.core.Edge;
import xyz.vvrf.cfg.core.Graph;
import xyz.vvrf.cfg.core.Node;

import static org.junit.jupiter.api.Assertions.*;

public class CfgBuilderTest {

    @Test
    void branch_setsLabelsAndColors() {
        Graph g = new CfgBuilder("f").branch("cond", "then", "else").build();
        Node cond = g.mustNodeByName("cond");

        Edge t = g.edge(cond, g.mustNodeByName("then")).get();
        assertEquals("true", t.getLabel());
        assertEquals("darkgreen", t.getAttributes().get("color").get());
        Edge f = g.edge(cond, g.mustNodeByName("else")).get();
        assertEquals("false", f.getLabel());
        assertEquals("red", f.getAttributes().get("color").get());

        assertSame(g.mustNodeByName("then"), g.trueTarget(cond));
        assertSame(g.mustNodeByName("else"), g.falseTarget(cond));
    }

    @Test
    void switchCases_useCaseLabels() {
        Graph g = new CfgBuilder("f")
                .switchCase("sw", "one", "1")
                .switchCase("sw", "two", "2")
                .defaultCase("sw", "other")
                .build();
        Node sw = g.mustNodeByName("sw");
        assertEquals("case (x=1)", g.edge(sw, g.mustNodeByName("one")).get().getLabel());
        assertEquals("case (x=2)", g.edge(sw, g.mustNodeByName("two")).get().getLabel());
        Edge def = g.edge(sw, g.mustNodeByName("other")).get();
        assertEquals("default case", def.getLabel());
        assertFalse(def.getAttributes().containsKey("color"));
        assertEquals(3, g.successors(sw).size());
    }

    @Test
    void jump_hasNoAttributes() {
        Graph g = new CfgBuilder("f").jump("a", "b").build();
        Edge e = g.edge(g.mustNodeByName("a"), g.mustNodeByName("b")).get();
        assertTrue(e.getAttributes().isEmpty());
        assertEquals("", e.getLabel());
    }

    @Test
    void build_firstBlockIsEntry() {
        Graph g = new CfgBuilder("f").jump("start", "end").block("dead").build();
        assertEquals("start", g.entry().get().getName());
        assertEquals("f", g.getDotId());
        assertEquals(3, g.nodeCount());
    }

    @Test
    void build_explicitEntry() {
        Graph g = new CfgBuilder("f").jump("a", "b").entry("b").build();
        assertEquals("b", g.entry().get().getName());
        assertFalse(g.mustNodeByName("a").isEntry());
    }

    @Test
    void build_emptyGraph_hasNoEntry() {
        Graph g = new CfgBuilder("f").build();
        assertFalse(g.entry().isPresent());
        assertEquals(0, g.nodeCount());
    }

    @Test
    void nodeWithName_reusesExistingNode() {
        Graph g = CfgBuilder.newGraph();
        Node a = CfgBuilder.nodeWithName(g, "a");
        assertSame(a, CfgBuilder.nodeWithName(g, "a"));
        assertEquals(1, g.nodeCount());
    }

    @Test
    void edgeWithLabel_emptyLabel_setsNoAttribute() {
        Graph g = CfgBuilder.newGraph();
        Edge e = CfgBuilder.edgeWithLabel(g, CfgBuilder.nodeWithName(g, "a"), CfgBuilder.nodeWithName(g, "b"), "");
        assertTrue(e.getAttributes().isEmpty());
        assertEquals(1, g.edgeCount());
    }

    @Test
    void emptyBlockName_isInvalid() {
        CfgInvariantException e = assertThrows(CfgInvariantException.class,
                () -> new CfgBuilder("f").block(""));
        assertEquals(CfgInvariantException.Kind.INVALID_NODE, e.getKind());
    }
}
