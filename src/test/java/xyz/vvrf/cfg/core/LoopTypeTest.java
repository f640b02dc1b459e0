package xyz.vvrf.cfg.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LoopTypeTest {

    @Test
    void textForms() {
        assertEquals("none", LoopType.NONE.getText());
        assertEquals("pre-test_loop", LoopType.PRE_TEST.getText());
        assertEquals("post-test_loop", LoopType.POST_TEST.getText());
        assertEquals("endless_loop", LoopType.ENDLESS.toString());
    }

    @Test
    void fromText_parsesEveryTextForm() {
        for (LoopType type : LoopType.values()) {
            assertSame(type, LoopType.fromText(type.getText()));
        }
    }

    @Test
    void fromText_unknown_isError() {
        assertThrows(IllegalArgumentException.class, () -> LoopType.fromText("while"));
        assertThrows(IllegalArgumentException.class, () -> LoopType.fromText("PRE_TEST"));
    }
}
