package xyz.vvrf.cfg.monitor;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class LoggingDiagnosticListenerTest {

    private static Diagnostic sample() {
        return Diagnostic.builder()
                .kind(Diagnostic.Kind.AMBIGUOUS_TRUE_BRANCH)
                .graphId("f")
                .nodeName("cond")
                .successorNames(Arrays.asList("a", "b"))
                .edgeLabels(Arrays.asList("", ""))
                .chosenSuccessor("a")
                .message("无法区分真分支")
                .build();
    }

    @Test
    void logging_isSharedInstance() {
        assertSame(DiagnosticListener.logging(), DiagnosticListener.logging());
        assertDoesNotThrow(() -> DiagnosticListener.logging().onAmbiguousBranch(sample()));
    }

    @Test
    void collecting_recordsInOrder_andClears() {
        CollectingDiagnosticListener listener = new CollectingDiagnosticListener();
        listener.onAmbiguousBranch(sample());
        listener.onAmbiguousBranch(sample());
        assertEquals(2, listener.getDiagnostics().size());
        assertEquals("cond", listener.getDiagnostics().get(0).getNodeName());
        assertThrows(UnsupportedOperationException.class, () -> listener.getDiagnostics().clear());
        listener.clear();
        assertTrue(listener.isEmpty());
    }
}
