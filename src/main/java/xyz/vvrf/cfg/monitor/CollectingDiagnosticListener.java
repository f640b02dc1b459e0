package xyz.vvrf.cfg.monitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 按接收顺序记录所有诊断信息的监听器。
 * 非线程安全，与图本身一样只在单线程中使用。
 *
 * @author ruifeng.wen
 */
public class CollectingDiagnosticListener implements DiagnosticListener {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    @Override
    public void onAmbiguousBranch(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public void clear() {
        diagnostics.clear();
    }
}
