package xyz.vvrf.cfg.monitor;

import lombok.extern.slf4j.Slf4j;

/**
 * 通过 SLF4J 以 WARN 级别输出诊断信息的监听器，是 {@link DiagnosticListener#logging()} 的实现。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class LoggingDiagnosticListener implements DiagnosticListener {

    static final LoggingDiagnosticListener INSTANCE = new LoggingDiagnosticListener();

    @Override
    public void onAmbiguousBranch(Diagnostic diagnostic) {
        log.warn("[CFG] 图:[{}] 节点:[{}] {}。 后继:{} label:{} 选择:[{}]",
                diagnostic.getGraphId(), diagnostic.getNodeName(), diagnostic.getMessage(),
                diagnostic.getSuccessorNames(), diagnostic.getEdgeLabels(), diagnostic.getChosenSuccessor());
    }
}
