package xyz.vvrf.cfg.monitor;

/**
 * 接收图操作诊断信息的监听器接口。
 * <p>
 * 诊断信息只在可恢复的降级场景下产生 (例如合并后无法根据边 label 区分真假分支)，
 * 调用方可以通过显式传入监听器来观察这些情况，而不依赖进程级的日志输出。
 * </p>
 *
 * @author ruifeng.wen
 */
public interface DiagnosticListener {

    /**
     * 两路分支节点的出边 label 不是 {@code "true"}/{@code "false"}，
     * 分支目标查询退化为返回内部 ID 最小的后继时调用。
     *
     * @param diagnostic 诊断详情
     */
    void onAmbiguousBranch(Diagnostic diagnostic);

    /**
     * 基于 SLF4J 的默认监听器。
     */
    static DiagnosticListener logging() {
        return LoggingDiagnosticListener.INSTANCE;
    }
}
