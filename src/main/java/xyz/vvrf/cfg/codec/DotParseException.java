package xyz.vvrf.cfg.codec;

import java.util.Objects;

/**
 * DOT 输入无法解析为控制流图时抛出的受检异常。
 * 这类错误来自外部输入 (文本格式、文件、I/O)，调用方可以恢复。
 *
 * @author ruifeng.wen
 */
public class DotParseException extends Exception {

    public enum Reason {
        /** 文本不符合 DOT 语法，或使用了不支持的 DOT 结构。 */
        MALFORMED_DOT,
        /** 既没有 label=entry 的节点，也没有名为 "0" 的节点。 */
        NO_ENTRY_NODE,
        /** 语法正确，但违反控制流图的结构不变量 (例如多个入口节点)。 */
        INVALID_GRAPH,
        /** 读取输入失败。 */
        IO
    }

    private final Reason reason;

    public DotParseException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "原因不能为空");
    }

    public DotParseException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "原因不能为空");
    }

    public Reason getReason() {
        return reason;
    }
}
