package xyz.vvrf.cfg.core;

import java.util.Objects;

/**
 * 控制流图构造 API 被误用时抛出的契约异常。
 * <p>
 * 与 {@link xyz.vvrf.cfg.codec.DotParseException} 不同，这类异常表示调用方的编程错误
 * (重复节点、重复入口、空名称等)，调用方通常不应捕获后重试。
 * 每个违例都带有一个 {@link Kind}，便于测试区分具体原因。
 * </p>
 *
 * @author ruifeng.wen
 */
public class CfgInvariantException extends IllegalStateException {

    /**
     * 违例类别。
     */
    public enum Kind {
        /** 节点名称为空。 */
        INVALID_NODE,
        /** 节点内部 ID 或名称已被另一个节点占用。 */
        DUPLICATE_NODE,
        /** 图中已存在另一个入口节点。 */
        DUPLICATE_ENTRY,
        /** 分支目标查询的节点后继数不等于 2。 */
        INVALID_BRANCH,
        /** 按名称查找的节点不存在。 */
        UNKNOWN_NODE,
        /** 其他结构不变量被破坏 (入口标签冲突、Copy 前置条件等)。 */
        INVARIANT_VIOLATION
    }

    private final Kind kind;

    public CfgInvariantException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "违例类别不能为空");
    }

    public Kind getKind() {
        return kind;
    }

    public static CfgInvariantException of(Kind kind, String format, Object... args) {
        return new CfgInvariantException(kind, String.format(format, args));
    }
}
