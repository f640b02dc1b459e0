package xyz.vvrf.cfg.core;

/**
 * 结构化分析识别出的循环类型。
 * 每个取值都有一个稳定的文本形式，用于在 DOT 属性或日志中表示。
 *
 * @author ruifeng.wen
 */
public enum LoopType {
    /**
     * 不是循环头。默认值。
     */
    NONE("none"),

    /**
     * 前测试循环 (while)：条件在循环体之前判断。
     */
    PRE_TEST("pre-test_loop"),

    /**
     * 后测试循环 (do-while)：条件在循环体之后由 latch 节点判断。
     */
    POST_TEST("post-test_loop"),

    /**
     * 无限循环：循环头和 latch 都不是条件节点。
     */
    ENDLESS("endless_loop");

    private final String text;

    LoopType(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    /**
     * 从文本形式解析循环类型。
     *
     * @param text 文本形式，例如 {@code pre-test_loop}
     * @return 对应的循环类型
     * @throws IllegalArgumentException 如果文本无法识别
     */
    public static LoopType fromText(String text) {
        for (LoopType type : values()) {
            if (type.text.equals(text)) {
                return type;
            }
        }
        throw new IllegalArgumentException(String.format("无法识别的循环类型文本 '%s'", text));
    }

    @Override
    public String toString() {
        return text;
    }
}
