package xyz.vvrf.cfg.core;

import java.util.Objects;

/**
 * 控制流图中的有向边。
 * 端点在创建后不可变，属性可原地修改。
 *
 * @author ruifeng.wen
 */
public final class Edge {
    private final Node from;
    private final Node to;
    private final AttributeMap attributes;

    Edge(Node from, Node to, AttributeMap attributes) {
        this.from = Objects.requireNonNull(from, "边的起点不能为空");
        this.to = Objects.requireNonNull(to, "边的终点不能为空");
        this.attributes = Objects.requireNonNull(attributes, "边属性不能为空");
    }

    public Node getFrom() {
        return from;
    }

    public Node getTo() {
        return to;
    }

    public AttributeMap getAttributes() {
        return attributes;
    }

    /**
     * 边的 label 属性，不存在时为空字符串。
     */
    public String getLabel() {
        return attributes.getOrEmpty(AttributeMap.LABEL);
    }

    @Override
    public String toString() {
        return String.format("Edge[%s -> %s, %s]", from.getName(), to.getName(), attributes);
    }
}
