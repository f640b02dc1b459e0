package xyz.vvrf.cfg.core;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.Optional;

/**
 * 控制流图中的节点 (通常对应一个基本块)。
 * <p>
 * 节点由两部分标识：图内分配的内部 ID (用于边寻址和确定性排序) 以及人类可读的名称
 * (即 DOT ID，在同一个图内唯一)。两者在创建后都不可变，只有属性、DFS 编号和结构化注解字段会原地修改。
 * </p>
 * <p>
 * 节点只能通过 {@link Graph#newNode(String)} 创建。Copy 与 Merge 会在多个图之间共享同一个节点对象，
 * 因此通过一个图修改节点，对仍引用该节点的其他图同样可见。
 * </p>
 * <p>
 * 结构化注解字段 (循环头、latch、follow 等) 以节点名称引用其他节点，而不是持有对象引用；
 * 被引用的节点可能已经在合并中被移除，修正这些悬空引用由结构化分类逻辑负责。
 * </p>
 *
 * @author ruifeng.wen
 */
@Getter
public final class Node {

    private final long id;
    private final String name;

    @Getter(AccessLevel.NONE)
    private boolean entry;

    private final AttributeMap attributes = new AttributeMap();

    /** DFS 前序编号。 */
    @Setter
    private int pre;
    /** DFS 逆后序编号。 */
    @Setter
    private int revPost;

    // --- 结构化注解 (由循环/条件分类阶段填充) ---

    /** 指向该节点的回边数量。 */
    @Setter
    private int backEdgeCount;
    /** 是否为某个循环的 latch 节点。 */
    @Setter
    private boolean latch;
    @Setter
    private LoopType loopType = LoopType.NONE;

    @Getter(AccessLevel.NONE)
    @Setter
    private String loopHead;
    @Getter(AccessLevel.NONE)
    @Setter
    private String latchNode;
    @Getter(AccessLevel.NONE)
    @Setter
    private String loopFollow;
    @Getter(AccessLevel.NONE)
    @Setter
    private String ifFollow;
    @Getter(AccessLevel.NONE)
    @Setter
    private String switchHead;
    @Getter(AccessLevel.NONE)
    @Setter
    private String switchFollow;

    Node(long id, String name) {
        this.id = id;
        this.name = name;
    }

    public boolean isEntry() {
        return entry;
    }

    /**
     * 标记为入口节点。节点加入图 ({@link Graph#addNode(Node)}) 时才会成为图的入口，
     * 入口标记一旦设置不会被清除。图外的调用方通过 {@link Graph#setEntry(Node)} 设置入口。
     */
    void markEntry() {
        this.entry = true;
    }

    public Optional<String> getLoopHead() {
        return Optional.ofNullable(loopHead);
    }

    public Optional<String> getLatchNode() {
        return Optional.ofNullable(latchNode);
    }

    public Optional<String> getLoopFollow() {
        return Optional.ofNullable(loopFollow);
    }

    public Optional<String> getIfFollow() {
        return Optional.ofNullable(ifFollow);
    }

    public Optional<String> getSwitchHead() {
        return Optional.ofNullable(switchHead);
    }

    public Optional<String> getSwitchFollow() {
        return Optional.ofNullable(switchFollow);
    }

    // 同一性即对象相等：两个图共享节点时比较的是同一个对象

    @Override
    public String toString() {
        return String.format("Node[id=%d, name=%s%s]", id, name, entry ? ", entry" : "");
    }
}
