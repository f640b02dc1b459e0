package xyz.vvrf.cfg.builder;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.cfg.core.AttributeMap;
import xyz.vvrf.cfg.core.Edge;
import xyz.vvrf.cfg.core.Graph;
import xyz.vvrf.cfg.core.Node;

import java.util.Objects;
import java.util.Optional;

/**
 * 以编程方式构建控制流图，供 IR 前端逐个基本块调用。
 * <p>
 * 第一个声明的基本块默认成为入口节点，除非在构建前显式调用 {@link #entry(String)}。
 * 分支边的 label 遵循 DOT 渲染约定：{@code true}/{@code false} 分别附带
 * {@code darkgreen}/{@code red} 颜色，switch 分支为 {@code case (x=<值>)} 和 {@code default case}。
 * </p>
 *
 * @author ruifeng.wen
 */
@Slf4j
public class CfgBuilder {

    public static final String TRUE_LABEL = "true";
    public static final String FALSE_LABEL = "false";
    public static final String DEFAULT_CASE_LABEL = "default case";

    private final Graph g;
    private String firstBlock;
    private String explicitEntry;

    public CfgBuilder(String graphId) {
        this.g = newGraph();
        this.g.setDotId(Objects.requireNonNull(graphId, "图 ID 不能为空"));
        log.debug("为图 '{}' 创建 CfgBuilder", graphId);
    }

    /**
     * 创建一个空的控制流图。
     */
    public static Graph newGraph() {
        return new Graph();
    }

    /**
     * 返回给定名称的节点，不存在时创建并加入图中。
     */
    public static Node nodeWithName(Graph g, String name) {
        Optional<Node> existing = g.nodeByName(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        Node n = g.newNode(name);
        g.addNode(n);
        return n;
    }

    /**
     * 添加一条有向边并设置 label。空 label 表示不设置 label 属性；
     * {@code true}/{@code false} 额外设置仅用于渲染的 color 属性。
     */
    public static Edge edgeWithLabel(Graph g, Node from, Node to, String label) {
        Objects.requireNonNull(label, "边 label 不能为空 (无 label 时使用空字符串)");
        Edge e = g.newEdge(from, to);
        if (!label.isEmpty()) {
            e.getAttributes().put(AttributeMap.LABEL, label);
            if (TRUE_LABEL.equals(label)) {
                e.getAttributes().put(AttributeMap.COLOR, "darkgreen");
            } else if (FALSE_LABEL.equals(label)) {
                e.getAttributes().put(AttributeMap.COLOR, "red");
            }
        }
        g.setEdge(e);
        return e;
    }

    /**
     * switch 分支边的 label。
     */
    public static String caseLabel(String caseValue) {
        return String.format("case (x=%s)", caseValue);
    }

    // --- 按基本块终结指令构建 ---

    /**
     * 声明一个基本块 (无后继，例如 ret/unreachable 结尾)。
     */
    public CfgBuilder block(String name) {
        node(name);
        return this;
    }

    /**
     * 显式指定入口基本块。
     */
    public CfgBuilder entry(String name) {
        node(name);
        this.explicitEntry = name;
        return this;
    }

    /**
     * 无条件跳转。
     */
    public CfgBuilder jump(String from, String to) {
        Node f = node(from);
        edgeWithLabel(g, f, node(to), "");
        return this;
    }

    /**
     * 条件跳转：两条出边分别标记为 true 和 false。
     */
    public CfgBuilder branch(String from, String trueTarget, String falseTarget) {
        Node f = node(from);
        Node t = node(trueTarget);
        Node e = node(falseTarget);
        edgeWithLabel(g, f, t, TRUE_LABEL);
        edgeWithLabel(g, f, e, FALSE_LABEL);
        return this;
    }

    public CfgBuilder switchCase(String from, String to, String caseValue) {
        Node f = node(from);
        edgeWithLabel(g, f, node(to), caseLabel(caseValue));
        return this;
    }

    public CfgBuilder defaultCase(String from, String to) {
        Node f = node(from);
        edgeWithLabel(g, f, node(to), DEFAULT_CASE_LABEL);
        return this;
    }

    /**
     * 设置入口节点并返回构建好的图。
     */
    public Graph build() {
        String entryName = explicitEntry != null ? explicitEntry : firstBlock;
        if (entryName != null && !g.entry().isPresent()) {
            g.setEntry(g.mustNodeByName(entryName));
        }
        log.debug("图 '{}' 构建完成。{} 个节点, {} 条边, 入口 '{}'",
                g.getDotId(), g.nodeCount(), g.edgeCount(), entryName);
        return g;
    }

    private Node node(String name) {
        Node n = nodeWithName(g, name);
        if (firstBlock == null) {
            firstBlock = name;
        }
        return n;
    }
}
