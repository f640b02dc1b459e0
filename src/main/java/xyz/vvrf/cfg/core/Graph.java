package xyz.vvrf.cfg.core;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.cfg.codec.DotEncoder;
import xyz.vvrf.cfg.monitor.Diagnostic;
import xyz.vvrf.cfg.monitor.DiagnosticListener;

import java.util.*;

import static xyz.vvrf.cfg.core.CfgInvariantException.Kind.*;

/**
 * 控制流图：带名称索引和唯一入口节点的有向简单图。
 * <p>
 * 不变量：
 * <ul>
 *     <li>名称索引与节点集合始终一致，名称在图内唯一；</li>
 *     <li>最多一个入口节点，且入口节点必须属于节点集合；</li>
 *     <li>每条边的两个端点都在节点集合中；同一有序节点对之间最多一条边。</li>
 * </ul>
 * 所有查询结果按内部 ID 排序，与插入顺序或哈希顺序无关。
 * </p>
 * <p>
 * 非线程安全：图只支持单线程构造和修改，共享时需由调用方在外部串行化访问。
 * </p>
 *
 * @author ruifeng.wen
 */
@Slf4j
public class Graph {

    private String dotId = "";

    private final SortedMap<Long, Node> nodes = new TreeMap<>();
    private final Map<String, Node> nodesByName = new HashMap<>();
    // 邻接表：起点 ID -> (终点 ID -> 边)，内外两层都按 ID 排序
    private final Map<Long, SortedMap<Long, Edge>> successors = new HashMap<>();
    private final Map<Long, SortedMap<Long, Edge>> predecessors = new HashMap<>();

    private Node entry;
    private long nextNodeId = 0;

    public Graph() {
    }

    public String getDotId() {
        return dotId;
    }

    public void setDotId(String dotId) {
        this.dotId = Objects.requireNonNull(dotId, "图 ID 不能为空");
    }

    // --- 节点 ---

    /**
     * 分配一个带有新内部 ID 的节点，但不将其加入图中。
     *
     * @param name 节点名称 (非空)
     * @throws CfgInvariantException 如果名称为空 ({@code INVALID_NODE})
     */
    public Node newNode(String name) {
        if (name == null || name.isEmpty()) {
            throw CfgInvariantException.of(INVALID_NODE, "图 '%s': 节点名称不能为空", dotId);
        }
        return new Node(nextNodeId++, name);
    }

    /**
     * 将节点加入图中。重复加入同一个节点对象是无操作的。
     * 如果节点带有入口标记，则将其设为图的入口。
     *
     * @throws CfgInvariantException 如果内部 ID 或名称已被其他节点占用 ({@code DUPLICATE_NODE})，
     *                               或图中已有另一个入口节点 ({@code DUPLICATE_ENTRY})
     */
    public void addNode(Node n) {
        Objects.requireNonNull(n, "节点不能为空");
        Node prevById = nodes.get(n.getId());
        if (prevById != null && prevById != n) {
            throw CfgInvariantException.of(DUPLICATE_NODE, "图 '%s': 节点 ID %d 已被占用; 已有节点 %s, 新节点 %s",
                    dotId, n.getId(), prevById, n);
        }
        Node prevByName = nodesByName.get(n.getName());
        if (prevByName != null && prevByName != n) {
            throw CfgInvariantException.of(DUPLICATE_NODE, "图 '%s': 节点名称 '%s' 已存在; 已有节点 %s, 新节点 %s",
                    dotId, n.getName(), prevByName, n);
        }
        if (n.isEntry() && entry != null && entry != n) {
            throw CfgInvariantException.of(DUPLICATE_ENTRY, "图 '%s': 入口节点已设置; 已有入口 %s, 新入口 %s",
                    dotId, entry, n);
        }
        if (prevById == n) {
            return;
        }
        nodes.put(n.getId(), n);
        nodesByName.put(n.getName(), n);
        if (n.isEntry()) {
            entry = n;
        }
        // 保证之后分配的 ID 不会与移植进来的节点冲突
        if (n.getId() >= nextNodeId) {
            nextNodeId = n.getId() + 1;
        }
    }

    /**
     * 移除节点及所有与之相连的边。节点不在图中时为无操作。
     * 如果被移除的是入口节点，入口将被清空。
     */
    public void removeNode(Node n) {
        Objects.requireNonNull(n, "节点不能为空");
        if (nodes.get(n.getId()) != n) {
            return;
        }
        SortedMap<Long, Edge> out = successors.remove(n.getId());
        if (out != null) {
            for (Long toId : out.keySet()) {
                SortedMap<Long, Edge> in = predecessors.get(toId);
                if (in != null) {
                    in.remove(n.getId());
                }
            }
        }
        SortedMap<Long, Edge> in = predecessors.remove(n.getId());
        if (in != null) {
            for (Long fromId : in.keySet()) {
                SortedMap<Long, Edge> fromOut = successors.get(fromId);
                if (fromOut != null) {
                    fromOut.remove(n.getId());
                }
            }
        }
        nodes.remove(n.getId());
        nodesByName.remove(n.getName(), n);
        if (entry == n) {
            entry = null;
        }
    }

    public boolean contains(Node n) {
        return n != null && nodes.get(n.getId()) == n;
    }

    public boolean containsId(long id) {
        return nodes.containsKey(id);
    }

    public Optional<Node> nodeByName(String name) {
        return Optional.ofNullable(nodesByName.get(name));
    }

    /**
     * 按名称获取节点，节点不存在属于编程错误。
     *
     * @throws CfgInvariantException 如果节点不存在 ({@code UNKNOWN_NODE})
     */
    public Node mustNodeByName(String name) {
        Node n = nodesByName.get(name);
        if (n == null) {
            throw CfgInvariantException.of(UNKNOWN_NODE, "图 '%s': 找不到名称为 '%s' 的节点", dotId, name);
        }
        return n;
    }

    /**
     * 所有节点，按内部 ID 排序。
     */
    public List<Node> nodes() {
        return new ArrayList<>(nodes.values());
    }

    public int nodeCount() {
        return nodes.size();
    }

    // --- 入口 ---

    public Optional<Node> entry() {
        return Optional.ofNullable(entry);
    }

    /**
     * 将图中的节点设为入口，并标记其入口标志。
     *
     * @throws CfgInvariantException 如果已有另一个入口 ({@code DUPLICATE_ENTRY})，
     *                               或节点不属于该图 ({@code UNKNOWN_NODE})
     */
    public void setEntry(Node n) {
        Objects.requireNonNull(n, "入口节点不能为空");
        if (entry != null && entry != n) {
            throw CfgInvariantException.of(DUPLICATE_ENTRY, "图 '%s': 无法将 '%s' 设为入口; 入口节点 '%s' 已存在",
                    dotId, n.getName(), entry.getName());
        }
        if (!contains(n)) {
            throw CfgInvariantException.of(UNKNOWN_NODE, "图 '%s': 入口节点 '%s' 不属于该图", dotId, n.getName());
        }
        n.markEntry();
        entry = n;
    }

    // --- 边 ---

    /**
     * 创建一条不带属性的边，但不将其加入图中。
     */
    public Edge newEdge(Node from, Node to) {
        return new Edge(from, to, new AttributeMap());
    }

    /**
     * 将边加入图中，端点不在图中时先通过 {@link #addNode(Node)} 自动加入。
     * 同一有序节点对之间已有边时将其替换。
     */
    public void setEdge(Edge e) {
        Objects.requireNonNull(e, "边不能为空");
        Node from = e.getFrom();
        Node to = e.getTo();
        if (!contains(from)) {
            addNode(from);
        }
        if (!contains(to)) {
            addNode(to);
        }
        successors.computeIfAbsent(from.getId(), k -> new TreeMap<>()).put(to.getId(), e);
        predecessors.computeIfAbsent(to.getId(), k -> new TreeMap<>()).put(from.getId(), e);
    }

    public Optional<Edge> edge(Node from, Node to) {
        SortedMap<Long, Edge> out = successors.get(from.getId());
        if (out == null || !contains(from)) {
            return Optional.empty();
        }
        return Optional.ofNullable(out.get(to.getId()));
    }

    /**
     * 所有边，按 (起点 ID, 终点 ID) 排序。
     */
    public List<Edge> edges() {
        List<Edge> result = new ArrayList<>();
        for (Long fromId : nodes.keySet()) {
            SortedMap<Long, Edge> out = successors.get(fromId);
            if (out != null) {
                result.addAll(out.values());
            }
        }
        return result;
    }

    public int edgeCount() {
        int count = 0;
        for (SortedMap<Long, Edge> out : successors.values()) {
            count += out.size();
        }
        return count;
    }

    /**
     * 节点的直接后继，按内部 ID 排序。
     */
    public List<Node> successors(Node n) {
        return endpoints(successors.get(n.getId()), true);
    }

    /**
     * 节点的直接前驱，按内部 ID 排序。
     */
    public List<Node> predecessors(Node n) {
        return endpoints(predecessors.get(n.getId()), false);
    }

    private static List<Node> endpoints(SortedMap<Long, Edge> adj, boolean target) {
        if (adj == null) {
            return Collections.emptyList();
        }
        List<Node> result = new ArrayList<>(adj.size());
        for (Edge e : adj.values()) {
            result.add(target ? e.getTo() : e.getFrom());
        }
        return result;
    }

    // --- 两路分支 ---

    public Node trueTarget(Node n) {
        return trueTarget(n, DiagnosticListener.logging());
    }

    /**
     * 两路分支节点的真分支目标。
     * <p>
     * 两条出边的 label 恰好为 {@code "true"}/{@code "false"} 时返回 label 为 {@code "true"} 的后继；
     * 否则向监听器报告诊断信息，并返回内部 ID 最小的后继。
     * 合并之后边的真假语义可能已经丢失，这个降级结果可能是错误的。
     * </p>
     *
     * @throws CfgInvariantException 如果后继数不等于 2 ({@code INVALID_BRANCH})
     */
    public Node trueTarget(Node n, DiagnosticListener listener) {
        return branchTarget(n, true, listener);
    }

    public Node falseTarget(Node n) {
        return falseTarget(n, DiagnosticListener.logging());
    }

    /**
     * 两路分支节点的假分支目标，降级行为与 {@link #trueTarget(Node, DiagnosticListener)} 相同。
     *
     * @throws CfgInvariantException 如果后继数不等于 2 ({@code INVALID_BRANCH})
     */
    public Node falseTarget(Node n, DiagnosticListener listener) {
        return branchTarget(n, false, listener);
    }

    private Node branchTarget(Node n, boolean wantTrue, DiagnosticListener listener) {
        Objects.requireNonNull(listener, "诊断监听器不能为空");
        SortedMap<Long, Edge> out = successors.get(n.getId());
        int count = out == null ? 0 : out.size();
        if (count != 2) {
            throw CfgInvariantException.of(INVALID_BRANCH, "图 '%s': 节点 '%s' 的后继数无效; 期望 2, 实际 %d",
                    dotId, n.getName(), count);
        }
        Iterator<Edge> it = out.values().iterator();
        Edge e1 = it.next();
        Edge e2 = it.next();
        String l1 = e1.getLabel();
        String l2 = e2.getLabel();
        if ("true".equals(l1) && "false".equals(l2)) {
            return wantTrue ? e1.getTo() : e2.getTo();
        }
        if ("false".equals(l1) && "true".equals(l2)) {
            return wantTrue ? e2.getTo() : e1.getTo();
        }
        // TODO: 在合并之间跟踪真假分支的边，去掉这个降级路径
        Node fallback = e1.getTo();
        listener.onAmbiguousBranch(Diagnostic.builder()
                .kind(wantTrue ? Diagnostic.Kind.AMBIGUOUS_TRUE_BRANCH : Diagnostic.Kind.AMBIGUOUS_FALSE_BRANCH)
                .graphId(dotId)
                .nodeName(n.getName())
                .successorNames(Arrays.asList(e1.getTo().getName(), e2.getTo().getName()))
                .edgeLabels(Arrays.asList(l1, l2))
                .chosenSuccessor(fallback.getName())
                .message(String.format("无法根据边 label 定位%s分支; 期望 \"true\" 和 \"false\", 实际 \"%s\" 和 \"%s\"",
                        wantTrue ? "真" : "假", l1, l2))
                .build());
        return fallback;
    }

    /**
     * 从节点集合重建名称索引。
     *
     * @throws CfgInvariantException 如果两个不同节点同名 ({@code DUPLICATE_NODE})
     */
    public void rebuildNameIndex() {
        Map<String, Node> rebuilt = new HashMap<>();
        for (Node n : nodes.values()) {
            Node prev = rebuilt.put(n.getName(), n);
            if (prev != null && prev != n) {
                throw CfgInvariantException.of(DUPLICATE_NODE, "图 '%s': 节点名称 '%s' 已存在; 已有节点 %s, 新节点 %s",
                        dotId, n.getName(), prev, n);
            }
        }
        nodesByName.clear();
        nodesByName.putAll(rebuilt);
        log.debug("图 '{}': 名称索引已重建, {} 个节点", dotId, rebuilt.size());
    }

    /**
     * 图的 DOT 规范文本形式。
     */
    @Override
    public String toString() {
        return DotEncoder.getDefault().encode(this);
    }
}
