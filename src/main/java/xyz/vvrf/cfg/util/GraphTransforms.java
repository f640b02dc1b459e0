package xyz.vvrf.cfg.util;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.cfg.core.AttributeMap;
import xyz.vvrf.cfg.core.CfgInvariantException;
import xyz.vvrf.cfg.core.Edge;
import xyz.vvrf.cfg.core.Graph;
import xyz.vvrf.cfg.core.Node;

import java.util.*;

/**
 * 图的整体移植 (Copy) 与区域合并 (Merge)。
 * <p>
 * 两种操作都在图之间共享节点对象而不做深拷贝：合并之后，目标图中未被合并的节点与源图中的是同一个对象。
 * 如果调用方希望之前读取的节点保持"合并前"的状态，应将源图视为只读。
 * </p>
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class GraphTransforms {

    private GraphTransforms() {}

    /**
     * 将源图的图 ID、全部节点 (同一对象) 和全部边复制到目标图中，不会先清空目标图，
     * 复制完成后重建目标图的名称索引。
     *
     * @param dst 目标图，内部 ID 空间必须与源图不相交
     * @param src 源图
     * @throws CfgInvariantException 如果源图节点的内部 ID 已存在于目标图中 ({@code INVARIANT_VIOLATION})，
     *                               或与目标图已有节点重名 ({@code DUPLICATE_NODE})
     */
    public static void copy(Graph dst, Graph src) {
        Objects.requireNonNull(dst, "目标图不能为空");
        Objects.requireNonNull(src, "源图不能为空");
        dst.setDotId(src.getDotId());
        List<Node> nodes = src.nodes();
        for (Node n : nodes) {
            if (dst.containsId(n.getId())) {
                throw CfgInvariantException.of(CfgInvariantException.Kind.INVARIANT_VIOLATION,
                        "图 '%s': 无法复制节点 '%s'; 内部 ID %d 已存在于目标图中", src.getDotId(), n.getName(), n.getId());
            }
            dst.addNode(n);
        }
        for (Edge e : src.edges()) {
            dst.setEdge(e);
        }
        dst.rebuildNameIndex();
        log.debug("图 '{}': 已复制 {} 个节点, {} 条边", src.getDotId(), nodes.size(), src.edgeCount());
    }

    /**
     * 返回一个新图，其中给定名称的节点被折叠为一个名为 {@code newName} 的新节点。
     * <p>
     * 合并集合外的前驱连向新节点 (保留原入边属性；多个被合并节点共享同一前驱时只保留一条边，后处理的属性覆盖先处理的)，
     * 新节点连向合并集合外的后继 (不带属性)。两端都在集合内的内部边随被合并节点一起消失。
     * 如果被合并的节点中包含入口节点，新节点继承入口标记。
     * 被合并节点按名称自然顺序处理，结果与集合的迭代顺序无关。
     * </p>
     * <p>
     * 源图不会被修改。
     * </p>
     *
     * @param src       源图
     * @param nodeNames 要合并的节点名称
     * @param newName   新节点名称
     * @return 合并后的新图
     * @throws CfgInvariantException 如果某个名称不存在 ({@code UNKNOWN_NODE})，
     *                               或 {@code newName} 为空 ({@code INVALID_NODE}) 或与集合外的节点重名 ({@code DUPLICATE_NODE})
     */
    public static Graph merge(Graph src, Set<String> nodeNames, String newName) {
        Objects.requireNonNull(src, "源图不能为空");
        Objects.requireNonNull(nodeNames, "合并节点集合不能为空");
        Graph dst = new Graph();
        copy(dst, src);
        Node newNode = dst.newNode(newName);

        // 外部前驱 -> 入边属性；外部后继。键为节点对象，按内部 ID 排序
        Map<Long, Node> preds = new TreeMap<>();
        Map<Long, AttributeMap> predAttrs = new HashMap<>();
        Map<Long, Node> succs = new TreeMap<>();

        Node oldEntry = dst.entry().orElse(null);
        boolean inheritEntry = false;
        List<String> ordered = new ArrayList<>(nodeNames);
        ordered.sort(NaturalOrderComparator.INSTANCE);
        for (String delName : ordered) {
            Node delNode = dst.mustNodeByName(delName);
            if (delNode == oldEntry) {
                inheritEntry = true;
            }
            for (Node pred : dst.predecessors(delNode)) {
                if (!nodeNames.contains(pred.getName())) {
                    Edge in = dst.edge(pred, delNode).get();
                    preds.put(pred.getId(), pred);
                    predAttrs.put(pred.getId(), in.getAttributes());
                }
            }
            for (Node succ : dst.successors(delNode)) {
                if (!nodeNames.contains(succ.getName())) {
                    succs.put(succ.getId(), succ);
                }
            }
            dst.removeNode(delNode);
        }

        // 先移除旧节点再加入新节点，避免与原入口节点冲突
        dst.addNode(newNode);
        if (inheritEntry) {
            dst.setEntry(newNode);
        }
        for (Node pred : preds.values()) {
            Edge e = dst.newEdge(pred, newNode);
            e.getAttributes().putAll(predAttrs.get(pred.getId()));
            dst.setEdge(e);
        }
        for (Node succ : succs.values()) {
            dst.setEdge(dst.newEdge(newNode, succ));
        }
        log.debug("图 '{}': 节点 {} 已合并为 '{}'。外部前驱 {} 个, 外部后继 {} 个",
                src.getDotId(), ordered, newName, preds.size(), succs.size());
        return dst;
    }
}
