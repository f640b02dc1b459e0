package xyz.vvrf.cfg.util;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.cfg.core.Graph;
import xyz.vvrf.cfg.core.Node;

import java.util.*;

/**
 * 控制流图的深度优先遍历编号及按编号排序的工具方法。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class GraphUtils {

    private GraphUtils() {}

    /**
     * 按节点名称 (DOT ID) 的自然顺序比较节点。
     */
    public static final Comparator<Node> BY_NATURAL_NAME =
            (a, b) -> NaturalOrderComparator.INSTANCE.compare(a.getName(), b.getName());

    /**
     * 为图中每个节点计算 DFS 前序编号和逆后序编号。
     * <p>
     * 从入口节点开始深度优先遍历 (使用显式栈，不受调用栈深度限制)，每个节点的后继按名称的自然顺序访问；
     * 首次访问时分配前序编号 (从 0 递增)，访问结束时分配逆后序编号 (从 {@code nodeCount - 1} 递减)，因此入口节点通常得到逆后序编号 0。
     * 入口不可达的节点随后按名称自然顺序作为新的遍历起点，保证所有节点都被编号。
     * </p>
     * <p>
     * 重复调用会覆盖之前的编号，结果完全相同。
     * </p>
     *
     * @param g 控制流图
     */
    public static void initDfsOrder(Graph g) {
        Objects.requireNonNull(g, "图不能为空");
        DfsState state = new DfsState(g);
        Optional<Node> entry = g.entry();
        if (entry.isPresent()) {
            walk(g, entry.get(), state);
        } else {
            log.debug("图 '{}': 没有入口节点, 所有节点按名称顺序遍历", g.getDotId());
        }
        int reachable = state.visited.size();
        for (Node n : sortByName(g.nodes())) {
            if (!state.visited.contains(n)) {
                walk(g, n, state);
            }
        }
        log.debug("图 '{}': DFS 编号完成。{} 个节点, 其中 {} 个从入口不可达",
                g.getDotId(), g.nodeCount(), state.visited.size() - reachable);
    }

    // 显式栈模拟递归：入栈时分配前序编号，出栈时分配逆后序编号，编号与递归版本完全一致
    private static void walk(Graph g, Node start, DfsState state) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(state.enter(g, start));
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (top.successors.hasNext()) {
                Node succ = top.successors.next();
                if (!state.visited.contains(succ)) {
                    stack.push(state.enter(g, succ));
                }
            } else {
                stack.pop();
                top.node.setRevPost(state.last--);
            }
        }
    }

    private static final class Frame {
        final Node node;
        // 按名称自然顺序排列的后继
        final Iterator<Node> successors;

        Frame(Node node, Iterator<Node> successors) {
            this.node = node;
            this.successors = successors;
        }
    }

    private static final class DfsState {
        // 节点按对象同一性比较
        final Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        int first = 0;
        int last;

        DfsState(Graph g) {
            this.last = g.nodeCount() - 1;
        }

        Frame enter(Graph g, Node n) {
            n.setPre(first++);
            visited.add(n);
            return new Frame(n, sortByName(g.successors(n)).iterator());
        }
    }

    /**
     * 按逆后序编号升序排列节点，返回新列表。编号相同时保持输入顺序。
     * 调用前应先对所属图执行 {@link #initDfsOrder(Graph)}。
     */
    public static List<Node> sortByRevPost(Collection<Node> nodes) {
        List<Node> sorted = new ArrayList<>(nodes);
        sorted.sort(Comparator.comparingInt(Node::getRevPost));
        return sorted;
    }

    /**
     * 按后序排列节点 (逆后序编号降序)，返回新列表。编号相同时保持输入顺序。
     * 调用前应先对所属图执行 {@link #initDfsOrder(Graph)}。
     */
    public static List<Node> sortByPost(Collection<Node> nodes) {
        List<Node> sorted = new ArrayList<>(nodes);
        sorted.sort((a, b) -> Integer.compare(b.getRevPost(), a.getRevPost()));
        return sorted;
    }

    /**
     * 按名称自然顺序排列节点，返回新列表。
     */
    public static List<Node> sortByName(Collection<Node> nodes) {
        List<Node> sorted = new ArrayList<>(nodes);
        sorted.sort(BY_NATURAL_NAME);
        return sorted;
    }
}
