package xyz.vvrf.cfg.codec;

import xyz.vvrf.cfg.config.CfgProperties;
import xyz.vvrf.cfg.core.AttributeMap;
import xyz.vvrf.cfg.core.CfgInvariantException;
import xyz.vvrf.cfg.core.Edge;
import xyz.vvrf.cfg.core.Graph;
import xyz.vvrf.cfg.core.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 将控制流图渲染为 Graphviz DOT 文本。
 * <p>
 * 输出是规范形式：节点按内部 ID 排列，边按 (起点 ID, 终点 ID) 排列，属性按键排序，
 * 入口节点带 {@code label=entry}。{@link DotDecoder} 可以将输出解析回等价的图。
 * </p>
 *
 * @author ruifeng.wen
 */
public class DotEncoder {

    static final String ENTRY_LABEL = "entry";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern NUMERAL = Pattern.compile("-?(\\.[0-9]+|[0-9]+(\\.[0-9]*)?)");

    private static volatile DotEncoder defaultEncoder;

    private final String indent;
    private final String prefix;

    /**
     * @throws IllegalArgumentException 如果缩进或行前缀包含非空白字符
     */
    public DotEncoder(CfgProperties.Dot options) {
        Objects.requireNonNull(options, "DOT 配置不能为空");
        this.indent = requireBlank(options.getIndent(), "cfg.dot.indent");
        this.prefix = requireBlank(options.getPrefix(), "cfg.dot.prefix");
    }

    // 缩进和行前缀只能是空白，否则输出无法被 DotDecoder 读回
    private static String requireBlank(String value, String key) {
        Objects.requireNonNull(value, key + " 不能为空");
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isWhitespace(value.charAt(i))) {
                throw new IllegalArgumentException(String.format(
                        "%s 只能包含空白字符, 实际为 '%s'", key, value));
            }
        }
        return value;
    }

    /**
     * 使用 classpath 配置 ({@link CfgProperties#load()}) 的共享编码器。
     */
    public static DotEncoder getDefault() {
        DotEncoder encoder = defaultEncoder;
        if (encoder == null) {
            encoder = new DotEncoder(CfgProperties.load().getDot());
            defaultEncoder = encoder;
        }
        return encoder;
    }

    /**
     * 渲染图。
     *
     * @throws CfgInvariantException 如果入口节点已有不同的 label 属性 ({@code INVARIANT_VIOLATION})
     */
    public String encode(Graph g) {
        StringBuilder dot = new StringBuilder();
        dot.append(prefix).append("digraph ");
        if (!g.getDotId().isEmpty()) {
            dot.append(formatId(g.getDotId())).append(' ');
        }
        dot.append("{\n");

        for (Node n : g.nodes()) {
            dot.append(prefix).append(indent).append(quote(n.getName()));
            appendAttributes(dot, nodeAttributes(g, n));
            dot.append(";\n");
        }
        for (Edge e : g.edges()) {
            dot.append(prefix).append(indent)
                    .append(quote(e.getFrom().getName()))
                    .append(" -> ")
                    .append(quote(e.getTo().getName()));
            appendAttributes(dot, e.getAttributes());
            dot.append(";\n");
        }

        dot.append(prefix).append('}');
        return dot.toString();
    }

    // 入口以图记录的入口节点为准；入口 label 只在输出时合成，不写回节点属性
    private static AttributeMap nodeAttributes(Graph g, Node n) {
        if (g.entry().orElse(null) != n) {
            return n.getAttributes();
        }
        String prev = n.getAttributes().get(AttributeMap.LABEL).orElse(null);
        if (prev != null && !ENTRY_LABEL.equals(prev)) {
            throw CfgInvariantException.of(CfgInvariantException.Kind.INVARIANT_VIOLATION,
                    "图 '%s': 入口节点 '%s' 的 DOT label 无效; 期望 \"%s\", 实际 \"%s\"",
                    g.getDotId(), n.getName(), ENTRY_LABEL, prev);
        }
        return AttributeMap.copyOf(n.getAttributes()).put(AttributeMap.LABEL, ENTRY_LABEL);
    }

    private static void appendAttributes(StringBuilder dot, AttributeMap attrs) {
        if (attrs.isEmpty()) {
            return;
        }
        List<String> parts = new ArrayList<>(attrs.size());
        for (Map.Entry<String, String> attr : attrs.asMap().entrySet()) {
            parts.add(formatId(attr.getKey()) + "=" + formatId(attr.getValue()));
        }
        dot.append(" [").append(String.join(", ", parts)).append(']');
    }

    /**
     * 合法的 DOT 标识符或数字原样输出，其余 (包括含空白的值和关键字) 加双引号。
     */
    static String formatId(String id) {
        if ((IDENTIFIER.matcher(id).matches() && !DotLexer.isKeyword(id)) || NUMERAL.matcher(id).matches()) {
            return id;
        }
        return quote(id);
    }

    static String quote(String id) {
        return "\"" + id.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
