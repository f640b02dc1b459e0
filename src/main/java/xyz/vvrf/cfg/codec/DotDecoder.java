package xyz.vvrf.cfg.codec;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.cfg.codec.DotLexer.Token;
import xyz.vvrf.cfg.codec.DotLexer.Type;
import xyz.vvrf.cfg.core.AttributeMap;
import xyz.vvrf.cfg.core.CfgInvariantException;
import xyz.vvrf.cfg.core.Edge;
import xyz.vvrf.cfg.core.Graph;
import xyz.vvrf.cfg.core.Node;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 将 Graphviz DOT 文本解析为控制流图。
 * <p>
 * 节点属性 {@code label=entry} 等价于显式设置入口节点。
 * 解析结束后如果没有发现入口节点，则使用名为 {@code 0} 的节点作为入口；
 * 两者都不存在时解析失败 ({@link DotParseException.Reason#NO_ENTRY_NODE})。
 * </p>
 * <p>
 * 支持的语法是 DOT 的一个子集：有向图、节点语句、边链 ({@code a -> b -> c})、属性列表、注释。
 * 图/节点/边的默认属性语句和图属性赋值会被接受但忽略；
 * 无向图、子图、端口和 HTML 字符串视为格式错误。
 * </p>
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class DotDecoder {

    static final String ENTRY_FALLBACK_NAME = "0";

    private DotDecoder() {}

    public static Graph parse(InputStream in) throws DotParseException {
        Objects.requireNonNull(in, "输入流不能为空");
        try {
            ByteArrayOutputStream buf = new ByteArrayOutputStream();
            byte[] chunk = new byte[8192];
            int n;
            while ((n = in.read(chunk)) != -1) {
                buf.write(chunk, 0, n);
            }
            return parseBytes(buf.toByteArray());
        } catch (IOException e) {
            throw new DotParseException(DotParseException.Reason.IO, "无法读取 DOT 输入流: " + e.getMessage(), e);
        }
    }

    public static Graph parse(Reader reader) throws DotParseException {
        Objects.requireNonNull(reader, "Reader 不能为空");
        try {
            StringBuilder buf = new StringBuilder();
            char[] chunk = new char[8192];
            int n;
            while ((n = reader.read(chunk)) != -1) {
                buf.append(chunk, 0, n);
            }
            return parseString(buf.toString());
        } catch (IOException e) {
            throw new DotParseException(DotParseException.Reason.IO, "无法读取 DOT 输入: " + e.getMessage(), e);
        }
    }

    /**
     * 解析 DOT 文件 (UTF-8)。
     */
    public static Graph parseFile(Path path) throws DotParseException {
        Objects.requireNonNull(path, "文件路径不能为空");
        byte[] buf;
        try {
            buf = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new DotParseException(DotParseException.Reason.IO,
                    String.format("无法读取 DOT 文件 '%s': %s", path, e), e);
        }
        log.debug("解析 DOT 文件 '{}' ({} 字节)", path, buf.length);
        return parseBytes(buf);
    }

    /**
     * 解析 UTF-8 编码的 DOT 文本。
     */
    public static Graph parseBytes(byte[] b) throws DotParseException {
        Objects.requireNonNull(b, "字节缓冲不能为空");
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(b))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new DotParseException(DotParseException.Reason.MALFORMED_DOT,
                    "DOT 输入不是有效的 UTF-8 文本: " + e, e);
        }
        return parseString(text);
    }

    public static Graph parseString(String s) throws DotParseException {
        Objects.requireNonNull(s, "DOT 文本不能为空");
        List<Token> tokens = new DotLexer(s).tokenize();
        Graph g = new Parser(tokens).parseGraph();
        resolveEntry(g);
        log.debug("图 '{}': DOT 解析完成。{} 个节点, {} 条边, 入口 '{}'",
                g.getDotId(), g.nodeCount(), g.edgeCount(), g.entry().map(Node::getName).orElse(null));
        return g;
    }

    private static void resolveEntry(Graph g) throws DotParseException {
        if (g.entry().isPresent()) {
            return;
        }
        Optional<Node> fallback = g.nodeByName(ENTRY_FALLBACK_NAME);
        if (!fallback.isPresent()) {
            throw new DotParseException(DotParseException.Reason.NO_ENTRY_NODE,
                    String.format("图 '%s': 找不到入口节点 (label=entry) 或名称为 \"%s\" 的节点",
                            g.getDotId(), ENTRY_FALLBACK_NAME));
        }
        log.debug("图 '{}': 未声明入口节点, 使用节点 '{}' 作为入口", g.getDotId(), ENTRY_FALLBACK_NAME);
        g.setEntry(fallback.get());
    }

    /**
     * 递归下降解析器，每次解析使用一个新实例。
     */
    private static final class Parser {
        private final List<Token> tokens;
        private int pos;
        private final Graph g = new Graph();

        Parser(List<Token> tokens) {
            this.tokens = tokens;
        }

        Graph parseGraph() throws DotParseException {
            if (peek().isKeyword("strict")) {
                next();
            }
            Token kind = next();
            if (kind.isKeyword("graph")) {
                throw unsupported(kind, "控制流图必须是有向图 (digraph)");
            }
            if (!kind.isKeyword("digraph")) {
                throw unexpected(kind, "'digraph'");
            }
            if (peek().type == Type.ID) {
                g.setDotId(id(next()));
            }
            expect(Type.LBRACE, "'{'");
            parseStatements();
            expect(Type.RBRACE, "'}'");
            expect(Type.EOF, "输入结束");
            return g;
        }

        private void parseStatements() throws DotParseException {
            while (peek().type != Type.RBRACE && peek().type != Type.EOF) {
                parseStatement();
                if (peek().type == Type.SEMI) {
                    next();
                }
            }
        }

        private void parseStatement() throws DotParseException {
            Token t = peek();
            if (t.isKeyword("graph") || t.isKeyword("node") || t.isKeyword("edge")) {
                next();
                if (peek().type != Type.LBRACKET) {
                    throw unexpected(peek(), "'['");
                }
                Map<String, String> ignored = parseAttributeLists();
                log.debug("图 '{}': 忽略 {} 默认属性语句 {}", g.getDotId(), t.text, ignored);
                return;
            }
            if (t.isKeyword("subgraph") || t.type == Type.LBRACE) {
                throw unsupported(t, "不支持子图");
            }
            if (t.type != Type.ID) {
                throw unexpected(t, "语句");
            }
            Token first = next();
            if (peek().type == Type.EQUALS) {
                next();
                Token value = expect(Type.ID, "属性值");
                log.debug("图 '{}': 忽略图属性 {}={}", g.getDotId(), id(first), id(value));
                return;
            }
            List<Token> chain = new ArrayList<>();
            chain.add(first);
            checkNoPort();
            while (peek().type == Type.ARROW || peek().type == Type.UNDIRECTED) {
                Token op = next();
                if (op.type == Type.UNDIRECTED) {
                    throw unsupported(op, "有向图中不能使用 '--' 边");
                }
                Token target = expect(Type.ID, "节点 ID");
                chain.add(target);
                checkNoPort();
            }
            Map<String, String> attrs = peek().type == Type.LBRACKET
                    ? parseAttributeLists()
                    : new LinkedHashMap<>();
            if (chain.size() == 1) {
                Node n = node(first);
                for (Map.Entry<String, String> attr : attrs.entrySet()) {
                    setNodeAttribute(n, attr.getKey(), attr.getValue(), first);
                }
                return;
            }
            List<Node> nodes = new ArrayList<>(chain.size());
            for (Token nodeToken : chain) {
                nodes.add(node(nodeToken));
            }
            for (int i = 0; i + 1 < nodes.size(); i++) {
                Edge e = g.newEdge(nodes.get(i), nodes.get(i + 1));
                for (Map.Entry<String, String> attr : attrs.entrySet()) {
                    e.getAttributes().put(attr.getKey(), attr.getValue());
                }
                g.setEdge(e);
            }
        }

        // 一个或多个 [ ... ] 列表，后出现的同名属性覆盖先出现的
        private Map<String, String> parseAttributeLists() throws DotParseException {
            Map<String, String> attrs = new LinkedHashMap<>();
            while (peek().type == Type.LBRACKET) {
                next();
                while (peek().type != Type.RBRACKET) {
                    Token key = expect(Type.ID, "属性名");
                    String value = "true";
                    if (peek().type == Type.EQUALS) {
                        next();
                        value = id(expect(Type.ID, "属性值"));
                    }
                    attrs.put(id(key), value);
                    if (peek().type == Type.COMMA || peek().type == Type.SEMI) {
                        next();
                    }
                }
                next();
            }
            return attrs;
        }

        private void setNodeAttribute(Node n, String key, String value, Token at) throws DotParseException {
            boolean labelKey = AttributeMap.LABEL.equals(key);
            if (labelKey && DotEncoder.ENTRY_LABEL.equals(value)) {
                String prev = n.getAttributes().get(AttributeMap.LABEL).orElse(null);
                if (prev != null) {
                    throw invalid(at, String.format("入口节点 '%s' 的 DOT label 无效; 期望 \"entry\", 实际 \"%s\"",
                            n.getName(), prev), null);
                }
                try {
                    g.setEntry(n);
                } catch (CfgInvariantException e) {
                    throw invalid(at, e.getMessage(), e);
                }
                return;
            }
            if (labelKey && n.isEntry()) {
                throw invalid(at, String.format("入口节点 '%s' 的 DOT label 无效; 期望 \"entry\", 实际 \"%s\"",
                        n.getName(), value), null);
            }
            n.getAttributes().put(key, value);
        }

        private Node node(Token t) throws DotParseException {
            String name = id(t);
            Optional<Node> existing = g.nodeByName(name);
            if (existing.isPresent()) {
                return existing.get();
            }
            try {
                Node n = g.newNode(name);
                g.addNode(n);
                return n;
            } catch (CfgInvariantException e) {
                throw invalid(t, e.getMessage(), e);
            }
        }

        private void checkNoPort() throws DotParseException {
            if (peek().type == Type.COLON) {
                throw unsupported(peek(), "不支持节点端口");
            }
        }

        private String id(Token t) throws DotParseException {
            if (!t.quoted && DotLexer.isKeyword(t.text)) {
                throw unexpected(t, "ID (关键字需要加引号)");
            }
            return t.text;
        }

        private Token peek() {
            return tokens.get(pos);
        }

        private Token next() {
            Token t = tokens.get(pos);
            if (t.type != Type.EOF) {
                pos++;
            }
            return t;
        }

        private Token expect(Type type, String what) throws DotParseException {
            Token t = next();
            if (t.type != type) {
                throw unexpected(t, what);
            }
            return t;
        }

        private DotParseException unexpected(Token t, String expected) {
            String found = t.type == Type.EOF ? "输入结束" : "'" + t + "'";
            return DotLexer.error(String.format("期望 %s, 实际为 %s", expected, found), t.line, t.column);
        }

        private DotParseException unsupported(Token t, String message) {
            return DotLexer.error(message, t.line, t.column);
        }

        private DotParseException invalid(Token t, String message, Throwable cause) {
            return new DotParseException(DotParseException.Reason.INVALID_GRAPH,
                    String.format("%d:%d: %s", t.line, t.column, message), cause);
        }
    }
}
