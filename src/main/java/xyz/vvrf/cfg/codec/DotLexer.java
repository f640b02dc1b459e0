package xyz.vvrf.cfg.codec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * DOT 文本的词法分析器。
 * 跳过空白和注释 (行注释、块注释以及以 {@code #} 开头的行)，
 * 将带引号的字符串 (包括 {@code +} 拼接) 合并为一个 ID 记号。
 */
final class DotLexer {

    private static final Set<String> KEYWORDS = Collections.unmodifiableSet(new HashSet<>(
            Arrays.asList("strict", "graph", "digraph", "node", "edge", "subgraph")));

    enum Type {
        ID, LBRACE, RBRACE, LBRACKET, RBRACKET, EQUALS, SEMI, COMMA, COLON, ARROW, UNDIRECTED, EOF
    }

    static final class Token {
        final Type type;
        final String text;
        // 带引号的字符串永远不是关键字
        final boolean quoted;
        final int line;
        final int column;

        Token(Type type, String text, boolean quoted, int line, int column) {
            this.type = type;
            this.text = text;
            this.quoted = quoted;
            this.line = line;
            this.column = column;
        }

        boolean isKeyword(String keyword) {
            return type == Type.ID && !quoted && text.equalsIgnoreCase(keyword);
        }

        @Override
        public String toString() {
            return type == Type.ID ? (quoted ? DotEncoder.quote(text) : text) : type.name();
        }
    }

    private final String input;
    private int pos;
    private int line = 1;
    private int column = 1;

    DotLexer(String input) {
        this.input = input;
    }

    static boolean isKeyword(String id) {
        return KEYWORDS.contains(id.toLowerCase(Locale.ROOT));
    }

    List<Token> tokenize() throws DotParseException {
        List<Token> tokens = new ArrayList<>();
        Token t;
        do {
            t = next();
            tokens.add(t);
        } while (t.type != Type.EOF);
        return tokens;
    }

    private Token next() throws DotParseException {
        skipWhitespaceAndComments();
        int startLine = line;
        int startColumn = column;
        if (pos >= input.length()) {
            return new Token(Type.EOF, "", false, startLine, startColumn);
        }
        char c = input.charAt(pos);
        switch (c) {
            case '{':
                advance();
                return new Token(Type.LBRACE, "{", false, startLine, startColumn);
            case '}':
                advance();
                return new Token(Type.RBRACE, "}", false, startLine, startColumn);
            case '[':
                advance();
                return new Token(Type.LBRACKET, "[", false, startLine, startColumn);
            case ']':
                advance();
                return new Token(Type.RBRACKET, "]", false, startLine, startColumn);
            case '=':
                advance();
                return new Token(Type.EQUALS, "=", false, startLine, startColumn);
            case ';':
                advance();
                return new Token(Type.SEMI, ";", false, startLine, startColumn);
            case ',':
                advance();
                return new Token(Type.COMMA, ",", false, startLine, startColumn);
            case ':':
                advance();
                return new Token(Type.COLON, ":", false, startLine, startColumn);
            case '"':
                return new Token(Type.ID, quotedString(), true, startLine, startColumn);
            case '<':
                throw error("不支持 HTML 字符串", startLine, startColumn);
            default:
                break;
        }
        if (c == '-' && pos + 1 < input.length()) {
            char n = input.charAt(pos + 1);
            if (n == '>') {
                advance();
                advance();
                return new Token(Type.ARROW, "->", false, startLine, startColumn);
            }
            if (n == '-') {
                advance();
                advance();
                return new Token(Type.UNDIRECTED, "--", false, startLine, startColumn);
            }
        }
        if (c == '-' || c == '.' || isDigit(c)) {
            return new Token(Type.ID, numeral(startLine, startColumn), false, startLine, startColumn);
        }
        if (isIdentifierStart(c)) {
            int start = pos;
            while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
                advance();
            }
            return new Token(Type.ID, input.substring(start, pos), false, startLine, startColumn);
        }
        throw error(String.format("意外的字符 '%s'", c), startLine, startColumn);
    }

    private String numeral(int startLine, int startColumn) throws DotParseException {
        int start = pos;
        if (input.charAt(pos) == '-') {
            advance();
        }
        boolean digits = false;
        while (pos < input.length() && isDigit(input.charAt(pos))) {
            advance();
            digits = true;
        }
        if (pos < input.length() && input.charAt(pos) == '.') {
            advance();
            while (pos < input.length() && isDigit(input.charAt(pos))) {
                advance();
                digits = true;
            }
        }
        if (!digits) {
            throw error(String.format("无效的数字 '%s'", input.substring(start, pos)), startLine, startColumn);
        }
        if (pos < input.length() && isIdentifierStart(input.charAt(pos))) {
            throw error(String.format("数字 '%s' 后紧跟标识符字符", input.substring(start, pos)), startLine, startColumn);
        }
        return input.substring(start, pos);
    }

    private String quotedString() throws DotParseException {
        StringBuilder value = new StringBuilder();
        quotedPart(value);
        // "a" + "b" 拼接为一个 ID
        while (true) {
            int savePos = pos;
            int saveLine = line;
            int saveColumn = column;
            skipWhitespaceAndComments();
            if (pos < input.length() && input.charAt(pos) == '+') {
                advance();
                skipWhitespaceAndComments();
                if (pos >= input.length() || input.charAt(pos) != '"') {
                    throw error("'+' 之后应为带引号的字符串", line, column);
                }
                quotedPart(value);
            } else {
                pos = savePos;
                line = saveLine;
                column = saveColumn;
                return value.toString();
            }
        }
    }

    private void quotedPart(StringBuilder value) throws DotParseException {
        int startLine = line;
        int startColumn = column;
        advance(); // 开头的引号
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                advance();
                return;
            }
            if (c == '\\' && pos + 1 < input.length()) {
                char n = input.charAt(pos + 1);
                if (n == '"' || n == '\\') {
                    value.append(n);
                    advance();
                    advance();
                    continue;
                }
                if (n == '\n') {
                    // 行继续符
                    advance();
                    advance();
                    continue;
                }
            }
            value.append(c);
            advance();
        }
        throw error("字符串未结束", startLine, startColumn);
    }

    private void skipWhitespaceAndComments() throws DotParseException {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '#' && atLineStart()) {
                skipLine();
            } else if (c == '/' && pos + 1 < input.length() && input.charAt(pos + 1) == '/') {
                skipLine();
            } else if (c == '/' && pos + 1 < input.length() && input.charAt(pos + 1) == '*') {
                int startLine = line;
                int startColumn = column;
                advance();
                advance();
                while (true) {
                    if (pos + 1 >= input.length()) {
                        throw error("注释未结束", startLine, startColumn);
                    }
                    if (input.charAt(pos) == '*' && input.charAt(pos + 1) == '/') {
                        advance();
                        advance();
                        break;
                    }
                    advance();
                }
            } else {
                return;
            }
        }
    }

    private boolean atLineStart() {
        for (int i = pos - 1; i >= 0; i--) {
            char c = input.charAt(i);
            if (c == '\n') {
                return true;
            }
            if (c != ' ' && c != '\t' && c != '\r') {
                return false;
            }
        }
        return true;
    }

    private void skipLine() {
        while (pos < input.length() && input.charAt(pos) != '\n') {
            advance();
        }
    }

    private void advance() {
        if (input.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c >= '\u0080';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    static DotParseException error(String message, int line, int column) {
        return new DotParseException(DotParseException.Reason.MALFORMED_DOT,
                String.format("%d:%d: %s", line, column, message));
    }
}
