package com.onelang.compiler.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One 语言词法分析器
 *
 * <p>换行不是空白：它作为 {@link TokenType#NEWLINE} 输出，是语句和参数的分隔符。
 * 遇到第一个词法错误即抛出 {@link LexException}，不做恢复。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    // 当前 token 起始位置
    private int startLine = 1;
    private int startColumn = 1;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 声明
        map.put("function", TokenType.KW_FUNCTION);
        map.put("type", TokenType.KW_TYPE);
        map.put("module", TokenType.KW_MODULE);
        map.put("import", TokenType.KW_IMPORT);
        map.put("export", TokenType.KW_EXPORT);

        // 函数分段
        map.put("inputs", TokenType.KW_INPUTS);
        map.put("outputs", TokenType.KW_OUTPUTS);
        map.put("requirements", TokenType.KW_REQUIREMENTS);
        map.put("implementation", TokenType.KW_IMPLEMENTATION);
        map.put("where", TokenType.KW_WHERE);
        map.put("invariant", TokenType.KW_INVARIANT);

        // 控制流
        map.put("ensure", TokenType.KW_ENSURE);
        map.put("otherwise", TokenType.KW_OTHERWISE);
        map.put("match", TokenType.KW_MATCH);
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("loop", TokenType.KW_LOOP);
        map.put("while", TokenType.KW_WHILE);
        map.put("for", TokenType.KW_FOR);
        map.put("in", TokenType.KW_IN);
        map.put("return", TokenType.KW_RETURN);
        map.put("break", TokenType.KW_BREAK);
        map.put("continue", TokenType.KW_CONTINUE);

        // 绑定
        map.put("const", TokenType.KW_CONST);
        map.put("let", TokenType.KW_LET);
        map.put("var", TokenType.KW_VAR);

        // 字面量
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);
        map.put("null", TokenType.KW_NULL);

        // 逻辑
        map.put("and", TokenType.KW_AND);
        map.put("or", TokenType.KW_OR);
        map.put("not", TokenType.KW_NOT);

        // 语法扩展
        map.put("syntax", TokenType.KW_SYNTAX);
        map.put("with_syntax", TokenType.KW_WITH_SYNTAX);
        map.put("use_syntax", TokenType.KW_USE_SYNTAX);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    /**
     * 执行词法分析，返回 Token 列表（以唯一的 EOF 结尾）
     *
     * @throws LexException 未闭合的字符串/块注释、未知转义序列或无法识别的字符
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }

        tokens.add(new Token(TokenType.EOF, "", null, currentLocation()));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '.': addToken(TokenType.DOT); break;
            case '?': addToken(TokenType.QUESTION); break;
            case '%': addToken(TokenType.MOD); break;
            case '&': addToken(TokenType.AMPERSAND); break;
            case '|': addToken(TokenType.PIPE); break;
            case '^': addToken(TokenType.CARET); break;
            case '~': addToken(TokenType.TILDE); break;

            // 可能是多字符的 Token（最长匹配）
            case '+':
                addToken(match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS);
                break;

            case '-':
                if (match('=')) addToken(TokenType.MINUS_ASSIGN);
                else if (match('>')) addToken(TokenType.ARROW);
                else addToken(TokenType.MINUS);
                break;

            case '*':
                if (match('=')) addToken(TokenType.MUL_ASSIGN);
                else if (match('*')) addToken(TokenType.POWER);
                else addToken(TokenType.MUL);
                break;

            case '/':
                if (match('/')) {
                    // 单行注释
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    // 多行注释（不支持嵌套）
                    blockComment();
                } else if (match('=')) {
                    addToken(TokenType.DIV_ASSIGN);
                } else {
                    addToken(TokenType.DIV);
                }
                break;

            case '=':
                if (match('=')) addToken(TokenType.EQ);
                else if (match('>')) addToken(TokenType.DOUBLE_ARROW);
                else addToken(TokenType.ASSIGN);
                break;

            case '!':
                if (match('=')) {
                    addToken(TokenType.NE);
                } else {
                    throw error("Unexpected character: '!'", tokenStart());
                }
                break;

            case '<':
                if (match('=')) addToken(TokenType.LE);
                else if (match('<')) addToken(TokenType.LSHIFT);
                else addToken(TokenType.LT);
                break;

            case '>':
                if (match('=')) addToken(TokenType.GE);
                else if (match('>')) addToken(TokenType.RSHIFT);
                else addToken(TokenType.GT);
                break;

            // 空白字符
            case ' ':
            case '\r':
            case '\t':
                break;

            case '\n':
                tokens.add(new Token(TokenType.NEWLINE, "\\n", null, tokenStart()));
                break;

            // 字符串
            case '"':
                string();
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw error("Unexpected character: '" + c + "'", tokenStart());
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private SourceLocation tokenStart() {
        return new SourceLocation(fileName, startLine, startColumn);
    }

    private SourceLocation currentLocation() {
        return new SourceLocation(fileName, line, column);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, tokenStart()));
    }

    // === 复杂 Token 扫描 ===

    private void string() {
        StringBuilder value = new StringBuilder();

        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\') {
                advance();
                if (isAtEnd()) break;
                value.append(escapeChar());
            } else {
                value.append(advance());
            }
        }

        if (isAtEnd()) {
            throw error("Unterminated string literal", tokenStart());
        }

        advance(); // 闭合的 "
        addToken(TokenType.STRING_LITERAL, value.toString());
    }

    private char escapeChar() {
        SourceLocation loc = currentLocation();
        char c = advance();
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            case '\\': return '\\';
            case '"': return '"';
            default:
                throw error("Unknown escape sequence: \\" + c, loc);
        }
    }

    private void number() {
        while (isDigit(peek())) advance();

        // 小数部分：'.' 后必须紧跟数字，否则 '.' 属于成员访问
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // 消费 .
            while (isDigit(peek())) advance();
            addToken(TokenType.FLOAT_LITERAL, Double.parseDouble(source.substring(start, current)));
            return;
        }

        String text = source.substring(start, current);
        try {
            addToken(TokenType.INT_LITERAL, Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw error("Integer literal out of range: " + text, tokenStart());
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;

        switch (type) {
            case KW_TRUE: addToken(type, Boolean.TRUE); break;
            case KW_FALSE: addToken(type, Boolean.FALSE); break;
            default: addToken(type); break;
        }
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
        throw error("Unterminated block comment", currentLocation());
    }

    private LexException error(String message, SourceLocation location) {
        return new LexException(message, location);
    }
}
