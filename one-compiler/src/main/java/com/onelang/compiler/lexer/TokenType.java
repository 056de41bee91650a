package com.onelang.compiler.lexer;

/**
 * One 语言词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 - 声明 ===
    KW_FUNCTION, KW_TYPE, KW_MODULE, KW_IMPORT, KW_EXPORT,

    // === 关键词 - 函数分段 ===
    KW_INPUTS, KW_OUTPUTS, KW_REQUIREMENTS, KW_IMPLEMENTATION,
    KW_WHERE, KW_INVARIANT,

    // === 关键词 - 控制流 ===
    KW_ENSURE, KW_OTHERWISE, KW_MATCH, KW_IF, KW_ELSE,
    KW_LOOP, KW_WHILE, KW_FOR, KW_IN, KW_RETURN,
    KW_BREAK, KW_CONTINUE,

    // === 关键词 - 绑定 ===
    KW_CONST, KW_LET, KW_VAR,

    // === 关键词 - 字面量 ===
    KW_TRUE, KW_FALSE, KW_NULL,

    // === 关键词 - 逻辑 ===
    KW_AND, KW_OR, KW_NOT,

    // === 关键词 - 语法扩展（保留） ===
    KW_SYNTAX, KW_WITH_SYNTAX, KW_USE_SYNTAX,

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /
    MOD,            // %
    POWER,          // **

    // === 操作符 - 比较 ===
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=

    // === 操作符 - 赋值 ===
    ASSIGN,         // =
    PLUS_ASSIGN,    // +=
    MINUS_ASSIGN,   // -=
    MUL_ASSIGN,     // *=
    DIV_ASSIGN,     // /=

    // === 操作符 - 位运算（保留） ===
    AMPERSAND,      // &
    PIPE,           // |
    CARET,          // ^
    TILDE,          // ~
    LSHIFT,         // <<
    RSHIFT,         // >>

    // === 操作符 - 特殊 ===
    ARROW,          // ->
    DOUBLE_ARROW,   // =>
    QUESTION,       // ?

    // === 分隔符 ===
    LPAREN,         // (
    RPAREN,         // )
    LBRACE,         // {
    RBRACE,         // }
    LBRACKET,       // [
    RBRACKET,       // ]
    COMMA,          // ,
    DOT,            // .
    COLON,          // :
    SEMICOLON,      // ;

    // === 特殊 ===
    NEWLINE,
    EOF;

    /**
     * 是否为关键词
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /**
     * 是否为赋值操作符
     */
    public boolean isAssignmentOp() {
        switch (this) {
            case ASSIGN:
            case PLUS_ASSIGN:
            case MINUS_ASSIGN:
            case MUL_ASSIGN:
            case DIV_ASSIGN:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为比较操作符
     */
    public boolean isComparisonOp() {
        switch (this) {
            case LT:
            case GT:
            case LE:
            case GE:
                return true;
            default:
                return false;
        }
    }
}
