package com.onelang.compiler.parser;

import com.onelang.compiler.CompilerException;
import com.onelang.compiler.lexer.Token;

/**
 * 解析异常：在第一个不合语法的 token 处抛出，不做错误恢复
 */
public class ParseException extends CompilerException {
    private final Token token;
    private final String expected;

    public ParseException(String message, Token token) {
        this(message, token, null);
    }

    public ParseException(String message, Token token, String expected) {
        super(message, token != null ? token.getLocation() : null);
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    /** 期望的 token 类型名，未知时为 null */
    public String getExpected() {
        return expected;
    }
}
