package com.onelang.compiler.parser;

import com.onelang.compiler.ast.decl.Declaration;
import com.onelang.compiler.ast.decl.FunctionDecl;
import com.onelang.compiler.ast.decl.Parameter;
import com.onelang.compiler.ast.decl.Requirement;
import com.onelang.compiler.ast.stmt.Block;
import com.onelang.compiler.ast.type.TypeAnnotation;
import com.onelang.compiler.lexer.SourceLocation;
import com.onelang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.onelang.compiler.lexer.TokenType.*;

/**
 * 声明解析辅助类
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 顶层只支持函数声明
     */
    Declaration parseDeclaration() {
        if (parser.check(KW_FUNCTION)) {
            return parseFunctionDecl();
        }
        throw parser.unexpected();
    }

    /**
     * {@code function NAME: [inputs:] [outputs:] [requirements:] implementation: Block}
     */
    FunctionDecl parseFunctionDecl() {
        SourceLocation loc = parser.location();
        parser.expect(KW_FUNCTION, "Expected 'function'");
        String name = parser.expect(IDENTIFIER, "Expected function name").getLexeme();
        parser.expect(COLON, "Expected ':' after function name");
        parser.skipNewlines();

        List<Parameter> inputs = Collections.emptyList();
        if (parser.match(KW_INPUTS)) {
            parser.expect(COLON, "Expected ':' after 'inputs'");
            parser.skipNewlines();
            inputs = parseParameterList();
            parser.skipNewlines();
        }

        List<Parameter> outputs = Collections.emptyList();
        if (parser.match(KW_OUTPUTS)) {
            parser.expect(COLON, "Expected ':' after 'outputs'");
            parser.skipNewlines();
            outputs = parseParameterList();
            parser.skipNewlines();
        }

        List<Requirement> requirements = Collections.emptyList();
        if (parser.match(KW_REQUIREMENTS)) {
            parser.expect(COLON, "Expected ':' after 'requirements'");
            parser.skipNewlines();
            requirements = parseRequirementList();
            parser.skipNewlines();
        }

        parser.expect(KW_IMPLEMENTATION, "Expected 'implementation'");
        parser.expect(COLON, "Expected ':' after 'implementation'");
        parser.skipNewlines();

        Block body = parser.parseBlock();
        return new FunctionDecl(loc, name, inputs, outputs, requirements, body);
    }

    /**
     * 换行分隔的参数列表，遇到下一个分段关键词结束
     */
    List<Parameter> parseParameterList() {
        List<Parameter> params = new ArrayList<Parameter>();

        while (!parser.checkAny(KW_OUTPUTS, KW_REQUIREMENTS, KW_IMPLEMENTATION) && !parser.isAtEnd()) {
            if (parser.check(NEWLINE)) {
                parser.skipNewlines();
                if (!parser.check(IDENTIFIER)) break;
            }

            params.add(parseParameter());

            if (!parser.match(NEWLINE)) break;
        }

        return params;
    }

    /**
     * {@code name [: TypeAnnotation]}
     */
    Parameter parseParameter() {
        Token name = parser.expect(IDENTIFIER, "Expected parameter name");
        TypeAnnotation type = null;
        if (parser.match(COLON)) {
            type = parser.parseTypeAnnotation();
        }
        return new Parameter(name.getLocation(), name.getLexeme(), type);
    }

    /**
     * {@code - 自由文本} 条目列表，描述为该行 token 以单个空格拼接
     */
    List<Requirement> parseRequirementList() {
        List<Requirement> requirements = new ArrayList<Requirement>();

        while (!parser.check(KW_IMPLEMENTATION) && !parser.isAtEnd()) {
            if (parser.check(NEWLINE)) {
                parser.skipNewlines();
                if (!parser.check(MINUS)) break;
            }

            SourceLocation loc = parser.expect(MINUS, "Expected '-' before requirement").getLocation();
            StringBuilder description = new StringBuilder();
            while (!parser.check(NEWLINE) && !parser.isAtEnd()) {
                if (description.length() > 0) description.append(' ');
                description.append(parser.advance().getLexeme());
            }
            requirements.add(new Requirement(loc, description.toString()));
        }

        return requirements;
    }
}
