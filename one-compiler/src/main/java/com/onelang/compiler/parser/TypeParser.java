package com.onelang.compiler.parser;

import com.onelang.compiler.ast.type.TypeAnnotation;
import com.onelang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.onelang.compiler.lexer.TokenType.*;

/**
 * 类型注解解析辅助类
 */
class TypeParser {

    final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * {@code NAME ['<' TypeAnnotation {',' TypeAnnotation} '>'] [where ...]}
     */
    TypeAnnotation parseTypeAnnotation() {
        TypeAnnotation type = parseNamedType();

        // where 约束：识别但不保留，跳到行尾
        if (parser.match(KW_WHERE)) {
            while (!parser.check(NEWLINE) && !parser.isAtEnd()) {
                parser.advance();
            }
        }

        return type;
    }

    private TypeAnnotation parseNamedType() {
        Token name = parser.expect(IDENTIFIER, "Expected type name");

        List<TypeAnnotation> typeArgs = new ArrayList<TypeAnnotation>();
        if (parser.match(LT)) {
            do {
                typeArgs.add(parseNamedType());
            } while (parser.match(COMMA));

            if (parser.check(RSHIFT)) {
                parser.splitShiftRight();
            }
            parser.expect(GT, "Expected '>' after type arguments");
        }

        return new TypeAnnotation(name.getLocation(), name.getLexeme(), typeArgs);
    }
}
