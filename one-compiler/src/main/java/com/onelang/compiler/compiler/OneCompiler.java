package com.onelang.compiler.compiler;

import com.onelang.compiler.analysis.TypeCheckError;
import com.onelang.compiler.analysis.TypeCheckException;
import com.onelang.compiler.analysis.TypeChecker;
import com.onelang.compiler.ast.decl.Program;
import com.onelang.compiler.bytecode.BytecodeJson;
import com.onelang.compiler.bytecode.BytecodeModule;
import com.onelang.compiler.bytecode.Disassembler;
import com.onelang.compiler.codegen.CodeGenerator;
import com.onelang.compiler.lexer.Lexer;
import com.onelang.compiler.lexer.Token;
import com.onelang.compiler.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * 编译器门面。
 * 管线：源码 → Lexer → Parser → AST → TypeChecker → CodeGenerator → 字节码模块。
 *
 * <p>每次编译都创建新的各阶段实例，门面本身只持有配置。</p>
 */
public class OneCompiler implements OneCompilerApi {

    private static final Logger log = LoggerFactory.getLogger(OneCompiler.class);

    private final CompilerOptions options;

    public OneCompiler() {
        this(new CompilerOptions());
    }

    public OneCompiler(CompilerOptions options) {
        this.options = options;
    }

    public CompilerOptions getOptions() {
        return options;
    }

    /**
     * 编译源代码。
     *
     * @throws com.onelang.compiler.lexer.LexException     词法错误
     * @throws com.onelang.compiler.parser.ParseException  语法错误
     * @throws TypeCheckException                          有类型诊断且配置为致命
     * @throws com.onelang.compiler.codegen.CodegenException 代码生成错误
     */
    @Override
    public BytecodeModule compile(String source, String sourceName) {
        Program program = parse(source, sourceName);

        if (options.isTypeCheck()) {
            List<TypeCheckError> diagnostics = typeCheck(program);
            if (!diagnostics.isEmpty()) {
                if (options.isFailOnTypeErrors()) {
                    throw new TypeCheckException(diagnostics);
                }
                for (TypeCheckError diagnostic : diagnostics) {
                    log.warn("{}", diagnostic);
                }
            }
        }

        CodeGenerator generator = new CodeGenerator(options.getEntryPoint(), options.isRequireEntryPoint());
        BytecodeModule module = generator.generate(program);
        log.debug("[{}] generated {} function(s)", sourceName, module.getFunctions().size());
        if (log.isTraceEnabled()) {
            log.trace("[{}] disassembly:\n{}", sourceName, Disassembler.disassemble(module));
        }
        return module;
    }

    /**
     * 只做词法和语法分析。
     */
    public Program parse(String source, String sourceName) {
        List<Token> tokens = new Lexer(source, sourceName).scanTokens();
        log.debug("[{}] lexed {} token(s)", sourceName, tokens.size());

        Program program = new Parser(tokens).parse();
        log.debug("[{}] parsed {} declaration(s)", sourceName, program.getDeclarations().size());
        return program;
    }

    /**
     * 只检查不生成，返回全部类型诊断（不抛出）。
     */
    public List<TypeCheckError> check(String source, String sourceName) {
        return typeCheck(parse(source, sourceName));
    }

    private List<TypeCheckError> typeCheck(Program program) {
        TypeChecker checker = new TypeChecker();
        if (checker.check(program)) {
            return Collections.emptyList();
        }
        return checker.getDiagnostics();
    }

    /**
     * 编译文件（UTF-8），文件名作为源名称。
     */
    public BytecodeModule compileFile(Path file) throws IOException {
        String source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return compile(source, file.getFileName().toString());
    }

    /**
     * 编译并把字节码模块以 JSON 保存到目标文件。
     */
    public BytecodeModule compileAndSave(Path sourceFile, Path outFile) throws IOException {
        BytecodeModule module = compileFile(sourceFile);
        Path parent = outFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        new BytecodeJson().write(module, outFile);
        log.debug("Wrote {}", outFile);
        return module;
    }
}
