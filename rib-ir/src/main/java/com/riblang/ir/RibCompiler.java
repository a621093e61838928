package com.riblang.ir;

import com.riblang.compiler.CompilationContext;
import com.riblang.compiler.CompilerOptions;
import com.riblang.compiler.analysis.TypeChecker;
import com.riblang.compiler.analysis.TypedProgram;
import com.riblang.compiler.ast.Span;
import com.riblang.compiler.diagnostic.Diagnostic;
import com.riblang.compiler.diagnostic.DiagnosticKind;
import com.riblang.compiler.diagnostic.Diagnostics;
import com.riblang.compiler.diagnostic.Severity;
import com.riblang.compiler.host.ExternalTypeTable;
import com.riblang.compiler.lexer.Lexer;
import com.riblang.compiler.parser.ParseResult;
import com.riblang.compiler.parser.Parser;
import com.riblang.ir.bytecode.BytecodeCompiler;
import com.riblang.ir.bytecode.Program;
import com.riblang.ir.bytecode.VerifyException;
import com.riblang.ir.ir.IrModule;
import com.riblang.ir.lowering.IrLowering;
import com.riblang.ir.pass.PassPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * RibLang 编译器门面。
 * 管线：源码 → Lexer → Parser → AST → TypeChecker → IR → 字节码 → 栈校验 → Program。
 *
 * <p>除外部类型表和选项外不持有状态，每次 {@link #compile} 使用独立的
 * {@link CompilationContext}，因此可以在多个线程上并发编译互不相关的单元。</p>
 */
public class RibCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(RibCompiler.class);

    private final ExternalTypeTable typeTable;
    private final CompilerOptions options;

    public RibCompiler(ExternalTypeTable typeTable) {
        this(typeTable, CompilerOptions.defaults());
    }

    public RibCompiler(ExternalTypeTable typeTable, CompilerOptions options) {
        this.typeTable = typeTable;
        this.options = options;
    }

    public ExternalTypeTable getTypeTable() {
        return typeTable;
    }

    public CompilerOptions getOptions() {
        return options;
    }

    /**
     * 编译一个单元。
     *
     * <p>语法错误不会阻止类型检查，以便一次返回尽可能多的诊断；
     * 存在任何错误级诊断时不生成 Program。</p>
     *
     * @param source 源代码
     * @param unitId 编译单元标识（文件名等），写入所有 Span
     */
    public CompileResult compile(String source, String unitId) {
        CompilationContext context = new CompilationContext(unitId, source, typeTable, options);
        Diagnostics diagnostics = context.getDiagnostics();
        Program program = null;
        try {
            Lexer lexer = new Lexer(source, unitId, diagnostics);
            ParseResult parsed = new Parser(lexer, diagnostics).parse();
            TypedProgram typed = new TypeChecker(diagnostics, typeTable).check(parsed.getSourceFile());
            if (!hasErrors(diagnostics)) {
                program = generate(typed);
            }
        } catch (VerifyException e) {
            LOG.error("Bytecode verification failed for unit '{}': {}", unitId, e.getMessage());
            diagnostics.error(DiagnosticKind.INTERNAL_ERROR, new Span(0, 0, unitId),
                    "Internal compiler error: " + e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Compiler crashed on unit '{}'", unitId, e);
            diagnostics.error(DiagnosticKind.INTERNAL_ERROR, new Span(0, 0, unitId),
                    "Internal compiler error: " + e);
        } catch (StackOverflowError e) {
            // 解析器限制了嵌套深度，这里只兜底
            LOG.error("Compiler stack overflow on unit '{}'", unitId);
            program = null;
            diagnostics.error(DiagnosticKind.INTERNAL_ERROR, new Span(0, 0, unitId),
                    "Internal compiler error: program nesting exhausted the compiler stack");
        }

        List<Diagnostic> reported = escalate(diagnostics.getAll());
        if (program != null && containsError(reported)) {
            program = null;
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Compiled unit '{}': {} diagnostic(s), {}", unitId, reported.size(),
                    program != null ? program.getFunctions().size() + " function(s)" : "no program");
        }
        return new CompileResult(program, reported);
    }

    private Program generate(TypedProgram typed) {
        IrModule module = new IrLowering(typed).lower();
        if (options.isOptimize()) {
            module = PassPipeline.createDefault().run(module);
        }
        return new BytecodeCompiler().compile(module);
    }

    private boolean hasErrors(Diagnostics diagnostics) {
        return diagnostics.hasErrors() || (options.isWarningsAsErrors() && diagnostics.size() > 0);
    }

    private List<Diagnostic> escalate(List<Diagnostic> all) {
        if (!options.isWarningsAsErrors()) {
            return all;
        }
        List<Diagnostic> result = new ArrayList<>();
        for (Diagnostic diagnostic : all) {
            result.add(diagnostic.isError() ? diagnostic : diagnostic.withSeverity(Severity.ERROR));
        }
        return result;
    }

    private static boolean containsError(List<Diagnostic> diagnostics) {
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.isError()) {
                return true;
            }
        }
        return false;
    }
}
