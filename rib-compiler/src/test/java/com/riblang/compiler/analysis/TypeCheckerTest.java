package com.riblang.compiler.analysis;

import com.riblang.compiler.analysis.types.ExternalType;
import com.riblang.compiler.analysis.types.RibTypes;
import com.riblang.compiler.ast.decl.FunctionDecl;
import com.riblang.compiler.ast.expr.CallExpr;
import com.riblang.compiler.ast.expr.FieldAccessExpr;
import com.riblang.compiler.diagnostic.Diagnostic;
import com.riblang.compiler.diagnostic.DiagnosticKind;
import com.riblang.compiler.diagnostic.Diagnostics;
import com.riblang.compiler.diagnostic.Severity;
import com.riblang.compiler.host.ExternalTypeTable;
import com.riblang.compiler.lexer.Lexer;
import com.riblang.compiler.parser.ParseResult;
import com.riblang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 名称解析与类型检查测试
 */
class TypeCheckerTest {

    private static final ExternalTypeTable TABLE = ExternalTypeTable.builder()
            .enumType("Origin", "Igp", "Egp", "Incomplete")
            .type("Route")
                .field("prefix", "Prefix")
                .field("as_path", "AsPath")
                .field("communities", "List<Community>")
                .field("origin", "Origin")
                .method("has_community", "Bool", "Community")
                .done()
            .type("Peer")
                .capability(ExternalType.Capability.EQUALITY)
                .done()
            .function("is_bogon", "Bool", "Prefix")
            .build();

    private String source;
    private TypedProgram program;

    private List<Diagnostic> check(String source) {
        this.source = source;
        Diagnostics diagnostics = new Diagnostics();
        ParseResult parsed = new Parser(new Lexer(source, "<test>", diagnostics), diagnostics).parse();
        assertFalse(parsed.hasErrors(), "Parse errors: " + diagnostics.getAll());
        program = new TypeChecker(diagnostics, TABLE).check(parsed.getSourceFile());
        return diagnostics.getAll();
    }

    private void assertClean(String source) {
        List<Diagnostic> diagnostics = check(source);
        assertTrue(diagnostics.isEmpty(), "Unexpected diagnostics: " + diagnostics);
    }

    /** 断言恰好一条错误（忽略警告）并返回它 */
    private Diagnostic singleError(String source, DiagnosticKind kind) {
        List<Diagnostic> errors = new ArrayList<Diagnostic>();
        for (Diagnostic d : check(source)) {
            if (d.isError()) {
                errors.add(d);
            }
        }
        assertEquals(1, errors.size(), "Expected exactly one error: " + errors);
        assertEquals(kind, errors.get(0).getKind());
        return errors.get(0);
    }

    private List<Diagnostic> warnings(String source) {
        List<Diagnostic> result = new ArrayList<Diagnostic>();
        for (Diagnostic d : check(source)) {
            assertFalse(d.isError(), "Unexpected error: " + d);
            result.add(d);
        }
        return result;
    }

    // ============ 典型场景 ============

    @Nested
    @DisplayName("典型场景")
    class ScenarioTests {

        @Test
        @DisplayName("合法过滤器没有诊断")
        void testValidFilter() {
            assertClean("filter drop_long(route: Route) {\n"
                    + "  if route.prefix.len() > 24 { reject } else { accept }\n"
                    + "}");
        }

        @Test
        @DisplayName("未定义标识符：一条诊断，区间恰好覆盖名称")
        void testUndefinedSymbol() {
            Diagnostic d = singleError("filter f(route: Route) {\n"
                    + "  if undefined_name { reject } else { accept }\n"
                    + "}", DiagnosticKind.UNDEFINED_SYMBOL);
            assertEquals(1, check(source).size());
            assertEquals("undefined_name", d.getSpan().slice(source));
        }

        @Test
        @DisplayName("返回类型不匹配：消息同时提到期望与实际类型")
        void testReturnTypeMismatch() {
            Diagnostic d = singleError("function f() -> Bool { 42 }", DiagnosticKind.TYPE_MISMATCH);
            assertEquals("Expected 'Bool', found 'Int'", d.getMessage());
            assertEquals("42", d.getSpan().slice(source));
        }

        @Test
        @DisplayName("match 缺少变体：列出缺失的变体")
        void testNonExhaustiveMatch() {
            Diagnostic d = singleError("enum Color { Red, Green, Blue }\n"
                    + "function name(c: Color) -> String {\n"
                    + "  match c { Red => \"r\", Green => \"g\" }\n"
                    + "}", DiagnosticKind.NON_EXHAUSTIVE_MATCH);
            assertTrue(d.getMessage().contains("Blue"), d.getMessage());
            assertFalse(d.getMessage().contains("Red"), d.getMessage());
        }

        @Test
        @DisplayName("错误类型不产生级联诊断")
        void testNoCascade() {
            List<Diagnostic> diagnostics = check(
                    "function f() -> Int { let x = nope; let y = x + 1; y }");
            assertEquals(1, diagnostics.size(), diagnostics.toString());
            assertEquals(DiagnosticKind.UNDEFINED_SYMBOL, diagnostics.get(0).getKind());
        }
    }

    // ============ 名称解析 ============

    @Nested
    @DisplayName("名称解析")
    class ResolutionTests {

        @Test
        @DisplayName("重复定义带有首次定义位置的标注")
        void testDuplicateFunction() {
            Diagnostic d = singleError("function f() { }\nfunction f() { }", DiagnosticKind.DUPLICATE_DEFINITION);
            assertEquals(2, d.getLabels().size());
            assertEquals("first defined here", d.getLabels().get(1).getText());
            assertEquals(9, d.getLabels().get(1).getSpan().getStart());
        }

        @Test
        @DisplayName("与内置类型或宿主类型同名的类型声明")
        void testTypeNameClash() {
            singleError("type Int { a: Int }", DiagnosticKind.DUPLICATE_DEFINITION);
            singleError("type Route { a: Int }", DiagnosticKind.DUPLICATE_DEFINITION);
        }

        @Test
        @DisplayName("重复参数")
        void testDuplicateParameter() {
            singleError("function f(a: Int, a: Int) -> Int { a }", DiagnosticKind.DUPLICATE_DEFINITION);
        }

        @Test
        @DisplayName("类型名不能当作值使用")
        void testTypeAsValue() {
            Diagnostic d = singleError("function f() -> Int { Route }", DiagnosticKind.UNDEFINED_SYMBOL);
            assertEquals("'Route' is a type, not a value", d.getMessage());
        }

        @Test
        @DisplayName("未定义的类型")
        void testUndefinedType() {
            Diagnostic d = singleError("function f(x: Nope) { }", DiagnosticKind.UNDEFINED_TYPE);
            assertEquals("Nope", d.getSpan().slice(source));
        }

        @Test
        @DisplayName("let 遮蔽外层变量")
        void testShadowing() {
            assertClean("function f(x: Int) -> Bool { let x = x > 1; x }");
        }
    }

    // ============ 运算符 ============

    @Nested
    @DisplayName("运算符")
    class OperatorTests {

        @Test
        @DisplayName("in 运算符的合法组合")
        void testMembership() {
            assertClean("function f(route: Route, ip: IpAddr, tags: List<String>) -> Bool {\n"
                    + "  ip in route.prefix && 10.0.0.0/16 in route.prefix\n"
                    + "    && AS65000 not in route.as_path && 65000:100 in route.communities\n"
                    + "    && \"x\" in tags\n"
                    + "}");
        }

        @Test
        @DisplayName("in 运算符类型不符")
        void testMembershipMismatch() {
            Diagnostic d = singleError("function f(route: Route) -> Bool { 1 in route.prefix }",
                    DiagnosticKind.TYPE_MISMATCH);
            assertEquals("Operator 'in' is not defined for 'Int' and 'Prefix'", d.getMessage());
        }

        @Test
        @DisplayName("宿主类型默认不支持相等比较")
        void testExternalEquality() {
            Diagnostic d = singleError("function f(a: Route, b: Route) -> Bool { a == b }",
                    DiagnosticKind.TYPE_MISMATCH);
            assertEquals("Type 'Route' does not support equality", d.getMessage());
            assertClean("function f(a: Peer, b: Peer) -> Bool { a != b }");
        }

        @Test
        @DisplayName("有序比较只适用于 Int 与 Asn")
        void testOrdering() {
            assertClean("function f(a: Asn) -> Bool { a > AS100 }");
            Diagnostic d = singleError("function f() -> Bool { \"a\" < \"b\" }", DiagnosticKind.TYPE_MISMATCH);
            assertEquals("Operator '<' is not defined for 'String'", d.getMessage());
        }

        @Test
        @DisplayName("不同类型无法比较")
        void testCompareDifferentTypes() {
            Diagnostic d = singleError("function f() -> Bool { 1 == \"1\" }", DiagnosticKind.TYPE_MISMATCH);
            assertEquals("Cannot compare 'Int' with 'String'", d.getMessage());
        }

        @Test
        @DisplayName("算术运算符要求 Int")
        void testArithmeticOperand() {
            Diagnostic d = singleError("function f() -> Int { 1 + \"a\" }", DiagnosticKind.TYPE_MISMATCH);
            assertEquals("Operator '+' expects 'Int', found 'String'", d.getMessage());
        }
    }

    // ============ 记录、列表与枚举 ============

    @Nested
    @DisplayName("记录、列表与枚举")
    class CompositeTests {

        @Test
        @DisplayName("记录字面量缺少字段")
        void testMissingField() {
            Diagnostic d = singleError("type Tag { name: String, weight: Int }\n"
                    + "function f() -> Tag { Tag { name: \"x\" } }", DiagnosticKind.MISSING_FIELD);
            assertEquals("Missing field(s) weight in 'Tag'", d.getMessage());
        }

        @Test
        @DisplayName("匿名记录按期望类型检查")
        void testAnonymousRecord() {
            assertClean("type Tag { name: String, weight: Int }\n"
                    + "function f() -> Tag { { weight: 1, name: \"x\" } }");
        }

        @Test
        @DisplayName("宿主字段与方法")
        void testExternalMembers() {
            assertClean("function f(route: Route) -> Bool {\n"
                    + "  route.has_community(65000:1) || route.communities.is_empty()\n"
                    + "}");
            Diagnostic field = singleError("function f(route: Route) -> Bool { route.has_community }",
                    DiagnosticKind.UNDEFINED_FIELD);
            assertTrue(field.getMessage().contains("call it as has_community()"), field.getMessage());
            Diagnostic method = singleError("function f(route: Route) -> Prefix { route.prefix() }",
                    DiagnosticKind.UNDEFINED_METHOD);
            assertEquals("'prefix' is a field of 'Route', not a method", method.getMessage());
        }

        @Test
        @DisplayName("空列表需要类型标注")
        void testEmptyList() {
            assertClean("function f() -> Int { let xs: List<Int> = []; xs.len() }");
            singleError("function f() -> Int { let xs = []; xs.len() }", DiagnosticKind.TYPE_MISMATCH);
        }

        @Test
        @DisplayName("列表元素类型必须一致")
        void testListElements() {
            singleError("function f() -> Int { let xs = [1, \"a\"]; xs.len() }", DiagnosticKind.TYPE_MISMATCH);
        }

        @Test
        @DisplayName("枚举变体构造与负载数量")
        void testVariants() {
            String decl = "enum Action { Keep, Prepend(Int) }\n";
            assertClean(decl + "function f() -> Action { Action.Prepend(3) }");
            singleError(decl + "function f() -> Action { Action.Prepend }", DiagnosticKind.ARITY_MISMATCH);
            singleError(decl + "function f() -> Action { Action.Drop }", DiagnosticKind.UNDEFINED_VARIANT);
            singleError(decl + "function f() -> Action { Action.Prepend(\"x\") }", DiagnosticKind.TYPE_MISMATCH);
        }

        @Test
        @DisplayName("带守卫的分支不计入穷尽性")
        void testGuardedArms() {
            String decl = "enum Action { Keep, Prepend(Int) }\n";
            assertClean(decl + "function f(a: Action) -> Int {\n"
                    + "  match a { Prepend(n) if n > 3 => n, Prepend(n) => n + 1, Keep => 0 }\n"
                    + "}");
            Diagnostic d = singleError(decl + "function f(a: Action) -> Int {\n"
                    + "  match a { Prepend(n) if n > 3 => n, Keep => 0 }\n"
                    + "}", DiagnosticKind.NON_EXHAUSTIVE_MATCH);
            assertTrue(d.getMessage().endsWith("Prepend"), d.getMessage());
        }

        @Test
        @DisplayName("通配之后的分支不可达")
        void testUnreachablePattern() {
            List<Diagnostic> diagnostics = warnings("function f(o: Origin) -> Int { match o { _ => 0, Igp => 1 } }");
            assertEquals(1, diagnostics.size());
            assertEquals(DiagnosticKind.UNREACHABLE_PATTERN, diagnostics.get(0).getKind());
            assertEquals("Igp", diagnostics.get(0).getSpan().slice(source));
        }

        @Test
        @DisplayName("递归类型")
        void testRecursiveType() {
            Diagnostic d = singleError("type Node { children: List<Node> }\nfunction f(n: Node) { }",
                    DiagnosticKind.RECURSIVE_TYPE);
            assertEquals("Type 'Node' is recursive", d.getMessage());
        }
    }

    // ============ 函数调用 ============

    @Nested
    @DisplayName("函数调用")
    class CallTests {

        @Test
        @DisplayName("相互递归被拒绝")
        void testMutualRecursion() {
            Diagnostic d = singleError("function a() -> Int { b() }\nfunction b() -> Int { a() }",
                    DiagnosticKind.RECURSIVE_CALL);
            assertEquals("Recursive call cycle is not allowed: a -> b -> a", d.getMessage());
        }

        @Test
        @DisplayName("自递归被拒绝")
        void testSelfRecursion() {
            singleError("function f(n: Int) -> Int { f(n - 1) }", DiagnosticKind.RECURSIVE_CALL);
        }

        @Test
        @DisplayName("参数数量不符")
        void testArity() {
            Diagnostic d = singleError("function f() -> Bool { is_bogon() }", DiagnosticKind.ARITY_MISMATCH);
            assertEquals("Function 'is_bogon' expects 1 argument(s), found 0", d.getMessage());
        }

        @Test
        @DisplayName("filter 不能被调用")
        void testCallFilter() {
            Diagnostic d = singleError("filter a(route: Route) { accept }\n"
                    + "function f(route: Route) -> Int { a(route); 1 }", DiagnosticKind.ENTRY_POINT_CALL);
            assertEquals("Filter 'a' is an entry point and cannot be called", d.getMessage());
        }

        @Test
        @DisplayName("类型化结果记录调用与字段目标")
        void testTypedProgram() {
            assertClean("function f(route: Route) -> Bool { is_bogon(route.prefix) }");
            FunctionDecl fn = (FunctionDecl) program.getSourceFile().getDeclarations().get(0);
            CallExpr call = (CallExpr) fn.getBody().getTail();
            assertEquals(RibTypes.BOOL, program.typeOf(call));
            assertEquals(CallTarget.Kind.EXTERNAL, program.callTarget(call).getKind());
            assertEquals("is_bogon", program.callTarget(call).getExternal().getSymbol());

            FieldAccessExpr field = (FieldAccessExpr) call.getArguments().get(0);
            assertEquals(FieldTarget.Kind.EXTERNAL_FIELD, program.fieldTarget(field).getKind());
            assertEquals(RibTypes.PREFIX, program.typeOf(field));

            assertEquals(1, program.getCallables().size());
            assertSame(program.getCallables().get(0), program.callableOf(fn));
        }
    }

    // ============ 终止动作 ============

    @Nested
    @DisplayName("终止动作")
    class TerminalTests {

        @Test
        @DisplayName("filter 可能不经终止动作结束")
        void testMissingTerminal() {
            Diagnostic d = singleError("filter f(route: Route) {\n"
                    + "  if route.prefix.len() > 24 { reject }\n"
                    + "}", DiagnosticKind.MISSING_TERMINAL);
            assertEquals("f", d.getSpan().slice(source));
        }

        @Test
        @DisplayName("accept / reject 只能出现在 filter 中")
        void testTerminalOutsideFilter() {
            singleError("function f() -> Int { accept }", DiagnosticKind.INVALID_TERMINAL);
            singleError("function f() -> Int { reject }", DiagnosticKind.INVALID_TERMINAL);
            singleError("filter f(route: Route) { return }", DiagnosticKind.INVALID_TERMINAL);
        }

        @Test
        @DisplayName("filter 的 accept 不带值，filtermap 的 accept 需要输出值")
        void testAcceptValue() {
            singleError("filter f(route: Route) { accept 1 }", DiagnosticKind.INVALID_TERMINAL);
            singleError("filtermap f(route: Route) -> Int { accept }", DiagnosticKind.INVALID_TERMINAL);
            singleError("filtermap f(route: Route) -> Int { accept \"x\" }", DiagnosticKind.TYPE_MISMATCH);
            assertClean("filtermap f(route: Route) -> Int { accept route.prefix.len() }");
        }

        @Test
        @DisplayName("abort 需要 String 原因")
        void testAbort() {
            assertClean("filter f(route: Route) { if is_bogon(route.prefix) { abort \"bogon\" } accept }");
            Diagnostic d = singleError("filter f(route: Route) { abort 1 }", DiagnosticKind.TYPE_MISMATCH);
            assertEquals("Expected 'String', found 'Int'", d.getMessage());
        }

        @Test
        @DisplayName("终止动作之后的代码不可达")
        void testUnreachableCode() {
            List<Diagnostic> diagnostics = warnings("filter f(route: Route) { reject; accept }");
            assertEquals(1, diagnostics.size());
            assertEquals(DiagnosticKind.UNREACHABLE_CODE, diagnostics.get(0).getKind());
            assertEquals(Severity.WARNING, diagnostics.get(0).getSeverity());
        }
    }

    // ============ 未使用的声明 ============

    @Nested
    @DisplayName("未使用的声明")
    class UnusedTests {

        @Test
        @DisplayName("未使用的 let 与循环变量；下划线开头的名称除外")
        void testUnusedLocals() {
            List<Diagnostic> diagnostics = warnings(
                    "function f(xs: List<Int>) -> Int { let unused = 1; let _ignored = 2; for x in xs { } 3 }");
            assertEquals(2, diagnostics.size(), diagnostics.toString());
            // 循环作用域先于函数体作用域关闭
            assertEquals("Unused variable 'x'", diagnostics.get(0).getMessage());
            assertEquals("Unused variable 'unused'", diagnostics.get(1).getMessage());
        }

        @Test
        @DisplayName("未使用的模式绑定")
        void testUnusedBinding() {
            List<Diagnostic> diagnostics = warnings("enum Action { Keep, Prepend(Int) }\n"
                    + "function f(a: Action) -> Int { match a { Prepend(n) => 1, Keep => 0 } }");
            assertEquals(1, diagnostics.size());
            assertEquals("Unused binding 'n'", diagnostics.get(0).getMessage());
        }

        @Test
        @DisplayName("未使用的类型")
        void testUnusedType() {
            List<Diagnostic> diagnostics = warnings("type Tag { name: String }");
            assertEquals(1, diagnostics.size());
            assertEquals("Unused type 'Tag'", diagnostics.get(0).getMessage());
        }

        @Test
        @DisplayName("参数与函数不报告未使用")
        void testParamsNotWarned() {
            assertClean("function helper(a: Int, b: Int) -> Int { a }");
        }
    }
}
