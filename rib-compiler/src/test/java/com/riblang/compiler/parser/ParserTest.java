package com.riblang.compiler.parser;

import com.riblang.compiler.ast.SourceFile;
import com.riblang.compiler.ast.decl.EnumDecl;
import com.riblang.compiler.ast.decl.FilterDecl;
import com.riblang.compiler.ast.decl.FunctionDecl;
import com.riblang.compiler.ast.decl.RecordDecl;
import com.riblang.compiler.ast.expr.BinaryExpr;
import com.riblang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.riblang.compiler.ast.expr.BlockExpr;
import com.riblang.compiler.ast.expr.CallExpr;
import com.riblang.compiler.ast.expr.ErrorExpr;
import com.riblang.compiler.ast.expr.Expression;
import com.riblang.compiler.ast.expr.FieldAccessExpr;
import com.riblang.compiler.ast.expr.IdentifierExpr;
import com.riblang.compiler.ast.expr.IfExpr;
import com.riblang.compiler.ast.expr.ListExpr;
import com.riblang.compiler.ast.expr.MatchExpr;
import com.riblang.compiler.ast.expr.RecordExpr;
import com.riblang.compiler.ast.expr.TerminalExpr;
import com.riblang.compiler.ast.expr.UnaryExpr;
import com.riblang.compiler.ast.stmt.ExprStmt;
import com.riblang.compiler.ast.stmt.ForStmt;
import com.riblang.compiler.ast.stmt.LetStmt;
import com.riblang.compiler.diagnostic.Diagnostic;
import com.riblang.compiler.diagnostic.DiagnosticKind;
import com.riblang.compiler.diagnostic.Diagnostics;
import com.riblang.compiler.lexer.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private Diagnostics diagnostics;

    private SourceFile parse(String source) {
        diagnostics = new Diagnostics();
        return new Parser(new Lexer(source, "<test>", diagnostics), diagnostics).parse().getSourceFile();
    }

    private SourceFile parseOk(String source) {
        SourceFile file = parse(source);
        assertEquals(0, diagnostics.size(), "Unexpected diagnostics: " + diagnostics.getAll());
        return file;
    }

    /** 解析单个函数体的尾表达式 */
    private Expression tail(String expression) {
        SourceFile file = parseOk("function f() { " + expression + " }");
        return ((FunctionDecl) file.getDeclarations().get(0)).getBody().getTail();
    }

    // ============ 声明 ============

    @Nested
    @DisplayName("声明")
    class DeclarationTests {

        @Test
        @DisplayName("四种顶层声明")
        void testAllDeclarations() {
            SourceFile file = parseOk(
                    "type Tag { name: String, weight: Int, }\n"
                    + "enum Action { Keep, Prepend(Int), Tagged(String, Int) }\n"
                    + "function double(x: Int) -> Int { x * 2 }\n"
                    + "filter keep(route: Route) { accept }\n"
                    + "filtermap relabel(route: Route) -> Tag { accept Tag { name: \"x\", weight: 1 } }\n");
            assertEquals(5, file.getDeclarations().size());

            RecordDecl tag = (RecordDecl) file.getDeclarations().get(0);
            assertEquals(2, tag.getFields().size());

            EnumDecl action = (EnumDecl) file.getDeclarations().get(1);
            assertEquals(3, action.getVariants().size());
            assertEquals(2, action.getVariants().get(2).getPayload().size());

            FunctionDecl fn = (FunctionDecl) file.getDeclarations().get(2);
            assertEquals("Int", fn.getReturnType().getName());

            FilterDecl keep = (FilterDecl) file.getDeclarations().get(3);
            assertEquals(FilterDecl.Kind.FILTER, keep.getKind());
            assertNull(keep.getOutputType());

            FilterDecl relabel = (FilterDecl) file.getDeclarations().get(4);
            assertEquals(FilterDecl.Kind.FILTER_MAP, relabel.getKind());
            assertEquals("Tag", relabel.getOutputType().getName());
        }

        @Test
        @DisplayName("泛型类型引用")
        void testGenericType() {
            SourceFile file = parseOk("function f(xs: List<List<Int>>) { }");
            FunctionDecl fn = (FunctionDecl) file.getDeclarations().get(0);
            assertEquals("List", fn.getParams().get(0).getType().getName());
            assertEquals("List", fn.getParams().get(0).getType().getTypeArgs().get(0).getName());
        }

        @Test
        @DisplayName("声明名称区间")
        void testNameSpan() {
            String source = "function check() { }";
            SourceFile file = parseOk(source);
            assertEquals("check", file.getDeclarations().get(0).getNameSpan().slice(source));
            assertEquals(source, file.getDeclarations().get(0).getSpan().slice(source));
        }
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testArithmeticPrecedence() {
            BinaryExpr add = (BinaryExpr) tail("1 + 2 * 3");
            assertEquals(BinaryOp.ADD, add.getOperator());
            assertEquals(BinaryOp.MUL, ((BinaryExpr) add.getRight()).getOperator());
        }

        @Test
        @DisplayName("&& 优先于 ||，比较优先于 &&")
        void testLogicalPrecedence() {
            BinaryExpr or = (BinaryExpr) tail("a || b && c == d");
            assertEquals(BinaryOp.OR, or.getOperator());
            BinaryExpr and = (BinaryExpr) or.getRight();
            assertEquals(BinaryOp.AND, and.getOperator());
            assertEquals(BinaryOp.EQ, ((BinaryExpr) and.getRight()).getOperator());
        }

        @Test
        @DisplayName("一元运算优先于乘法")
        void testUnary() {
            BinaryExpr mul = (BinaryExpr) tail("-a * b");
            assertTrue(mul.getLeft() instanceof UnaryExpr);
            assertTrue(tail("!x") instanceof UnaryExpr);
        }

        @Test
        @DisplayName("in 与 not in")
        void testMembership() {
            assertEquals(BinaryOp.IN, ((BinaryExpr) tail("AS1 in path")).getOperator());
            BinaryExpr and = (BinaryExpr) tail("a not in b && c");
            assertEquals(BinaryOp.AND, and.getOperator());
            assertEquals(BinaryOp.NOT_IN, ((BinaryExpr) and.getLeft()).getOperator());
        }

        @Test
        @DisplayName("方法调用链")
        void testMethodChain() {
            CallExpr call = (CallExpr) tail("route.prefix.len()");
            FieldAccessExpr callee = (FieldAccessExpr) call.getCallee();
            assertEquals("len", callee.getName());
            assertEquals("prefix", ((FieldAccessExpr) callee.getTarget()).getName());
            assertTrue(call.getArguments().isEmpty());
        }

        @Test
        @DisplayName("具名与匿名记录字面量")
        void testRecordLiterals() {
            RecordExpr named = (RecordExpr) tail("Tag { name: \"a\", weight: 2 }");
            assertEquals("Tag", named.getTypeName());
            assertEquals(2, named.getFields().size());
            RecordExpr anonymous = (RecordExpr) tail("{ n: 1 }");
            assertNull(anonymous.getTypeName());
        }

        @Test
        @DisplayName("if 头部不解析记录字面量")
        void testNoRecordInIfHead() {
            IfExpr ifExpr = (IfExpr) tail("if ok { 1 } else if other { 2 } else { 3 }");
            assertTrue(ifExpr.getCondition() instanceof IdentifierExpr);
            assertTrue(ifExpr.getElseBranch() instanceof IfExpr);
        }

        @Test
        @DisplayName("match 分支：绑定、守卫与块体")
        void testMatchArms() {
            MatchExpr match = (MatchExpr) tail(
                    "match action { Prepend(n) if n > 3 => { n }, Prepend(n) => n, _ => 0 }");
            assertEquals(3, match.getArms().size());
            MatchExpr.Arm first = match.getArms().get(0);
            assertEquals("Prepend", first.getVariant());
            assertEquals(1, first.getBindings().size());
            assertNotNull(first.getGuard());
            assertTrue(first.getBody() instanceof BlockExpr);
            assertTrue(match.getArms().get(2).isWildcard());
        }

        @Test
        @DisplayName("终止表达式")
        void testTerminals() {
            TerminalExpr accept = (TerminalExpr) tail("accept");
            assertEquals(TerminalExpr.Kind.ACCEPT, accept.getKind());
            assertNull(accept.getValue());
            TerminalExpr abort = (TerminalExpr) tail("abort \"bad route\"");
            assertEquals(TerminalExpr.Kind.ABORT, abort.getKind());
            assertNotNull(abort.getValue());
        }
    }

    // ============ 语句 ============

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("let、for、表达式语句与尾表达式")
        void testStatements() {
            SourceFile file = parseOk("function f(xs: List<Int>) -> Int {\n"
                    + "  let total: Int = 0;\n"
                    + "  for x in xs { total + x; }\n"
                    + "  if total > 1 { abort \"big\" }\n"
                    + "  total\n"
                    + "}");
            BlockExpr body = ((FunctionDecl) file.getDeclarations().get(0)).getBody();
            assertEquals(3, body.getStatements().size());
            assertTrue(body.getStatements().get(0) instanceof LetStmt);
            assertTrue(body.getStatements().get(1) instanceof ForStmt);
            assertTrue(body.getStatements().get(2) instanceof ExprStmt);
            assertTrue(body.getTail() instanceof IdentifierExpr);
        }
    }

    // ============ 错误恢复 ============

    @Nested
    @DisplayName("错误恢复")
    class RecoveryTests {

        @Test
        @DisplayName("同一函数内多个语句错误都被报告")
        void testStatementRecovery() {
            SourceFile file = parse("function f() {\n"
                    + "  let a = ;\n"
                    + "  let b = 1;\n"
                    + "  let = 2;\n"
                    + "  b\n"
                    + "}\n");
            assertEquals(2, diagnostics.getErrorCount());
            for (Diagnostic d : diagnostics.getAll()) {
                assertEquals(DiagnosticKind.UNEXPECTED_TOKEN, d.getKind());
            }
            BlockExpr body = ((FunctionDecl) file.getDeclarations().get(0)).getBody();
            assertEquals(1, body.getStatements().size());
            assertNotNull(body.getTail());
        }

        @Test
        @DisplayName("声明级恢复后继续解析后续声明")
        void testDeclarationRecovery() {
            SourceFile file = parse("function (x: Int) { x }\n"
                    + "function g() -> Int { 1 }\n"
                    + "garbage here\n"
                    + "filter ok(route: Route) { accept }\n");
            assertEquals(2, diagnostics.getErrorCount());
            assertEquals(2, file.getDeclarations().size());
            assertEquals("g", file.getDeclarations().get(0).getName());
            assertEquals("ok", file.getDeclarations().get(1).getName());
        }

        @Test
        @DisplayName("缺少右花括号时不吞掉下一个声明")
        void testMissingBrace() {
            SourceFile file = parse("function f() { let x = 1;\n"
                    + "function g() -> Int { 2 }\n");
            assertTrue(diagnostics.hasErrors());
            assertTrue(file.getDeclarations().stream().anyMatch(d -> d.getName().equals("g")));
        }

        @Test
        @DisplayName("错误信息列出期望的 token")
        void testMessage() {
            parse("function (");
            Diagnostic first = diagnostics.getAll().get(0);
            assertEquals("Expected identifier, found '('", first.getMessage());
            assertEquals(9, first.getSpan().getStart());
        }

        @Test
        @DisplayName("普通 filter 不允许输出类型")
        void testFilterOutputRejected() {
            parse("filter f(route: Route) -> Int { accept }");
            assertEquals(1, diagnostics.getErrorCount());
        }

        @Test
        @DisplayName("词法错误 token 成为占位表达式，不再追加语法诊断")
        void testErrorTokenAsExpression() {
            SourceFile file = parse("function f() { [1, 0xFFFFFFFFFFFFFFFF, 3] }");
            assertEquals(1, diagnostics.size());
            assertEquals(DiagnosticKind.INVALID_LITERAL, diagnostics.getAll().get(0).getKind());
            BlockExpr body = ((FunctionDecl) file.getDeclarations().get(0)).getBody();
            assertFalse(body.isRecovered());
            ListExpr list = (ListExpr) body.getTail();
            assertEquals(3, list.getElements().size());
            assertTrue(list.getElements().get(1) instanceof ErrorExpr);
        }

        @Test
        @DisplayName("语句出错的块被标记为已恢复")
        void testRecoveredBlock() {
            SourceFile file = parse("function f() { if true { let a = ; } else { 1 }; 2 }");
            assertEquals(1, diagnostics.size());
            BlockExpr body = ((FunctionDecl) file.getDeclarations().get(0)).getBody();
            assertFalse(body.isRecovered());
            IfExpr branch = (IfExpr) ((ExprStmt) body.getStatements().get(0)).getExpression();
            assertTrue(branch.getThenBranch().isRecovered());
            assertFalse(((BlockExpr) branch.getElseBranch()).isRecovered());
        }

        @Test
        @DisplayName("match 分支出错时跳到下一个分支")
        void testMatchArmRecovery() {
            SourceFile file = parse("function f() { match e { A => , B(x) => x, C => { 1 } } }");
            assertEquals(1, diagnostics.size());
            assertEquals("Expected expression, found ','", diagnostics.getAll().get(0).getMessage());
            MatchExpr match = (MatchExpr) ((FunctionDecl) file.getDeclarations().get(0)).getBody().getTail();
            assertTrue(match.isRecovered());
            assertEquals(2, match.getArms().size());
            assertEquals("B", match.getArms().get(0).getVariant());
        }

        @Test
        @DisplayName("类型引用嵌套过深")
        void testDeepTypeReference() {
            StringBuilder sb = new StringBuilder("function f(x: ");
            for (int i = 0; i < 1000; i++) sb.append("List<");
            sb.append("Int");
            for (int i = 0; i < 1000; i++) sb.append('>');
            sb.append(") -> Int { 1 }\nfunction g() -> Int { 2 }");
            SourceFile file = parse(sb.toString());
            assertEquals(1, diagnostics.size());
            assertEquals(DiagnosticKind.NESTING_TOO_DEEP, diagnostics.getAll().get(0).getKind());
            assertEquals(1, file.getDeclarations().size());
            assertEquals("g", file.getDeclarations().get(0).getName());
        }
    }
}
