package rib.runtime.vm;

import com.riblang.compiler.host.ExternalTypeTable;
import com.riblang.ir.CompileResult;
import com.riblang.ir.RibCompiler;
import com.riblang.ir.bytecode.Program;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import rib.runtime.HostFunction;
import rib.runtime.RibAsPath;
import rib.runtime.RibBool;
import rib.runtime.RibCommunity;
import rib.runtime.RibExternal;
import rib.runtime.RibInt;
import rib.runtime.RibList;
import rib.runtime.RibPrefix;
import rib.runtime.RibRecord;
import rib.runtime.RibValue;
import rib.runtime.RibVerdict;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 虚拟机测试：编译真实源码后执行
 */
class VirtualMachineTest {

    /** 测试用的宿主路由对象 */
    static final class TestRoute {
        final RibPrefix prefix;
        final RibAsPath asPath;
        final List<RibCommunity> communities;

        TestRoute(String prefix, long... hops) {
            this(prefix, Arrays.<RibCommunity>asList(), hops);
        }

        TestRoute(String prefix, List<RibCommunity> communities, long... hops) {
            this.prefix = RibPrefix.parse(prefix);
            this.asPath = RibAsPath.of(hops);
            this.communities = communities;
        }
    }

    static final ExternalTypeTable TABLE = ExternalTypeTable.builder()
            .type("Route")
                .field("prefix", "Prefix")
                .field("as_path", "AsPath")
                .field("communities", "List<Community>")
                .method("has_community", "Bool", "Community")
                .done()
            .function("is_bogon", "Bool", "Prefix")
            .build();

    static final String SCENARIO_A = "filter drop_long(route: Route) {\n"
            + "  if route.prefix.len() > 24 { reject }\n"
            + "  accept\n"
            + "}\n";

    static final String POLICY = "enum Decision { Keep, Drop, Tag(Int) }\n"
            + "type Summary { hops: Int, tagged: Bool }\n"
            + "function classify(route: Route) -> Decision {\n"
            + "  if is_bogon(route.prefix) { Decision.Drop }\n"
            + "  else if route.as_path.len() > 10 { Decision.Tag(route.as_path.len()) }\n"
            + "  else { Decision.Keep }\n"
            + "}\n"
            + "filtermap summarize(route: Route) -> Summary {\n"
            + "  let tagged = route.has_community(65000:100) || route.has_community(65000:200);\n"
            + "  for asn in route.as_path { if asn == AS23456 { reject } }\n"
            + "  match classify(route) {\n"
            + "    Drop => reject,\n"
            + "    Tag(n) => accept Summary { hops: n, tagged: tagged },\n"
            + "    Keep => accept Summary { hops: route.as_path.len(), tagged: tagged }\n"
            + "  }\n"
            + "}\n";

    static Program compile(String source) {
        CompileResult result = new RibCompiler(TABLE).compile(source, "<test>");
        assertTrue(result.isSuccess(), "Compile failed: " + result.getDiagnostics());
        return result.getProgram().get();
    }

    static TestRoute route(RibValue value) {
        return ((RibExternal) value).getHandle(TestRoute.class);
    }

    static HostBindings.Builder routeBindings() {
        return HostBindings.builder()
                .bind("Route.prefix", args -> route(args.get(0)).prefix)
                .bind("Route.as_path", args -> route(args.get(0)).asPath)
                .bind("Route.communities", args -> RibList.of(route(args.get(0)).communities))
                .bind("Route.has_community", args -> RibBool.of(route(args.get(0)).communities.contains(args.get(1))))
                .bind("is_bogon", args -> RibBool.of(RibPrefix.parse("10.0.0.0/8").covers((RibPrefix) args.get(0))));
    }

    static RuntimeContext input(TestRoute route) {
        return RuntimeContext.builder().input("route", RibExternal.of("Route", route)).build();
    }

    static RuntimeContext ints(Object... namesAndValues) {
        RuntimeContext.Builder builder = RuntimeContext.builder();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            builder.input((String) namesAndValues[i], RibInt.of((Long) namesAndValues[i + 1]));
        }
        return builder.build();
    }

    private final VirtualMachine vm = new VirtualMachine();

    private BoundProgram attach(String source) {
        return vm.attach(compile(source), routeBindings().build());
    }

    // ============ 场景 ============

    @Nested
    @DisplayName("场景 A")
    class ScenarioATests {

        @Test
        @DisplayName("前缀长度 26 被拒绝")
        void testLongPrefixRejected() {
            ExecutionResult result = vm.run(attach(SCENARIO_A), "drop_long", input(new TestRoute("192.0.2.0/26")));
            assertTrue(result.isSuccess(), String.valueOf(result.getFault()));
            assertEquals(RibVerdict.REJECTED, result.getVerdict());
        }

        @Test
        @DisplayName("前缀长度 20 被接受")
        void testShortPrefixAccepted() {
            ExecutionResult result = vm.run(attach(SCENARIO_A), "drop_long", input(new TestRoute("198.16.0.0/20")));
            assertEquals(RibVerdict.ACCEPTED, result.getVerdict());
            assertTrue(result.getInstructionCount() > 0);
        }

        @Test
        @DisplayName("同一 Program 可绑定不同的宿主实现")
        void testRebindWithTestDouble() {
            Program program = compile(SCENARIO_A);
            BoundProgram fake = vm.attach(program, HostBindings.builder()
                    .bind("Route.prefix", args -> RibPrefix.parse("203.0.113.0/32"))
                    .build());
            ExecutionResult result = vm.run(fake, "drop_long", input(new TestRoute("198.16.0.0/20")));
            assertEquals(RibVerdict.REJECTED, result.getVerdict());
        }
    }

    // ============ filtermap / match / for ============

    @Nested
    @DisplayName("filtermap")
    class FilterMapTests {

        @Test
        @DisplayName("Keep 分支输出 Summary 记录")
        void testKeepOutputsSummary() {
            TestRoute route = new TestRoute("192.0.2.0/24",
                    Arrays.asList(RibCommunity.of(65000, 200)), 65001, 65002, 65003);
            RibVerdict verdict = vm.run(attach(POLICY), "summarize", input(route)).getVerdict();
            assertTrue(verdict.isAccepted());
            RibRecord summary = (RibRecord) verdict.getOutput();
            assertEquals("Summary", summary.getTypeName());
            assertEquals(RibInt.of(3), summary.get("hops"));
            assertEquals(RibBool.TRUE, summary.get("tagged"));
        }

        @Test
        @DisplayName("Tag 分支取出变体负载")
        void testTagPayload() {
            TestRoute route = new TestRoute("192.0.2.0/24", 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12);
            RibRecord summary = (RibRecord) vm.run(attach(POLICY), "summarize", input(route))
                    .getVerdict().getOutput();
            assertEquals(RibInt.of(12), summary.get("hops"));
            assertEquals(RibBool.FALSE, summary.get("tagged"));
        }

        @Test
        @DisplayName("for 循环命中 AS23456 时拒绝")
        void testLoopReject() {
            TestRoute route = new TestRoute("192.0.2.0/24", 65001, 23456, 65003);
            assertEquals(RibVerdict.REJECTED, vm.run(attach(POLICY), "summarize", input(route)).getVerdict());
        }

        @Test
        @DisplayName("Drop 分支拒绝")
        void testDropReject() {
            TestRoute route = new TestRoute("10.1.0.0/16", 65001);
            assertEquals(RibVerdict.REJECTED, vm.run(attach(POLICY), "summarize", input(route)).getVerdict());
        }

        @Test
        @DisplayName("可以直接调用普通函数")
        void testRunPlainFunction() {
            RibValue decision = vm.run(attach(POLICY), "classify", input(new TestRoute("10.0.0.0/24")))
                    .getValue();
            assertEquals("Decision.Drop", decision.toString());
        }
    }

    // ============ 运算语义 ============

    @Nested
    @DisplayName("整数运算")
    class ArithmeticTests {

        private static final String SOURCE = "function div(a: Int, b: Int) -> Int { a / b }\n"
                + "function rem(a: Int, b: Int) -> Int { a % b }\n"
                + "function add(a: Int, b: Int) -> Int { a + b }\n"
                + "function neg(a: Int) -> Int { -a }\n";

        @Test
        @DisplayName("除以 0 得 0")
        void testDivisionByZero() {
            BoundProgram bound = attach(SOURCE);
            assertEquals(RibInt.ZERO, vm.run(bound, "div", ints("a", 7L, "b", 0L)).getValue());
            assertEquals(RibInt.ZERO, vm.run(bound, "rem", ints("a", 7L, "b", 0L)).getValue());
            assertEquals(RibInt.of(-3), vm.run(bound, "div", ints("a", -7L, "b", 2L)).getValue());
        }

        @Test
        @DisplayName("溢出按补码回绕")
        void testWrapping() {
            BoundProgram bound = attach(SOURCE);
            assertEquals(RibInt.of(Long.MIN_VALUE),
                    vm.run(bound, "add", ints("a", Long.MAX_VALUE, "b", 1L)).getValue());
            assertEquals(RibInt.of(Long.MIN_VALUE), vm.run(bound, "neg", ints("a", Long.MIN_VALUE)).getValue());
            assertEquals(RibInt.of(Long.MIN_VALUE),
                    vm.run(bound, "div", ints("a", Long.MIN_VALUE, "b", -1L)).getValue());
        }
    }

    // ============ 栈深度 ============

    @Nested
    @DisplayName("栈深度")
    class StackDepthTests {

        @Test
        @DisplayName("直线代码实际最大深度等于静态最大深度")
        void testObservedEqualsStatic() {
            Program program = compile("function f(a: Int, b: Int, c: Int) -> Int { a * (b + c) }");
            ExecutionResult result = vm.run(vm.attach(program, HostBindings.empty()), "f",
                    ints("a", 2L, "b", 3L, "c", 4L));
            assertEquals(RibInt.of(14), result.getValue());
            assertEquals(Integer.valueOf(program.findFunction("f").getMaxStack()),
                    result.getObservedMaxStacks().get("f"));
        }

        @Test
        @DisplayName("任何执行路径都不超过静态最大深度")
        void testObservedBoundedByStatic() {
            Program program = compile(POLICY);
            BoundProgram bound = vm.attach(program, routeBindings().build());
            TestRoute[] routes = {
                    new TestRoute("10.0.0.0/24", 1),
                    new TestRoute("192.0.2.0/24", 1, 23456),
                    new TestRoute("192.0.2.0/24", 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11),
                    new TestRoute("192.0.2.0/24", 1, 2)
            };
            for (TestRoute route : routes) {
                ExecutionResult result = vm.run(bound, "summarize", input(route));
                assertTrue(result.isSuccess());
                for (Map.Entry<String, Integer> e : result.getObservedMaxStacks().entrySet()) {
                    assertThat(e.getValue()).isLessThanOrEqualTo(program.findFunction(e.getKey()).getMaxStack());
                }
            }
        }
    }

    // ============ 故障 ============

    @Nested
    @DisplayName("故障")
    class FaultTests {

        @Test
        @DisplayName("abort 产生 USER_TERMINATION 并携带消息")
        void testAbort() {
            BoundProgram bound = attach("filter f(route: Route) {\n"
                    + "  if route.prefix.len() > 30 { abort \"too specific\" }\n"
                    + "  accept\n"
                    + "}");
            ExecutionResult result = vm.run(bound, "f", input(new TestRoute("192.0.2.1/32")));
            assertFalse(result.isSuccess());
            assertEquals(FaultKind.USER_TERMINATION, result.getFault().getKind());
            assertEquals("too specific", result.getFault().getMessage());
            assertEquals("f", result.getFault().getFunction());
            assertThrows(IllegalStateException.class, result::getValue);
        }

        @Test
        @DisplayName("指令预算耗尽")
        void testBudgetExhausted() {
            Program program = compile("function f(xs: List<Int>) -> Int {\n"
                    + "  for x in xs { for y in xs { let _z = x * y; } }\n"
                    + "  0\n"
                    + "}");
            List<RibValue> items = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                items.add(RibInt.of(i));
            }
            RuntimeContext context = RuntimeContext.builder().input("xs", RibList.of(items)).build();

            VirtualMachine small = new VirtualMachine(ExecutionPolicy.custom().maxInstructions(1000).build());
            ExecutionResult result = small.run(small.attach(program, HostBindings.empty()), "f", context);
            assertEquals(FaultKind.RESOURCE_EXHAUSTED, result.getFault().getKind());
            assertEquals(1001, result.getInstructionCount());

            ExecutionResult full = vm.run(vm.attach(program, HostBindings.empty()), "f", context);
            assertEquals(RibInt.ZERO, full.getValue());
        }

        @Test
        @DisplayName("调用深度超限")
        void testCallDepth() {
            Program program = compile("function a(x: Int) -> Int { b(x) + 1 }\n"
                    + "function b(x: Int) -> Int { c(x) + 1 }\n"
                    + "function c(x: Int) -> Int { x }\n");
            VirtualMachine shallow = new VirtualMachine(ExecutionPolicy.custom().maxCallDepth(2).build());
            ExecutionResult result = shallow.run(shallow.attach(program, HostBindings.empty()), "a", ints("x", 1L));
            assertEquals(FaultKind.RESOURCE_EXHAUSTED, result.getFault().getKind());

            assertEquals(RibInt.of(3), vm.run(vm.attach(program, HostBindings.empty()), "a", ints("x", 1L)).getValue());
        }

        @Test
        @DisplayName("宿主函数抛出异常")
        void testHostThrows() {
            final IllegalStateException failure = new IllegalStateException("rib unavailable");
            BoundProgram bound = vm.attach(compile(SCENARIO_A), HostBindings.builder()
                    .bind("Route.prefix", args -> { throw failure; })
                    .build());
            Fault fault = vm.run(bound, "drop_long", input(new TestRoute("192.0.2.0/24"))).getFault();
            assertEquals(FaultKind.EXTERNAL_CALL_ERROR, fault.getKind());
            assertSame(failure, fault.getCause());
            assertThat(fault.getMessage()).contains("Route.prefix");
        }

        @Test
        @DisplayName("宿主函数抛出 Error 不越过虚拟机边界")
        void testHostThrowsError() {
            final AssertionError failure = new AssertionError("broken table");
            BoundProgram bound = vm.attach(compile(SCENARIO_A), HostBindings.builder()
                    .bind("Route.prefix", args -> { throw failure; })
                    .build());
            ExecutionResult result = vm.run(bound, "drop_long", input(new TestRoute("192.0.2.0/24")));
            assertFalse(result.isSuccess());
            assertEquals(FaultKind.EXTERNAL_CALL_ERROR, result.getFault().getKind());
            assertSame(failure, result.getFault().getCause());
        }

        @Test
        @DisplayName("宿主函数返回 null 或错误类型")
        void testHostBadResult() {
            Program program = compile(SCENARIO_A);
            HostFunction nothing = args -> null;
            HostFunction wrongType = args -> RibInt.of(24);
            for (HostFunction fn : Arrays.asList(nothing, wrongType)) {
                BoundProgram bound = vm.attach(program, HostBindings.builder().bind("Route.prefix", fn).build());
                ExecutionResult result = vm.run(bound, "drop_long", input(new TestRoute("192.0.2.0/24")));
                assertEquals(FaultKind.EXTERNAL_CALL_ERROR, result.getFault().getKind());
            }
        }

        @Test
        @DisplayName("未知入口、缺少输入和类型不符的输入")
        void testHostMisuse() {
            BoundProgram bound = attach(SCENARIO_A);
            Fault unknown = vm.run(bound, "missing", RuntimeContext.empty()).getFault();
            assertEquals(FaultKind.INVALID_STATE, unknown.getKind());
            assertEquals(-1, unknown.getPc());

            assertEquals(FaultKind.INVALID_STATE,
                    vm.run(bound, "drop_long", RuntimeContext.empty()).getFault().getKind());
            assertEquals(FaultKind.INVALID_STATE,
                    vm.run(bound, "drop_long", ints("route", 1L)).getFault().getKind());
        }

        @Test
        @DisplayName("缺少宿主绑定时 attach 失败")
        void testMissingBinding() {
            Program program = compile(POLICY);
            BindingException e = assertThrows(BindingException.class,
                    () -> vm.attach(program, HostBindings.builder()
                            .bind("Route.prefix", args -> RibPrefix.parse("192.0.2.0/24"))
                            .build()));
            assertThat(e.getMessage()).contains("No host binding").contains("<test>");
        }

        @Test
        @DisplayName("合法程序在合法输入下不会出现 INVALID_STATE")
        void testNoInvalidStateForWellTypedPrograms() {
            BoundProgram bound = attach(POLICY);
            for (int hops = 0; hops < 15; hops++) {
                long[] path = new long[hops];
                for (int i = 0; i < hops; i++) {
                    path[i] = 64512 + i;
                }
                for (String prefix : Arrays.asList("10.0.0.0/24", "192.0.2.0/24", "2001:db8::/32")) {
                    ExecutionResult result = vm.run(bound, "summarize", input(new TestRoute(prefix, path)));
                    assertTrue(result.isSuccess(), String.valueOf(result.getFault()));
                }
            }
        }
    }
}
