package rib.runtime.vm;

import com.riblang.ir.bytecode.Program;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import rib.runtime.RibBool;
import rib.runtime.RibVerdict;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 热重载测试
 */
class ProgramSlotTest {

    private static final String ACCEPTING = "filter gate(route: Route) {\n"
            + "  if is_bogon(route.prefix) { reject }\n"
            + "  accept\n"
            + "}\n";

    private static final String REJECTING = "filter gate(route: Route) { reject }";

    private final VirtualMachine vm = new VirtualMachine();

    @Test
    @DisplayName("替换不影响进行中的调用")
    void testSwapWhileInFlight() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        HostBindings bindings = VirtualMachineTest.routeBindings()
                .bind("is_bogon", args -> {
                    entered.countDown();
                    assertTrue(release.await(5, TimeUnit.SECONDS));
                    return RibBool.FALSE;
                })
                .build();

        Program v1 = VirtualMachineTest.compile(ACCEPTING);
        Program v2 = VirtualMachineTest.compile(REJECTING);
        ProgramSlot slot = new ProgramSlot(vm.attach(v1, bindings));
        RuntimeContext context = VirtualMachineTest.input(new VirtualMachineTest.TestRoute("192.0.2.0/24"));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            BoundProgram inFlightProgram = slot.current();
            Future<ExecutionResult> inFlight = executor.submit(() -> vm.run(inFlightProgram, "gate", context));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            BoundProgram previous = slot.publish(vm.attach(v2, bindings));
            assertSame(inFlightProgram, previous);
            assertEquals(RibVerdict.REJECTED, vm.run(slot.current(), "gate", context).getVerdict());

            release.countDown();
            assertEquals(RibVerdict.ACCEPTED, inFlight.get(5, TimeUnit.SECONDS).getVerdict());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("不能发布 null")
    void testRejectNull() {
        ProgramSlot slot = new ProgramSlot(vm.attach(VirtualMachineTest.compile(REJECTING), HostBindings.empty()));
        assertThrows(IllegalArgumentException.class, () -> slot.publish(null));
        assertThrows(IllegalArgumentException.class, () -> new ProgramSlot(null));
    }
}
