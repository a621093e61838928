package rib.runtime.vm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 当前生效策略的发布点
 *
 * <p>热重载时用 {@link #publish} 原子替换。已经取得旧 {@link BoundProgram} 的调用
 * 不受影响，照常执行完毕；之后的 {@link #current()} 返回新程序。</p>
 *
 * <pre>
 * ProgramSlot slot = new ProgramSlot(vm.attach(program, bindings));
 * // 数据面线程
 * ExecutionResult result = vm.run(slot.current(), "drop_long", context);
 * // 控制面线程
 * slot.publish(vm.attach(recompiled, bindings));
 * </pre>
 */
public final class ProgramSlot {

    private static final Logger LOG = LoggerFactory.getLogger(ProgramSlot.class);

    private final AtomicReference<BoundProgram> current;

    public ProgramSlot(BoundProgram initial) {
        if (initial == null) {
            throw new IllegalArgumentException("Initial program must not be null");
        }
        this.current = new AtomicReference<>(initial);
    }

    public BoundProgram current() {
        return current.get();
    }

    /**
     * 发布新程序
     *
     * @return 被替换的旧程序
     */
    public BoundProgram publish(BoundProgram next) {
        if (next == null) {
            throw new IllegalArgumentException("Published program must not be null");
        }
        BoundProgram previous = current.getAndSet(next);
        LOG.info("Published program '{}' replacing '{}'",
                next.getProgram().getUnitId(), previous.getProgram().getUnitId());
        return previous;
    }
}
