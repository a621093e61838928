package rib.runtime.vm;

import rib.runtime.RibValue;
import rib.runtime.RibVerdict;

import java.util.Collections;
import java.util.Map;

/**
 * 一次调用的结果：一个值（filter 为 {@link RibVerdict}）或一个故障。
 */
public final class ExecutionResult {

    private final RibValue value;
    private final Fault fault;
    private final long instructionCount;
    private final Map<String, Integer> observedMaxStacks;

    private ExecutionResult(RibValue value, Fault fault, long instructionCount,
                            Map<String, Integer> observedMaxStacks) {
        this.value = value;
        this.fault = fault;
        this.instructionCount = instructionCount;
        this.observedMaxStacks = Collections.unmodifiableMap(observedMaxStacks);
    }

    static ExecutionResult success(RibValue value, long instructionCount, Map<String, Integer> observedMaxStacks) {
        return new ExecutionResult(value, null, instructionCount, observedMaxStacks);
    }

    static ExecutionResult failure(Fault fault, long instructionCount, Map<String, Integer> observedMaxStacks) {
        return new ExecutionResult(null, fault, instructionCount, observedMaxStacks);
    }

    public boolean isSuccess() {
        return fault == null;
    }

    /**
     * @throws IllegalStateException 调用以故障结束
     */
    public RibValue getValue() {
        if (fault != null) {
            throw new IllegalStateException("Invocation faulted: " + fault);
        }
        return value;
    }

    /**
     * filter / filtermap 的判定结果。
     *
     * @throws IllegalStateException 调用以故障结束或入口不是 filter
     */
    public RibVerdict getVerdict() {
        RibValue result = getValue();
        if (!(result instanceof RibVerdict)) {
            throw new IllegalStateException("Result " + result + " is not a verdict");
        }
        return (RibVerdict) result;
    }

    public Fault getFault() {
        return fault;
    }

    /** 本次调用执行的指令数 */
    public long getInstructionCount() {
        return instructionCount;
    }

    /** 各函数在本次调用中实际达到的最大操作数栈深度；未执行的函数不在其中 */
    public Map<String, Integer> getObservedMaxStacks() {
        return observedMaxStacks;
    }

    @Override
    public String toString() {
        return fault != null ? "Fault[" + fault + "]" : "Value[" + value + "]";
    }
}
