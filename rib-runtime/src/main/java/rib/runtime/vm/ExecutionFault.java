package rib.runtime.vm;

/**
 * 解释循环内部用于中止调用的异常，在 {@link VirtualMachine#run} 边界转换为 {@link Fault}。
 */
final class ExecutionFault extends RuntimeException {

    private final FaultKind kind;

    ExecutionFault(FaultKind kind, String message) {
        this(kind, message, null);
    }

    ExecutionFault(FaultKind kind, String message, Throwable cause) {
        super(message, cause, false, false);
        this.kind = kind;
    }

    FaultKind getKind() {
        return kind;
    }
}
