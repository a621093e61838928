package rib.runtime.vm;

/**
 * 一次调用的故障，作为值返回给宿主。
 */
public final class Fault {

    private final FaultKind kind;
    private final String message;
    private final String function;
    private final int pc;
    private final Throwable cause;

    public Fault(FaultKind kind, String message, String function, int pc, Throwable cause) {
        this.kind = kind;
        this.message = message;
        this.function = function;
        this.pc = pc;
        this.cause = cause;
    }

    public FaultKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    /** 出错时正在执行的函数；调用开始前的故障为入口名 */
    public String getFunction() {
        return function;
    }

    /** 出错指令下标；调用开始前的故障为 -1 */
    public int getPc() {
        return pc;
    }

    /** 宿主函数抛出的异常，其他故障为 null */
    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name()).append(": ").append(message);
        if (function != null) {
            sb.append(" (in ").append(function);
            if (pc >= 0) sb.append(" at ").append(pc);
            sb.append(')');
        }
        return sb.toString();
    }
}
