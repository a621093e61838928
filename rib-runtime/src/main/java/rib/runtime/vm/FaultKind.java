package rib.runtime.vm;

/**
 * 虚拟机故障种类
 */
public enum FaultKind {
    /** 程序执行了 abort */
    USER_TERMINATION,
    /** 指令预算、栈深度或调用深度耗尽 */
    RESOURCE_EXHAUSTED,
    /** 宿主函数抛出异常、返回 null 或返回了声明类型以外的值 */
    EXTERNAL_CALL_ERROR,
    /** 宿主误用（未知入口、缺少或类型不符的输入）或校验器缺陷 */
    INVALID_STATE
}
