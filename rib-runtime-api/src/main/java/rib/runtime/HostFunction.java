package rib.runtime;

import java.util.List;

/**
 * 宿主提供的外部函数
 *
 * <p>必须同步返回且开销有界。抛出的任何异常都会被虚拟机转换为
 * ExternalCallError 故障，不会传播到调用方。</p>
 */
@FunctionalInterface
public interface HostFunction {

    /**
     * @param args 参数（字段访问和方法调用时，第一个参数为接收者）
     * @return 非 null 的结果值
     */
    RibValue call(List<RibValue> args) throws Exception;
}
