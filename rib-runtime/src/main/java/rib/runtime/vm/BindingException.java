package rib.runtime.vm;

/**
 * Program 的外部调用表无法绑定到宿主函数（缺少绑定）。
 */
public class BindingException extends RuntimeException {

    public BindingException(String message) {
        super(message);
    }
}
