package rib.runtime;

/**
 * 宿主对象句柄
 *
 * <p>语言本身不了解句柄内容，只能通过注册的字段和方法访问。
 * 相等性委托给宿主对象的 equals。</p>
 */
public final class RibExternal extends RibValue {

    private final String typeName;
    private final Object handle;

    private RibExternal(String typeName, Object handle) {
        this.typeName = typeName;
        this.handle = handle;
    }

    public static RibExternal of(String typeName, Object handle) {
        if (handle == null) {
            throw new IllegalArgumentException("External handle of type " + typeName + " must not be null");
        }
        return new RibExternal(typeName, handle);
    }

    public Object getHandle() {
        return handle;
    }

    /**
     * 以指定类型取出宿主对象
     *
     * @throws ClassCastException 句柄类型不符
     */
    public <T> T getHandle(Class<T> type) {
        return type.cast(handle);
    }

    @Override
    public String getTypeName() {
        return typeName;
    }

    @Override
    public Object toJavaValue() {
        return handle;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RibExternal)) return false;
        RibExternal other = (RibExternal) o;
        return other.typeName.equals(typeName) && other.handle.equals(handle);
    }

    @Override
    public int hashCode() {
        return typeName.hashCode() * 31 + handle.hashCode();
    }

    @Override
    public String toString() {
        return typeName + "(" + handle + ")";
    }
}
