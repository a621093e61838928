package rib.runtime.vm;

import com.riblang.ir.bytecode.Opcode;
import rib.runtime.RibAsn;
import rib.runtime.RibInt;
import rib.runtime.RibList;
import rib.runtime.RibRecord;
import rib.runtime.RibValue;

/**
 * 解释器使用的值运算。
 *
 * <p>整数运算按 64 位补码回绕；除数为 0 时 {@code /} 和 {@code %} 结果为 0。</p>
 */
final class Operations {

    private Operations() {}

    // ============ 整数 ============

    static long arithmetic(Opcode op, long a, long b) {
        switch (op) {
            case ADD: return a + b;
            case SUB: return a - b;
            case MUL: return a * b;
            case DIV: return b == 0 ? 0 : a / b;
            case MOD: return b == 0 ? 0 : a % b;
            default:
                throw new IllegalArgumentException("Not an arithmetic opcode: " + op);
        }
    }

    // ============ 比较 ============

    /**
     * 有序比较，只定义在 Int 与 Asn 上
     */
    static int compare(RibValue a, RibValue b) {
        if (a instanceof RibInt && b instanceof RibInt) {
            return Long.compare(((RibInt) a).getValue(), ((RibInt) b).getValue());
        }
        if (a instanceof RibAsn && b instanceof RibAsn) {
            return Long.compare(((RibAsn) a).getValue(), ((RibAsn) b).getValue());
        }
        throw new ClassCastException("Cannot order " + a.getTypeName() + " and " + b.getTypeName());
    }

    static boolean ordered(Opcode op, RibValue a, RibValue b) {
        int c = compare(a, b);
        switch (op) {
            case LT: return c < 0;
            case LE: return c <= 0;
            case GT: return c > 0;
            case GE: return c >= 0;
            default:
                throw new IllegalArgumentException("Not an ordering opcode: " + op);
        }
    }

    // ============ 类型符合性 ============

    /**
     * 值是否符合源码语法的类型串（如 {@code List<Community>}、{@code Route}、{@code {a: Int}}）。
     * 用于校验宿主提供的输入和宿主函数的返回值。
     */
    static boolean conforms(RibValue value, String type) {
        if (value == null) {
            return false;
        }
        if (type.startsWith("List<") && type.endsWith(">")) {
            if (!(value instanceof RibList)) {
                return false;
            }
            String element = type.substring(5, type.length() - 1);
            for (RibValue item : ((RibList) value).getItems()) {
                if (!conforms(item, element)) {
                    return false;
                }
            }
            return true;
        }
        if (type.startsWith("{")) {
            return value instanceof RibRecord;
        }
        return value.getTypeName().equals(type);
    }
}
