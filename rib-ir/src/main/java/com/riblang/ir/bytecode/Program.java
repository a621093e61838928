package com.riblang.ir.bytecode;

import com.riblang.ir.ir.RecordShape;
import com.riblang.ir.ir.VariantShape;
import rib.runtime.RibAsn;
import rib.runtime.RibBool;
import rib.runtime.RibBytes;
import rib.runtime.RibCommunity;
import rib.runtime.RibInt;
import rib.runtime.RibIpAddr;
import rib.runtime.RibPrefix;
import rib.runtime.RibString;
import rib.runtime.RibUnit;
import rib.runtime.RibValue;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 编译产物：常量池、记录/变体布局表、外部调用表和函数。
 *
 * <p>不可变，可在任意多个并发的虚拟机调用之间共享。重新编译时整体替换，不做修改。</p>
 */
public final class Program {

    static final byte[] MAGIC = {'R', 'I', 'B', 'P'};
    static final int FORMAT_VERSION = 1;

    // 常量标记
    private static final int TAG_UNIT = 0;
    private static final int TAG_BOOL = 1;
    private static final int TAG_INT = 2;
    private static final int TAG_STRING = 3;
    private static final int TAG_BYTES = 4;
    private static final int TAG_IP = 5;
    private static final int TAG_PREFIX = 6;
    private static final int TAG_ASN = 7;
    private static final int TAG_COMMUNITY = 8;

    private final String unitId;
    private final List<RibValue> constants;
    private final List<RecordShape> recordShapes;
    private final List<VariantShape> variantShapes;
    private final List<ExternalCallEntry> externals;
    private final List<CompiledFunction> functions;

    Program(String unitId, List<RibValue> constants, List<RecordShape> recordShapes,
            List<VariantShape> variantShapes, List<ExternalCallEntry> externals,
            List<CompiledFunction> functions) {
        this.unitId = unitId;
        this.constants = Collections.unmodifiableList(new ArrayList<>(constants));
        this.recordShapes = Collections.unmodifiableList(new ArrayList<>(recordShapes));
        this.variantShapes = Collections.unmodifiableList(new ArrayList<>(variantShapes));
        this.externals = Collections.unmodifiableList(new ArrayList<>(externals));
        this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
    }

    public String getUnitId() { return unitId; }
    public List<RibValue> getConstants() { return constants; }
    public List<RecordShape> getRecordShapes() { return recordShapes; }
    public List<VariantShape> getVariantShapes() { return variantShapes; }
    public List<ExternalCallEntry> getExternals() { return externals; }
    public List<CompiledFunction> getFunctions() { return functions; }

    public RibValue getConstant(int index) {
        return constants.get(index);
    }

    public CompiledFunction getFunction(int index) {
        return functions.get(index);
    }

    /** 按名称查找函数，找不到时返回 null */
    public CompiledFunction findFunction(String name) {
        int index = indexOf(name);
        return index >= 0 ? functions.get(index) : null;
    }

    public int indexOf(String functionName) {
        for (int i = 0; i < functions.size(); i++) {
            if (functions.get(i).getName().equals(functionName)) {
                return i;
            }
        }
        return -1;
    }

    /** 用校验得到的栈深度替换各函数的 maxStack */
    Program withMaxStacks(int[] maxStacks) {
        List<CompiledFunction> verified = new ArrayList<>();
        for (int i = 0; i < functions.size(); i++) {
            verified.add(functions.get(i).withMaxStack(maxStacks[i]));
        }
        return new Program(unitId, constants, recordShapes, variantShapes, externals, verified);
    }

    // ============ 序列化 ============

    /**
     * 编码为确定性的二进制形式：同一源码两次编译得到逐字节相同的结果。
     */
    public byte[] encode() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.write(MAGIC);
            out.writeShort(FORMAT_VERSION);
            writeString(out, unitId);

            out.writeInt(constants.size());
            for (RibValue constant : constants) {
                writeConstant(out, constant);
            }

            out.writeInt(recordShapes.size());
            for (RecordShape shape : recordShapes) {
                out.writeBoolean(shape.getTypeName() != null);
                if (shape.getTypeName() != null) {
                    writeString(out, shape.getTypeName());
                }
                out.writeShort(shape.getFieldCount());
                for (int i = 0; i < shape.getFieldCount(); i++) {
                    writeString(out, shape.getFieldName(i));
                }
            }

            out.writeInt(variantShapes.size());
            for (VariantShape shape : variantShapes) {
                writeString(out, shape.getEnumName());
                writeString(out, shape.getVariantName());
                out.writeShort(shape.getTag());
                out.writeShort(shape.getPayloadSize());
            }

            out.writeInt(externals.size());
            for (ExternalCallEntry entry : externals) {
                writeString(out, entry.getSymbol());
                writeString(out, entry.getKind());
                out.writeShort(entry.getArity());
                for (String type : entry.getParamTypes()) {
                    writeString(out, type);
                }
                writeString(out, entry.getReturnType());
            }

            out.writeInt(functions.size());
            for (CompiledFunction function : functions) {
                writeFunction(out, function);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    private static void writeFunction(DataOutputStream out, CompiledFunction function) throws IOException {
        writeString(out, function.getName());
        out.writeByte(function.getKind().ordinal());
        out.writeShort(function.getParamCount());
        for (int i = 0; i < function.getParamCount(); i++) {
            writeString(out, function.getParamNames().get(i));
            writeString(out, function.getParamTypes().get(i));
        }
        writeString(out, function.getReturnType());
        out.writeShort(function.getSlotCount());
        out.writeShort(function.getMaxStack());
        out.writeInt(function.getCodeLength());
        for (int pc = 0; pc < function.getCodeLength(); pc++) {
            Instruction inst = function.getInstruction(pc);
            out.writeByte(inst.getOpcode().ordinal());
            out.writeShort(inst.getOperandCount());
            for (int i = 0; i < inst.getOperandCount(); i++) {
                out.writeInt(inst.operand(i));
            }
        }
    }

    private static void writeConstant(DataOutputStream out, RibValue value) throws IOException {
        if (value instanceof RibUnit) {
            out.writeByte(TAG_UNIT);
        } else if (value instanceof RibBool) {
            out.writeByte(TAG_BOOL);
            out.writeBoolean(((RibBool) value).getValue());
        } else if (value instanceof RibInt) {
            out.writeByte(TAG_INT);
            out.writeLong(((RibInt) value).getValue());
        } else if (value instanceof RibString) {
            out.writeByte(TAG_STRING);
            writeString(out, ((RibString) value).getValue());
        } else if (value instanceof RibBytes) {
            out.writeByte(TAG_BYTES);
            writeBytes(out, ((RibBytes) value).toByteArray());
        } else if (value instanceof RibIpAddr) {
            out.writeByte(TAG_IP);
            writeBytes(out, ((RibIpAddr) value).toByteArray());
        } else if (value instanceof RibPrefix) {
            RibPrefix prefix = (RibPrefix) value;
            out.writeByte(TAG_PREFIX);
            writeBytes(out, prefix.getAddress().toByteArray());
            out.writeByte(prefix.getLength());
        } else if (value instanceof RibAsn) {
            out.writeByte(TAG_ASN);
            out.writeLong(((RibAsn) value).getValue());
        } else if (value instanceof RibCommunity) {
            RibCommunity community = (RibCommunity) value;
            out.writeByte(TAG_COMMUNITY);
            out.writeInt(community.getAsn());
            out.writeInt(community.getValue());
        } else {
            throw new IllegalStateException("Unsupported constant " + value.getTypeName());
        }
    }

    private static void writeString(DataOutputStream out, String value) throws IOException {
        writeBytes(out, value.getBytes(StandardCharsets.UTF_8));
    }

    private static void writeBytes(DataOutputStream out, byte[] value) throws IOException {
        out.writeInt(value.length);
        out.write(value);
    }

    // ============ 反汇编 ============

    /**
     * 人类可读的转储，用于调试和测试断言。
     */
    public String disassemble() {
        StringBuilder sb = new StringBuilder();
        sb.append("; unit ").append(unitId).append('\n');
        sb.append("constants:\n");
        for (int i = 0; i < constants.size(); i++) {
            RibValue value = constants.get(i);
            sb.append(String.format("  #%-3d %s %s\n", i, value.getTypeName(), value));
        }
        if (!recordShapes.isEmpty()) {
            sb.append("records:\n");
            for (int i = 0; i < recordShapes.size(); i++) {
                sb.append(String.format("  @%-3d %s\n", i, recordShapes.get(i)));
            }
        }
        if (!variantShapes.isEmpty()) {
            sb.append("variants:\n");
            for (int i = 0; i < variantShapes.size(); i++) {
                sb.append(String.format("  &%-3d %s\n", i, variantShapes.get(i)));
            }
        }
        if (!externals.isEmpty()) {
            sb.append("externals:\n");
            for (int i = 0; i < externals.size(); i++) {
                sb.append(String.format("  !%-3d %s\n", i, externals.get(i)));
            }
        }
        for (CompiledFunction function : functions) {
            sb.append('\n').append(function.getKind().name().toLowerCase()).append(' ')
                    .append(function.getName()).append('(');
            for (int i = 0; i < function.getParamCount(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(function.getParamNames().get(i)).append(": ").append(function.getParamTypes().get(i));
            }
            sb.append(") -> ").append(function.getReturnType())
                    .append("  ; slots=").append(function.getSlotCount())
                    .append(" max_stack=").append(function.getMaxStack()).append('\n');
            for (int pc = 0; pc < function.getCodeLength(); pc++) {
                sb.append(String.format("  %4d  %s\n", pc, function.getInstruction(pc)));
            }
        }
        return sb.toString();
    }
}
