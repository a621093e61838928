package com.riblang.ir.ir;

import com.riblang.compiler.analysis.types.RibType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * IR 函数：function、filter 或 filtermap。参数占用槽位 0..n-1。
 */
public class IrFunction {

    public enum Kind {
        FUNCTION,
        FILTER,
        FILTER_MAP
    }

    private final String name;
    private final Kind kind;
    private final List<String> paramNames;
    private final List<RibType> paramTypes;
    private final RibType returnType;       // filtermap 为输出类型，filter 为 Unit
    private final List<BasicBlock> blocks = new ArrayList<>();
    private final List<IrLocal> locals = new ArrayList<>();
    private int nextBlockId;

    public IrFunction(String name, Kind kind, List<String> paramNames, List<RibType> paramTypes, RibType returnType) {
        this.name = name;
        this.kind = kind;
        this.paramNames = Collections.unmodifiableList(new ArrayList<>(paramNames));
        this.paramTypes = Collections.unmodifiableList(new ArrayList<>(paramTypes));
        this.returnType = returnType;
        for (String param : paramNames) {
            newLocal(param);
        }
    }

    public String getName() { return name; }
    public Kind getKind() { return kind; }
    public List<String> getParamNames() { return paramNames; }
    public List<RibType> getParamTypes() { return paramTypes; }
    public RibType getReturnType() { return returnType; }
    public List<BasicBlock> getBlocks() { return blocks; }
    public List<IrLocal> getLocals() { return locals; }

    public int getSlotCount() {
        return locals.size();
    }

    public boolean isEntryPoint() {
        return kind != Kind.FUNCTION;
    }

    public BasicBlock newBlock() {
        BasicBlock block = new BasicBlock(nextBlockId++);
        blocks.add(block);
        return block;
    }

    public int newLocal(String localName) {
        int index = locals.size();
        locals.add(new IrLocal(index, localName));
        return index;
    }

    public BasicBlock getEntryBlock() {
        return blocks.get(0);
    }

    public BasicBlock findBlock(int id) {
        for (BasicBlock block : blocks) {
            if (block.getId() == id) return block;
        }
        return null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind.name().toLowerCase()).append(' ').append(name).append('(');
        for (int i = 0; i < paramNames.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append('%').append(i).append(' ').append(paramNames.get(i));
        }
        sb.append(") -> ").append(returnType.toDisplayString()).append(" {\n");
        for (BasicBlock block : blocks) {
            sb.append(block);
        }
        return sb.append("}\n").toString();
    }
}
