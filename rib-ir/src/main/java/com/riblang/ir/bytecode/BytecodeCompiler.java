package com.riblang.ir.bytecode;

import com.riblang.compiler.analysis.types.RibType;
import com.riblang.compiler.host.ExternalMember;
import com.riblang.ir.ir.BasicBlock;
import com.riblang.ir.ir.BinaryOp;
import com.riblang.ir.ir.IrFunction;
import com.riblang.ir.ir.IrInst;
import com.riblang.ir.ir.IrModule;
import com.riblang.ir.ir.IrTerminator;
import com.riblang.ir.ir.RecordShape;
import com.riblang.ir.ir.UnaryOp;
import com.riblang.ir.ir.VariantShape;
import rib.runtime.BuiltinMethod;
import rib.runtime.RibUnit;
import rib.runtime.RibValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * IR → 字节码编译器。
 *
 * <p>基本块按逆后序排列（从入口出发，后继逆序访问），使 then 分支和循环体紧跟在分支之后，
 * 只有循环回边向后跳转。从入口不可达的块不生成代码。</p>
 *
 * <p>每条 IR 指令编译为"加载操作数、运算、存入目标槽位"，因此 IR 指令之间的栈深度恒为 0。
 * 跳转目标先记录为块 id，布局完成后统一回填为指令下标。</p>
 *
 * <p>编译结果在返回前经过 {@link StackVerifier} 校验。</p>
 */
public class BytecodeCompiler {

    private final ConstantPool constants = new ConstantPool();
    private final Map<RecordShape, Integer> recordShapes = new LinkedHashMap<>();
    private final Map<VariantShape, Integer> variantShapes = new LinkedHashMap<>();
    private final Map<String, Integer> externalIndices = new HashMap<>();
    private final List<ExternalCallEntry> externals = new ArrayList<>();
    private Map<String, Integer> functionIndices;

    /**
     * 编译整个模块。
     *
     * @throws VerifyException 生成的代码未通过栈校验
     */
    public Program compile(IrModule module) {
        functionIndices = new HashMap<>();
        List<IrFunction> functions = module.getFunctions();
        for (int i = 0; i < functions.size(); i++) {
            functionIndices.put(functions.get(i).getName(), i);
        }

        List<CompiledFunction> compiled = new ArrayList<>();
        for (IrFunction function : functions) {
            compiled.add(compileFunction(function));
        }

        Program draft = new Program(module.getUnitId(), constants.toList(),
                new ArrayList<>(recordShapes.keySet()), new ArrayList<>(variantShapes.keySet()),
                externals, compiled);
        int[] maxStacks = new StackVerifier().verify(draft);
        return draft.withMaxStacks(maxStacks);
    }

    // ============ 函数 ============

    private CompiledFunction compileFunction(IrFunction function) {
        List<BasicBlock> layout = layout(function);
        Map<Integer, Integer> position = new HashMap<>();
        for (int i = 0; i < layout.size(); i++) {
            position.put(layout.get(i).getId(), i);
        }

        FunctionEmitter emitter = new FunctionEmitter();
        for (int i = 0; i < layout.size(); i++) {
            BasicBlock block = layout.get(i);
            emitter.markBlock(block.getId());
            for (IrInst inst : block.getInstructions()) {
                compileInstruction(emitter, inst);
            }
            int next = i + 1 < layout.size() ? layout.get(i + 1).getId() : -1;
            compileTerminator(emitter, block, next, i, position);
        }

        List<String> paramTypes = new ArrayList<>();
        for (RibType type : function.getParamTypes()) {
            paramTypes.add(type.toDisplayString());
        }
        return new CompiledFunction(function.getName(), kindOf(function.getKind()),
                function.getParamNames(), paramTypes, function.getReturnType().toDisplayString(),
                function.getSlotCount(), -1, emitter.finish(function.getName()));
    }

    /**
     * 逆后序布局。
     */
    static List<BasicBlock> layout(IrFunction function) {
        Map<Integer, BasicBlock> byId = new HashMap<>();
        for (BasicBlock block : function.getBlocks()) {
            byId.put(block.getId(), block);
        }
        List<BasicBlock> postOrder = new ArrayList<>();
        Set<Integer> visited = new HashSet<>();
        // 显式栈避免深嵌套时的递归溢出：每帧为 {块 id, 下一个待访问的后继下标}
        List<int[]> stack = new ArrayList<>();
        BasicBlock entry = function.getEntryBlock();
        visited.add(entry.getId());
        stack.add(new int[]{entry.getId(), 0});
        while (!stack.isEmpty()) {
            int[] frame = stack.get(stack.size() - 1);
            BasicBlock block = byId.get(frame[0]);
            int[] successors = block.hasTerminator() ? block.getTerminator().getSuccessors() : new int[0];
            if (frame[1] < successors.length) {
                // 后继逆序访问，逆后序中第一个后继排在最前
                int succ = successors[successors.length - 1 - frame[1]];
                frame[1]++;
                if (byId.containsKey(succ) && visited.add(succ)) {
                    stack.add(new int[]{succ, 0});
                }
            } else {
                postOrder.add(block);
                stack.remove(stack.size() - 1);
            }
        }
        Collections.reverse(postOrder);
        return postOrder;
    }

    // ============ 指令 ============

    private void compileInstruction(FunctionEmitter out, IrInst inst) {
        switch (inst.getOp()) {
            case CONST:
                out.emit(Opcode.CONST, constants.intern(inst.<RibValue>extraAs()));
                break;
            case MOVE:
                out.load(inst.getOperands());
                break;
            case BINARY:
                out.load(inst.getOperands());
                out.emit(binaryOpcode(inst.<BinaryOp>extraAs()));
                break;
            case UNARY:
                out.load(inst.getOperands());
                out.emit(inst.<UnaryOp>extraAs() == UnaryOp.NEG ? Opcode.NEG : Opcode.NOT);
                break;
            case NEW_RECORD:
                out.load(inst.getOperands());
                out.emit(Opcode.NEW_RECORD, indexOf(recordShapes, inst.<RecordShape>extraAs()),
                        inst.getOperands().length);
                break;
            case GET_FIELD:
                out.load(inst.getOperands());
                out.emit(Opcode.GET_FIELD, inst.<Integer>extraAs());
                break;
            case NEW_VARIANT:
                out.load(inst.getOperands());
                out.emit(Opcode.NEW_VARIANT, indexOf(variantShapes, inst.<VariantShape>extraAs()),
                        inst.getOperands().length);
                break;
            case IS_VARIANT:
                out.load(inst.getOperands());
                out.emit(Opcode.IS_VARIANT, inst.<Integer>extraAs());
                break;
            case GET_PAYLOAD:
                out.load(inst.getOperands());
                out.emit(Opcode.GET_PAYLOAD, inst.<Integer>extraAs());
                break;
            case NEW_LIST:
                out.load(inst.getOperands());
                out.emit(Opcode.NEW_LIST, inst.getOperands().length);
                break;
            case CALL: {
                Integer callee = functionIndices.get(inst.<String>extraAs());
                if (callee == null) {
                    throw new IllegalStateException("Call to unknown function '" + inst.getExtra() + "'");
                }
                out.load(inst.getOperands());
                out.emit(Opcode.CALL, callee, inst.getOperands().length);
                break;
            }
            case CALL_EXT:
                out.load(inst.getOperands());
                out.emit(Opcode.CALL_EXT, externalIndex(inst.<ExternalMember>extraAs()), inst.getOperands().length);
                break;
            case CALL_BUILTIN:
                out.load(inst.getOperands());
                out.emit(Opcode.CALL_BUILTIN, inst.<BuiltinMethod>extraAs().ordinal(), inst.getOperands().length);
                break;
            default:
                throw new IllegalStateException("Unknown IR op " + inst.getOp());
        }
        out.emit(Opcode.STORE, inst.getDest());
    }

    private void compileTerminator(FunctionEmitter out, BasicBlock block, int nextBlock,
                                   int position, Map<Integer, Integer> positions) {
        IrTerminator term = block.getTerminator();
        if (term instanceof IrTerminator.Goto) {
            int target = ((IrTerminator.Goto) term).getTargetBlockId();
            if (target == nextBlock) {
                return;
            }
            Integer targetPosition = positions.get(target);
            if (targetPosition != null && targetPosition <= position) {
                out.jump(Opcode.LOOP, target);
            } else {
                out.jump(Opcode.JUMP, target);
            }
        } else if (term instanceof IrTerminator.Branch) {
            IrTerminator.Branch branch = (IrTerminator.Branch) term;
            out.emit(Opcode.LOAD, branch.getCondition());
            out.jump(Opcode.JUMP_IF_FALSE, branch.getElseBlock());
            if (branch.getThenBlock() != nextBlock) {
                out.jump(Opcode.JUMP, branch.getThenBlock());
            }
        } else if (term instanceof IrTerminator.Switch) {
            IrTerminator.Switch sw = (IrTerminator.Switch) term;
            out.emit(Opcode.LOAD, sw.getScrutinee());
            out.switchOn(sw.getTargets());
        } else if (term instanceof IrTerminator.IterNext) {
            IrTerminator.IterNext iter = (IrTerminator.IterNext) term;
            out.iterNext(iter.getCollection(), iter.getIndex(), iter.getVariable(), iter.getExitBlock());
            if (iter.getBodyBlock() != nextBlock) {
                out.jump(Opcode.JUMP, iter.getBodyBlock());
            }
        } else if (term instanceof IrTerminator.Return) {
            out.emit(Opcode.LOAD, ((IrTerminator.Return) term).getValue());
            out.emit(Opcode.RETURN);
        } else if (term instanceof IrTerminator.Accept) {
            out.emit(Opcode.LOAD, ((IrTerminator.Accept) term).getValue());
            out.emit(Opcode.ACCEPT);
        } else if (term instanceof IrTerminator.Reject) {
            out.emit(Opcode.CONST, constants.intern(RibUnit.UNIT));
            out.emit(Opcode.REJECT);
        } else if (term instanceof IrTerminator.Abort) {
            out.emit(Opcode.LOAD, ((IrTerminator.Abort) term).getMessage());
            out.emit(Opcode.ABORT);
        } else {
            // Unreachable 或缺少终止指令
            out.emit(Opcode.TRAP);
        }
    }

    // ============ 表 ============

    private static <T> int indexOf(Map<T, Integer> table, T shape) {
        Integer index = table.get(shape);
        if (index == null) {
            index = table.size();
            table.put(shape, index);
        }
        return index;
    }

    private int externalIndex(ExternalMember member) {
        Integer index = externalIndices.get(member.getSymbol());
        if (index == null) {
            List<String> paramTypes = new ArrayList<>();
            if (member.getKind() != ExternalMember.Kind.FUNCTION) {
                paramTypes.add(member.getOwnerType());
            }
            for (RibType type : member.getParamTypes()) {
                paramTypes.add(type.toDisplayString());
            }
            index = externals.size();
            externals.add(new ExternalCallEntry(member.getSymbol(), member.getKind().name(), paramTypes,
                    member.getReturnType().toDisplayString()));
            externalIndices.put(member.getSymbol(), index);
        }
        return index;
    }

    private static Opcode binaryOpcode(BinaryOp op) {
        switch (op) {
            case ADD: return Opcode.ADD;
            case SUB: return Opcode.SUB;
            case MUL: return Opcode.MUL;
            case DIV: return Opcode.DIV;
            case MOD: return Opcode.MOD;
            case EQ: return Opcode.EQ;
            case NE: return Opcode.NE;
            case LT: return Opcode.LT;
            case LE: return Opcode.LE;
            case GT: return Opcode.GT;
            case GE: return Opcode.GE;
            case LIST_CONTAINS: return Opcode.LIST_CONTAINS;
            case PREFIX_CONTAINS: return Opcode.PREFIX_CONTAINS;
            case PREFIX_COVERED: return Opcode.PREFIX_COVERED;
            case AS_PATH_CONTAINS: return Opcode.AS_PATH_CONTAINS;
            default: throw new IllegalStateException("Unknown binary op " + op);
        }
    }

    private static CompiledFunction.Kind kindOf(IrFunction.Kind kind) {
        switch (kind) {
            case FILTER: return CompiledFunction.Kind.FILTER;
            case FILTER_MAP: return CompiledFunction.Kind.FILTER_MAP;
            default: return CompiledFunction.Kind.FUNCTION;
        }
    }

    // ============ 单个函数的指令缓冲 ============

    /**
     * 指令缓冲区：跳转目标先以块 id 记录，{@link #finish} 时回填为指令下标。
     */
    private static final class FunctionEmitter {

        private final List<Instruction> code = new ArrayList<>();
        private final Map<Integer, Integer> blockStarts = new HashMap<>();
        // {pc, 操作数下标, 目标块 id}
        private final List<int[]> fixups = new ArrayList<>();

        void markBlock(int blockId) {
            blockStarts.put(blockId, code.size());
        }

        void emit(Opcode opcode, int... operands) {
            code.add(new Instruction(opcode, operands));
        }

        void load(int[] slots) {
            for (int slot : slots) {
                emit(Opcode.LOAD, slot);
            }
        }

        void jump(Opcode opcode, int targetBlock) {
            fixups.add(new int[]{code.size(), 0, targetBlock});
            emit(opcode, -1);
        }

        void switchOn(int[] targetBlocks) {
            int pc = code.size();
            int[] operands = new int[targetBlocks.length];
            for (int i = 0; i < targetBlocks.length; i++) {
                operands[i] = -1;
                fixups.add(new int[]{pc, i, targetBlocks[i]});
            }
            emit(Opcode.SWITCH, operands);
        }

        void iterNext(int collection, int index, int variable, int exitBlock) {
            fixups.add(new int[]{code.size(), 3, exitBlock});
            emit(Opcode.ITER_NEXT, collection, index, variable, -1);
        }

        Instruction[] finish(String functionName) {
            for (int[] fixup : fixups) {
                Integer target = blockStarts.get(fixup[2]);
                if (target == null) {
                    throw new IllegalStateException("Jump in '" + functionName
                            + "' to block B" + fixup[2] + " that has no code");
                }
                code.set(fixup[0], code.get(fixup[0]).withOperand(fixup[1], target));
            }
            return code.toArray(new Instruction[0]);
        }
    }
}
