package rib.runtime.vm;

import com.riblang.ir.bytecode.CompiledFunction;
import com.riblang.ir.bytecode.ExternalCallEntry;
import com.riblang.ir.bytecode.Instruction;
import com.riblang.ir.bytecode.Program;
import com.riblang.ir.ir.RecordShape;
import com.riblang.ir.ir.VariantShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rib.runtime.BuiltinMethod;
import rib.runtime.HostFunction;
import rib.runtime.RibAsPath;
import rib.runtime.RibAsn;
import rib.runtime.RibBool;
import rib.runtime.RibEnumValue;
import rib.runtime.RibInt;
import rib.runtime.RibIpAddr;
import rib.runtime.RibList;
import rib.runtime.RibPrefix;
import rib.runtime.RibRecord;
import rib.runtime.RibString;
import rib.runtime.RibValue;
import rib.runtime.RibVerdict;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 字节码虚拟机
 *
 * <p>基于栈的解释器。每次 {@link #run} 都新建调用帧，同一个 VirtualMachine 与
 * {@link BoundProgram} 可被多个线程同时使用。调用不会挂起，外部调用必须同步返回；
 * 超出 {@link ExecutionPolicy} 的预算时以 {@link FaultKind#RESOURCE_EXHAUSTED} 结束。</p>
 *
 * <p>{@code run} 从不抛出异常：所有失败都作为 {@link Fault} 值返回。</p>
 *
 * <pre>
 * VirtualMachine vm = new VirtualMachine(ExecutionPolicy.standard());
 * BoundProgram bound = vm.attach(program, HostBindings.builder()
 *     .bind("Route.prefix", args -&gt; ((RibExternal) args.get(0)).getHandle(Route.class).prefix())
 *     .build());
 * ExecutionResult result = vm.run(bound, "drop_long",
 *     RuntimeContext.builder().input("route", RibExternal.of("Route", route)).build());
 * </pre>
 */
public class VirtualMachine {

    private static final Logger LOG = LoggerFactory.getLogger(VirtualMachine.class);

    private static final BuiltinMethod[] BUILTINS = BuiltinMethod.values();
    private static final RibValue[] NO_ARGS = new RibValue[0];

    private final ExecutionPolicy policy;

    public VirtualMachine() {
        this(ExecutionPolicy.standard());
    }

    public VirtualMachine(ExecutionPolicy policy) {
        this.policy = policy;
    }

    public ExecutionPolicy getPolicy() {
        return policy;
    }

    // ============ 绑定 ============

    /**
     * 按符号名把外部调用表绑定到宿主函数
     *
     * @throws BindingException 外部调用表中有符号没有绑定
     */
    public BoundProgram attach(Program program, HostBindings bindings) {
        List<ExternalCallEntry> entries = program.getExternals();
        HostFunction[] resolved = new HostFunction[entries.size()];
        for (int i = 0; i < resolved.length; i++) {
            String symbol = entries.get(i).getSymbol();
            resolved[i] = bindings.get(symbol);
            if (resolved[i] == null) {
                throw new BindingException("No host binding for external '" + symbol
                        + "' required by unit '" + program.getUnitId() + "'");
            }
        }
        LOG.debug("Attached unit '{}' with {} external(s)", program.getUnitId(), resolved.length);
        return new BoundProgram(program, resolved);
    }

    // ============ 执行 ============

    /**
     * 执行一个函数
     *
     * @param bound   已绑定的程序
     * @param entry   函数名（filter、filtermap 或普通函数）
     * @param context 按参数名提供的输入
     * @return 结果值或故障，从不为 null
     */
    public ExecutionResult run(BoundProgram bound, String entry, RuntimeContext context) {
        Invocation invocation = new Invocation(bound);
        Program program = bound.getProgram();
        CompiledFunction function = program.findFunction(entry);
        if (function == null) {
            return invalid(invocation, entry, "Unknown entry point '" + entry + "'");
        }

        RibValue[] args = new RibValue[function.getParamCount()];
        for (int i = 0; i < args.length; i++) {
            String name = function.getParamNames().get(i);
            String type = function.getParamTypes().get(i);
            RibValue value = context.getInput(name);
            if (value == null) {
                return invalid(invocation, entry, "Missing input '" + name + "' for '" + entry + "'");
            }
            if (!Operations.conforms(value, type)) {
                return invalid(invocation, entry, "Input '" + name + "' of type " + value.getTypeName()
                        + " does not conform to '" + type + "'");
            }
            args[i] = value;
        }

        try {
            RibValue value = invocation.execute(function, args);
            return ExecutionResult.success(value, invocation.count, invocation.observed);
        } catch (ExecutionFault e) {
            Fault fault = invocation.fault(e.getKind(), e.getMessage(), e.getCause());
            if (fault.getKind() == FaultKind.INVALID_STATE) {
                LOG.warn("Invalid state in unit '{}': {}", program.getUnitId(), fault);
            }
            return ExecutionResult.failure(fault, invocation.count, invocation.observed);
        } catch (RuntimeException | Error e) {
            // 校验过的程序不应到达这里
            Fault fault = invocation.fault(FaultKind.INVALID_STATE, e.toString(), e);
            LOG.warn("Invalid state in unit '{}': {}", program.getUnitId(), fault, e);
            return ExecutionResult.failure(fault, invocation.count, invocation.observed);
        }
    }

    private static ExecutionResult invalid(Invocation invocation, String entry, String message) {
        LOG.warn("Rejected invocation of '{}' in unit '{}': {}", entry,
                invocation.program.getUnitId(), message);
        return ExecutionResult.failure(new Fault(FaultKind.INVALID_STATE, message, entry, -1, null),
                0, invocation.observed);
    }

    /**
     * 单次调用的执行状态
     */
    private final class Invocation {
        final BoundProgram bound;
        final Program program;
        final Deque<Frame> frames = new ArrayDeque<>();
        final Map<String, Integer> observed = new LinkedHashMap<>();
        long count;
        int stackInUse;

        Invocation(BoundProgram bound) {
            this.bound = bound;
            this.program = bound.getProgram();
        }

        Fault fault(FaultKind kind, String message, Throwable cause) {
            Frame top = frames.peek();
            Fault fault = top != null
                    ? new Fault(kind, message, top.function.getName(), top.pc, cause)
                    : new Fault(kind, message, null, -1, cause);
            while (!frames.isEmpty()) {
                leave(frames.pop());
            }
            return fault;
        }

        private void enter(CompiledFunction function, RibValue[] args) {
            if (frames.size() >= policy.getMaxCallDepth()) {
                throw new ExecutionFault(FaultKind.RESOURCE_EXHAUSTED,
                        "Call depth limit " + policy.getMaxCallDepth() + " exceeded");
            }
            Frame frame = new Frame(function, args);
            if (stackInUse + frame.getStackCapacity() > policy.getMaxStackDepth()) {
                throw new ExecutionFault(FaultKind.RESOURCE_EXHAUSTED,
                        "Stack depth limit " + policy.getMaxStackDepth() + " exceeded");
            }
            stackInUse += frame.getStackCapacity();
            frames.push(frame);
        }

        private void leave(Frame frame) {
            stackInUse -= frame.getStackCapacity();
            Integer previous = observed.get(frame.function.getName());
            if (previous == null || previous < frame.getObservedMax()) {
                observed.put(frame.function.getName(), frame.getObservedMax());
            }
        }

        RibValue execute(CompiledFunction entry, RibValue[] args) {
            enter(entry, args);
            long budget = policy.getMaxInstructions();

            while (true) {
                Frame frame = frames.peek();
                if (++count > budget) {
                    throw new ExecutionFault(FaultKind.RESOURCE_EXHAUSTED,
                            "Instruction budget " + budget + " exhausted");
                }
                int pc = frame.pc;
                Instruction inst = frame.function.getInstruction(pc);
                int next = pc + 1;

                switch (inst.getOpcode()) {
                    // ===== 常量与槽位 =====
                    case CONST:
                        frame.push(program.getConstant(inst.operand(0)));
                        break;
                    case LOAD:
                        frame.push(frame.load(inst.operand(0)));
                        break;
                    case STORE:
                        frame.slots[inst.operand(0)] = frame.pop();
                        break;

                    // ===== 运算 =====
                    case ADD:
                    case SUB:
                    case MUL:
                    case DIV:
                    case MOD: {
                        long b = frame.pop().asLong();
                        long a = frame.pop().asLong();
                        frame.push(RibInt.of(Operations.arithmetic(inst.getOpcode(), a, b)));
                        break;
                    }
                    case EQ: {
                        RibValue b = frame.pop();
                        frame.push(RibBool.of(frame.pop().equals(b)));
                        break;
                    }
                    case NE: {
                        RibValue b = frame.pop();
                        frame.push(RibBool.of(!frame.pop().equals(b)));
                        break;
                    }
                    case LT:
                    case LE:
                    case GT:
                    case GE: {
                        RibValue b = frame.pop();
                        RibValue a = frame.pop();
                        frame.push(RibBool.of(Operations.ordered(inst.getOpcode(), a, b)));
                        break;
                    }
                    case LIST_CONTAINS: {
                        RibList list = (RibList) frame.pop();
                        frame.push(RibBool.of(list.contains(frame.pop())));
                        break;
                    }
                    case PREFIX_CONTAINS: {
                        RibPrefix prefix = (RibPrefix) frame.pop();
                        frame.push(RibBool.of(prefix.contains((RibIpAddr) frame.pop())));
                        break;
                    }
                    case PREFIX_COVERED: {
                        RibPrefix outer = (RibPrefix) frame.pop();
                        frame.push(RibBool.of(outer.covers((RibPrefix) frame.pop())));
                        break;
                    }
                    case AS_PATH_CONTAINS: {
                        RibAsPath path = (RibAsPath) frame.pop();
                        frame.push(RibBool.of(path.contains((RibAsn) frame.pop())));
                        break;
                    }
                    case NEG:
                        frame.push(RibInt.of(-frame.pop().asLong()));
                        break;
                    case NOT:
                        frame.push(RibBool.of(!frame.pop().asBool()));
                        break;

                    // ===== 复合值 =====
                    case NEW_RECORD: {
                        RecordShape shape = program.getRecordShapes().get(inst.operand(0));
                        RibValue[] fields = frame.popN(inst.operand(1));
                        frame.push(new RibRecord(shape.getTypeName(), shape.getFieldNames(), fields));
                        break;
                    }
                    case GET_FIELD:
                        frame.push(((RibRecord) frame.pop()).get(inst.operand(0)));
                        break;
                    case NEW_VARIANT: {
                        VariantShape shape = program.getVariantShapes().get(inst.operand(0));
                        RibValue[] payload = frame.popN(inst.operand(1));
                        frame.push(new RibEnumValue(shape.getEnumName(), shape.getVariantName(),
                                shape.getTag(), payload));
                        break;
                    }
                    case IS_VARIANT:
                        frame.push(RibBool.of(((RibEnumValue) frame.pop()).getTag() == inst.operand(0)));
                        break;
                    case GET_PAYLOAD:
                        frame.push(((RibEnumValue) frame.pop()).getPayload(inst.operand(0)));
                        break;
                    case NEW_LIST:
                        frame.push(RibList.of(frame.popN(inst.operand(0))));
                        break;

                    // ===== 调用 =====
                    case CALL: {
                        RibValue[] callArgs = frame.popN(inst.operand(1));
                        frame.pc = next;
                        enter(program.getFunction(inst.operand(0)), callArgs);
                        continue;
                    }
                    case CALL_EXT:
                        frame.push(callExternal(inst.operand(0), frame.popN(inst.operand(1))));
                        break;
                    case CALL_BUILTIN: {
                        RibValue[] all = frame.popN(inst.operand(1));
                        RibValue[] rest = all.length > 1 ? Arrays.copyOfRange(all, 1, all.length) : NO_ARGS;
                        frame.push(BUILTINS[inst.operand(0)].invoke(all[0], rest));
                        break;
                    }

                    // ===== 控制流 =====
                    case JUMP:
                    case LOOP:
                        next = inst.operand(0);
                        break;
                    case JUMP_IF_FALSE:
                        if (!frame.pop().asBool()) {
                            next = inst.operand(0);
                        }
                        break;
                    case SWITCH:
                        next = inst.operand(((RibEnumValue) frame.pop()).getTag());
                        break;
                    case ITER_NEXT: {
                        RibValue collection = frame.load(inst.operand(0));
                        long index = frame.load(inst.operand(1)).asLong();
                        int size = collection instanceof RibAsPath
                                ? ((RibAsPath) collection).length()
                                : ((RibList) collection).size();
                        if (index < size) {
                            frame.slots[inst.operand(2)] = collection instanceof RibAsPath
                                    ? ((RibAsPath) collection).getHops().get((int) index)
                                    : ((RibList) collection).get((int) index);
                            frame.slots[inst.operand(1)] = RibInt.of(index + 1);
                        } else {
                            next = inst.operand(3);
                        }
                        break;
                    }

                    // ===== 退出 =====
                    case RETURN: {
                        RibValue value = frame.pop();
                        leave(frames.pop());
                        if (frames.isEmpty()) {
                            return value;
                        }
                        frames.peek().push(value);
                        continue;
                    }
                    case ACCEPT: {
                        RibVerdict verdict = RibVerdict.accept(frame.pop());
                        unwind();
                        return verdict;
                    }
                    case REJECT:
                        frame.pop();
                        unwind();
                        return RibVerdict.REJECTED;
                    case ABORT: {
                        RibValue message = frame.pop();
                        throw new ExecutionFault(FaultKind.USER_TERMINATION, message instanceof RibString
                                ? ((RibString) message).getValue() : message.toString());
                    }
                    case TRAP:
                        throw new ExecutionFault(FaultKind.INVALID_STATE, "Reached unreachable code");
                    default:
                        throw new ExecutionFault(FaultKind.INVALID_STATE, "Unknown opcode " + inst.getOpcode());
                }
                frame.pc = next;
            }
        }

        private void unwind() {
            while (!frames.isEmpty()) {
                leave(frames.pop());
            }
        }

        private RibValue callExternal(int index, RibValue[] args) {
            ExternalCallEntry entry = program.getExternals().get(index);
            RibValue result;
            try {
                result = bound.getExternal(index).call(Arrays.asList(args));
            } catch (Throwable e) {
                // 宿主抛出的 Error 同样归为调用故障
                throw new ExecutionFault(FaultKind.EXTERNAL_CALL_ERROR,
                        "External '" + entry.getSymbol() + "' failed: " + e.getMessage(), e);
            }
            if (result == null) {
                throw new ExecutionFault(FaultKind.EXTERNAL_CALL_ERROR,
                        "External '" + entry.getSymbol() + "' returned null");
            }
            if (!Operations.conforms(result, entry.getReturnType())) {
                throw new ExecutionFault(FaultKind.EXTERNAL_CALL_ERROR, "External '" + entry.getSymbol()
                        + "' returned " + result.getTypeName() + ", declared '" + entry.getReturnType() + "'");
            }
            return result;
        }
    }
}
