package com.riblang.ir.ir;

import com.riblang.compiler.ast.Span;

/**
 * 基本块终止指令。每个基本块必须恰好有一个终止指令。
 */
public abstract class IrTerminator {

    private static final int[] NONE = new int[0];

    protected final Span location;

    protected IrTerminator(Span location) {
        this.location = location;
    }

    public Span getLocation() { return location; }

    /** 后继块 id（按布局优先顺序） */
    public int[] getSuccessors() {
        return NONE;
    }

    /** 是否结束整个调用（return / accept / reject / abort） */
    public boolean isExit() {
        return false;
    }

    /**
     * 无条件跳转。
     */
    public static class Goto extends IrTerminator {
        private final int targetBlockId;

        public Goto(Span location, int targetBlockId) {
            super(location);
            this.targetBlockId = targetBlockId;
        }

        public int getTargetBlockId() { return targetBlockId; }

        @Override
        public int[] getSuccessors() {
            return new int[]{targetBlockId};
        }

        @Override
        public String toString() {
            return "goto B" + targetBlockId;
        }
    }

    /**
     * 条件分支。
     */
    public static class Branch extends IrTerminator {
        private final int condition;
        private final int thenBlock;
        private final int elseBlock;

        public Branch(Span location, int condition, int thenBlock, int elseBlock) {
            super(location);
            this.condition = condition;
            this.thenBlock = thenBlock;
            this.elseBlock = elseBlock;
        }

        public int getCondition() { return condition; }
        public int getThenBlock() { return thenBlock; }
        public int getElseBlock() { return elseBlock; }

        @Override
        public int[] getSuccessors() {
            return new int[]{thenBlock, elseBlock};
        }

        @Override
        public String toString() {
            return "branch %" + condition + " ? B" + thenBlock + " : B" + elseBlock;
        }
    }

    /**
     * 按枚举值的变体 tag 分派。targets[tag] 为该变体的目标块。
     */
    public static class Switch extends IrTerminator {
        private final int scrutinee;
        private final int[] targets;

        public Switch(Span location, int scrutinee, int[] targets) {
            super(location);
            this.scrutinee = scrutinee;
            this.targets = targets;
        }

        public int getScrutinee() { return scrutinee; }
        public int[] getTargets() { return targets; }

        @Override
        public int[] getSuccessors() {
            return targets.clone();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("switch %").append(scrutinee).append(" [");
            for (int i = 0; i < targets.length; i++) {
                if (i > 0) sb.append(", ");
                sb.append(i).append(" -> B").append(targets[i]);
            }
            return sb.append(']').toString();
        }
    }

    /**
     * for 循环头：collection[index] 存在时写入 variable、index 加一并进入 body，否则进入 exit。
     */
    public static class IterNext extends IrTerminator {
        private final int collection;
        private final int index;
        private final int variable;
        private final int bodyBlock;
        private final int exitBlock;

        public IterNext(Span location, int collection, int index, int variable, int bodyBlock, int exitBlock) {
            super(location);
            this.collection = collection;
            this.index = index;
            this.variable = variable;
            this.bodyBlock = bodyBlock;
            this.exitBlock = exitBlock;
        }

        public int getCollection() { return collection; }
        public int getIndex() { return index; }
        public int getVariable() { return variable; }
        public int getBodyBlock() { return bodyBlock; }
        public int getExitBlock() { return exitBlock; }

        @Override
        public int[] getSuccessors() {
            return new int[]{bodyBlock, exitBlock};
        }

        @Override
        public String toString() {
            return "iter_next %" + collection + "[%" + index + "] -> %" + variable
                    + " ? B" + bodyBlock + " : B" + exitBlock;
        }
    }

    /**
     * 函数返回。
     */
    public static class Return extends IrTerminator {
        private final int value;

        public Return(Span location, int value) {
            super(location);
            this.value = value;
        }

        public int getValue() { return value; }

        @Override
        public boolean isExit() {
            return true;
        }

        @Override
        public String toString() {
            return "return %" + value;
        }
    }

    /**
     * filter 接受；filtermap 中 value 为输出值。
     */
    public static class Accept extends IrTerminator {
        private final int value;

        public Accept(Span location, int value) {
            super(location);
            this.value = value;
        }

        public int getValue() { return value; }

        @Override
        public boolean isExit() {
            return true;
        }

        @Override
        public String toString() {
            return "accept %" + value;
        }
    }

    public static class Reject extends IrTerminator {
        public Reject(Span location) {
            super(location);
        }

        @Override
        public boolean isExit() {
            return true;
        }

        @Override
        public String toString() {
            return "reject";
        }
    }

    /**
     * 以用户终止故障结束调用，message 为 String 槽位。
     */
    public static class Abort extends IrTerminator {
        private final int message;

        public Abort(Span location, int message) {
            super(location);
            this.message = message;
        }

        public int getMessage() { return message; }

        @Override
        public boolean isExit() {
            return true;
        }

        @Override
        public String toString() {
            return "abort %" + message;
        }
    }

    /**
     * 类型检查保证不可达的位置（穷尽 match 的兜底、发散表达式之后）。
     */
    public static class Unreachable extends IrTerminator {
        public Unreachable(Span location) {
            super(location);
        }

        @Override
        public String toString() {
            return "unreachable";
        }
    }
}
