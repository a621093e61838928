package rib.runtime;

/**
 * 过滤器的判定结果（accept / reject，accept 时可附带输出值）
 */
public final class RibVerdict extends RibValue {

    public enum Action {
        ACCEPT, REJECT
    }

    public static final RibVerdict ACCEPTED = new RibVerdict(Action.ACCEPT, RibUnit.UNIT);
    public static final RibVerdict REJECTED = new RibVerdict(Action.REJECT, RibUnit.UNIT);

    public static RibVerdict accept(RibValue output) {
        return output == RibUnit.UNIT ? ACCEPTED : new RibVerdict(Action.ACCEPT, output);
    }

    private final Action action;
    private final RibValue output;

    private RibVerdict(Action action, RibValue output) {
        this.action = action;
        this.output = output;
    }

    public Action getAction() {
        return action;
    }

    public boolean isAccepted() {
        return action == Action.ACCEPT;
    }

    /** filtermap 输出值；普通 filter 为 Unit */
    public RibValue getOutput() {
        return output;
    }

    @Override
    public String getTypeName() {
        return "Verdict";
    }

    @Override
    public Object toJavaValue() {
        return action == Action.ACCEPT ? output.toJavaValue() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RibVerdict)) return false;
        RibVerdict other = (RibVerdict) o;
        return other.action == action && other.output.equals(output);
    }

    @Override
    public int hashCode() {
        return action.hashCode() * 31 + output.hashCode();
    }

    @Override
    public String toString() {
        if (action == Action.REJECT) {
            return "reject";
        }
        return output == RibUnit.UNIT ? "accept" : "accept " + output;
    }
}
