package com.librenovel.decompiler;

import com.librenovel.ast.Node.SourceLocation;

/**
 * Register for the postfix with clause of a paired with statement.
 * <p>
 * ABSENT: no pairing in progress. ARMED: a paired with was seen and the
 * next display statement may take it as its "with" clause. CONSUMED: a
 * display statement took it, so the trailing with renders nothing.
 *
 * @param state register state
 * @param expression transition expression, null when absent
 * @param ownerDepth block depth of the paired with that armed it
 * @param location location of that paired with
 */
public record PendingWith(State state, String expression, int ownerDepth, SourceLocation location) {

    public enum State {
        ABSENT,
        ARMED,
        CONSUMED
    }

    private static final PendingWith ABSENT = new PendingWith(State.ABSENT, null, -1, null);

    public static PendingWith absent() {
        return ABSENT;
    }

    public static PendingWith armed(String expression, int ownerDepth, SourceLocation location) {
        return new PendingWith(State.ARMED, expression, ownerDepth, location);
    }

    public PendingWith consume() {
        return new PendingWith(State.CONSUMED, expression, ownerDepth, location);
    }

    public boolean isAbsent() {
        return state == State.ABSENT;
    }

    public boolean isArmed() {
        return state == State.ARMED;
    }

    public boolean isConsumed() {
        return state == State.CONSUMED;
    }
}
