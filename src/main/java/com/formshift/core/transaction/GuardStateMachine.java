package com.formshift.core.transaction;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Valid {@link GuardState} transitions.
 *
 * <pre>
 *   IDLE        → OPEN
 *   OPEN        → COMMITTED, ROLLED_BACK
 *   COMMITTED   → IDLE
 *   ROLLED_BACK → IDLE
 * </pre>
 */
public final class GuardStateMachine {

    private static final Map<GuardState, Set<GuardState>> TRANSITIONS;

    static {
        TRANSITIONS = new EnumMap<>(GuardState.class);
        TRANSITIONS.put(GuardState.IDLE,        EnumSet.of(GuardState.OPEN));
        TRANSITIONS.put(GuardState.OPEN,        EnumSet.of(GuardState.COMMITTED, GuardState.ROLLED_BACK));
        TRANSITIONS.put(GuardState.COMMITTED,   EnumSet.of(GuardState.IDLE));
        TRANSITIONS.put(GuardState.ROLLED_BACK, EnumSet.of(GuardState.IDLE));
    }

    private GuardStateMachine() {
    }

    public static boolean canTransition(GuardState from, GuardState to) {
        return TRANSITIONS.getOrDefault(from, EnumSet.noneOf(GuardState.class)).contains(to);
    }

    /**
     * Validates a transition and returns the target state.
     *
     * @throws TransactionStateException {@code ALREADY_OPEN} when opening an open guard,
     *                                   {@code NOT_OPEN} for any other rejected move
     */
    public static GuardState transition(GuardState from, GuardState to) {
        if (from == null || to == null) {
            throw new NullPointerException("from and to must not be null");
        }
        if (!canTransition(from, to)) {
            var code = from == GuardState.OPEN && to == GuardState.OPEN
                    ? TransactionStateException.ErrorCode.ALREADY_OPEN
                    : TransactionStateException.ErrorCode.NOT_OPEN;
            throw new TransactionStateException("Invalid transition: " + from + " → " + to, code);
        }
        return to;
    }
}
