package com.nullcontracts.contracts;

/**
 * Runtime side of the contract statements kept in sync with {@code @NotNull}.
 *
 * <p>Preconditions and invariants are checked eagerly. Postconditions are
 * declarative: there is no bytecode rewriter to evaluate them at method exit,
 * so {@link #ensures(boolean)} records intent only and {@link #result()}
 * always yields {@code null} when executed.</p>
 */
public final class Contract {

    private Contract() {
    }

    /**
     * Precondition checked at member entry.
     *
     * @param condition The condition that must hold
     * @throws ContractViolationException if the condition is false
     */
    public static void requires(boolean condition) {
        requires(condition, null);
    }

    public static void requires(boolean condition, String message) {
        if (!condition) {
            throw new ContractViolationException("Precondition failed", message);
        }
    }

    /**
     * Postcondition on the member's result. Not evaluated at runtime.
     *
     * @param condition The condition that should hold on exit
     */
    public static void ensures(boolean condition) {
        ensures(condition, null);
    }

    public static void ensures(boolean condition, String message) {
        // Declarative only.
    }

    /**
     * Invariant checked whenever the invariant method runs.
     *
     * @param condition The condition that must hold
     * @throws ContractViolationException if the condition is false
     */
    public static void invariant(boolean condition) {
        invariant(condition, null);
    }

    public static void invariant(boolean condition, String message) {
        if (!condition) {
            throw new ContractViolationException("Invariant failed", message);
        }
    }

    /**
     * Stands for the return value inside a postcondition.
     *
     * @param <T> The declared return type of the enclosing member
     * @return always {@code null}
     */
    public static <T> T result() {
        return null;
    }
}
