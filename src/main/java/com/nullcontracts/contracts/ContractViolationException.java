package com.nullcontracts.contracts;

/**
 * Thrown when a precondition or invariant does not hold.
 */
public class ContractViolationException extends IllegalStateException {

    public ContractViolationException(String kind, String message) {
        super(message == null ? kind : kind + ": " + message);
    }
}
