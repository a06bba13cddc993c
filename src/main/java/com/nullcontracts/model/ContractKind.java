package com.nullcontracts.model;

/**
 * The three recognized contract statements.
 */
public enum ContractKind {
    REQUIRES,
    ENSURES,
    INVARIANT
}
