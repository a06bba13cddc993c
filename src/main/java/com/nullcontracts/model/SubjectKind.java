package com.nullcontracts.model;

/**
 * What a {@code @NotNull} annotation is attached to.
 */
public enum SubjectKind {
    PARAMETER("Parameter", ContractKind.REQUIRES),
    RETURN_VALUE("Return value of", ContractKind.ENSURES),
    FIELD("Field", ContractKind.INVARIANT);

    private final String label;
    private final ContractKind requiredContract;

    SubjectKind(String label, ContractKind requiredContract) {
        this.label = label;
        this.requiredContract = requiredContract;
    }

    public String getLabel() {
        return label;
    }

    /**
     * The contract statement that backs this kind of subject.
     */
    public ContractKind getRequiredContract() {
        return requiredContract;
    }
}
