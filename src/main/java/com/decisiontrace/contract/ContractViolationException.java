package com.decisiontrace.contract;

/**
 * A decision payload does not have the shape a record requires
 * (missing required field, wrong type, out-of-range value).
 */
public class ContractViolationException extends RuntimeException {

    public ContractViolationException(String message) {
        super(message);
    }
}
