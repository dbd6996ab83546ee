package com.arbiter.contract;

/**
 * Thrown when input handed to the arbitration engine does not satisfy the
 * violation/rule contract.
 */
public class ContractViolationException extends RuntimeException {

    public ContractViolationException(String message) {
        super(message);
    }
}
