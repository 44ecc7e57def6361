package com.codeprint.code;

/**
 * A callable does not satisfy the shape the context builder needs, e.g. its captured
 * variable names and closure cells disagree in count. Raised before any instruction is walked.
 */
public class ContractViolationException extends RuntimeException {
    public ContractViolationException(String message) {
        super(message);
    }
}
