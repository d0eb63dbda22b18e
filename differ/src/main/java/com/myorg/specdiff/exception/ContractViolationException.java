package com.myorg.specdiff.exception;

/**
 * The diff engine was called with inputs it cannot work with: not exactly two trees, or nodes of
 * different kinds. Always fatal for the comparison.
 */
public class ContractViolationException extends RuntimeException {

    public ContractViolationException(String message) {
        super(message);
    }
}
