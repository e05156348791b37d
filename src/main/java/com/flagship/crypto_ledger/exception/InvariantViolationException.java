package com.flagship.crypto_ledger.exception;

/**
 * An internal consistency check failed, e.g. unlocking more than is locked.
 *
 * Unreachable with correct callers. Never caught and corrected: the enclosing
 * transaction rolls back and the failure is logged at ERROR for investigation.
 */
public class InvariantViolationException extends LedgerException {

    public InvariantViolationException(String message) {
        super("InvariantViolation", message);
    }
}
