package com.flagship.crypto_ledger.exception;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.function.Supplier;

/**
 * Maps Spring's data access hierarchy onto StorageUnavailable.
 */
public final class StorageFailures {

    private StorageFailures() {
    }

    /**
     * Connection loss, lock timeouts, deadlock victims and serialization failures.
     */
    public static boolean isTransient(Throwable failure) {
        return failure instanceof TransientDataAccessException
            || failure instanceof RecoverableDataAccessException
            || failure instanceof DataAccessResourceFailureException
            || failure instanceof CannotCreateTransactionException;
    }

    public static <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            if (isTransient(e)) {
                throw new StorageUnavailableException("Storage unavailable during " + operation, e);
            }
            throw e;
        }
    }
}
