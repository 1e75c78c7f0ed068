package com.sheetengine.app.exceptions;

/**
 * Thrown when a mutation could not acquire its document's write lock in time.
 * The mutation was rejected before it started; nothing was changed.
 */
public class MutationTimeoutException extends RuntimeException {
    public MutationTimeoutException(String message) {
        super(message);
    }
}
