package com.zzf.agentdock.store;

/**
 * A store operation failed. The transaction it ran in has been rolled back.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
