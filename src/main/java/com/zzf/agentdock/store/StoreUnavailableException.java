package com.zzf.agentdock.store;

/**
 * The database could not be opened or initialized.
 */
public class StoreUnavailableException extends StoreException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
