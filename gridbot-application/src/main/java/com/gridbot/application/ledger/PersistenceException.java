package com.gridbot.application.ledger;

/**
 * State could not be written or read. Fatal for the affected symbol: the loop must not keep trading
 * on state that is not on disk.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public PersistenceException(String message) {
        super(message);
    }
}
