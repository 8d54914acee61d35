package com.gridbot.application.exchange;

/**
 * Base class of every failure an {@link ExchangeClient} call can surface.
 */
public class ExchangeException extends Exception {

    public ExchangeException(String message) {
        super(message);
    }

    public ExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
