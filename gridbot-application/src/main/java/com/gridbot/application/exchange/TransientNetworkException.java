package com.gridbot.application.exchange;

/**
 * Timeout, connection reset or 5xx. Retried by the client; surfaces only once the retry budget is spent.
 */
public class TransientNetworkException extends ExchangeException {

    public TransientNetworkException(String message) {
        super(message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
