package com.gridbot.application.exchange;

/**
 * Non-retryable rejection: 4xx (other than rate limit) or a non-zero exchange error code.
 */
public class OrderRejectedException extends ExchangeException {

    private final int errorCode;

    public OrderRejectedException(String message, int errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    /** Exchange error code, or the HTTP status when the exchange gave none. */
    public int getErrorCode() {
        return errorCode;
    }
}
