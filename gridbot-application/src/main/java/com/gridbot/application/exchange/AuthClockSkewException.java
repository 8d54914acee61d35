package com.gridbot.application.exchange;

/**
 * Signature or timestamp rejected even after the clock offset was refreshed.
 */
public class AuthClockSkewException extends ExchangeException {

    private final int errorCode;

    public AuthClockSkewException(String message, int errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public int getErrorCode() {
        return errorCode;
    }
}
