package com.moneyflow.backend.exception;

/**
 * Raised by a notification channel when a delivery attempt fails.
 */
public class NotificationException extends RuntimeException {

    private final String channel;

    public NotificationException(String channel, String message) {
        super(message);
        this.channel = channel;
    }

    public NotificationException(String channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
