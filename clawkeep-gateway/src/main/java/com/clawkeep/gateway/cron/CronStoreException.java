package com.clawkeep.gateway.cron;

/**
 * Raised when the cron store cannot be read or written.
 */
public class CronStoreException extends RuntimeException {

    public CronStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
