package com.example.notificationscheduler.exception;

/**
 * Rejected cron job definition: bad expression or job data that does not fit the job type
 */
public class InvalidCronJobException extends RuntimeException {

    public InvalidCronJobException(String message) {
        super(message);
    }

    public InvalidCronJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
