package com.slotplanner.slotplanner_api.exception;

/**
 * The result of an asynchronous solve was requested before the job finished.
 */
public class JobInProgressException extends RuntimeException {

    public JobInProgressException(String message) {
        super(message);
    }
}
