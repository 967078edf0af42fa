package com.screenstreamer.screenstreamer.service.producer;

/**
 * The capture producer could not be started.
 */
public class LaunchException extends Exception {

    public LaunchException(String message) {
        super(message);
    }

    public LaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
