package com.evertz.featured.core.exception;

/**
 * Domain exception thrown when the external video source is missing or fails to respond.
 */
public class VideoSourceException extends RuntimeException {

    public VideoSourceException(String message) {
        super(message);
    }

    public VideoSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
