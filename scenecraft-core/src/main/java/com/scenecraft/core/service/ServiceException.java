package com.scenecraft.core.service;

/**
 * Raised when a generative service call fails: transport error, non-success status
 * or a payload that cannot be parsed.
 */
public class ServiceException extends Exception {

    public ServiceException(String message) {
        super(message);
    }

    public ServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
