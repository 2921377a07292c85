package com.example.owlmon;

/**
 * Base class of the runtime exceptions raised while building or running a monitor.
 */
public class MonitoringException extends RuntimeException {

    public MonitoringException(String message) {
        super(message);
    }

    public MonitoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
