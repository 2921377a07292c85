package com.example.owlmon.ltl;

import com.example.owlmon.MonitoringException;

public class LtlCompilationException extends MonitoringException {

    public LtlCompilationException(String message) {
        super(message);
    }

    public LtlCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
