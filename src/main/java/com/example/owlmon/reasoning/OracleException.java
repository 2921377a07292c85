package com.example.owlmon.reasoning;

import com.example.owlmon.MonitoringException;

/**
 * The reasoner behind a {@link SatisfiabilityOracle} could not answer.
 */
public class OracleException extends MonitoringException {

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
