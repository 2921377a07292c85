package com.example.owlmon.monitoring;

import com.example.owlmon.MonitoringException;

/**
 * Neither the formula nor its negation has a run left: no interpretation is consistent with the
 * trace read so far.
 */
public class MonitorInvariantException extends MonitoringException {

    public MonitorInvariantException(String message) {
        super(message);
    }
}
