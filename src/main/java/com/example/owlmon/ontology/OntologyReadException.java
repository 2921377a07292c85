package com.example.owlmon.ontology;

import com.example.owlmon.MonitoringException;

/**
 * An ontology document could not be found or parsed.
 */
public class OntologyReadException extends MonitoringException {

    public OntologyReadException(String message) {
        super(message);
    }

    public OntologyReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
