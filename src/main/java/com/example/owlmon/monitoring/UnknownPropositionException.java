package com.example.owlmon.monitoring;

import com.example.owlmon.MonitoringException;

/**
 * A transition label mentions a literal the formula's translation map does not define.
 */
public class UnknownPropositionException extends MonitoringException {

    private final String literal;

    public UnknownPropositionException(String literal, String formula) {
        super("No axiom for literal '" + literal + "' in translation map of formula: " + formula);
        this.literal = literal;
    }

    public String getLiteral() {
        return literal;
    }
}
