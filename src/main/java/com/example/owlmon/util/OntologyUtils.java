// com/example/owlmon/util/OntologyUtils.java
package com.example.owlmon.util;

import org.semanticweb.owlapi.model.*;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Utility methods for rendering OWL objects in log messages and reports
 */
public final class OntologyUtils {

    private OntologyUtils() {
    }

    /**
     * Get short form of an entity (extract name from IRI)
     */
    public static String getShortForm(Object obj) {
        if (obj == null) return "null";

        if (obj instanceof OWLEntity) {
            return getShortForm(((OWLEntity) obj).getIRI());
        }

        if (obj instanceof IRI) {
            String iri = obj.toString();
            if (iri.contains("#")) {
                return iri.substring(iri.lastIndexOf("#") + 1);
            } else if (iri.contains("/")) {
                return iri.substring(iri.lastIndexOf("/") + 1);
            }
            return iri;
        }

        if (obj instanceof OWLClassExpression) {
            OWLClassExpression expr = (OWLClassExpression) obj;
            if (expr.isAnonymous()) {
                return expr.toString();
            } else {
                return getShortForm(expr.asOWLClass());
            }
        }

        if (obj instanceof OWLObjectPropertyExpression) {
            OWLObjectPropertyExpression expr = (OWLObjectPropertyExpression) obj;
            if (expr.isAnonymous()) {
                return expr.toString();
            } else {
                return getShortForm(expr.asOWLObjectProperty());
            }
        }

        return obj.toString();
    }

    /**
     * Format axiom in human-readable form
     */
    public static String formatAxiom(OWLAxiom axiom) {
        if (axiom == null) return "";

        if (axiom instanceof OWLClassAssertionAxiom) {
            OWLClassAssertionAxiom ca = (OWLClassAssertionAxiom) axiom;
            return getShortForm(ca.getClassExpression()) + "(" + getShortForm(ca.getIndividual()) + ")";
        }

        if (axiom instanceof OWLObjectPropertyAssertionAxiom) {
            OWLObjectPropertyAssertionAxiom opa = (OWLObjectPropertyAssertionAxiom) axiom;
            return getShortForm(opa.getProperty())
                    + "(" + getShortForm(opa.getSubject()) + ", " + getShortForm(opa.getObject()) + ")";
        }

        if (axiom instanceof OWLNegativeObjectPropertyAssertionAxiom) {
            OWLNegativeObjectPropertyAssertionAxiom npa = (OWLNegativeObjectPropertyAssertionAxiom) axiom;
            return "not " + getShortForm(npa.getProperty())
                    + "(" + getShortForm(npa.getSubject()) + ", " + getShortForm(npa.getObject()) + ")";
        }

        if (axiom instanceof OWLSubClassOfAxiom) {
            OWLSubClassOfAxiom sca = (OWLSubClassOfAxiom) axiom;
            return getShortForm(sca.getSubClass()) + " SubClassOf " + getShortForm(sca.getSuperClass());
        }

        return axiom.toString();
    }

    /**
     * Format a set of axioms, one per entry, for debug output
     */
    public static String formatAxioms(Collection<? extends OWLAxiom> axioms) {
        return axioms.stream()
                .map(OntologyUtils::formatAxiom)
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
