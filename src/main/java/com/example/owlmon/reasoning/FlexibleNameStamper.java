package com.example.owlmon.reasoning;

import org.semanticweb.owlapi.model.*;

import java.util.Set;

/**
 * Renames the flexible (non-rigid) concept and role names of an axiom apart for one time point.
 * <p>
 * A name {@code n} becomes {@code n_t<k>} at time point {@code k}; rigid and built-in names are
 * left alone. Handled axioms are class assertions, (negative) object property assertions and
 * subclass axioms; handled class expressions are named classes, existential and universal
 * restrictions, complements, intersections and unions. Anything else is returned unchanged.
 */
public class FlexibleNameStamper {

    static final String STAMP_SEPARATOR = "_t";

    private final OWLDataFactory dataFactory;
    private final Set<IRI> rigidNames;

    public FlexibleNameStamper(OWLDataFactory dataFactory, Set<IRI> rigidNames) {
        this.dataFactory = dataFactory;
        this.rigidNames = rigidNames;
    }

    public OWLAxiom stamp(OWLAxiom axiom, int timePoint) {
        // C(a)
        if (axiom instanceof OWLClassAssertionAxiom) {
            OWLClassAssertionAxiom ax = (OWLClassAssertionAxiom) axiom;
            return dataFactory.getOWLClassAssertionAxiom(
                    stampClass(ax.getClassExpression(), timePoint),
                    ax.getIndividual());
        }

        // not r(a,b)
        if (axiom instanceof OWLNegativeObjectPropertyAssertionAxiom) {
            OWLNegativeObjectPropertyAssertionAxiom ax = (OWLNegativeObjectPropertyAssertionAxiom) axiom;
            return dataFactory.getOWLNegativeObjectPropertyAssertionAxiom(
                    stampProperty(ax.getProperty(), timePoint),
                    ax.getSubject(),
                    ax.getObject());
        }

        // r(a,b)
        if (axiom instanceof OWLObjectPropertyAssertionAxiom) {
            OWLObjectPropertyAssertionAxiom ax = (OWLObjectPropertyAssertionAxiom) axiom;
            return dataFactory.getOWLObjectPropertyAssertionAxiom(
                    stampProperty(ax.getProperty(), timePoint),
                    ax.getSubject(),
                    ax.getObject());
        }

        // C SubClassOf D
        if (axiom instanceof OWLSubClassOfAxiom) {
            OWLSubClassOfAxiom ax = (OWLSubClassOfAxiom) axiom;
            return dataFactory.getOWLSubClassOfAxiom(
                    stampClass(ax.getSubClass(), timePoint),
                    stampClass(ax.getSuperClass(), timePoint));
        }

        return axiom;
    }

    OWLClassExpression stampClass(OWLClassExpression expression, int timePoint) {
        if (expression instanceof OWLClass) {
            OWLClass c = (OWLClass) expression;
            if (c.isBuiltIn()) {
                return c;
            }
            return dataFactory.getOWLClass(stampIri(c.getIRI(), timePoint));
        }

        if (expression instanceof OWLObjectAllValuesFrom) {
            OWLObjectAllValuesFrom c = (OWLObjectAllValuesFrom) expression;
            return dataFactory.getOWLObjectAllValuesFrom(
                    stampProperty(c.getProperty(), timePoint),
                    stampClass(c.getFiller(), timePoint));
        }

        if (expression instanceof OWLObjectSomeValuesFrom) {
            OWLObjectSomeValuesFrom c = (OWLObjectSomeValuesFrom) expression;
            return dataFactory.getOWLObjectSomeValuesFrom(
                    stampProperty(c.getProperty(), timePoint),
                    stampClass(c.getFiller(), timePoint));
        }

        if (expression instanceof OWLObjectComplementOf) {
            OWLObjectComplementOf c = (OWLObjectComplementOf) expression;
            return dataFactory.getOWLObjectComplementOf(stampClass(c.getOperand(), timePoint));
        }

        if (expression instanceof OWLObjectIntersectionOf) {
            OWLObjectIntersectionOf c = (OWLObjectIntersectionOf) expression;
            return dataFactory.getOWLObjectIntersectionOf(
                    c.operands().map(operand -> stampClass(operand, timePoint)));
        }

        if (expression instanceof OWLObjectUnionOf) {
            OWLObjectUnionOf c = (OWLObjectUnionOf) expression;
            return dataFactory.getOWLObjectUnionOf(
                    c.operands().map(operand -> stampClass(operand, timePoint)));
        }

        return expression;
    }

    OWLObjectPropertyExpression stampProperty(OWLObjectPropertyExpression expression, int timePoint) {
        if (expression instanceof OWLObjectInverseOf) {
            OWLObjectProperty named = expression.getNamedProperty();
            return dataFactory.getOWLObjectInverseOf(stampNamedProperty(named, timePoint));
        }

        if (expression instanceof OWLObjectProperty) {
            return stampNamedProperty((OWLObjectProperty) expression, timePoint);
        }

        return expression;
    }

    private OWLObjectProperty stampNamedProperty(OWLObjectProperty property, int timePoint) {
        if (property.isBuiltIn()) {
            return property;
        }
        return dataFactory.getOWLObjectProperty(stampIri(property.getIRI(), timePoint));
    }

    private IRI stampIri(IRI iri, int timePoint) {
        if (rigidNames.contains(iri)) {
            return iri;
        }
        return IRI.create(iri.toString() + STAMP_SEPARATOR + timePoint);
    }
}
