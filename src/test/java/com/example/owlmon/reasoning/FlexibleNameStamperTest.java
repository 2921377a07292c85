package com.example.owlmon.reasoning;

import org.junit.jupiter.api.Test;
import org.semanticweb.owlapi.apibinding.OWLManager;
import org.semanticweb.owlapi.model.*;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FlexibleNameStamperTest {

    private static final String NS = "http://example.org/test#";

    private final OWLDataFactory df = OWLManager.getOWLDataFactory();
    private final OWLClass busy = df.getOWLClass(IRI.create(NS + "Busy"));
    private final OWLClass server = df.getOWLClass(IRI.create(NS + "Server"));
    private final OWLObjectProperty serves = df.getOWLObjectProperty(IRI.create(NS + "serves"));
    private final OWLNamedIndividual a = df.getOWLNamedIndividual(IRI.create(NS + "a"));
    private final OWLNamedIndividual b = df.getOWLNamedIndividual(IRI.create(NS + "b"));

    private final FlexibleNameStamper stamper = new FlexibleNameStamper(df, Set.of(server.getIRI()));

    private OWLClass stamped(OWLClass cls, int time) {
        return df.getOWLClass(IRI.create(cls.getIRI() + "_t" + time));
    }

    @Test
    void stampsFlexibleClassesAndKeepsRigidOnes() {
        OWLAxiom axiom = df.getOWLClassAssertionAxiom(df.getOWLObjectIntersectionOf(busy, server), a);

        OWLAxiom result = stamper.stamp(axiom, 2);

        assertEquals(df.getOWLClassAssertionAxiom(df.getOWLObjectIntersectionOf(stamped(busy, 2), server), a),
                result);
    }

    @Test
    void stampsPropertiesInAssertionsAndRestrictions() {
        OWLObjectProperty servesAt1 = df.getOWLObjectProperty(IRI.create(NS + "serves_t1"));

        assertEquals(df.getOWLObjectPropertyAssertionAxiom(servesAt1, a, b),
                stamper.stamp(df.getOWLObjectPropertyAssertionAxiom(serves, a, b), 1));
        assertEquals(df.getOWLNegativeObjectPropertyAssertionAxiom(servesAt1, a, b),
                stamper.stamp(df.getOWLNegativeObjectPropertyAssertionAxiom(serves, a, b), 1));

        OWLAxiom restriction = df.getOWLSubClassOfAxiom(server,
                df.getOWLObjectSomeValuesFrom(df.getOWLObjectInverseOf(serves), df.getOWLObjectComplementOf(busy)));
        assertEquals(df.getOWLSubClassOfAxiom(server,
                        df.getOWLObjectSomeValuesFrom(df.getOWLObjectInverseOf(servesAt1),
                                df.getOWLObjectComplementOf(stamped(busy, 1)))),
                stamper.stamp(restriction, 1));
    }

    @Test
    void leavesBuiltInNamesAlone() {
        OWLAxiom tautology = df.getOWLSubClassOfAxiom(df.getOWLThing(), df.getOWLThing());
        assertEquals(tautology, stamper.stamp(tautology, 3));

        OWLObjectProperty top = df.getOWLTopObjectProperty();
        assertEquals(top, stamper.stampProperty(top, 3));
    }

    @Test
    void differentTimePointsGetDifferentNames() {
        OWLClassExpression first = stamper.stampClass(busy, 1);
        OWLClassExpression second = stamper.stampClass(busy, 2);
        assertNotEquals(first, second);
        assertEquals(stamped(busy, 1), first);
    }
}
