package com.example.owlmon.reasoning;

import org.junit.jupiter.api.Test;
import org.semanticweb.owlapi.apibinding.OWLManager;
import org.semanticweb.owlapi.model.*;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OpenlletSatisfiabilityOracleTest {

    private static final String NS = "http://example.org/test#";

    private final OWLDataFactory df = OWLManager.getOWLDataFactory();
    private final OWLClass busy = df.getOWLClass(IRI.create(NS + "Busy"));
    private final OWLClass idle = df.getOWLClass(IRI.create(NS + "Idle"));
    private final OWLNamedIndividual server = df.getOWLNamedIndividual(IRI.create(NS + "server"));

    private final OpenlletSatisfiabilityOracle oracle = new OpenlletSatisfiabilityOracle();

    private final OWLAxiom isBusy = df.getOWLClassAssertionAxiom(busy, server);
    private final OWLAxiom isNotBusy = df.getOWLClassAssertionAxiom(df.getOWLObjectComplementOf(busy), server);

    @Test
    void emptySetIsSatisfiable() {
        assertTrue(oracle.isSatisfiable(Set.of()));
    }

    @Test
    void assertionAndComplementClash() {
        assertTrue(oracle.isSatisfiable(Set.of(isBusy)));
        assertFalse(oracle.isSatisfiable(Set.of(isBusy, isNotBusy)));
        assertEquals(2, oracle.getCheckCount());
    }

    @Test
    void usesTerminologicalAxioms() {
        Set<OWLAxiom> axioms = Set.of(
                df.getOWLDisjointClassesAxiom(busy, idle),
                isBusy,
                df.getOWLClassAssertionAxiom(idle, server));
        assertFalse(oracle.isSatisfiable(axioms));
    }

    @Test
    void flexibleNamesMayChangeBetweenTimePoints() {
        List<Set<OWLAxiom>> timePoints = List.of(Set.of(isBusy), Set.of(isNotBusy));
        assertTrue(oracle.isSatisfiable(timePoints, Set.of()));
    }

    @Test
    void rigidNamesKeepTheirMeaning() {
        List<Set<OWLAxiom>> timePoints = List.of(Set.of(isBusy), Set.of(isNotBusy));
        assertFalse(oracle.isSatisfiable(timePoints, Set.of(busy.getIRI())));
    }

    @Test
    void tautologyStaysSatisfiableAcrossTimePoints() {
        OWLAxiom tautology = df.getOWLSubClassOfAxiom(df.getOWLThing(), df.getOWLThing());
        assertTrue(oracle.isSatisfiable(List.of(Set.of(tautology), Set.of(tautology, isBusy)), Set.of()));
    }
}
