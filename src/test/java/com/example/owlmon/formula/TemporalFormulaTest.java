package com.example.owlmon.formula;

import com.example.owlmon.automaton.Symbol;
import com.example.owlmon.monitoring.UnknownPropositionException;
import org.junit.jupiter.api.Test;
import org.semanticweb.owlapi.apibinding.OWLManager;
import org.semanticweb.owlapi.model.IRI;
import org.semanticweb.owlapi.model.OWLAxiom;
import org.semanticweb.owlapi.model.OWLDataFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TemporalFormulaTest {

    private static final String NS = "http://example.org/test#";

    private final OWLDataFactory df = OWLManager.getOWLDataFactory();

    private OWLAxiom member(String cls, String individual) {
        return df.getOWLClassAssertionAxiom(df.getOWLClass(IRI.create(NS + cls)),
                df.getOWLNamedIndividual(IRI.create(NS + individual)));
    }

    @Test
    void translationMapAlwaysKnowsTheWildcard() {
        TemporalFormula formula = new TemporalFormula("p", Map.of("p", member("C", "a")));

        assertEquals(TemporalFormula.tautology(), formula.getTranslationMap().get(Symbol.SIGMA));
        assertEquals(Set.of(TemporalFormula.tautology()), formula.translate(Symbol.sigma()));
        assertEquals(Set.of("p"), formula.getAtoms());
        assertFalse(formula.hasRigidNames());
    }

    @Test
    void explicitWildcardEntryIsKept() {
        OWLAxiom custom = member("Top", "a");
        TemporalFormula formula = new TemporalFormula("p", Map.of(Symbol.SIGMA, custom));
        assertEquals(custom, formula.getTranslationMap().get(Symbol.SIGMA));
    }

    @Test
    void negationWrapsTheFormulaAndKeepsItsMap() {
        TemporalFormula formula = new TemporalFormula("G p", Map.of("p", member("C", "a")),
                Set.of(IRI.create(NS + "C")));

        TemporalFormula negation = formula.getNegation();

        assertEquals("!(G p)", negation.getPropositionalAbstraction());
        assertEquals(formula.getTranslationMap(), negation.getTranslationMap());
        assertEquals(formula.getRigidNames(), negation.getRigidNames());
    }

    @Test
    void conjunctionPrefersTheSecondOperandOnCollisions() {
        OWLAxiom first = member("C", "a");
        OWLAxiom second = member("D", "a");
        TemporalFormula left = new TemporalFormula("p", Map.of("p", first, "q", member("Q", "a")),
                Set.of(IRI.create(NS + "C")));
        TemporalFormula right = new TemporalFormula("F p", Map.of("p", second),
                Set.of(IRI.create(NS + "D")));

        TemporalFormula conjunction = left.getConjunction(right);

        assertEquals("(p) && (F p)", conjunction.getPropositionalAbstraction());
        assertEquals(second, conjunction.getTranslationMap().get("p"));
        assertTrue(conjunction.getTranslationMap().containsKey("q"));
        assertEquals(Set.of(IRI.create(NS + "C"), IRI.create(NS + "D")), conjunction.getRigidNames());
    }

    @Test
    void restrictionKeepsAtomsNegationsAndWildcard() {
        TemporalFormula formula = new TemporalFormula("p", Map.of(
                "p", member("C", "a"), "!p", member("D", "a"),
                "q", member("E", "a"), "!q", member("F", "a")));

        TemporalFormula restricted = formula.restrictedTo(List.of("p"));

        assertEquals(Set.of("p", "!p", Symbol.SIGMA), restricted.getTranslationMap().keySet());
        assertEquals(Set.of("p"), restricted.getAtoms());
    }

    @Test
    void translateUnionsTheLiteralAxioms() {
        TemporalFormula formula = new TemporalFormula("p && !q", Map.of(
                "p", member("C", "a"), "!q", member("D", "b")));

        assertEquals(Set.of(member("C", "a"), member("D", "b")), formula.translate(Symbol.of("p", "!q")));
        assertTrue(formula.translate(Symbol.empty()).isEmpty());
    }

    @Test
    void translateRejectsUnknownLiterals() {
        TemporalFormula formula = new TemporalFormula("p", Map.of("p", member("C", "a")));

        UnknownPropositionException e = assertThrows(UnknownPropositionException.class,
                () -> formula.translate(Symbol.of("p", "!p")));
        assertEquals("!p", e.getLiteral());
    }

    @Test
    void mapIsReadOnly() {
        TemporalFormula formula = new TemporalFormula("p", Map.of("p", member("C", "a")));
        assertThrows(UnsupportedOperationException.class,
                () -> formula.getTranslationMap().put("q", member("D", "a")));
    }
}
