package com.example.owlmon.automaton;

import com.example.owlmon.formula.TemporalFormula;
import org.semanticweb.owlapi.model.OWLAxiom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The set of symbols read on the way to a state of the rigid-name product. Two histories with
 * the same symbols are equal regardless of how they were built.
 */
final class History {

    private static final History EMPTY = new History(new TreeSet<>());

    private final SortedSet<Symbol> symbols;

    private History(TreeSet<Symbol> symbols) {
        this.symbols = Collections.unmodifiableSortedSet(symbols);
    }

    static History empty() {
        return EMPTY;
    }

    History with(Symbol symbol) {
        if (symbols.contains(symbol)) {
            return this;
        }
        TreeSet<Symbol> extended = new TreeSet<>(symbols);
        extended.add(symbol);
        return new History(extended);
    }

    /**
     * One axiom set per symbol, in canonical order, each extended by the global context.
     */
    List<Set<OWLAxiom>> toTimePoints(TemporalFormula formula, Set<OWLAxiom> globalContext) {
        List<Set<OWLAxiom>> timePoints = new ArrayList<>(symbols.size());
        for (Symbol symbol : symbols) {
            Set<OWLAxiom> axioms = new LinkedHashSet<>(formula.translate(symbol));
            axioms.addAll(globalContext);
            timePoints.add(axioms);
        }
        return timePoints;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof History)) return false;
        return symbols.equals(((History) obj).symbols);
    }

    @Override
    public int hashCode() {
        return symbols.hashCode();
    }

    @Override
    public String toString() {
        return symbols.toString();
    }
}
