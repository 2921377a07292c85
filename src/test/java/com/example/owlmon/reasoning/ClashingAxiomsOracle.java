package com.example.owlmon.reasoning;

import org.semanticweb.owlapi.model.IRI;
import org.semanticweb.owlapi.model.OWLAxiom;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Oracle for tests: a set of axioms is unsatisfiable iff it contains a registered pair of
 * clashing axioms. For sequences, time points are checked together when rigid names are given
 * and one by one otherwise.
 */
public class ClashingAxiomsOracle implements SatisfiabilityOracle {

    private final Map<OWLAxiom, Set<OWLAxiom>> clashes = new HashMap<>();
    private final AtomicInteger singleChecks = new AtomicInteger();
    private final AtomicInteger sequenceChecks = new AtomicInteger();

    public ClashingAxiomsOracle clash(OWLAxiom first, OWLAxiom second) {
        clashes.computeIfAbsent(first, k -> new HashSet<>()).add(second);
        clashes.computeIfAbsent(second, k -> new HashSet<>()).add(first);
        return this;
    }

    @Override
    public boolean isSatisfiable(Set<OWLAxiom> axioms) {
        singleChecks.incrementAndGet();
        return consistent(axioms);
    }

    @Override
    public boolean isSatisfiable(List<Set<OWLAxiom>> timePoints, Set<IRI> rigidNames) {
        sequenceChecks.incrementAndGet();
        if (rigidNames.isEmpty()) {
            return timePoints.stream().allMatch(this::consistent);
        }
        Set<OWLAxiom> all = new HashSet<>();
        timePoints.forEach(all::addAll);
        return consistent(all);
    }

    private boolean consistent(Set<OWLAxiom> axioms) {
        for (OWLAxiom axiom : axioms) {
            Set<OWLAxiom> clashing = clashes.get(axiom);
            if (clashing != null && clashing.stream().anyMatch(axioms::contains)) {
                return false;
            }
        }
        return true;
    }

    public int getSingleChecks() {
        return singleChecks.get();
    }

    public int getSequenceChecks() {
        return sequenceChecks.get();
    }
}
