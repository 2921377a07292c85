package com.example.owlmon.reasoning;

import org.semanticweb.owlapi.model.IRI;
import org.semanticweb.owlapi.model.OWLAxiom;

import java.util.List;
import java.util.Set;

/**
 * Decides joint satisfiability of OWL axioms.
 */
public interface SatisfiabilityOracle {

    /**
     * Check if a set of axioms has a model
     */
    boolean isSatisfiable(Set<OWLAxiom> axioms);

    /**
     * Check if a sequence of axiom sets, one per time point, has a common model in which the
     * rigid names are interpreted the same way at every time point and all other names may
     * change between time points.
     */
    boolean isSatisfiable(List<Set<OWLAxiom>> timePoints, Set<IRI> rigidNames);
}
