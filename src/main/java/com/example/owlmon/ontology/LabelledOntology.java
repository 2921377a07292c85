package com.example.owlmon.ontology;

import com.example.owlmon.formula.LtlFormulas;
import com.example.owlmon.formula.TemporalFormula;
import org.semanticweb.owlapi.model.IRI;
import org.semanticweb.owlapi.model.OWLAxiom;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Propositions read from a labelled ontology: the translation map from proposition names (and
 * their {@code !}-negations) to axioms, and the IRIs declared rigid.
 */
public class LabelledOntology {

    private final Map<String, OWLAxiom> translationMap;
    private final Set<IRI> rigidNames;

    public LabelledOntology(Map<String, OWLAxiom> translationMap, Set<IRI> rigidNames) {
        this.translationMap = Collections.unmodifiableMap(new LinkedHashMap<>(translationMap));
        this.rigidNames = Collections.unmodifiableSet(new LinkedHashSet<>(rigidNames));
    }

    public Map<String, OWLAxiom> getTranslationMap() {
        return translationMap;
    }

    public Set<IRI> getRigidNames() {
        return rigidNames;
    }

    /**
     * Formula over these propositions. With {@code restrict} set, the translation map only keeps
     * the atoms occurring in the formula, which keeps automaton completion small.
     */
    public TemporalFormula formula(String propositionalAbstraction, boolean restrict) {
        TemporalFormula formula = new TemporalFormula(propositionalAbstraction, translationMap, rigidNames);
        if (restrict) {
            return formula.restrictedTo(LtlFormulas.atomsOf(propositionalAbstraction));
        }
        return formula;
    }

    @Override
    public String toString() {
        return String.format("LabelledOntology{propositions=%d, rigidNames=%d}",
                translationMap.size(), rigidNames.size());
    }
}
