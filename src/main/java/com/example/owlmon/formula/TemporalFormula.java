package com.example.owlmon.formula;

import com.example.owlmon.automaton.Symbol;
import com.example.owlmon.monitoring.UnknownPropositionException;
import org.semanticweb.owlapi.apibinding.OWLManager;
import org.semanticweb.owlapi.model.IRI;
import org.semanticweb.owlapi.model.OWLAxiom;
import org.semanticweb.owlapi.model.OWLDataFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An ALC-LTL formula: an LTL formula over propositional atoms, each atom standing for an OWL
 * axiom.
 * <p>
 * The translation map sends every atom {@code p} to its axiom and {@code !p} to the complement
 * of that axiom. It always contains {@link Symbol#SIGMA}, mapped to the tautology
 * {@code owl:Thing SubClassOf owl:Thing}. Rigid IRIs name concepts and roles whose
 * interpretation does not change over time.
 * <p>
 * Instances are immutable; combinators share the maps of their operands where possible.
 */
public final class TemporalFormula {

    private final String propositionalAbstraction;
    private final Map<String, OWLAxiom> translationMap;
    private final Set<IRI> rigidNames;

    public TemporalFormula(String propositionalAbstraction, Map<String, OWLAxiom> translationMap) {
        this(propositionalAbstraction, translationMap, Collections.emptySet());
    }

    public TemporalFormula(String propositionalAbstraction,
                           Map<String, OWLAxiom> translationMap,
                           Set<IRI> rigidNames) {
        this.propositionalAbstraction = Objects.requireNonNull(propositionalAbstraction, "propositionalAbstraction");
        Map<String, OWLAxiom> map = new LinkedHashMap<>(translationMap);
        map.putIfAbsent(Symbol.SIGMA, tautology());
        this.translationMap = Collections.unmodifiableMap(map);
        this.rigidNames = Collections.unmodifiableSet(new LinkedHashSet<>(rigidNames));
    }

    private TemporalFormula(String propositionalAbstraction,
                            Map<String, OWLAxiom> sharedTranslationMap,
                            Set<IRI> sharedRigidNames,
                            boolean shared) {
        this.propositionalAbstraction = propositionalAbstraction;
        this.translationMap = sharedTranslationMap;
        this.rigidNames = sharedRigidNames;
    }

    public static OWLAxiom tautology() {
        OWLDataFactory df = OWLManager.getOWLDataFactory();
        return df.getOWLSubClassOfAxiom(df.getOWLThing(), df.getOWLThing());
    }

    public String getPropositionalAbstraction() {
        return propositionalAbstraction;
    }

    public Map<String, OWLAxiom> getTranslationMap() {
        return translationMap;
    }

    public Set<IRI> getRigidNames() {
        return rigidNames;
    }

    public boolean hasRigidNames() {
        return !rigidNames.isEmpty();
    }

    /**
     * Atom names of the translation map, i.e. the non-negated keys other than the wildcard.
     */
    public Set<String> getAtoms() {
        Set<String> atoms = new LinkedHashSet<>();
        for (String key : translationMap.keySet()) {
            if (!Symbol.SIGMA.equals(key) && !Symbol.isNegated(key)) {
                atoms.add(key);
            }
        }
        return atoms;
    }

    public TemporalFormula getNegation() {
        return new TemporalFormula("!(" + propositionalAbstraction + ")", translationMap, rigidNames, true);
    }

    /**
     * Conjunction of this formula and {@code other}. Entries of {@code other}'s translation map win
     * on key collisions; rigid names are united.
     */
    public TemporalFormula getConjunction(TemporalFormula other) {
        Map<String, OWLAxiom> merged = new LinkedHashMap<>(translationMap);
        merged.putAll(other.translationMap);
        Set<IRI> mergedRigid = new LinkedHashSet<>(rigidNames);
        mergedRigid.addAll(other.rigidNames);
        return new TemporalFormula(
                "(" + propositionalAbstraction + ") && (" + other.propositionalAbstraction + ")",
                Collections.unmodifiableMap(merged),
                Collections.unmodifiableSet(mergedRigid),
                true);
    }

    /**
     * Copy of this formula whose translation map only keeps the given atoms, their negations and
     * the wildcard.
     */
    public TemporalFormula restrictedTo(Collection<String> atoms) {
        Map<String, OWLAxiom> restricted = new LinkedHashMap<>();
        translationMap.forEach((key, axiom) -> {
            if (Symbol.SIGMA.equals(key) || atoms.contains(Symbol.atomOf(key))) {
                restricted.put(key, axiom);
            }
        });
        return new TemporalFormula(propositionalAbstraction,
                Collections.unmodifiableMap(restricted), rigidNames, true);
    }

    /**
     * Axioms a symbol stands for.
     *
     * @throws UnknownPropositionException if a literal has no entry in the translation map
     */
    public Set<OWLAxiom> translate(Symbol symbol) {
        Set<OWLAxiom> axioms = new LinkedHashSet<>();
        for (String literal : symbol.getLiterals()) {
            OWLAxiom axiom = translationMap.get(literal);
            if (axiom == null) {
                throw new UnknownPropositionException(literal, propositionalAbstraction);
            }
            axioms.add(axiom);
        }
        return axioms;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TemporalFormula)) return false;
        TemporalFormula other = (TemporalFormula) obj;
        return propositionalAbstraction.equals(other.propositionalAbstraction)
                && translationMap.equals(other.translationMap)
                && rigidNames.equals(other.rigidNames);
    }

    @Override
    public int hashCode() {
        return Objects.hash(propositionalAbstraction, translationMap, rigidNames);
    }

    @Override
    public String toString() {
        return "TemporalFormula{" + propositionalAbstraction + ", atoms=" + getAtoms()
                + ", rigid=" + rigidNames.size() + "}";
    }
}
