package com.example.owlmon.monitoring;

import com.example.owlmon.automaton.AutomatonBuilder;
import com.example.owlmon.automaton.LabelledAutomaton;
import com.example.owlmon.automaton.Symbol;
import com.example.owlmon.formula.TemporalFormula;
import com.example.owlmon.reasoning.SatisfiabilityOracle;
import org.semanticweb.owlapi.model.OWLAxiom;
import org.semanticweb.owlapi.model.OWLOntology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Monitor for an ALC-LTL formula over a trace of observations.
 * <p>
 * Two trimmed Buechi automata are built, one for the formula and one for its negation, both
 * conjoined with the optional constraint formula. Each observation advances the live state sets
 * of both automata. If the formula automaton has no live state left the formula is violated by
 * every continuation; if the negation automaton has none the formula is satisfied by every
 * continuation. Decided verdicts never change again.
 * <p>
 * The global context restricts the automata when they are built. A step only checks the
 * transition labels against the observation, unless the monitor is asked to check the global
 * context on every step as well.
 * <p>
 * A monitor is not thread-safe; {@link #step} must be called once per time point, in order.
 */
public class Monitor {

    private static final Logger LOGGER = LoggerFactory.getLogger(Monitor.class);

    private final TemporalFormula formula;
    private final TemporalFormula formulaAutomatonSource;
    private final TemporalFormula negationAutomatonSource;
    private final Set<OWLAxiom> globalContext;
    private final SatisfiabilityOracle oracle;
    private final boolean globalContextInSteps;

    private final LabelledAutomaton formulaAutomaton;
    private final LabelledAutomaton negationAutomaton;

    private Set<String> formulaStates;
    private Set<String> negationStates;
    private long stepCount;

    public Monitor(TemporalFormula formula, AutomatonBuilder builder, SatisfiabilityOracle oracle) {
        this(formula, null, null, builder, oracle);
    }

    /**
     * @param formula       the formula to monitor
     * @param globalContext axioms holding at every point in time; may be {@code null}
     * @param constraints   formula assumed to hold on the trace; may be {@code null}
     * @param builder       builds the automata
     * @param oracle        decides which transitions an observation enables
     */
    public Monitor(TemporalFormula formula,
                   Set<OWLAxiom> globalContext,
                   TemporalFormula constraints,
                   AutomatonBuilder builder,
                   SatisfiabilityOracle oracle) {
        this(formula, globalContext, constraints, builder, oracle, false);
    }

    /**
     * @param globalContextInSteps also add the global context to the axioms checked on every step
     */
    public Monitor(TemporalFormula formula,
                   Set<OWLAxiom> globalContext,
                   TemporalFormula constraints,
                   AutomatonBuilder builder,
                   SatisfiabilityOracle oracle,
                   boolean globalContextInSteps) {
        this.formula = formula;
        this.globalContextInSteps = globalContextInSteps;
        this.globalContext = globalContext == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(globalContext));
        this.oracle = oracle;

        TemporalFormula negation = formula.getNegation();
        this.formulaAutomatonSource = constraints == null ? formula : formula.getConjunction(constraints);
        this.negationAutomatonSource = constraints == null ? negation : negation.getConjunction(constraints);

        this.formulaAutomaton = buildTrimmed(builder, formulaAutomatonSource, "formula");
        this.negationAutomaton = buildTrimmed(builder, negationAutomatonSource, "negation");

        this.formulaStates = formulaAutomaton.initialStates();
        this.negationStates = negationAutomaton.initialStates();
        LOGGER.info("Monitor for '{}' ready, initial verdict {}",
                formula.getPropositionalAbstraction(), describeVerdict());
    }

    /**
     * Reads the next observation.
     *
     * @throws MonitorInvariantException if the observation leaves neither automaton a live state;
     *                                   the monitor then keeps its previous state
     */
    public void step(Set<OWLAxiom> observation) {
        Set<String> nextFormulaStates = successors(formulaAutomaton, formulaAutomatonSource, formulaStates, observation);
        Set<String> nextNegationStates = successors(negationAutomaton, negationAutomatonSource, negationStates, observation);

        if (nextFormulaStates.isEmpty() && nextNegationStates.isEmpty()) {
            throw new MonitorInvariantException("Observation " + (stepCount + 1)
                    + " is inconsistent with both '" + formula.getPropositionalAbstraction() + "' and its negation");
        }

        Verdict before = verdict();
        formulaStates = Collections.unmodifiableSet(nextFormulaStates);
        negationStates = Collections.unmodifiableSet(nextNegationStates);
        stepCount++;

        Verdict after = verdict();
        if (before != after) {
            LOGGER.info("Verdict changed from {} to {} after {} observations", before, after, stepCount);
        } else {
            LOGGER.debug("Step {}: {} / {} live states, verdict {}",
                    stepCount, formulaStates.size(), negationStates.size(), after);
        }
    }

    public void step(OWLOntology observation) {
        step(observation.axioms().collect(Collectors.toSet()));
    }

    /**
     * @throws MonitorInvariantException if both live state sets are empty
     */
    public Verdict verdict() {
        if (formulaStates.isEmpty() && negationStates.isEmpty()) {
            throw new MonitorInvariantException("Neither '" + formula.getPropositionalAbstraction()
                    + "' nor its negation has a run left");
        }
        if (formulaStates.isEmpty()) {
            return Verdict.FALSE;
        }
        if (negationStates.isEmpty()) {
            return Verdict.TRUE;
        }
        return Verdict.UNDECIDED;
    }

    public MonitorState currentStatePair() {
        return new MonitorState(formulaStates, negationStates);
    }

    public long getStepCount() {
        return stepCount;
    }

    public TemporalFormula getFormula() {
        return formula;
    }

    public int getFormulaAutomatonSize() {
        return formulaAutomaton.states().size();
    }

    public int getNegationAutomatonSize() {
        return negationAutomaton.states().size();
    }

    private Set<String> successors(LabelledAutomaton automaton,
                                   TemporalFormula source,
                                   Set<String> states,
                                   Set<OWLAxiom> observation) {
        Map<Symbol, Boolean> enabled = new HashMap<>();
        Set<String> successors = new LinkedHashSet<>();
        for (String state : states) {
            for (Map.Entry<Symbol, Set<String>> transition : automaton.transitionsFrom(state).entrySet()) {
                Symbol symbol = transition.getKey();
                Boolean allowed = enabled.get(symbol);
                if (allowed == null) {
                    Set<OWLAxiom> axioms = new LinkedHashSet<>(source.translate(symbol));
                    if (globalContextInSteps) {
                        axioms.addAll(globalContext);
                    }
                    axioms.addAll(observation);
                    allowed = oracle.isSatisfiable(axioms);
                    enabled.put(symbol, allowed);
                }
                if (allowed) {
                    successors.addAll(transition.getValue());
                }
            }
        }
        return successors;
    }

    private LabelledAutomaton buildTrimmed(AutomatonBuilder builder, TemporalFormula source, String role) {
        long start = System.currentTimeMillis();
        LabelledAutomaton automaton = builder.build(source, globalContext);
        long built = System.currentTimeMillis();
        LOGGER.info("Built {} automaton with {} states in {} ms", role, automaton.states().size(), built - start);

        automaton.trim();
        LOGGER.info("Trimmed {} automaton to {} states in {} ms", role, automaton.states().size(),
                System.currentTimeMillis() - built);
        return automaton;
    }

    private String describeVerdict() {
        if (formulaStates.isEmpty() && negationStates.isEmpty()) {
            return "none (no run left)";
        }
        return verdict().name();
    }
}
