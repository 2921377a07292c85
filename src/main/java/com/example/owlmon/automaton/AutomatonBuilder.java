package com.example.owlmon.automaton;

import com.example.owlmon.MonitoringException;
import com.example.owlmon.formula.TemporalFormula;
import com.example.owlmon.ltl.CompiledEdge;
import com.example.owlmon.ltl.CompiledState;
import com.example.owlmon.ltl.LtlCompiler;
import com.example.owlmon.reasoning.SatisfiabilityOracle;
import org.semanticweb.owlapi.model.OWLAxiom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Builds the Buechi automaton of an ALC-LTL formula.
 * <p>
 * The propositional abstraction is compiled by an {@link LtlCompiler}; an edge survives iff the
 * axioms of its label, together with the global context, are satisfiable. Formulas with rigid
 * names additionally go through {@link #respectRigidNames}, which keeps only runs whose labels
 * are jointly satisfiable with the rigid names fixed over time.
 * <p>
 * Edge checks are independent of each other. If an executor is given they run on it and their
 * results are merged back in edge order, so the resulting automaton does not depend on
 * scheduling. Exceptions of the compiler and the oracle are passed through unchanged.
 */
public class AutomatonBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(AutomatonBuilder.class);

    public static final int DEFAULT_MAX_PRODUCT_STATES = 1_000_000;

    private final LtlCompiler compiler;
    private final SatisfiabilityOracle oracle;
    private final ExecutorService executor;
    private final int maxProductStates;

    public AutomatonBuilder(LtlCompiler compiler, SatisfiabilityOracle oracle) {
        this(compiler, oracle, null, DEFAULT_MAX_PRODUCT_STATES);
    }

    /**
     * @param executor         runs edge checks in parallel; {@code null} checks sequentially
     * @param maxProductStates upper bound on the states of a rigid-name product
     */
    public AutomatonBuilder(LtlCompiler compiler, SatisfiabilityOracle oracle,
                            ExecutorService executor, int maxProductStates) {
        this.compiler = compiler;
        this.oracle = oracle;
        this.executor = executor;
        this.maxProductStates = maxProductStates;
    }

    public LabelledAutomaton build(TemporalFormula formula) {
        return build(formula, Collections.emptySet());
    }

    /**
     * @param globalContext axioms holding at every point in time; may be {@code null}
     */
    public LabelledAutomaton build(TemporalFormula formula, Set<OWLAxiom> globalContext) {
        Set<OWLAxiom> global = globalContext == null ? Collections.emptySet() : globalContext;
        boolean complete = formula.hasRigidNames();

        List<CompiledEdge> edges = compiler.compile(formula.getPropositionalAbstraction());
        LOGGER.debug("Compiled '{}' into {} edges", formula.getPropositionalAbstraction(), edges.size());

        Set<String> alphabet = formula.getAtoms();
        List<Callable<List<Symbol>>> checks = new ArrayList<>(edges.size());
        for (CompiledEdge edge : edges) {
            checks.add(() -> checkEdge(edge.getLabel(), formula, global, complete ? alphabet : null));
        }
        List<List<Symbol>> results = runAll(checks);

        LabelledAutomaton automaton = new LabelledAutomaton();
        int kept = 0;
        for (int i = 0; i < edges.size(); i++) {
            List<Symbol> labels = results.get(i);
            if (labels == null) {
                continue;
            }
            kept++;
            CompiledEdge edge = edges.get(i);
            String source = edge.getSource().getLabel();
            String target = edge.getTarget().getLabel();
            for (Symbol label : labels) {
                automaton.addTransition(source, label, target);
            }
            markState(automaton, edge.getSource());
            markState(automaton, edge.getTarget());
        }
        LOGGER.debug("Kept {} of {} edges", kept, edges.size());

        if (complete) {
            return respectRigidNames(automaton, formula, global);
        }
        return automaton;
    }

    /**
     * Product of {@code automaton} with the histories of symbols read so far. A state
     * {@code (q, H)} is named {@code q-<id of H>}; an edge reading {@code s} is kept iff the
     * histories {@code H + s}, one time point per symbol, are jointly satisfiable with the rigid
     * names of {@code formula} shared across time points. Finality is inherited from {@code q}.
     *
     * @param globalContext axioms holding at every point in time; may be {@code null}
     */
    public LabelledAutomaton respectRigidNames(LabelledAutomaton automaton,
                                               TemporalFormula formula,
                                               Set<OWLAxiom> globalContext) {
        Set<OWLAxiom> global = globalContext == null ? Collections.emptySet() : globalContext;
        LabelledAutomaton product = new LabelledAutomaton();

        Map<History, Integer> historyIds = new HashMap<>();
        historyIds.put(History.empty(), 0);
        Set<String> expanded = new HashSet<>();
        Deque<ProductState> work = new ArrayDeque<>();

        List<String> initialStates = new ArrayList<>(automaton.initialStates());
        for (String state : initialStates) {
            product.addInitialState(productName(state, History.empty(), historyIds));
        }
        for (int i = initialStates.size() - 1; i >= 0; i--) {
            work.push(new ProductState(initialStates.get(i), History.empty()));
        }

        while (!work.isEmpty()) {
            ProductState current = work.pop();
            String source = productName(current.state, current.history, historyIds);
            if (!expanded.add(source)) {
                continue;
            }
            if (expanded.size() > maxProductStates) {
                throw new MonitoringException("Rigid-name product of '" + formula.getPropositionalAbstraction()
                        + "' exceeds " + maxProductStates + " states");
            }

            if (automaton.isFinal(current.state)) {
                product.addFinalState(source);
            }

            List<ProductState> successors = new ArrayList<>();
            for (Map.Entry<Symbol, Set<String>> transition : automaton.transitionsFrom(current.state).entrySet()) {
                Symbol symbol = transition.getKey();
                History candidate = current.history.with(symbol);
                if (!oracle.isSatisfiable(candidate.toTimePoints(formula, global), formula.getRigidNames())) {
                    continue;
                }
                for (String destination : transition.getValue()) {
                    product.addTransition(source, symbol, productName(destination, candidate, historyIds));
                    successors.add(new ProductState(destination, candidate));
                }
            }
            for (int i = successors.size() - 1; i >= 0; i--) {
                work.push(successors.get(i));
            }
        }

        LOGGER.info("Rigid-name product: {} states, {} histories, {} transitions",
                expanded.size(), historyIds.size(), product.transitionCount());
        return product;
    }

    /**
     * All extensions of {@code symbol} that fix a sign for every atom of {@code alphabet} the
     * symbol does not mention. The wildcard is dropped from the extensions.
     */
    static List<Symbol> completions(Symbol symbol, Set<String> alphabet) {
        Set<String> mentioned = symbol.atoms();
        List<String> free = new ArrayList<>();
        for (String atom : alphabet) {
            if (!mentioned.contains(atom)) {
                free.add(atom);
            }
        }

        List<List<String>> assignments = new ArrayList<>();
        assignments.add(new ArrayList<>());
        for (String atom : free) {
            List<List<String>> next = new ArrayList<>(assignments.size() * 2);
            for (List<String> assignment : assignments) {
                List<String> positive = new ArrayList<>(assignment);
                positive.add(atom);
                List<String> negative = new ArrayList<>(assignment);
                negative.add(Symbol.negate(atom));
                next.add(positive);
                next.add(negative);
            }
            assignments = next;
        }

        Symbol base = symbol.without(Symbol.SIGMA);
        Set<Symbol> completions = new LinkedHashSet<>();
        for (List<String> assignment : assignments) {
            completions.add(base.with(assignment));
        }
        return new ArrayList<>(completions);
    }

    /**
     * @param alphabet atoms to complete over, or {@code null} to keep the label as it is
     * @return the labels to add for this edge, or {@code null} if the edge is dropped
     */
    private List<Symbol> checkEdge(Symbol label, TemporalFormula formula, Set<OWLAxiom> global, Set<String> alphabet) {
        Set<OWLAxiom> axioms = new LinkedHashSet<>(formula.translate(label));
        axioms.addAll(global);
        if (!oracle.isSatisfiable(axioms)) {
            return null;
        }
        if (alphabet == null) {
            return List.of(label);
        }

        List<Symbol> labels = new ArrayList<>();
        for (Symbol completion : completions(label, alphabet)) {
            Set<OWLAxiom> completed = new LinkedHashSet<>(axioms);
            completed.addAll(formula.translate(completion));
            if (oracle.isSatisfiable(completed)) {
                labels.add(completion);
            }
        }
        return labels;
    }

    private <T> List<T> runAll(List<Callable<T>> tasks) {
        List<T> results = new ArrayList<>(tasks.size());
        if (executor == null) {
            for (Callable<T> task : tasks) {
                try {
                    results.add(task.call());
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new MonitoringException("Edge check failed", e);
                }
            }
            return results;
        }

        try {
            for (Future<T> future : executor.invokeAll(tasks)) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MonitoringException("Interrupted while checking edges", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new MonitoringException("Edge check failed", cause);
        }
        return results;
    }

    private static void markState(LabelledAutomaton automaton, CompiledState state) {
        if (state.isInitial()) {
            automaton.addInitialState(state.getLabel());
        }
        if (state.isFinal()) {
            automaton.addFinalState(state.getLabel());
        }
    }

    private static String productName(String state, History history, Map<History, Integer> historyIds) {
        Integer id = historyIds.get(history);
        if (id == null) {
            id = historyIds.size();
            historyIds.put(history, id);
        }
        return state + "-" + id;
    }

    private static final class ProductState {
        private final String state;
        private final History history;

        private ProductState(String state, History history) {
            this.state = state;
            this.history = history;
        }
    }
}
