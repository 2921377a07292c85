package com.example.owlmon.automaton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A Buechi automaton whose transitions are labelled with {@link Symbol}s.
 * <p>
 * States are identified by name. Internally names and symbols are interned into dense tables and
 * the transition relation is kept as one adjacency map per state index. The set of states is
 * implicit: every state that is initial, final or the end point of a transition belongs to the
 * automaton.
 * <p>
 * Instances are not thread-safe.
 */
public class LabelledAutomaton {

    private static final Logger LOGGER = LoggerFactory.getLogger(LabelledAutomaton.class);

    private final List<String> stateNames = new ArrayList<>();
    private final Map<String, Integer> stateIds = new HashMap<>();

    private final List<Symbol> symbols = new ArrayList<>();
    private final Map<Symbol, Integer> symbolIds = new HashMap<>();

    // state id -> symbol id -> destination state ids
    private final List<Map<Integer, Set<Integer>>> adjacency = new ArrayList<>();

    private final Set<Integer> initial = new LinkedHashSet<>();
    private final Set<Integer> finals = new LinkedHashSet<>();

    public void addInitialState(String state) {
        initial.add(intern(state));
    }

    public void addFinalState(String state) {
        finals.add(intern(state));
    }

    /**
     * Adds {@code destination} to the states reached from {@code source} by reading {@code symbol}.
     */
    public void addTransition(String source, Symbol symbol, String destination) {
        int src = intern(source);
        int dst = intern(destination);
        adjacency.get(src)
                .computeIfAbsent(internSymbol(symbol), k -> new LinkedHashSet<>())
                .add(dst);
    }

    public Set<String> initialStates() {
        return names(initial);
    }

    public Set<String> finalStates() {
        return names(finals);
    }

    public boolean isInitial(String state) {
        Integer id = stateIds.get(state);
        return id != null && initial.contains(id);
    }

    public boolean isFinal(String state) {
        Integer id = stateIds.get(state);
        return id != null && finals.contains(id);
    }

    /**
     * All states currently referenced by the automaton.
     */
    public Set<String> states() {
        Set<Integer> referenced = new HashSet<>(initial);
        referenced.addAll(finals);
        for (int id = 0; id < adjacency.size(); id++) {
            Map<Integer, Set<Integer>> out = adjacency.get(id);
            if (!out.isEmpty()) {
                referenced.add(id);
                out.values().forEach(referenced::addAll);
            }
        }
        Set<String> result = new LinkedHashSet<>();
        for (int id = 0; id < stateNames.size(); id++) {
            if (referenced.contains(id)) {
                result.add(stateNames.get(id));
            }
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * Read-only view of the transition relation: state, then symbol, then destination states.
     * States without outgoing transitions are absent.
     */
    public Map<String, Map<Symbol, Set<String>>> transitions() {
        Map<String, Map<Symbol, Set<String>>> view = new LinkedHashMap<>();
        for (int id = 0; id < adjacency.size(); id++) {
            if (!adjacency.get(id).isEmpty()) {
                view.put(stateNames.get(id), outgoing(id));
            }
        }
        return Collections.unmodifiableMap(view);
    }

    /**
     * Outgoing transitions of one state; empty if the state is unknown or has none.
     */
    public Map<Symbol, Set<String>> transitionsFrom(String state) {
        Integer id = stateIds.get(state);
        if (id == null) {
            return Collections.emptyMap();
        }
        return outgoing(id);
    }

    public int transitionCount() {
        int count = 0;
        for (Map<Integer, Set<Integer>> out : adjacency) {
            for (Set<Integer> destinations : out.values()) {
                count += destinations.size();
            }
        }
        return count;
    }

    /**
     * Removes every state that cannot lie on an accepting run.
     * <p>
     * A synthetic root pointing at the initial states is added and the strongly connected
     * components reachable from it are computed. A component is kept if it contains a final state
     * and admits a cycle (more than one state, or a self-loop), or if it has an edge into a kept
     * component. Initial and final states outside the kept components are dropped, as are
     * transitions leaving them; destination sets are restricted to kept states and labels left
     * without destinations disappear.
     */
    public void trim() {
        int root = stateNames.size();
        List<Set<Integer>> components = StronglyConnectedComponents.compute(
                root + 1, root, node -> node == root ? initial : successorsOf(node));

        Set<Integer> bad = new HashSet<>();
        Set<Integer> good = new HashSet<>();
        // components arrive successors-first, so everything an edge can reach is already settled
        for (Set<Integer> component : components) {
            if (component.contains(root)) {
                continue;
            }
            if (isAccepting(component) || escapesTo(component, bad)) {
                good.addAll(component);
            } else {
                bad.addAll(component);
            }
        }

        int before = states().size();

        initial.retainAll(good);
        finals.retainAll(good);
        for (int id = 0; id < adjacency.size(); id++) {
            Map<Integer, Set<Integer>> out = adjacency.get(id);
            if (!good.contains(id)) {
                out.clear();
                continue;
            }
            out.values().forEach(destinations -> destinations.retainAll(good));
            out.values().removeIf(Set::isEmpty);
        }

        LOGGER.debug("Trimmed automaton from {} to {} states ({} components)",
                before, good.size(), components.size() - 1);
    }

    /**
     * Deep copy with the same state names and symbols.
     */
    public LabelledAutomaton copy() {
        LabelledAutomaton copy = new LabelledAutomaton();
        initialStates().forEach(copy::addInitialState);
        finalStates().forEach(copy::addFinalState);
        transitions().forEach((source, out) ->
                out.forEach((symbol, destinations) ->
                        destinations.forEach(destination -> copy.addTransition(source, symbol, destination))));
        return copy;
    }

    private boolean isAccepting(Set<Integer> component) {
        boolean hasFinal = component.stream().anyMatch(finals::contains);
        if (!hasFinal) {
            return false;
        }
        if (component.size() == 1) {
            return hasSelfLoop(component.iterator().next());
        }
        return true;
    }

    private boolean escapesTo(Set<Integer> component, Set<Integer> bad) {
        for (int state : component) {
            for (Set<Integer> destinations : adjacency.get(state).values()) {
                for (int destination : destinations) {
                    if (!component.contains(destination) && !bad.contains(destination)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private boolean hasSelfLoop(int state) {
        return adjacency.get(state).values().stream().anyMatch(d -> d.contains(state));
    }

    private List<Integer> successorsOf(int state) {
        List<Integer> successors = new ArrayList<>();
        adjacency.get(state).values().forEach(successors::addAll);
        return successors;
    }

    private Map<Symbol, Set<String>> outgoing(int state) {
        Map<Symbol, Set<String>> out = new LinkedHashMap<>();
        adjacency.get(state).forEach((symbolId, destinations) ->
                out.put(symbols.get(symbolId), names(destinations)));
        return Collections.unmodifiableMap(out);
    }

    private Set<String> names(Set<Integer> ids) {
        Set<String> result = new LinkedHashSet<>();
        ids.forEach(id -> result.add(stateNames.get(id)));
        return Collections.unmodifiableSet(result);
    }

    private int intern(String state) {
        Integer id = stateIds.get(state);
        if (id == null) {
            id = stateNames.size();
            stateNames.add(state);
            stateIds.put(state, id);
            adjacency.add(new LinkedHashMap<>());
        }
        return id;
    }

    private int internSymbol(Symbol symbol) {
        Integer id = symbolIds.get(symbol);
        if (id == null) {
            id = symbols.size();
            symbols.add(symbol);
            symbolIds.put(symbol, id);
        }
        return id;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LabelledAutomaton)) return false;
        LabelledAutomaton other = (LabelledAutomaton) obj;
        return initialStates().equals(other.initialStates())
                && finalStates().equals(other.finalStates())
                && transitions().equals(other.transitions());
    }

    @Override
    public int hashCode() {
        return 31 * (31 * initialStates().hashCode() + finalStates().hashCode()) + transitions().hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Initial States:\n  ");
        sb.append(String.join("\n  ", initialStates()));
        sb.append("\n\nFinal States:\n  ");
        sb.append(String.join("\n  ", finalStates()));
        sb.append("\n\nTransitions:\n");
        transitions().forEach((source, out) -> out.forEach((symbol, destinations) ->
                sb.append("  ").append(source)
                        .append(" --").append(symbol).append("--> ")
                        .append(destinations).append('\n')));
        return sb.toString();
    }
}
