package com.example.owlmon.monitoring;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Snapshot of the live states of a monitor: those of the automaton for the formula and those of
 * the automaton for its negation.
 */
public final class MonitorState {

    private final Set<String> formulaStates;
    private final Set<String> negationStates;

    public MonitorState(Set<String> formulaStates, Set<String> negationStates) {
        this.formulaStates = Collections.unmodifiableSet(new LinkedHashSet<>(formulaStates));
        this.negationStates = Collections.unmodifiableSet(new LinkedHashSet<>(negationStates));
    }

    public Set<String> getFormulaStates() {
        return formulaStates;
    }

    public Set<String> getNegationStates() {
        return negationStates;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MonitorState)) return false;
        MonitorState other = (MonitorState) obj;
        return formulaStates.equals(other.formulaStates) && negationStates.equals(other.negationStates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(formulaStates, negationStates);
    }

    @Override
    public String toString() {
        return "(" + formulaStates + ", " + negationStates + ")";
    }
}
