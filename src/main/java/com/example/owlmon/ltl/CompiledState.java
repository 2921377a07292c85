package com.example.owlmon.ltl;

import java.util.Objects;

/**
 * A state of a compiled Buechi automaton with its initial/final tags.
 */
public final class CompiledState {

    private final String label;
    private final boolean initial;
    private final boolean fin;

    public CompiledState(String label, boolean initial, boolean fin) {
        this.label = Objects.requireNonNull(label, "label");
        this.initial = initial;
        this.fin = fin;
    }

    public String getLabel() { return label; }
    public boolean isInitial() { return initial; }
    public boolean isFinal() { return fin; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CompiledState)) return false;
        CompiledState other = (CompiledState) obj;
        return label.equals(other.label) && initial == other.initial && fin == other.fin;
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, initial, fin);
    }

    @Override
    public String toString() {
        return label + (initial ? "[init]" : "") + (fin ? "[final]" : "");
    }
}
