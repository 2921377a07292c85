package com.example.owlmon.ltl;

import com.example.owlmon.automaton.Symbol;

import java.util.Objects;

/**
 * One edge of a compiled Buechi automaton. The label is a conjunction of literals.
 */
public final class CompiledEdge {

    private final CompiledState source;
    private final Symbol label;
    private final CompiledState target;

    public CompiledEdge(CompiledState source, Symbol label, CompiledState target) {
        this.source = Objects.requireNonNull(source, "source");
        this.label = Objects.requireNonNull(label, "label");
        this.target = Objects.requireNonNull(target, "target");
    }

    public CompiledState getSource() { return source; }
    public Symbol getLabel() { return label; }
    public CompiledState getTarget() { return target; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CompiledEdge)) return false;
        CompiledEdge other = (CompiledEdge) obj;
        return source.equals(other.source) && label.equals(other.label) && target.equals(other.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, label, target);
    }

    @Override
    public String toString() {
        return source + " --" + label + "--> " + target;
    }
}
