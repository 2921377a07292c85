package com.example.owlmon.automaton;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A transition label: a finite set of signed literals.
 * <p>
 * A literal is an atom name ({@code p}), a negated atom name ({@code !p}) or the
 * wildcard {@link #SIGMA}. Two symbols are equal iff they contain the same literals.
 */
public final class Symbol implements Comparable<Symbol> {

    /** Literal that matches every observation. */
    public static final String SIGMA = "<SIGMA>";

    public static final String NEGATION_PREFIX = "!";

    private static final Symbol EMPTY = new Symbol(new TreeSet<>());

    private final SortedSet<String> literals;

    private Symbol(TreeSet<String> literals) {
        this.literals = Collections.unmodifiableSortedSet(literals);
    }

    public static Symbol of(String... literals) {
        return of(Arrays.asList(literals));
    }

    public static Symbol of(Collection<String> literals) {
        if (literals.isEmpty()) {
            return EMPTY;
        }
        return new Symbol(new TreeSet<>(literals));
    }

    public static Symbol empty() {
        return EMPTY;
    }

    public static Symbol sigma() {
        return of(SIGMA);
    }

    public SortedSet<String> getLiterals() {
        return literals;
    }

    public boolean isEmpty() {
        return literals.isEmpty();
    }

    public boolean contains(String literal) {
        return literals.contains(literal);
    }

    /**
     * Atom names this symbol talks about, with negation stripped. The wildcard is not an atom.
     */
    public SortedSet<String> atoms() {
        SortedSet<String> atoms = new TreeSet<>();
        for (String literal : literals) {
            if (!SIGMA.equals(literal)) {
                atoms.add(atomOf(literal));
            }
        }
        return atoms;
    }

    public Symbol with(Collection<String> additional) {
        List<String> merged = new ArrayList<>(literals);
        merged.addAll(additional);
        return of(merged);
    }

    public Symbol without(String literal) {
        if (!literals.contains(literal)) {
            return this;
        }
        List<String> remaining = new ArrayList<>(literals);
        remaining.remove(literal);
        return of(remaining);
    }

    public static boolean isNegated(String literal) {
        return literal.startsWith(NEGATION_PREFIX);
    }

    public static String atomOf(String literal) {
        return isNegated(literal) ? literal.substring(NEGATION_PREFIX.length()) : literal;
    }

    public static String negate(String atom) {
        return NEGATION_PREFIX + atom;
    }

    @Override
    public int compareTo(Symbol other) {
        Iterator<String> mine = literals.iterator();
        Iterator<String> theirs = other.literals.iterator();
        while (mine.hasNext() && theirs.hasNext()) {
            int cmp = mine.next().compareTo(theirs.next());
            if (cmp != 0) {
                return cmp;
            }
        }
        return Boolean.compare(mine.hasNext(), theirs.hasNext());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Symbol)) return false;
        return literals.equals(((Symbol) obj).literals);
    }

    @Override
    public int hashCode() {
        return literals.hashCode();
    }

    @Override
    public String toString() {
        return "{" + String.join(", ", literals) + "}";
    }
}
