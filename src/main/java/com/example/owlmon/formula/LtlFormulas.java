package com.example.owlmon.formula;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for propositional LTL formulas in ltl2ba syntax.
 */
public final class LtlFormulas {

    // ltl2ba atoms start with a lower-case letter; temporal operators are upper-case or symbolic
    private static final Pattern ATOM = Pattern.compile("\\b[a-z][A-Za-z0-9_]*\\b");

    private LtlFormulas() {
    }

    /**
     * Atom names occurring in a formula, in order of first occurrence.
     */
    public static Set<String> atomsOf(String formula) {
        Set<String> atoms = new LinkedHashSet<>();
        Matcher matcher = ATOM.matcher(formula);
        while (matcher.find()) {
            String token = matcher.group();
            if (!"true".equals(token) && !"false".equals(token)) {
                atoms.add(token);
            }
        }
        return atoms;
    }
}
