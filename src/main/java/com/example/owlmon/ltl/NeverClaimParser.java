package com.example.owlmon.ltl;

import com.example.owlmon.automaton.Symbol;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the SPIN never claim printed by ltl2ba.
 * <p>
 * States whose label ends in {@code init} are initial, states whose label starts with
 * {@code accept} are final. A guard {@code (1)} becomes the wildcard symbol, {@code skip} a
 * wildcard self-loop and {@code false;} a state without transitions. Disjunctive guards yield
 * one edge per disjunct.
 */
public class NeverClaimParser {

    private static final Pattern COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern STATE = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\s*:$");
    private static final Pattern OPTION = Pattern.compile("^::\\s*(.+?)\\s*->\\s*goto\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*;?$");

    public List<CompiledEdge> parse(String neverClaim) {
        String text = COMMENT.matcher(neverClaim).replaceAll("");
        List<CompiledEdge> edges = new ArrayList<>();
        String current = null;

        int lineNumber = 0;
        for (String rawLine : text.split("\\R")) {
            lineNumber++;
            String line = rawLine.trim();
            if (line.isEmpty() || isStructural(line)) {
                continue;
            }

            Matcher state = STATE.matcher(line);
            if (state.matches()) {
                current = state.group(1);
                continue;
            }
            if (current == null) {
                throw new LtlCompilationException("Transition outside of a state at line " + lineNumber + ": " + line);
            }

            if (line.startsWith("skip")) {
                edges.add(new CompiledEdge(state(current), Symbol.sigma(), state(current)));
                continue;
            }
            if (line.startsWith("false")) {
                continue;
            }

            Matcher option = OPTION.matcher(line);
            if (!option.matches()) {
                throw new LtlCompilationException("Unrecognised never claim line " + lineNumber + ": " + line);
            }
            String target = option.group(2);
            for (String disjunct : option.group(1).split("\\|\\|")) {
                Symbol label = parseConjunction(disjunct);
                if (label != null) {
                    edges.add(new CompiledEdge(state(current), label, state(target)));
                }
            }
        }
        return edges;
    }

    /**
     * @return the literals of the conjunction, or {@code null} if it is unsatisfiable
     */
    private Symbol parseConjunction(String conjunction) {
        List<String> literals = new ArrayList<>();
        for (String part : conjunction.replace("(", "").replace(")", "").split("&&")) {
            String literal = part.replaceAll("\\s+", "");
            if (literal.equals("0") || literal.equals("false")) {
                return null;
            }
            if (literal.equals("1") || literal.equals("true") || literal.isEmpty()) {
                continue;
            }
            literals.add(literal);
        }
        return literals.isEmpty() ? Symbol.sigma() : Symbol.of(literals);
    }

    private static CompiledState state(String label) {
        return new CompiledState(label, label.endsWith("init"), label.startsWith("accept"));
    }

    private static boolean isStructural(String line) {
        return line.startsWith("never")
                || line.equals("if") || line.equals("fi;") || line.equals("fi")
                || line.equals("do") || line.equals("od;") || line.equals("od")
                || line.equals("{") || line.equals("}");
    }
}
