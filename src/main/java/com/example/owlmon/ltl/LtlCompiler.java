package com.example.owlmon.ltl;

import java.util.List;

/**
 * Translates a propositional LTL formula into the edges of an equivalent Buechi automaton.
 */
public interface LtlCompiler {

    /**
     * @param formula propositional LTL formula over atom names
     * @return the edges of the automaton, states tagged initial/final
     * @throws LtlCompilationException if the formula cannot be translated
     */
    List<CompiledEdge> compile(String formula);
}
