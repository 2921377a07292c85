package com.example.owlmon.automaton;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LabelledAutomatonTest {

    private static final Symbol P = Symbol.of("p");
    private static final Symbol NOT_P = Symbol.of("!p");

    private LabelledAutomaton automaton;

    @BeforeEach
    void setUp() {
        automaton = new LabelledAutomaton();
    }

    @Test
    void transitionsAccumulateDestinations() {
        automaton.addTransition("s0", P, "s1");
        automaton.addTransition("s0", P, "s2");
        automaton.addTransition("s0", NOT_P, "s0");

        assertEquals(Map.of(P, Set.of("s1", "s2"), NOT_P, Set.of("s0")), automaton.transitionsFrom("s0"));
        assertEquals(3, automaton.transitionCount());
        assertEquals(Set.of("s0", "s1", "s2"), automaton.states());
        assertTrue(automaton.transitionsFrom("unknown").isEmpty());
    }

    @Test
    void transitionViewIsReadOnly() {
        automaton.addTransition("s0", P, "s1");
        assertThrows(UnsupportedOperationException.class,
                () -> automaton.transitions().get("s0").put(NOT_P, Set.of("s0")));
    }

    @Test
    void trimKeepsAcceptingSelfLoop() {
        automaton.addInitialState("s0");
        automaton.addFinalState("s0");
        automaton.addTransition("s0", P, "s0");
        LabelledAutomaton before = automaton.copy();

        automaton.trim();

        assertEquals(before, automaton);
        assertEquals(Set.of("s0"), automaton.states());
    }

    @Test
    void trimRemovesFinalStateWithoutCycle() {
        automaton.addInitialState("s0");
        automaton.addFinalState("s1");
        automaton.addTransition("s0", P, "s1");

        automaton.trim();

        assertTrue(automaton.states().isEmpty());
        assertTrue(automaton.initialStates().isEmpty());
        assertTrue(automaton.finalStates().isEmpty());
        assertTrue(automaton.transitions().isEmpty());
    }

    @Test
    void trimKeepsPathIntoAcceptingCycleAndDropsDeadBranch() {
        automaton.addInitialState("init");
        automaton.addFinalState("acc");
        automaton.addTransition("init", P, "mid");
        automaton.addTransition("mid", P, "acc");
        automaton.addTransition("acc", Symbol.sigma(), "acc");
        automaton.addTransition("init", NOT_P, "dead");
        automaton.addTransition("dead", NOT_P, "dead");

        automaton.trim();

        assertEquals(Set.of("init", "mid", "acc"), automaton.states());
        assertEquals(Map.of(P, Set.of("mid")), automaton.transitionsFrom("init"));
        assertTrue(automaton.transitionsFrom("dead").isEmpty());
    }

    @Test
    void trimDropsUnreachableStates() {
        automaton.addInitialState("s0");
        automaton.addFinalState("s0");
        automaton.addTransition("s0", P, "s0");
        automaton.addFinalState("island");
        automaton.addTransition("island", P, "island");

        automaton.trim();

        assertEquals(Set.of("s0"), automaton.states());
        assertFalse(automaton.isFinal("island"));
    }

    @Test
    void trimKeepsNonTrivialFinalComponent() {
        automaton.addInitialState("a");
        automaton.addFinalState("b");
        automaton.addTransition("a", P, "b");
        automaton.addTransition("b", NOT_P, "a");

        automaton.trim();

        assertEquals(Set.of("a", "b"), automaton.states());
        assertTrue(automaton.isInitial("a"));
        assertTrue(automaton.isFinal("b"));
    }

    @Test
    void trimKeepsFinalStateWithoutSelfLoopThatLeadsToAcceptingCycle() {
        automaton.addInitialState("s0");
        automaton.addFinalState("f");
        automaton.addFinalState("acc");
        automaton.addTransition("s0", P, "f");
        automaton.addTransition("f", P, "acc");
        automaton.addTransition("acc", NOT_P, "acc");

        automaton.trim();

        assertEquals(Set.of("s0", "f", "acc"), automaton.states());
        assertTrue(automaton.isFinal("f"));
        assertEquals(Map.of(P, Set.of("acc")), automaton.transitionsFrom("f"));
    }

    @Test
    void trimChecksEveryDestinationOfALabel() {
        // {a, b} is a cycle without final states; its only way out shares a label with a cycle edge
        automaton.addInitialState("a");
        automaton.addFinalState("g");
        automaton.addTransition("a", P, "b");
        automaton.addTransition("a", P, "g");
        automaton.addTransition("b", P, "a");
        automaton.addTransition("g", P, "g");
        automaton.addTransition("a", NOT_P, "b");
        automaton.addTransition("a", NOT_P, "dead");

        automaton.trim();

        assertEquals(Set.of("a", "b", "g"), automaton.states());
        assertEquals(Map.of(P, Set.of("b", "g"), NOT_P, Set.of("b")), automaton.transitionsFrom("a"));
        assertEquals(Map.of(P, Set.of("a")), automaton.transitionsFrom("b"));
    }

    @Test
    void trimDropsCycleWhoseLabelsOnlyReachDeadStates() {
        automaton.addInitialState("a");
        automaton.addTransition("a", P, "b");
        automaton.addTransition("a", P, "dead");
        automaton.addTransition("b", P, "a");

        automaton.trim();

        assertTrue(automaton.states().isEmpty());
    }

    @Test
    void trimIsIdempotent() {
        automaton.addInitialState("init");
        automaton.addFinalState("acc");
        automaton.addFinalState("sink");
        automaton.addTransition("init", P, "acc");
        automaton.addTransition("acc", P, "acc");
        automaton.addTransition("init", NOT_P, "sink");

        automaton.trim();
        LabelledAutomaton once = automaton.copy();
        automaton.trim();

        assertEquals(once, automaton);
        assertEquals(Set.of("init", "acc"), automaton.states());
    }

    @Test
    void copyIsIndependent() {
        automaton.addInitialState("s0");
        automaton.addTransition("s0", P, "s1");

        LabelledAutomaton copy = automaton.copy();
        copy.addTransition("s1", P, "s0");

        assertNotEquals(automaton, copy);
        assertTrue(automaton.transitionsFrom("s1").isEmpty());
        assertTrue(copy.isInitial("s0"));
    }
}
