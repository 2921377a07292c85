package com.example.owlmon.automaton;

import com.example.owlmon.MonitoringException;
import com.example.owlmon.formula.TemporalFormula;
import com.example.owlmon.ltl.CompiledEdge;
import com.example.owlmon.ltl.CompiledState;
import com.example.owlmon.ltl.LtlCompiler;
import com.example.owlmon.monitoring.UnknownPropositionException;
import com.example.owlmon.reasoning.ClashingAxiomsOracle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.semanticweb.owlapi.apibinding.OWLManager;
import org.semanticweb.owlapi.model.IRI;
import org.semanticweb.owlapi.model.OWLAxiom;
import org.semanticweb.owlapi.model.OWLClass;
import org.semanticweb.owlapi.model.OWLDataFactory;
import org.semanticweb.owlapi.model.OWLNamedIndividual;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class AutomatonBuilderTest {

    private static final String NS = "http://example.org/test#";

    private static final CompiledState INIT = new CompiledState("T0_init", true, false);
    private static final CompiledState ACCEPT = new CompiledState("accept_all", false, true);

    private final OWLDataFactory df = OWLManager.getOWLDataFactory();
    private final OWLClass c = df.getOWLClass(IRI.create(NS + "C"));
    private final OWLNamedIndividual a = df.getOWLNamedIndividual(IRI.create(NS + "a"));
    private final OWLAxiom pAxiom = df.getOWLClassAssertionAxiom(c, a);
    private final OWLAxiom notPAxiom = df.getOWLClassAssertionAxiom(df.getOWLObjectComplementOf(c), a);

    private ClashingAxiomsOracle oracle;
    private TemporalFormula formula;

    @BeforeEach
    void setUp() {
        oracle = new ClashingAxiomsOracle().clash(pAxiom, notPAxiom);
        formula = new TemporalFormula("F p", Map.of("p", pAxiom, "!p", notPAxiom));
    }

    /**
     * Never claim of {@code F p}: wait on any symbol, then accept after p.
     */
    private static LtlCompiler eventually() {
        return f -> List.of(
                new CompiledEdge(INIT, Symbol.sigma(), INIT),
                new CompiledEdge(INIT, Symbol.of("p"), ACCEPT),
                new CompiledEdge(INIT, Symbol.of("!p"), INIT),
                new CompiledEdge(ACCEPT, Symbol.sigma(), ACCEPT));
    }

    @Test
    void keepsEveryEdgeWithoutContext() {
        LabelledAutomaton automaton = new AutomatonBuilder(eventually(), oracle).build(formula);

        assertEquals(Set.of("T0_init"), automaton.initialStates());
        assertEquals(Set.of("accept_all"), automaton.finalStates());
        assertEquals(4, automaton.transitionCount());
        assertEquals(4, oracle.getSingleChecks());
    }

    @Test
    void dropsEdgesContradictingTheGlobalContext() {
        LabelledAutomaton automaton = new AutomatonBuilder(eventually(), oracle)
                .build(formula, Set.of(notPAxiom));

        assertEquals(Map.of(Symbol.sigma(), Set.of("T0_init"), Symbol.of("!p"), Set.of("T0_init")),
                automaton.transitionsFrom("T0_init"));

        // accept_all is no longer reachable, so no accepting run is left
        automaton.trim();
        assertTrue(automaton.states().isEmpty());
    }

    @Test
    void unknownLiteralFailsTheBuild() {
        LtlCompiler compiler = f -> List.of(new CompiledEdge(INIT, Symbol.of("q"), ACCEPT));
        AutomatonBuilder builder = new AutomatonBuilder(compiler, oracle);

        UnknownPropositionException e = assertThrows(UnknownPropositionException.class,
                () -> builder.build(formula));
        assertEquals("q", e.getLiteral());
    }

    @Test
    void parallelBuildMatchesSequentialBuild() {
        LabelledAutomaton sequential = new AutomatonBuilder(eventually(), oracle).build(formula);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            LabelledAutomaton parallel = new AutomatonBuilder(eventually(), oracle, executor,
                    AutomatonBuilder.DEFAULT_MAX_PRODUCT_STATES).build(formula);
            assertEquals(sequential, parallel);
            assertEquals(sequential.toString(), parallel.toString());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void parallelBuildPassesOracleExceptionsThrough() {
        LtlCompiler compiler = f -> List.of(new CompiledEdge(INIT, Symbol.of("q"), ACCEPT));
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            AutomatonBuilder builder = new AutomatonBuilder(compiler, oracle, executor, 10);
            assertThrows(UnknownPropositionException.class, () -> builder.build(formula));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void completionsFixEveryFreeAtom() {
        List<Symbol> completions = AutomatonBuilder.completions(Symbol.of("p"), Set.of("p", "q"));
        assertEquals(List.of(Symbol.of("p", "q"), Symbol.of("p", "!q")), completions);

        List<Symbol> fromWildcard = AutomatonBuilder.completions(Symbol.sigma(), Set.of("p"));
        assertEquals(List.of(Symbol.of("p"), Symbol.of("!p")), fromWildcard);

        assertEquals(List.of(Symbol.of("!p")), AutomatonBuilder.completions(Symbol.of("!p"), Set.of("p")));
    }

    @Test
    void rigidNamesFixTheChoiceMadeOnTheFirstStep() {
        TemporalFormula rigid = new TemporalFormula("G true",
                Map.of("p", pAxiom, "!p", notPAxiom), Set.of(c.getIRI()));
        CompiledState loop = new CompiledState("accept_init", true, true);
        LtlCompiler compiler = f -> List.of(new CompiledEdge(loop, Symbol.sigma(), loop));

        LabelledAutomaton product = new AutomatonBuilder(compiler, oracle).build(rigid);

        assertEquals(Set.of("accept_init-0"), product.initialStates());
        assertEquals(Set.of("accept_init-0", "accept_init-1", "accept_init-2"), product.states());
        assertEquals(product.states(), product.finalStates());
        assertEquals(Map.of(Symbol.of("p"), Set.of("accept_init-1"), Symbol.of("!p"), Set.of("accept_init-2")),
                product.transitionsFrom("accept_init-0"));
        assertEquals(Map.of(Symbol.of("p"), Set.of("accept_init-1")), product.transitionsFrom("accept_init-1"));
        assertEquals(Map.of(Symbol.of("!p"), Set.of("accept_init-2")), product.transitionsFrom("accept_init-2"));
    }

    @Test
    void rigidProductIsBounded() {
        TemporalFormula rigid = new TemporalFormula("G true",
                Map.of("p", pAxiom, "!p", notPAxiom), Set.of(c.getIRI()));
        CompiledState loop = new CompiledState("accept_init", true, true);
        LtlCompiler compiler = f -> List.of(new CompiledEdge(loop, Symbol.sigma(), loop));

        AutomatonBuilder builder = new AutomatonBuilder(compiler, oracle, null, 2);

        assertThrows(MonitoringException.class, () -> builder.build(rigid));
    }
}
