package com.example.owlmon.processing;

import com.example.owlmon.MonitoringException;
import com.example.owlmon.automaton.AutomatonBuilder;
import com.example.owlmon.config.MonitorConfiguration;
import com.example.owlmon.formula.TemporalFormula;
import com.example.owlmon.monitoring.Monitor;
import com.example.owlmon.monitoring.MonitorState;
import com.example.owlmon.monitoring.Verdict;
import com.example.owlmon.ontology.LabelledAxiomReader;
import com.example.owlmon.ontology.LabelledOntology;
import com.example.owlmon.ontology.OntologyService;
import com.example.owlmon.output.OutputService;
import com.example.owlmon.reasoning.CachingSatisfiabilityOracle;
import com.example.owlmon.reasoning.SatisfiabilityOracle;
import com.example.owlmon.util.OntologyUtils;
import org.semanticweb.owlapi.model.OWLAxiom;
import org.semanticweb.owlapi.model.OWLOntology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Monitors a trace given as a directory of observation ontologies, read in file name order.
 * <p>
 * The labelled ontology provides the propositions of the formula and of the optional
 * constraints. Once a verdict is decided the remaining observations are still read, so the
 * output covers the whole trace.
 */
public class TraceMonitoringProcessor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TraceMonitoringProcessor.class);

    private final OntologyService ontologyService;
    private final LabelledAxiomReader labelledAxiomReader;
    private final AutomatonBuilder automatonBuilder;
    private final SatisfiabilityOracle oracle;
    private final OutputService outputService;
    private final MonitorConfiguration config;
    private final PerformanceTracker performanceTracker;

    public TraceMonitoringProcessor(OntologyService ontologyService,
                                    LabelledAxiomReader labelledAxiomReader,
                                    AutomatonBuilder automatonBuilder,
                                    SatisfiabilityOracle oracle,
                                    OutputService outputService,
                                    MonitorConfiguration config) {
        this.ontologyService = ontologyService;
        this.labelledAxiomReader = labelledAxiomReader;
        this.automatonBuilder = automatonBuilder;
        this.oracle = oracle;
        this.outputService = outputService;
        this.config = config;
        this.performanceTracker = new PerformanceTracker();
    }

    public MonitoringResult process() {
        MonitoringResult result = new MonitoringResult();
        result.setFormula(config.getFormula());
        performanceTracker.start("total_monitoring");

        try {
            if (config.getFormula() == null || config.getFormula().isBlank()) {
                throw new MonitoringException("No formula configured (monitor.formula)");
            }
            outputService.initialize();

            Monitor monitor = createMonitor();
            result.setInitialVerdict(monitor.verdict());
            result.setAutomatonSizes(monitor.getFormulaAutomatonSize(), monitor.getNegationAutomatonSize());

            List<File> observations = performanceTracker.time("file_discovery",
                    () -> ontologyService.listOntologyFiles(config.getObservationsDirectory()));
            if (observations.isEmpty()) {
                result.addWarning("No observations found in " + config.getObservationsDirectory());
            }

            for (File observation : observations) {
                if (!readObservation(monitor, observation, result)) {
                    break;
                }
            }

            outputService.flush();
        } catch (MonitoringException | IOException e) {
            LOGGER.error("Monitoring failed", e);
            result.addError("Monitoring failed: " + e.getMessage());
        } finally {
            performanceTracker.end("total_monitoring");
            result.setProcessingTimeMs(performanceTracker.getDuration("total_monitoring"));
            performanceTracker.logSummary();
            if (oracle instanceof CachingSatisfiabilityOracle) {
                ((CachingSatisfiabilityOracle) oracle).logStatistics();
            }
        }

        outputService.writeSummary(result);
        LOGGER.info("{}", result);
        return result;
    }

    /**
     * @return whether the next observation should be read
     */
    private boolean readObservation(Monitor monitor, File file, MonitoringResult result) {
        OWLOntology observation = ontologyService.loadOntology(file);
        Set<OWLAxiom> axioms = observation.axioms().collect(Collectors.toSet());
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Observation {}: {}", file.getName(), OntologyUtils.formatAxioms(axioms));
        }

        long start = System.currentTimeMillis();
        try {
            performanceTracker.time("step", () -> {
                monitor.step(axioms);
                return null;
            });
        } catch (MonitoringException e) {
            LOGGER.error("Could not read observation {}", file.getName(), e);
            result.addError("Observation " + file.getName() + ": " + e.getMessage());
            return false;
        }

        MonitorState state = monitor.currentStatePair();
        Verdict verdict = monitor.verdict();
        StepRecord record = new StepRecord(monitor.getStepCount(), file.getName(), verdict,
                state.getFormulaStates().size(), state.getNegationStates().size(),
                System.currentTimeMillis() - start);
        result.addStep(record);
        outputService.writeStep(record);
        LOGGER.info("Step {} ({}): {}", record.getStep(), file.getName(), verdict);
        return true;
    }

    private Monitor createMonitor() {
        LabelledOntology labelled = performanceTracker.time("read_labelled_ontology",
                () -> labelledAxiomReader.read(new File(config.getLabelledOntology())));

        boolean restrict = config.isRestrictTranslationMap();
        TemporalFormula formula = labelled.formula(config.getFormula(), restrict);
        TemporalFormula constraints = config.hasConstraints()
                ? labelled.formula(config.getConstraints(), restrict)
                : null;

        Set<OWLAxiom> globalContext = null;
        if (config.hasGlobalOntology()) {
            OWLOntology global = ontologyService.loadOntology(new File(config.getGlobalOntology()));
            globalContext = global.axioms().collect(Collectors.toSet());
            LOGGER.info("Global context: {} axioms from {}", globalContext.size(), config.getGlobalOntology());
        }

        Set<OWLAxiom> context = globalContext;
        return performanceTracker.time("build_monitor",
                () -> new Monitor(formula, context, constraints, automatonBuilder, oracle,
                        config.isGlobalContextInSteps()));
    }

    @Override
    public void close() throws IOException {
        outputService.close();
        ontologyService.close();
    }
}
