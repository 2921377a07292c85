package com.example.owlmon.application;

import com.example.owlmon.automaton.AutomatonBuilder;
import com.example.owlmon.config.MonitorConfiguration;
import com.example.owlmon.ontology.LabelledAxiomReader;
import com.example.owlmon.ontology.OntologyService;
import com.example.owlmon.output.OutputService;
import com.example.owlmon.processing.MonitoringResult;
import com.example.owlmon.processing.StepRecord;
import com.example.owlmon.processing.TraceMonitoringProcessor;
import com.example.owlmon.reasoning.SatisfiabilityOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import jakarta.annotation.PreDestroy;

/**
 * Runtime monitor for ALC-LTL formulas over a trace of observation ontologies.
 * <p>
 * Usage: {@code [formula] [observations directory]}; both override the configured values.
 */
@SpringBootApplication(scanBasePackages = "com.example.owlmon")
@EnableConfigurationProperties(MonitorConfiguration.class)
public class OwlMonitorApplication implements CommandLineRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(OwlMonitorApplication.class);

    @Autowired
    private MonitorConfiguration config;

    @Autowired
    private OntologyService ontologyService;

    @Autowired
    private LabelledAxiomReader labelledAxiomReader;

    @Autowired
    private AutomatonBuilder automatonBuilder;

    @Autowired
    private SatisfiabilityOracle satisfiabilityOracle;

    @Autowired
    private OutputService outputService;

    private TraceMonitoringProcessor processor;

    public static void main(String[] args) {
        configureJVM();
        SpringApplication.run(OwlMonitorApplication.class, args);
    }

    private static void configureJVM() {
        System.setProperty("java.awt.headless", "true");

        // Openllet and the OWL API are chatty at INFO
        System.setProperty("logging.level.openllet", "WARN");
        System.setProperty("logging.level.org.semanticweb.owlapi", "WARN");
    }

    @Override
    public void run(String... args) throws Exception {
        if (args.length > 0) {
            config.setFormula(args[0]);
        }
        if (args.length > 1) {
            config.setObservationsDirectory(args[1]);
        }

        LOGGER.info("=== OWL Trace Monitor ===");
        logConfiguration();

        processor = new TraceMonitoringProcessor(ontologyService, labelledAxiomReader,
                automatonBuilder, satisfiabilityOracle, outputService, config);
        MonitoringResult result = processor.process();
        logResults(result);
    }

    private void logConfiguration() {
        LOGGER.info("Configuration:");
        LOGGER.info("  Formula: {}", config.getFormula());
        LOGGER.info("  Constraints: {}", config.hasConstraints() ? config.getConstraints() : "none");
        LOGGER.info("  Labelled ontology: {}", config.getLabelledOntology());
        LOGGER.info("  Global ontology: {}", config.hasGlobalOntology() ? config.getGlobalOntology() : "none");
        LOGGER.info("  Observations directory: {}", config.getObservationsDirectory());
        LOGGER.info("  Output directory: {}", config.getOutputDirectory());
        LOGGER.info("  ltl2ba executable: {}", config.getLtl2baExecutable());
        LOGGER.info("  Thread pool size: {}", config.getThreadPoolSize());
    }

    private void logResults(MonitoringResult result) {
        LOGGER.info("=== MONITORING COMPLETED ===");
        LOGGER.info("  Formula automaton states: {}", result.getFormulaAutomatonSize());
        LOGGER.info("  Negation automaton states: {}", result.getNegationAutomatonSize());
        LOGGER.info("  Observations read: {}", result.getSteps().size());
        for (StepRecord step : result.getSteps()) {
            LOGGER.debug("  {}", step);
        }
        LOGGER.info("  Final verdict: {}", result.getFinalVerdict());
        LOGGER.info("  Processing time: {} ms", result.getProcessingTimeMs());

        if (result.hasErrors()) {
            LOGGER.warn("Errors encountered:");
            result.getErrors().forEach(error -> LOGGER.warn("  - {}", error));
        }
        result.getWarnings().forEach(warning -> LOGGER.warn("  - {}", warning));
    }

    @PreDestroy
    public void cleanup() {
        if (processor == null) {
            return;
        }
        try {
            processor.close();
            LOGGER.info("Monitor resources released");
        } catch (Exception e) {
            LOGGER.error("Error during cleanup", e);
        }
    }
}
