package com.example.owlmon.output;

import com.example.owlmon.MonitoringException;
import com.example.owlmon.processing.MonitoringResult;
import com.example.owlmon.processing.StepRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

/**
 * Writes one CSV row per observation as it is read and a JSON summary of the whole trace.
 */
public class HybridOutputService implements OutputService {
    private static final Logger LOGGER = LoggerFactory.getLogger(HybridOutputService.class);

    static final String CSV_FILE_NAME = "verdicts.csv";
    static final String JSON_FILE_NAME = "summary.json";
    static final String[] CSV_HEADER = {
            "Step", "Observation", "Verdict", "FormulaStates", "NegationStates", "DurationMs"
    };

    private final Path csvFilePath;
    private final Path jsonFilePath;
    private final ObjectMapper jsonMapper;

    private CSVPrinter csvPrinter;
    private boolean initialized = false;
    private boolean closed = false;

    public HybridOutputService(String outputDirectory) {
        Path directory = Paths.get(outputDirectory);
        this.csvFilePath = directory.resolve(CSV_FILE_NAME);
        this.jsonFilePath = directory.resolve(JSON_FILE_NAME);
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public synchronized void initialize() throws IOException {
        if (initialized || closed) return;

        LOGGER.info("Initializing output service with CSV: {}, JSON: {}", csvFilePath, jsonFilePath);
        Path parent = csvFilePath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        BufferedWriter writer = Files.newBufferedWriter(csvFilePath, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        CSVFormat csvFormat = CSVFormat.DEFAULT
                .withQuoteMode(QuoteMode.ALL)
                .withEscape('\\')
                .withRecordSeparator("\n")
                .withHeader(CSV_HEADER);
        csvPrinter = new CSVPrinter(writer, csvFormat);

        initialized = true;
    }

    @Override
    public synchronized void writeStep(StepRecord step) {
        try {
            if (!initialized) initialize();
            if (closed) {
                LOGGER.warn("Output service closed, dropping {}", step);
                return;
            }
            csvPrinter.printRecord(
                    step.getStep(),
                    step.getObservation(),
                    step.getVerdict(),
                    step.getFormulaStates(),
                    step.getNegationStates(),
                    step.getDurationMs());
        } catch (IOException e) {
            throw new MonitoringException("Could not write step " + step.getStep() + " to " + csvFilePath, e);
        }
    }

    @Override
    public synchronized void writeSummary(MonitoringResult result) {
        ObjectNode summary = jsonMapper.createObjectNode();
        summary.put("formula", result.getFormula());
        summary.put("success", result.isSuccess());
        summary.put("initialVerdict", String.valueOf(result.getInitialVerdict()));
        summary.put("finalVerdict", String.valueOf(result.getFinalVerdict()));
        summary.put("formulaAutomatonStates", result.getFormulaAutomatonSize());
        summary.put("negationAutomatonStates", result.getNegationAutomatonSize());
        summary.put("processingTimeMs", result.getProcessingTimeMs());

        ArrayNode steps = summary.putArray("steps");
        for (StepRecord record : result.getSteps()) {
            ObjectNode node = steps.addObject();
            node.put("step", record.getStep());
            node.put("observation", record.getObservation());
            node.put("verdict", record.getVerdict().name());
            node.put("formulaStates", record.getFormulaStates());
            node.put("negationStates", record.getNegationStates());
            node.put("durationMs", record.getDurationMs());
        }

        ArrayNode errors = summary.putArray("errors");
        result.getErrors().forEach(errors::add);
        ArrayNode warnings = summary.putArray("warnings");
        result.getWarnings().forEach(warnings::add);

        try {
            Path parent = jsonFilePath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            jsonMapper.writeValue(jsonFilePath.toFile(), summary);
            LOGGER.info("Summary written to {}", jsonFilePath);
        } catch (IOException e) {
            throw new MonitoringException("Could not write summary to " + jsonFilePath, e);
        }
    }

    @Override
    public synchronized void flush() {
        if (csvPrinter == null || closed) return;
        try {
            csvPrinter.flush();
        } catch (IOException e) {
            LOGGER.error("Error flushing CSV output", e);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) return;
        if (csvPrinter != null) {
            csvPrinter.close();
            LOGGER.info("CSV file closed: {}", csvFilePath);
        }
        closed = true;
    }
}
