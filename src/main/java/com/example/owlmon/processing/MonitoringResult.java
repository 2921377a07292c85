package com.example.owlmon.processing;

import com.example.owlmon.monitoring.Verdict;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of monitoring one trace
 */
public class MonitoringResult {
    private String formula;
    private Verdict initialVerdict;
    private int formulaAutomatonSize;
    private int negationAutomatonSize;
    private final List<StepRecord> steps = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private long processingTimeMs;

    public String getFormula() { return formula; }
    public void setFormula(String formula) { this.formula = formula; }

    public Verdict getInitialVerdict() { return initialVerdict; }
    public void setInitialVerdict(Verdict initialVerdict) { this.initialVerdict = initialVerdict; }

    public int getFormulaAutomatonSize() { return formulaAutomatonSize; }
    public int getNegationAutomatonSize() { return negationAutomatonSize; }

    public void setAutomatonSizes(int formulaAutomatonSize, int negationAutomatonSize) {
        this.formulaAutomatonSize = formulaAutomatonSize;
        this.negationAutomatonSize = negationAutomatonSize;
    }

    public void addStep(StepRecord step) {
        steps.add(step);
    }

    public List<StepRecord> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    /**
     * Verdict after the last observation read, or the initial verdict if none was read.
     */
    public Verdict getFinalVerdict() {
        if (steps.isEmpty()) {
            return initialVerdict;
        }
        return steps.get(steps.size() - 1).getVerdict();
    }

    public List<String> getErrors() {
        return new ArrayList<>(errors);
    }

    public void addError(String error) {
        errors.add(error);
    }

    public List<String> getWarnings() {
        return new ArrayList<>(warnings);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public long getProcessingTimeMs() { return processingTimeMs; }
    public void setProcessingTimeMs(long processingTimeMs) { this.processingTimeMs = processingTimeMs; }

    @Override
    public String toString() {
        return String.format("MonitoringResult{success=%s, formula=%s, steps=%d, finalVerdict=%s, " +
                        "automata=%d/%d, errors=%d, warnings=%d, timeMs=%d}",
                isSuccess(), formula, steps.size(), getFinalVerdict(),
                formulaAutomatonSize, negationAutomatonSize, errors.size(), warnings.size(), processingTimeMs);
    }
}
