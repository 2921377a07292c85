package com.example.owlmon.processing;

import com.example.owlmon.monitoring.Verdict;

/**
 * Outcome of reading one observation.
 */
public class StepRecord {
    private final long step;
    private final String observation;
    private final Verdict verdict;
    private final int formulaStates;
    private final int negationStates;
    private final long durationMs;

    public StepRecord(long step, String observation, Verdict verdict,
                      int formulaStates, int negationStates, long durationMs) {
        this.step = step;
        this.observation = observation;
        this.verdict = verdict;
        this.formulaStates = formulaStates;
        this.negationStates = negationStates;
        this.durationMs = durationMs;
    }

    public long getStep() { return step; }
    public String getObservation() { return observation; }
    public Verdict getVerdict() { return verdict; }
    public int getFormulaStates() { return formulaStates; }
    public int getNegationStates() { return negationStates; }
    public long getDurationMs() { return durationMs; }

    @Override
    public String toString() {
        return String.format("StepRecord{step=%d, observation=%s, verdict=%s, live=%d/%d, timeMs=%d}",
                step, observation, verdict, formulaStates, negationStates, durationMs);
    }
}
