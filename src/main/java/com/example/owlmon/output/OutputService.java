package com.example.owlmon.output;

import com.example.owlmon.processing.MonitoringResult;
import com.example.owlmon.processing.StepRecord;

import java.io.IOException;

public interface OutputService extends AutoCloseable {
    void initialize() throws IOException;

    void writeStep(StepRecord step);

    void writeSummary(MonitoringResult result);

    void flush();

    @Override
    void close() throws IOException;
}
