package com.example.owlmon.ltl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Compiles formulas by running the external {@code ltl2ba} tool and parsing its never claim.
 */
public class Ltl2BaCompiler implements LtlCompiler {

    private static final Logger LOGGER = LoggerFactory.getLogger(Ltl2BaCompiler.class);

    private final String executable;
    private final NeverClaimParser parser;

    public Ltl2BaCompiler(String executable) {
        this(executable, new NeverClaimParser());
    }

    public Ltl2BaCompiler(String executable, NeverClaimParser parser) {
        this.executable = executable;
        this.parser = parser;
    }

    @Override
    public List<CompiledEdge> compile(String formula) {
        LOGGER.debug("Running {} on formula: {}", executable, formula);

        ProcessBuilder builder = new ProcessBuilder(executable, "-f", formula);
        builder.redirectErrorStream(true);

        String output;
        int exitCode;
        try {
            Process process = builder.start();
            try (InputStream in = process.getInputStream()) {
                output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            exitCode = process.waitFor();
        } catch (IOException e) {
            throw new LtlCompilationException("Could not run " + executable + " on formula: " + formula, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LtlCompilationException("Interrupted while translating formula: " + formula, e);
        }

        if (exitCode != 0 || !output.contains("never")) {
            throw new LtlCompilationException(executable + " failed (exit code " + exitCode + ") on formula "
                    + formula + ": " + output.trim());
        }

        List<CompiledEdge> edges = parser.parse(output);
        LOGGER.debug("{} produced {} edges", executable, edges.size());
        return edges;
    }

    public String getExecutable() {
        return executable;
    }
}
