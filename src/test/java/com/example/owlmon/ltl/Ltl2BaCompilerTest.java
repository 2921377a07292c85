package com.example.owlmon.ltl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Ltl2BaCompilerTest {

    @Test
    void missingExecutableIsACompilationError() {
        Ltl2BaCompiler compiler = new Ltl2BaCompiler("/nonexistent/ltl2ba-for-tests");

        LtlCompilationException e = assertThrows(LtlCompilationException.class, () -> compiler.compile("F p"));
        assertTrue(e.getMessage().contains("F p"));
        assertEquals("/nonexistent/ltl2ba-for-tests", compiler.getExecutable());
    }
}
