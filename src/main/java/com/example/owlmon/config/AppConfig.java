package com.example.owlmon.config;

import com.example.owlmon.automaton.AutomatonBuilder;
import com.example.owlmon.ltl.Ltl2BaCompiler;
import com.example.owlmon.ltl.LtlCompiler;
import com.example.owlmon.ontology.DefaultOntologyService;
import com.example.owlmon.ontology.LabelledAxiomReader;
import com.example.owlmon.ontology.OntologyService;
import com.example.owlmon.output.HybridOutputService;
import com.example.owlmon.output.OutputService;
import com.example.owlmon.reasoning.CachingSatisfiabilityOracle;
import com.example.owlmon.reasoning.OpenlletSatisfiabilityOracle;
import com.example.owlmon.reasoning.SatisfiabilityOracle;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AppConfig {

    @Bean
    public OntologyService ontologyService() {
        return new DefaultOntologyService();
    }

    @Bean
    public LabelledAxiomReader labelledAxiomReader(OntologyService ontologyService) {
        return new LabelledAxiomReader(ontologyService);
    }

    @Bean
    public SatisfiabilityOracle satisfiabilityOracle(MonitorConfiguration config) {
        SatisfiabilityOracle oracle = new OpenlletSatisfiabilityOracle();
        return config.isCacheOracle() ? new CachingSatisfiabilityOracle(oracle) : oracle;
    }

    @Bean
    public LtlCompiler ltlCompiler(MonitorConfiguration config) {
        return new Ltl2BaCompiler(config.getLtl2baExecutable());
    }

    // only instantiated when edge checks run in parallel
    @Bean(destroyMethod = "shutdown")
    @Lazy
    public ExecutorService edgeCheckExecutor(MonitorConfiguration config) {
        return Executors.newFixedThreadPool(config.getThreadPoolSize());
    }

    @Bean
    public AutomatonBuilder automatonBuilder(LtlCompiler ltlCompiler,
                                             SatisfiabilityOracle satisfiabilityOracle,
                                             ObjectProvider<ExecutorService> edgeCheckExecutor,
                                             MonitorConfiguration config) {
        ExecutorService executor = config.getThreadPoolSize() > 1 ? edgeCheckExecutor.getObject() : null;
        return new AutomatonBuilder(ltlCompiler, satisfiabilityOracle, executor, config.getMaxProductStates());
    }

    @Bean
    public OutputService outputService(MonitorConfiguration config) {
        return new HybridOutputService(config.getOutputDirectory());
    }
}
