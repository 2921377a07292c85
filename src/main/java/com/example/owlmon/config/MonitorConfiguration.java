// com/example/owlmon/config/MonitorConfiguration.java
package com.example.owlmon.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Configuration properties for monitoring a trace of observation ontologies
 */
@Configuration
@ConfigurationProperties(prefix = "monitor")
@Primary
public class MonitorConfiguration {

    private String labelledOntology = "input/labelled.owl";
    private String formula;
    private String constraints;
    private String globalOntology;
    private String observationsDirectory = "input/observations";
    private String outputDirectory = "./output";
    private String ltl2baExecutable = "ltl2ba";
    private int threadPoolSize = 1;
    private int maxProductStates = 1_000_000;
    private boolean cacheOracle = true;
    private boolean restrictTranslationMap = true;
    private boolean globalContextInSteps = false;

    // Getters and setters
    public String getLabelledOntology() { return labelledOntology; }
    public void setLabelledOntology(String labelledOntology) { this.labelledOntology = labelledOntology; }

    public String getFormula() { return formula; }
    public void setFormula(String formula) { this.formula = formula; }

    public String getConstraints() { return constraints; }
    public void setConstraints(String constraints) { this.constraints = constraints; }

    public String getGlobalOntology() { return globalOntology; }
    public void setGlobalOntology(String globalOntology) { this.globalOntology = globalOntology; }

    public String getObservationsDirectory() { return observationsDirectory; }
    public void setObservationsDirectory(String observationsDirectory) { this.observationsDirectory = observationsDirectory; }

    public String getOutputDirectory() { return outputDirectory; }
    public void setOutputDirectory(String outputDirectory) { this.outputDirectory = outputDirectory; }

    public String getLtl2baExecutable() { return ltl2baExecutable; }
    public void setLtl2baExecutable(String ltl2baExecutable) { this.ltl2baExecutable = ltl2baExecutable; }

    public int getThreadPoolSize() { return threadPoolSize; }
    public void setThreadPoolSize(int threadPoolSize) { this.threadPoolSize = threadPoolSize; }

    public int getMaxProductStates() { return maxProductStates; }
    public void setMaxProductStates(int maxProductStates) { this.maxProductStates = maxProductStates; }

    public boolean isCacheOracle() { return cacheOracle; }
    public void setCacheOracle(boolean cacheOracle) { this.cacheOracle = cacheOracle; }

    public boolean isRestrictTranslationMap() { return restrictTranslationMap; }
    public void setRestrictTranslationMap(boolean restrictTranslationMap) {
        this.restrictTranslationMap = restrictTranslationMap;
    }

    public boolean isGlobalContextInSteps() { return globalContextInSteps; }
    public void setGlobalContextInSteps(boolean globalContextInSteps) { this.globalContextInSteps = globalContextInSteps; }

    public boolean hasConstraints() {
        return constraints != null && !constraints.isBlank();
    }

    public boolean hasGlobalOntology() {
        return globalOntology != null && !globalOntology.isBlank();
    }

    @Override
    public String toString() {
        return "MonitorConfiguration{" +
                "labelledOntology='" + labelledOntology + '\'' +
                ", formula='" + formula + '\'' +
                ", constraints='" + constraints + '\'' +
                ", globalOntology='" + globalOntology + '\'' +
                ", observationsDirectory='" + observationsDirectory + '\'' +
                ", outputDirectory='" + outputDirectory + '\'' +
                ", ltl2baExecutable='" + ltl2baExecutable + '\'' +
                ", threadPoolSize=" + threadPoolSize +
                ", cacheOracle=" + cacheOracle +
                '}';
    }
}
