package com.example.owlmon.ontology;

import org.semanticweb.owlapi.apibinding.OWLManager;
import org.semanticweb.owlapi.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Loads ontology documents with the OWL API. Every document gets a fresh manager, so documents
 * sharing an ontology IRI (typical for the observations of one trace) do not clash.
 */
public class DefaultOntologyService implements OntologyService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultOntologyService.class);
    private static final String[] SUPPORTED_EXTENSIONS = {".owl", ".ofn", ".rdf", ".ttl", ".n3", ".omn"};

    @Override
    public OWLOntology loadOntology(File ontologyFile) {
        OWLOntologyManager manager = OWLManager.createOWLOntologyManager();

        if (!ontologyFile.isFile()) {
            throw new OntologyReadException("Ontology file does not exist: " + ontologyFile.getAbsolutePath());
        }

        try {
            LOGGER.debug("Loading ontology from file: {}", ontologyFile.getAbsolutePath());

            OWLOntology ontology = manager.loadOntologyFromOntologyDocument(ontologyFile);

            LOGGER.debug("Successfully loaded ontology: {} with {} axioms",
                    ontology.getOntologyID().getOntologyIRI().orElse(null),
                    ontology.getAxiomCount());

            return ontology;
        } catch (OWLOntologyCreationException e) {
            LOGGER.error("Failed to load ontology from file: {}", ontologyFile.getAbsolutePath(), e);
            throw new OntologyReadException("Could not read ontology from " + ontologyFile.getAbsolutePath(), e);
        }
    }

    @Override
    public List<File> listOntologyFiles(String directoryPath) {
        File directory = new File(directoryPath);
        if (!directory.exists() || !directory.isDirectory()) {
            throw new OntologyReadException("Directory does not exist or is not a directory: " + directoryPath);
        }

        File[] files = directory.listFiles(this::isOntologyFile);
        if (files == null || files.length == 0) {
            LOGGER.warn("No ontology files found in directory: {}", directoryPath);
            return new ArrayList<>();
        }

        List<File> sorted = new ArrayList<>(Arrays.asList(files));
        sorted.sort(Comparator.comparing(File::getName));
        LOGGER.info("Found {} ontology files in {}", sorted.size(), directoryPath);
        return sorted;
    }

    private boolean isOntologyFile(File file) {
        if (file.isDirectory()) return false;

        String fileName = file.getName().toLowerCase();
        return Arrays.stream(SUPPORTED_EXTENSIONS)
                .anyMatch(fileName::endsWith);
    }

    @Override
    public void close() {
        LOGGER.info("Ontology service closed successfully");
    }
}
