package com.example.owlmon.ontology;

import org.semanticweb.owlapi.model.OWLOntology;

import java.io.File;
import java.util.List;

public interface OntologyService extends AutoCloseable {

    /**
     * Load a single ontology from file
     */
    OWLOntology loadOntology(File ontologyFile);

    /**
     * List the ontology documents of a directory, ordered by file name
     */
    List<File> listOntologyFiles(String directoryPath);

    @Override
    void close();
}
