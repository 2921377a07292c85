package com.example.owlmon.ontology;

import com.example.owlmon.automaton.Symbol;
import com.example.owlmon.formula.TemporalFormula;
import com.example.owlmon.util.OntologyUtils;
import org.semanticweb.owlapi.apibinding.OWLManager;
import org.semanticweb.owlapi.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Reads propositions from an ontology whose axioms carry {@code rdfs:label} annotations.
 * <p>
 * A labelled axiom {@code p} contributes {@code p -> axiom} and {@code !p -> complement}:
 * <ul>
 *   <li>{@code C(a)} has complement {@code (not C)(a)},</li>
 *   <li>{@code r(a,b)} has complement {@code not r(a,b)} and vice versa,</li>
 *   <li>{@code C SubClassOf D} has complement {@code (C and not D)(x)} for a fresh individual
 *   {@code x}.</li>
 * </ul>
 * An annotation assertion {@code rdfs:label "rigid"} on an IRI declares that IRI rigid. Other
 * axioms are ignored.
 */
public class LabelledAxiomReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(LabelledAxiomReader.class);

    public static final String RIGID_LABEL = "rigid";
    static final String HELPER_INDIVIDUAL_PREFIX = "urn:owlmon:helper#a";

    private final OntologyService ontologyService;
    private final OWLDataFactory dataFactory = OWLManager.getOWLDataFactory();
    private final AtomicInteger helperIndividuals = new AtomicInteger();

    public LabelledAxiomReader(OntologyService ontologyService) {
        this.ontologyService = ontologyService;
    }

    public LabelledOntology read(File ontologyFile) {
        LOGGER.info("Reading labelled axioms from {}", ontologyFile.getAbsolutePath());
        return read(ontologyService.loadOntology(ontologyFile));
    }

    public LabelledOntology read(OWLOntology ontology) {
        Map<String, OWLAxiom> translationMap = new LinkedHashMap<>();
        translationMap.put(Symbol.SIGMA, TemporalFormula.tautology());
        Set<IRI> rigidNames = new LinkedHashSet<>();

        List<OWLAxiom> axioms = ontology.axioms().sorted().collect(Collectors.toList());
        for (OWLAxiom axiom : axioms) {
            if (axiom instanceof OWLAnnotationAssertionAxiom) {
                readRigidName((OWLAnnotationAssertionAxiom) axiom, rigidNames);
                continue;
            }

            Optional<String> label = labelOf(axiom);
            if (!label.isPresent()) {
                continue;
            }

            OWLAxiom complement = complementOf(axiom);
            if (complement == null) {
                LOGGER.warn("Ignoring labelled axiom of unsupported type {}: {}",
                        axiom.getAxiomType(), OntologyUtils.formatAxiom(axiom));
                continue;
            }

            String name = label.get();
            if (translationMap.containsKey(name)) {
                LOGGER.warn("Label '{}' used more than once, keeping {}", name, OntologyUtils.formatAxiom(axiom));
            }
            translationMap.put(name, axiom.getAxiomWithoutAnnotations());
            translationMap.put(Symbol.negate(name), complement);
            LOGGER.debug("Proposition {} := {}", name, OntologyUtils.formatAxiom(axiom));
        }

        LabelledOntology result = new LabelledOntology(translationMap, rigidNames);
        LOGGER.info("Read {}", result);
        return result;
    }

    private void readRigidName(OWLAnnotationAssertionAxiom axiom, Set<IRI> rigidNames) {
        if (!axiom.getProperty().isLabel()) {
            return;
        }
        OWLAnnotationValue value = axiom.getValue();
        if (value instanceof OWLLiteral && RIGID_LABEL.equals(((OWLLiteral) value).getLiteral())) {
            OWLAnnotationSubject subject = axiom.getSubject();
            if (subject instanceof IRI) {
                rigidNames.add((IRI) subject);
                LOGGER.debug("Rigid name: {}", subject);
            }
        }
    }

    private Optional<String> labelOf(OWLAxiom axiom) {
        return axiom.annotations()
                .filter(annotation -> annotation.getProperty().isLabel())
                .map(OWLAnnotation::getValue)
                .filter(value -> value instanceof OWLLiteral)
                .map(value -> ((OWLLiteral) value).getLiteral())
                .findFirst();
    }

    /**
     * @return the complement, or {@code null} for unsupported axiom types
     */
    private OWLAxiom complementOf(OWLAxiom axiom) {
        // C(a)
        if (axiom instanceof OWLClassAssertionAxiom) {
            OWLClassAssertionAxiom ax = (OWLClassAssertionAxiom) axiom;
            return dataFactory.getOWLClassAssertionAxiom(
                    dataFactory.getOWLObjectComplementOf(ax.getClassExpression()),
                    ax.getIndividual());
        }

        // not r(a,b)
        if (axiom instanceof OWLNegativeObjectPropertyAssertionAxiom) {
            OWLNegativeObjectPropertyAssertionAxiom ax = (OWLNegativeObjectPropertyAssertionAxiom) axiom;
            return dataFactory.getOWLObjectPropertyAssertionAxiom(
                    ax.getProperty(), ax.getSubject(), ax.getObject());
        }

        // r(a,b)
        if (axiom instanceof OWLObjectPropertyAssertionAxiom) {
            OWLObjectPropertyAssertionAxiom ax = (OWLObjectPropertyAssertionAxiom) axiom;
            return dataFactory.getOWLNegativeObjectPropertyAssertionAxiom(
                    ax.getProperty(), ax.getSubject(), ax.getObject());
        }

        // C SubClassOf D, complement (C and not D)(x)
        if (axiom instanceof OWLSubClassOfAxiom) {
            OWLSubClassOfAxiom ax = (OWLSubClassOfAxiom) axiom;
            OWLNamedIndividual helper = dataFactory.getOWLNamedIndividual(
                    IRI.create(HELPER_INDIVIDUAL_PREFIX + helperIndividuals.getAndIncrement()));
            return dataFactory.getOWLClassAssertionAxiom(
                    dataFactory.getOWLObjectIntersectionOf(
                            ax.getSubClass(),
                            dataFactory.getOWLObjectComplementOf(ax.getSuperClass())),
                    helper);
        }

        return null;
    }
}
