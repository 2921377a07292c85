package com.example.owlmon.reasoning;

import openllet.owlapi.OpenlletReasoner;
import openllet.owlapi.OpenlletReasonerFactory;
import org.semanticweb.owlapi.apibinding.OWLManager;
import org.semanticweb.owlapi.model.*;
import org.semanticweb.owlapi.reasoner.OWLReasonerConfiguration;
import org.semanticweb.owlapi.reasoner.SimpleConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pellet-based satisfiability oracle: a set of axioms is satisfiable iff the ontology made of
 * them is consistent.
 * <p>
 * Every check works on a fresh ontology manager, so checks may run concurrently.
 */
public class OpenlletSatisfiabilityOracle implements SatisfiabilityOracle {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenlletSatisfiabilityOracle.class);

    private final OpenlletReasonerFactory reasonerFactory = new OpenlletReasonerFactory();
    private final OWLReasonerConfiguration configuration = new SimpleConfiguration();
    private final AtomicLong checks = new AtomicLong();

    @Override
    public boolean isSatisfiable(Set<OWLAxiom> axioms) {
        OWLOntologyManager manager = OWLManager.createOWLOntologyManager();
        OWLOntology ontology;
        try {
            ontology = manager.createOntology();
        } catch (OWLOntologyCreationException e) {
            throw new OracleException("Could not create ontology for consistency check", e);
        }
        for (OWLAxiom axiom : axioms) {
            manager.addAxiom(ontology, axiom);
        }

        OpenlletReasoner reasoner = reasonerFactory.createReasoner(ontology, configuration);
        try {
            boolean consistent = reasoner.isConsistent();
            long count = checks.incrementAndGet();
            LOGGER.debug("Consistency check #{} on {} axioms: {}", count, axioms.size(),
                    consistent ? "CONSISTENT" : "INCONSISTENT");
            return consistent;
        } finally {
            reasoner.dispose();
            manager.removeOntology(ontology);
        }
    }

    @Override
    public boolean isSatisfiable(List<Set<OWLAxiom>> timePoints, Set<IRI> rigidNames) {
        FlexibleNameStamper stamper = new FlexibleNameStamper(OWLManager.getOWLDataFactory(), rigidNames);
        Set<OWLAxiom> stamped = new LinkedHashSet<>();
        int time = 0;
        for (Set<OWLAxiom> axioms : timePoints) {
            time++;
            for (OWLAxiom axiom : axioms) {
                stamped.add(stamper.stamp(axiom, time));
            }
        }
        return isSatisfiable(stamped);
    }

    /**
     * Number of reasoner invocations so far.
     */
    public long getCheckCount() {
        return checks.get();
    }
}
