package com.example.owlmon.reasoning;

import org.semanticweb.owlapi.model.IRI;
import org.semanticweb.owlapi.model.OWLAxiom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Remembers the answers of another oracle. Keys are copies of the queried sets, so callers may
 * reuse their collections.
 */
public class CachingSatisfiabilityOracle implements SatisfiabilityOracle {

    private static final Logger LOGGER = LoggerFactory.getLogger(CachingSatisfiabilityOracle.class);

    private final SatisfiabilityOracle delegate;
    private final Map<Set<OWLAxiom>, Boolean> singleAnswers = new ConcurrentHashMap<>();
    private final Map<List<Object>, Boolean> sequenceAnswers = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public CachingSatisfiabilityOracle(SatisfiabilityOracle delegate) {
        this.delegate = delegate;
    }

    @Override
    public boolean isSatisfiable(Set<OWLAxiom> axioms) {
        Set<OWLAxiom> key = new HashSet<>(axioms);
        Boolean cached = singleAnswers.get(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }
        misses.incrementAndGet();
        boolean answer = delegate.isSatisfiable(axioms);
        singleAnswers.put(key, answer);
        return answer;
    }

    @Override
    public boolean isSatisfiable(List<Set<OWLAxiom>> timePoints, Set<IRI> rigidNames) {
        List<Object> key = new ArrayList<>(timePoints.size() + 1);
        for (Set<OWLAxiom> axioms : timePoints) {
            key.add(new HashSet<>(axioms));
        }
        key.add(new HashSet<>(rigidNames));

        Boolean cached = sequenceAnswers.get(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }
        misses.incrementAndGet();
        boolean answer = delegate.isSatisfiable(timePoints, rigidNames);
        sequenceAnswers.put(key, answer);
        return answer;
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public void logStatistics() {
        LOGGER.info("Oracle cache: {} hits, {} misses, {} cached answers",
                hits.get(), misses.get(), singleAnswers.size() + sequenceAnswers.size());
    }

    public void clear() {
        singleAnswers.clear();
        sequenceAnswers.clear();
    }
}
