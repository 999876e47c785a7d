package org.rescueswarm.engine.domain.service;

import org.rescueswarm.engine.domain.model.ScoredVictim;
import org.rescueswarm.engine.domain.model.Victim;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Service for computing dispatch priority of victims.
 * Higher score = more urgent.
 */
public interface PriorityScorer {

    /**
     * Calculate the priority of a victim at a given instant.
     * For a fixed victim the result never decreases as {@code now} advances.
     *
     * @param victim the victim to score
     * @param now the scoring instant
     * @return priority score, higher is more urgent
     */
    double score(Victim victim, Instant now);

    /**
     * Score every victim and return them in dispatch order
     * (score descending, then oldest detection, then id).
     */
    List<ScoredVictim> rank(Collection<Victim> victims, Instant now);
}
