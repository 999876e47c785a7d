package org.rescueswarm.engine.domain.service;

import org.rescueswarm.engine.domain.model.DispatchConfig;
import org.rescueswarm.engine.domain.model.ScoredVictim;
import org.rescueswarm.engine.domain.model.Victim;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Implementation of PriorityScorer fusing survival estimate, injury severity and elapsed time.
 *
 * Score formula (higher = more urgent):
 *   score = survival_likelihood * 100
 *         * injury_multiplier(injury_level)
 *         * (1 + elapsed_hours / urgency_horizon_hours)
 *
 * A low survival likelihood does not raise priority on its own; severity and
 * waiting time do.
 */
public final class PriorityScorerImpl implements PriorityScorer {

    private static final Logger LOG = Logger.getLogger(PriorityScorerImpl.class.getName());

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private final DispatchConfig config;

    public PriorityScorerImpl(DispatchConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        if (!(config.getUrgencyHorizonHours() > 0.0)) {
            throw new IllegalArgumentException("urgency horizon must be positive");
        }
    }

    @Override
    public double score(Victim victim, Instant now) {
        double base = victim.getSurvivalLikelihood() * 100.0;
        double injuryMultiplier = config.getInjuryMultiplier(victim.getInjuryLevel());
        double urgencyMultiplier = 1.0 + elapsedHours(victim, now) / config.getUrgencyHorizonHours();
        return base * injuryMultiplier * urgencyMultiplier;
    }

    @Override
    public List<ScoredVictim> rank(Collection<Victim> victims, Instant now) {
        List<ScoredVictim> ranked = new ArrayList<>(victims.size());
        for (Victim victim : victims) {
            ranked.add(new ScoredVictim(victim, score(victim, now)));
        }
        Collections.sort(ranked);
        LOG.fine(() -> "Ranked " + ranked.size() + " victims");
        return ranked;
    }

    /**
     * Hours since first detection. Clamped at zero so a clock skewed behind the
     * detection timestamp cannot lower a score.
     */
    private static double elapsedHours(Victim victim, Instant now) {
        long millis = Duration.between(victim.getDetectedAt(), now).toMillis();
        return Math.max(0L, millis) / MILLIS_PER_HOUR;
    }
}
