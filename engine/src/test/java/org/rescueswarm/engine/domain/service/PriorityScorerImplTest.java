package org.rescueswarm.engine.domain.service;

import org.rescueswarm.engine.domain.model.DispatchConfig;
import org.rescueswarm.engine.domain.model.GeoPoint;
import org.rescueswarm.engine.domain.model.InjuryLevel;
import org.rescueswarm.engine.domain.model.ScoredVictim;
import org.rescueswarm.engine.domain.model.Victim;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Priority Scorer Tests")
class PriorityScorerImplTest {

    private static final Instant T0 = Instant.parse("2026-03-01T08:00:00Z");

    private final PriorityScorerImpl scorer = new PriorityScorerImpl(DispatchConfig.defaults());

    private static Victim victim(String id, InjuryLevel level, double survival, Instant detectedAt) {
        return new Victim.Builder()
                .id(id)
                .location(GeoPoint.of(45.0, 5.0))
                .injuryLevel(level)
                .survivalLikelihood(survival)
                .detectedAt(detectedAt)
                .build();
    }

    @Test
    @DisplayName("Fresh detection scores survival x 100 x injury multiplier")
    void testBaseScore() {
        assertEquals(50.0, scorer.score(victim("v", InjuryLevel.NONE, 0.5, T0), T0), 1e-9);
        assertEquals(55.0, scorer.score(victim("v", InjuryLevel.MINOR, 0.5, T0), T0), 1e-9);
        assertEquals(65.0, scorer.score(victim("v", InjuryLevel.SEVERE, 0.5, T0), T0), 1e-9);
        assertEquals(75.0, scorer.score(victim("v", InjuryLevel.UNCONSCIOUS, 0.5, T0), T0), 1e-9);
    }

    @Test
    @DisplayName("Urgency doubles the score after one horizon of waiting")
    void testUrgencyGrowth() {
        Victim v = victim("v", InjuryLevel.MINOR, 0.5, T0);
        assertEquals(82.5, scorer.score(v, T0.plus(Duration.ofHours(12))), 1e-9);
        assertEquals(110.0, scorer.score(v, T0.plus(Duration.ofHours(24))), 1e-9);
    }

    @Test
    @DisplayName("Score is non-decreasing in elapsed time, injury severity and survival")
    void testMonotonicity() {
        Victim v = victim("v", InjuryLevel.SEVERE, 0.6, T0);
        double previous = -1.0;
        for (int minutes = 0; minutes <= 600; minutes += 30) {
            double current = scorer.score(v, T0.plus(Duration.ofMinutes(minutes)));
            assertTrue(current >= previous);
            previous = current;
        }

        double lastByInjury = -1.0;
        for (InjuryLevel level : InjuryLevel.values()) {
            double current = scorer.score(victim("v", level, 0.6, T0), T0);
            assertTrue(current >= lastByInjury);
            lastByInjury = current;
        }

        assertTrue(scorer.score(victim("v", InjuryLevel.MINOR, 0.9, T0), T0)
                > scorer.score(victim("v", InjuryLevel.MINOR, 0.3, T0), T0));
    }

    @Test
    @DisplayName("Clock behind the detection time does not lower the score")
    void testClockSkewClamped() {
        Victim v = victim("v", InjuryLevel.MINOR, 0.5, T0);
        assertEquals(55.0, scorer.score(v, T0.minusSeconds(600)), 1e-9);
    }

    @Test
    @DisplayName("Ranking orders by score, then detection time, then id")
    void testRankOrdering() {
        Victim low = victim("v-low", InjuryLevel.NONE, 0.2, T0);
        Victim high = victim("v-high", InjuryLevel.UNCONSCIOUS, 0.9, T0);
        Victim tieLater = victim("v-a", InjuryLevel.MINOR, 0.5, T0.plusSeconds(1));
        Victim tieEarlierB = victim("v-c", InjuryLevel.MINOR, 0.5, T0);
        Victim tieEarlierA = victim("v-b", InjuryLevel.MINOR, 0.5, T0);

        // scored at T0, so the later detection has zero elapsed time like the others
        List<ScoredVictim> ranked = scorer.rank(
                Arrays.asList(low, tieLater, high, tieEarlierB, tieEarlierA), T0);

        assertEquals("v-high", ranked.get(0).getId());
        assertEquals("v-b", ranked.get(1).getId());
        assertEquals("v-c", ranked.get(2).getId());
        assertEquals("v-a", ranked.get(3).getId());
        assertEquals("v-low", ranked.get(4).getId());
    }

    @Test
    @DisplayName("Custom injury multipliers are honoured")
    void testCustomMultipliers() {
        DispatchConfig config = DispatchConfig.defaults().with(DispatchConfig.INJURY_MULTIPLIER_SEVERE, 3.0);
        PriorityScorerImpl custom = new PriorityScorerImpl(config);
        assertEquals(150.0, custom.score(victim("v", InjuryLevel.SEVERE, 0.5, T0), T0), 1e-9);
    }

    @Test
    @DisplayName("Urgency horizon must be positive")
    void testInvalidHorizon() {
        DispatchConfig config = DispatchConfig.defaults().with(DispatchConfig.URGENCY_HORIZON_HOURS, 0.0);
        assertThrows(IllegalArgumentException.class, () -> new PriorityScorerImpl(config));
    }
}
