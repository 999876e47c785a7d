package org.rescueswarm.engine.domain.registry;

import org.rescueswarm.engine.domain.ValidationException;
import org.rescueswarm.engine.domain.geo.GeoCost;
import org.rescueswarm.engine.domain.model.Detection;
import org.rescueswarm.engine.domain.model.DetectionResult;
import org.rescueswarm.engine.domain.model.GeoPoint;
import org.rescueswarm.engine.domain.model.InjuryLevel;
import org.rescueswarm.engine.domain.model.Victim;
import org.rescueswarm.engine.domain.model.VictimStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * Thread-safe in-memory VictimRegistry.
 * Uses a read-write lock: snapshots share the read lock, mutations take the write lock.
 *
 * <p>Merge policy, chosen so the outcome does not depend on arrival order:
 * the location follows the newest observation, while detection time, survival
 * likelihood and injury level belong to the earliest one.
 */
public final class VictimRegistryImpl implements VictimRegistry {

    private static final Logger LOG = Logger.getLogger(VictimRegistryImpl.class.getName());

    private static final String ID_PREFIX = "victim-";

    private final double mergeRadiusMeters;
    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Record> records = new LinkedHashMap<>();
    private long sequence = 0;

    public VictimRegistryImpl(double mergeRadiusMeters) {
        this(mergeRadiusMeters, Clock.systemUTC());
    }

    public VictimRegistryImpl(double mergeRadiusMeters, Clock clock) {
        if (!(mergeRadiusMeters >= 0.0) || Double.isInfinite(mergeRadiusMeters)) {
            throw new IllegalArgumentException("mergeRadiusMeters must be a finite value >= 0");
        }
        this.mergeRadiusMeters = mergeRadiusMeters;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public DetectionResult upsertDetection(Detection detection) {
        validate(detection);

        lock.writeLock().lock();
        try {
            String candidateId = normalizeId(detection.getVictimCandidateId());
            if (candidateId != null) {
                Record known = records.get(candidateId);
                if (known != null) {
                    if (known.status == VictimStatus.ACTIVE) {
                        known.merge(detection);
                    } else {
                        LOG.fine(() -> "Ignoring detection for retired victim " + candidateId);
                    }
                    return new DetectionResult(known.id, false);
                }
            }

            Record nearest = findNearestActive(detection.getLocation());
            if (nearest != null) {
                nearest.merge(detection);
                LOG.fine(() -> "Merged detection into " + nearest.id);
                return new DetectionResult(nearest.id, false);
            }

            String id = candidateId != null ? candidateId : nextId();
            Record created = new Record(id, detection);
            records.put(id, created);
            LOG.info(() -> String.format("Registered victim %s at %s (%s, survival=%.2f)",
                    id, detection.getLocation(), detection.getInjuryLevel().getCode(),
                    detection.getSurvivalLikelihood()));
            return new DetectionResult(id, true);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean markServed(String victimId) {
        lock.writeLock().lock();
        try {
            Record record = records.get(victimId);
            if (record == null || record.status != VictimStatus.ACTIVE) {
                return false;
            }
            record.retire(VictimStatus.SERVED, clock.instant());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<String> expireStale(Instant now, Duration maxAge) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(maxAge, "maxAge must not be null");
        Instant cutoff = now.minus(maxAge);

        lock.writeLock().lock();
        try {
            List<String> expired = new ArrayList<>();
            for (Record record : records.values()) {
                if (record.status == VictimStatus.ACTIVE
                        && record.assignedResponderId == null
                        && record.detectedAt.isBefore(cutoff)) {
                    record.retire(VictimStatus.EXPIRED, now);
                    expired.add(record.id);
                }
            }
            if (!expired.isEmpty()) {
                LOG.info(() -> "Expired " + expired.size() + " stale victims: " + expired);
            }
            return expired;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Victim> activeVictims() {
        lock.readLock().lock();
        try {
            List<Victim> active = new ArrayList<>();
            for (Record record : records.values()) {
                if (record.status == VictimStatus.ACTIVE) {
                    active.add(record.snapshot());
                }
            }
            return active;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Victim> allVictims() {
        lock.readLock().lock();
        try {
            List<Victim> all = new ArrayList<>(records.size());
            for (Record record : records.values()) {
                all.add(record.snapshot());
            }
            return all;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Victim get(String victimId) {
        lock.readLock().lock();
        try {
            Record record = records.get(victimId);
            return record != null ? record.snapshot() : null;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void assign(Collection<String> victimIds, String responderId) {
        Objects.requireNonNull(responderId, "responderId must not be null");
        lock.writeLock().lock();
        try {
            for (String victimId : victimIds) {
                Record record = records.get(victimId);
                if (record != null && record.status == VictimStatus.ACTIVE) {
                    record.assignedResponderId = responderId;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void release(Collection<String> victimIds) {
        lock.writeLock().lock();
        try {
            for (String victimId : victimIds) {
                Record record = records.get(victimId);
                if (record != null) {
                    record.assignedResponderId = null;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void updateScores(Map<String, Double> scores) {
        lock.writeLock().lock();
        try {
            for (Map.Entry<String, Double> entry : scores.entrySet()) {
                Record record = records.get(entry.getKey());
                if (record != null && entry.getValue() != null) {
                    record.priorityScore = entry.getValue();
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int purgeRetired(Instant now, Duration retention) {
        Instant cutoff = now.minus(retention);
        lock.writeLock().lock();
        try {
            int removed = 0;
            Iterator<Record> it = records.values().iterator();
            while (it.hasNext()) {
                Record record = it.next();
                if (record.status.isTerminal() && record.retiredAt != null && record.retiredAt.isBefore(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
            if (removed > 0) {
                final int count = removed;
                LOG.info(() -> "Purged " + count + " retired victim records");
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Nearest active record within the merge radius. Equal distances keep the earlier-inserted record.
     * Caller must hold the lock.
     */
    private Record findNearestActive(GeoPoint location) {
        Record best = null;
        double bestDistance = Double.MAX_VALUE;
        for (Record record : records.values()) {
            if (record.status != VictimStatus.ACTIVE) {
                continue;
            }
            double distance = GeoCost.distanceMeters(record.location, location);
            if (distance <= mergeRadiusMeters && distance < bestDistance) {
                best = record;
                bestDistance = distance;
            }
        }
        return best;
    }

    /**
     * Caller must hold the write lock.
     */
    private String nextId() {
        String id;
        do {
            sequence++;
            id = String.format("%s%06d", ID_PREFIX, sequence);
        } while (records.containsKey(id));
        return id;
    }

    private static String normalizeId(String id) {
        if (id == null || id.trim().isEmpty()) {
            return null;
        }
        return id.trim();
    }

    private static void validate(Detection detection) {
        if (detection == null) {
            throw new ValidationException("detection must not be null");
        }
        GeoPoint location = detection.getLocation();
        if (location == null || !location.isValid()) {
            throw new ValidationException("invalid detection coordinates: " + location);
        }
        double survival = detection.getSurvivalLikelihood();
        if (!Double.isFinite(survival) || survival < 0.0 || survival > 1.0) {
            throw new ValidationException("survivalLikelihood must be within [0,1], got " + survival);
        }
        if (detection.getInjuryLevel() == null) {
            throw new ValidationException("injuryLevel must not be null");
        }
        if (detection.getDetectedAt() == null) {
            throw new ValidationException("detectedAt must not be null");
        }
    }

    /**
     * Mutable registry-owned record. Guarded by the registry lock.
     */
    private static final class Record {
        private final String id;
        private GeoPoint location;
        private InjuryLevel injuryLevel;
        private double survivalLikelihood;
        private Instant detectedAt;
        private Instant lastSeenAt;
        private double priorityScore;
        private VictimStatus status = VictimStatus.ACTIVE;
        private String assignedResponderId;
        private Instant retiredAt;

        Record(String id, Detection detection) {
            this.id = id;
            this.location = detection.getLocation();
            this.injuryLevel = detection.getInjuryLevel();
            this.survivalLikelihood = detection.getSurvivalLikelihood();
            this.detectedAt = detection.getDetectedAt();
            this.lastSeenAt = detection.getDetectedAt();
        }

        void merge(Detection detection) {
            Instant observedAt = detection.getDetectedAt();
            int seen = observedAt.compareTo(lastSeenAt);
            if (seen > 0 || (seen == 0 && compareLocation(detection.getLocation(), location) < 0)) {
                location = detection.getLocation();
                lastSeenAt = observedAt;
            }
            int first = observedAt.compareTo(detectedAt);
            if (first < 0 || (first == 0 && compareAttributes(detection, injuryLevel, survivalLikelihood) < 0)) {
                detectedAt = observedAt;
                injuryLevel = detection.getInjuryLevel();
                survivalLikelihood = detection.getSurvivalLikelihood();
            }
        }

        /**
         * Tie-break for sightings at the same instant: lower latitude, then lower longitude wins.
         */
        private static int compareLocation(GeoPoint candidate, GeoPoint current) {
            int byLat = Double.compare(candidate.getLatitude(), current.getLatitude());
            return byLat != 0 ? byLat : Double.compare(candidate.getLongitude(), current.getLongitude());
        }

        /**
         * Tie-break for first sightings at the same instant: the more severe injury wins,
         * then the lower survival likelihood.
         */
        private static int compareAttributes(Detection candidate, InjuryLevel level, double survival) {
            int bySeverity = Integer.compare(level.ordinal(), candidate.getInjuryLevel().ordinal());
            return bySeverity != 0 ? bySeverity : Double.compare(candidate.getSurvivalLikelihood(), survival);
        }

        void retire(VictimStatus terminal, Instant at) {
            status = terminal;
            retiredAt = at;
            assignedResponderId = null;
        }

        Victim snapshot() {
            return new Victim.Builder()
                    .id(id)
                    .location(location)
                    .injuryLevel(injuryLevel)
                    .survivalLikelihood(survivalLikelihood)
                    .detectedAt(detectedAt)
                    .lastSeenAt(lastSeenAt)
                    .priorityScore(priorityScore)
                    .status(status)
                    .assignedResponderId(assignedResponderId)
                    .retiredAt(retiredAt)
                    .build();
        }
    }
}
