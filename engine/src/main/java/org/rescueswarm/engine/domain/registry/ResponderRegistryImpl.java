package org.rescueswarm.engine.domain.registry;

import org.rescueswarm.engine.domain.CapacityExceededException;
import org.rescueswarm.engine.domain.ValidationException;
import org.rescueswarm.engine.domain.model.Responder;
import org.rescueswarm.engine.domain.model.ResponderStatus;
import org.rescueswarm.engine.domain.model.ResponderStatusUpdate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * Thread-safe in-memory ResponderRegistry, keyed and iterated by responder id.
 */
public final class ResponderRegistryImpl implements ResponderRegistry {

    private static final Logger LOG = Logger.getLogger(ResponderRegistryImpl.class.getName());

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Responder> responders = new TreeMap<>();

    @Override
    public Responder upsert(ResponderStatusUpdate update) {
        validate(update);
        String id = normalizeId(update.getResponderId());

        lock.writeLock().lock();
        try {
            Responder previous = responders.get(id);
            List<String> route = Collections.emptyList();
            if (previous != null && update.getStatus() == ResponderStatus.ENROUTE) {
                route = previous.getCurrentRoute();
                if (route.size() > update.getCapacity()) {
                    throw new CapacityExceededException(id, update.getCapacity(), route.size());
                }
            }
            responders.put(id, new Responder(id, update.getLocation(), update.getCapacity(), update.getStatus(), route));
            if (previous == null) {
                LOG.info(() -> String.format("Registered responder %s (%s, capacity=%d)",
                        id, update.getStatus().getCode(), update.getCapacity()));
            } else if (previous.getStatus() != update.getStatus()) {
                LOG.info(() -> String.format("Responder %s: %s -> %s",
                        id, previous.getStatus().getCode(), update.getStatus().getCode()));
            }
            return previous;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<String> setAvailable(String responderId) {
        String id = normalizeId(responderId);
        if (id == null) {
            return Collections.emptyList();
        }
        lock.writeLock().lock();
        try {
            Responder current = responders.get(id);
            if (current == null) {
                return Collections.emptyList();
            }
            responders.put(id, new Responder(id, current.getLocation(), current.getCapacity(),
                    ResponderStatus.AVAILABLE, Collections.emptyList()));
            return current.getCurrentRoute();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean setRoute(String responderId, List<String> victimIds) {
        Objects.requireNonNull(victimIds, "victimIds must not be null");
        String id = normalizeId(responderId);
        if (id == null) {
            return false;
        }
        lock.writeLock().lock();
        try {
            Responder current = responders.get(id);
            if (current == null) {
                return false;
            }
            if (victimIds.size() > current.getCapacity()) {
                throw new CapacityExceededException(id, current.getCapacity(), victimIds.size());
            }
            ResponderStatus status = victimIds.isEmpty() ? ResponderStatus.AVAILABLE : ResponderStatus.ENROUTE;
            responders.put(id, new Responder(id, current.getLocation(), current.getCapacity(),
                    status, victimIds));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Responder> availableResponders() {
        lock.readLock().lock();
        try {
            List<Responder> available = new ArrayList<>();
            for (Responder responder : responders.values()) {
                if (responder.isAvailable()) {
                    available.add(responder);
                }
            }
            return available;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Responder> all() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(responders.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Responder get(String responderId) {
        String id = normalizeId(responderId);
        if (id == null) {
            return null;
        }
        lock.readLock().lock();
        try {
            return responders.get(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Ids are stored trimmed; lookups go through the same normalisation.
     */
    static String normalizeId(String responderId) {
        if (responderId == null) {
            return null;
        }
        String trimmed = responderId.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static void validate(ResponderStatusUpdate update) {
        if (update == null) {
            throw new ValidationException("responder update must not be null");
        }
        if (update.getResponderId() == null || update.getResponderId().trim().isEmpty()) {
            throw new ValidationException("responderId must not be blank");
        }
        if (update.getLocation() == null || !update.getLocation().isValid()) {
            throw new ValidationException("invalid responder coordinates: " + update.getLocation());
        }
        if (update.getCapacity() < 0) {
            throw new ValidationException("capacity must be >= 0, got " + update.getCapacity());
        }
        if (update.getStatus() == null) {
            throw new ValidationException("status must not be null");
        }
    }
}
