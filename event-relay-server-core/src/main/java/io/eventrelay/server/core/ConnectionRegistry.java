package io.eventrelay.server.core;

import io.eventrelay.core.EventRelayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded set of active connections keyed by identifier.
 *
 * <p>Membership changes take the write lock, snapshot queries the read lock. Done signals are always
 * fired after the lock is released.
 */
public final class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final int maxConnections;
    private final Map<String, Connection> connections = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public ConnectionRegistry(int maxConnections) {
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("maxConnections must be positive");
        }
        this.maxConnections = maxConnections;
    }

    public int maxConnections() {
        return maxConnections;
    }

    /**
     * Adds a connection.
     *
     * <p>A connection registering under an identifier that is already present replaces the stale entry,
     * which is signalled done. Replacement does not count against capacity.
     *
     * @throws EventRelayException.CapacityExceeded if the registry is full
     */
    public void register(Connection connection) {
        Objects.requireNonNull(connection, "connection");
        Connection replaced;
        lock.writeLock().lock();
        try {
            replaced = connections.get(connection.id());
            if (replaced == null && connections.size() >= maxConnections) {
                throw new EventRelayException.CapacityExceeded(maxConnections);
            }
            connections.put(connection.id(), connection);
        } finally {
            lock.writeLock().unlock();
        }
        if (replaced != null && replaced != connection && replaced.signalDone()) {
            log.info("Client {} replaced by a newer connection", connection.id());
        }
    }

    /**
     * Removes the connection with the given id, if any. Idempotent.
     *
     * @return {@code true} if a connection was removed by this call
     */
    public boolean remove(String id) {
        Connection removed;
        lock.writeLock().lock();
        try {
            removed = connections.remove(id);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed == null) {
            return false;
        }
        if (removed.signalDone()) {
            log.info("Client {} disconnected", id);
        }
        return true;
    }

    /**
     * Removes {@code connection} only if it is still the one registered under its id, and fires its done
     * signal in any case. Idempotent.
     */
    public boolean remove(Connection connection) {
        boolean removed;
        lock.writeLock().lock();
        try {
            removed = connections.remove(connection.id(), connection);
        } finally {
            lock.writeLock().unlock();
        }
        if (connection.signalDone()) {
            log.info("Client {} disconnected", connection.id());
        }
        return removed;
    }

    /**
     * Removes every connection and fires their done signals.
     */
    public void removeAll() {
        List<Connection> drained;
        lock.writeLock().lock();
        try {
            drained = new ArrayList<>(connections.values());
            connections.clear();
        } finally {
            lock.writeLock().unlock();
        }
        for (Connection c : drained) {
            c.signalDone();
        }
        if (!drained.isEmpty()) {
            log.info("Closed {} connections", drained.size());
        }
    }

    public List<Connection> list() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(connections.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> ids() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(connections.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Resolves the ids that are currently registered; unknown ids are skipped.
     */
    public List<Connection> resolve(Collection<String> ids) {
        lock.readLock().lock();
        try {
            List<Connection> out = new ArrayList<>(ids.size());
            for (String id : ids) {
                Connection c = connections.get(id);
                if (c != null && !out.contains(c)) {
                    out.add(c);
                }
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int count() {
        lock.readLock().lock();
        try {
            return connections.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String id) {
        lock.readLock().lock();
        try {
            return connections.containsKey(id);
        } finally {
            lock.readLock().unlock();
        }
    }
}
