package com.wine.resolution.catalog;

import com.wine.resolution.core.model.CanonicalWineRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory {@link CatalogStore}.
 * Thread-safe; iterates in insertion order. Records are copied on the way in and out
 * so callers cannot mutate stored state without going through {@link #update}.
 */
public class InMemoryCatalogStore implements CatalogStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCatalogStore.class);

    private final Map<String, CanonicalWineRecord> records = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Optional<CanonicalWineRecord> findOne(CatalogFilter filter) {
        lock.readLock().lock();
        try {
            for (CanonicalWineRecord record : records.values()) {
                if (filter.test(record)) {
                    return Optional.of(record.copy());
                }
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<CanonicalWineRecord> findMany(CatalogFilter filter, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        lock.readLock().lock();
        try {
            List<CanonicalWineRecord> results = new ArrayList<>();
            for (CanonicalWineRecord record : records.values()) {
                if (results.size() >= limit) {
                    break;
                }
                if (filter.test(record)) {
                    results.add(record.copy());
                }
            }
            return results;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public CanonicalWineRecord insert(CanonicalWineRecord record) {
        lock.writeLock().lock();
        try {
            if (records.containsKey(record.getId())) {
                throw new CatalogStoreException("Record already exists: " + record.getId());
            }
            records.put(record.getId(), record.copy());
            log.debug("catalog.insert id={} name='{}'", record.getId(), record.getName());
            return record.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void update(CanonicalWineRecord record) {
        lock.writeLock().lock();
        try {
            if (!records.containsKey(record.getId())) {
                throw new CatalogStoreException("Record not found: " + record.getId());
            }
            records.put(record.getId(), record.copy());
            log.debug("catalog.update id={} name='{}'", record.getId(), record.getName());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Number of stored records, user-owned copies included.
     */
    public int size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
