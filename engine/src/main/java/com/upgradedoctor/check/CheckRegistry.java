package com.upgradedoctor.check;

import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Catalogue of checks keyed by ID.
 *
 * One instance is built at startup by {@code CheckRegistryFactory} and injected wherever checks
 * are selected. Registration takes the write lock; every lookup and listing takes the read lock.
 * Listings are fresh lists in no particular order.
 */
public class CheckRegistry {

    private static final Logger log = LoggerFactory.getLogger(CheckRegistry.class);

    private final Map<String, Check> checks = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public void register(Check check) throws DuplicateCheckException {
        lock.writeLock().lock();
        try {
            if (checks.containsKey(check.id())) {
                throw new DuplicateCheckException(check.id());
            }
            checks.put(check.id(), check);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Registered check {} ({})", check.id(), check.group());
    }

    /**
     * Registers a check whose ID is known to be unique. A duplicate is a programming error and
     * fails bean creation.
     */
    public void mustRegister(Check check) {
        try {
            register(check);
        } catch (DuplicateCheckException e) {
            throw new IllegalStateException("Failed to register check: " + e.getMessage(), e);
        }
    }

    public Optional<Check> get(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(checks.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Check> listAll() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(checks.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Check> listByGroup(CheckGroup group) {
        lock.readLock().lock();
        try {
            List<Check> result = new ArrayList<>();
            for (Check c : checks.values()) {
                if (c.group() == group) {
                    result.add(c);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return checks.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Checks matching {@code pattern}, restricted to {@code group} when it is non-null.
     *
     * @throws InvalidPatternException when the pattern is a malformed glob
     */
    public List<Check> listByPattern(String pattern, @Nullable CheckGroup group) {
        return listByPatterns(List.of(pattern), group);
    }

    /**
     * Union of the checks matching any of {@code patterns}, restricted to {@code group} when it is
     * non-null. A check matched by several patterns appears once.
     *
     * @throws InvalidPatternException when any pattern is a malformed glob
     */
    public List<Check> listByPatterns(List<String> patterns, @Nullable CheckGroup group) {
        lock.readLock().lock();
        try {
            Map<String, Check> selected = new LinkedHashMap<>();
            for (String pattern : patterns) {
                for (Check check : checks.values()) {
                    if (group != null && check.group() != group) {
                        continue;
                    }
                    if (matches(check, pattern)) {
                        selected.putIfAbsent(check.id(), check);
                    }
                }
            }
            return new ArrayList<>(selected.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    private static boolean matches(Check check, String pattern) {
        try {
            return CheckSelector.matches(check, pattern);
        } catch (InvalidPatternException e) {
            throw new InvalidPatternException(
                "pattern matching for check " + check.id() + ": " + e.getMessage(), e);
        }
    }
}
