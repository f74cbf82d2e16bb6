/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.reveille.agent.workload;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Host-wide mutual exclusion around the alarm workload, backed by a marker file.
 *
 * <p>The marker is created atomically and holds the owner's pid on the first line and the
 * acquisition time in epoch millis on the second. A marker older than the stale threshold is
 * assumed to belong to a crashed holder: it is deleted and creation is retried once.</p>
 *
 * <p>{@link #acquire(Duration)} blocks while polling and must not be called on an event loop.</p>
 *
 * <pre>{@code
 * Optional<SingleFlightGuard.Lease> lease = guard.acquire(Duration.ZERO);
 * if (lease.isPresent()) {
 *     try (SingleFlightGuard.Lease held = lease.get()) {
 *         // exclusive section
 *     }
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class SingleFlightGuard {

    private static final Logger logger = LoggerFactory.getLogger(SingleFlightGuard.class);

    private final Path lockFile;
    private final Duration staleAfter;
    private final Duration pollInterval;
    private final AtomicReference<Lease> held = new AtomicReference<>();

    /**
     * @param lockFile     marker file location
     * @param staleAfter   age after which a marker is reclaimed
     * @param pollInterval wait between attempts while a wait budget remains
     */
    public SingleFlightGuard(Path lockFile, Duration staleAfter, Duration pollInterval) {
        this.lockFile = Objects.requireNonNull(lockFile, "Lock file cannot be null");
        this.staleAfter = Objects.requireNonNull(staleAfter, "Stale threshold cannot be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "Poll interval cannot be null");
    }

    /**
     * Tries to take the lock, polling until the budget is spent.
     *
     * @param waitBudget how long to keep trying; {@link Duration#ZERO} tries once
     * @return the lease, or empty if another holder kept the lock for the whole budget
     * @throws UncheckedIOException if the marker cannot be written for a reason other than contention
     */
    public Optional<Lease> acquire(Duration waitBudget) {
        long deadline = System.nanoTime() + waitBudget.toNanos();
        while (true) {
            Optional<Lease> lease = tryCreate();
            if (lease.isPresent()) {
                return lease;
            }
            if (reclaimIfStale()) {
                lease = tryCreate();
                if (lease.isPresent()) {
                    return lease;
                }
            }

            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0) {
                logger.debug("Lock {} is held by another process", lockFile);
                return Optional.empty();
            }
            try {
                Thread.sleep(Math.max(1, Math.min(pollInterval.toMillis(), remainingNanos / 1_000_000)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }

    /**
     * Releases the lock if this instance holds it. Safe to call when not held.
     */
    public void release() {
        Lease lease = held.get();
        if (lease != null) {
            lease.close();
        }
    }

    /**
     * @return true if a marker exists and is not stale, whoever holds it
     */
    public boolean isLocked() {
        try {
            Optional<Duration> age = markerAge();
            return age.isPresent() && age.get().compareTo(staleAfter) <= 0;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public Path getLockFile() {
        return lockFile;
    }

    private Optional<Lease> tryCreate() {
        String content = ProcessHandle.current().pid() + "\n" + Instant.now().toEpochMilli() + "\n";
        try {
            Path parent = lockFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(lockFile, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create lock file " + lockFile, e);
        }
        Lease lease = new Lease(content);
        held.set(lease);
        logger.debug("Lock {} acquired", lockFile);
        return Optional.of(lease);
    }

    private boolean reclaimIfStale() {
        try {
            Optional<Duration> age = markerAge();
            if (age.isEmpty()) {
                // vanished between the create attempt and now
                return true;
            }
            if (age.get().compareTo(staleAfter) <= 0) {
                return false;
            }
            logger.warn("Removing stale lock {} (age {}s)", lockFile, age.get().toSeconds());
            Files.deleteIfExists(lockFile);
            return true;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot inspect lock file " + lockFile, e);
        }
    }

    private Optional<Duration> markerAge() throws IOException {
        Instant acquiredAt;
        try {
            List<String> lines = Files.readAllLines(lockFile, StandardCharsets.UTF_8);
            acquiredAt = parseTimestamp(lines).orElse(null);
            if (acquiredAt == null) {
                acquiredAt = Files.getLastModifiedTime(lockFile).toInstant();
            }
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(acquiredAt, Instant.now()));
    }

    private static Optional<Instant> parseTimestamp(List<String> lines) {
        if (lines.size() < 2) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.ofEpochMilli(Long.parseLong(lines.get(1).trim())));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Proof of holding the lock. Closing it removes the marker, but only if the marker on
     * disk is still the one this lease wrote.
     */
    public final class Lease implements AutoCloseable {

        private final String content;

        private Lease(String content) {
            this.content = content;
        }

        @Override
        public void close() {
            if (!held.compareAndSet(this, null)) {
                return;
            }
            try {
                String onDisk = Files.readString(lockFile, StandardCharsets.UTF_8);
                if (onDisk.equals(content)) {
                    Files.deleteIfExists(lockFile);
                    logger.debug("Lock {} released", lockFile);
                } else {
                    logger.warn("Lock {} was reclaimed by another holder, leaving it in place", lockFile);
                }
            } catch (NoSuchFileException e) {
                logger.warn("Lock {} already removed", lockFile);
            } catch (IOException e) {
                logger.error("Failed to release lock {}: {}", lockFile, e.getMessage());
            }
        }
    }
}
