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

import dev.mars.reveille.agent.config.AgentConfiguration;
import dev.mars.reveille.agent.observability.AgentMetrics;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs the alarm workload as a child process, one at a time per host.
 *
 * <p>Each trigger moves through Locking, Validating and Running before ending Completed,
 * Failed or TimedOut. The blocking work happens on a dedicated worker pool so the caller's
 * event loop is never held up by a run that can last half an hour. The pool has two threads
 * so that a trigger arriving during a run reaches the lock and fails at once instead of
 * queueing behind it.</p>
 *
 * <p>The lock is released on every path. {@link WorkloadListener#onCompleted(WorkloadOutcome)}
 * is called exactly once per trigger, on the caller's context. Closing the runner lets an
 * in-flight workload run to its end or its ceiling; only the ceiling kills a child.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class WorkloadRunner {

    private static final Logger logger = LoggerFactory.getLogger(WorkloadRunner.class);

    static final String LOCK_BUSY = "Another alarm is already running";
    private static final int STDERR_TAIL_CHARS = 200;
    private static final int POOL_SIZE = 2;
    private static final Duration KILL_GRACE = Duration.ofSeconds(5);

    private final Vertx vertx;
    private final AgentConfiguration config;
    private final SingleFlightGuard guard;
    private final WorkloadListener listener;
    private final AgentMetrics metrics;
    private final WorkerExecutor executor;
    private final Set<Future<WorkloadOutcome>> inFlight = ConcurrentHashMap.newKeySet();

    public WorkloadRunner(Vertx vertx, AgentConfiguration config, SingleFlightGuard guard,
                          WorkloadListener listener, AgentMetrics metrics) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.config = Objects.requireNonNull(config, "Configuration cannot be null");
        this.guard = Objects.requireNonNull(guard, "Guard cannot be null");
        this.listener = Objects.requireNonNull(listener, "Listener cannot be null");
        this.metrics = metrics;
        // the worker blocked-thread checker only warns; the process ceiling is enforced below
        long maxExecuteSeconds = config.getMaxWorkloadDuration().toSeconds() + 60;
        this.executor = vertx.createSharedWorkerExecutor("reveille-workload", POOL_SIZE,
                maxExecuteSeconds, TimeUnit.SECONDS);
    }

    /**
     * Starts one run of the workload for the given alarm.
     *
     * @return the terminal outcome; the future never fails
     */
    public Future<WorkloadOutcome> trigger(long scheduleId) {
        Context context = vertx.getOrCreateContext();
        long startNanos = System.nanoTime();
        logger.info("Alarm {} triggered, starting workload", scheduleId);

        Future<WorkloadOutcome> run = executor.executeBlocking(() -> execute(scheduleId, context, startNanos), false)
                .recover(err -> {
                    logger.error("Workload for alarm {} failed unexpectedly", scheduleId, err);
                    return Future.succeededFuture(WorkloadOutcome.failed(scheduleId,
                            "Unexpected error: " + err.getMessage(), elapsedSince(startNanos)));
                })
                .onSuccess(outcome -> {
                    logOutcome(outcome);
                    if (metrics != null) {
                        metrics.recordWorkloadOutcome(outcome.status());
                    }
                    listener.onCompleted(outcome);
                });
        inFlight.add(run);
        run.onComplete(ar -> inFlight.remove(run));
        return run;
    }

    /**
     * Age after which another trigger may reclaim the lock: the ceiling plus the time a killed
     * child gets to exit, with the same again as margin.
     */
    public static Duration lockStaleAfter(AgentConfiguration config) {
        return config.getMaxWorkloadDuration().plus(KILL_GRACE.multipliedBy(2));
    }

    /**
     * Checks that the workload root, script and model exist.
     *
     * @return one message per missing prerequisite, empty when the agent can start
     */
    public List<String> checkPrerequisites() {
        List<String> problems = new ArrayList<>();
        if (!Files.isDirectory(config.getWorkloadRoot())) {
            problems.add("Workload root not found: " + config.getWorkloadRoot());
        }
        if (!Files.exists(config.scriptPath())) {
            problems.add("Alarm script not found: " + config.scriptPath());
        }
        if (!Files.exists(config.modelFilePath())) {
            problems.add("Model file not found: " + config.modelFilePath());
        }
        return problems;
    }

    /**
     * Waits for in-flight workloads to finish, then releases the worker pool.
     */
    public Future<Void> close() {
        List<Future<WorkloadOutcome>> running = new ArrayList<>(inFlight);
        if (!running.isEmpty()) {
            logger.info("Waiting for {} running workload(s) before closing", running.size());
        }
        return Future.join(running).transform(ar -> executor.close());
    }

    private WorkloadOutcome execute(long scheduleId, Context context, long startNanos) {
        Optional<SingleFlightGuard.Lease> lease = guard.acquire(Duration.ZERO);
        if (lease.isEmpty()) {
            return WorkloadOutcome.failed(scheduleId, LOCK_BUSY, elapsedSince(startNanos));
        }

        try (SingleFlightGuard.Lease held = lease.get()) {
            Path script = config.scriptPath();
            if (!Files.exists(script)) {
                return WorkloadOutcome.failed(scheduleId, "Alarm script not found: " + script, elapsedSince(startNanos));
            }
            Path model = config.modelFilePath();
            if (!Files.exists(model)) {
                return WorkloadOutcome.failed(scheduleId, "Model file not found: " + model, elapsedSince(startNanos));
            }

            context.runOnContext(v -> listener.onTriggered(scheduleId));
            return runProcess(scheduleId, script, startNanos);
        }
    }

    private WorkloadOutcome runProcess(long scheduleId, Path script, long startNanos) {
        List<String> command = new ArrayList<>();
        if (config.hasInterpreter()) {
            command.add(config.getInterpreter());
        }
        command.add(script.toString());

        Path stderrFile = null;
        Process process = null;
        try {
            stderrFile = Files.createTempFile("reveille-workload-", ".stderr");
            process = new ProcessBuilder(command)
                    .directory(config.getWorkloadRoot().toFile())
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(stderrFile.toFile())
                    .start();
            logger.debug("Alarm {} workload started as pid {}: {}", scheduleId, process.pid(), command);

            Duration ceiling = config.getMaxWorkloadDuration();
            if (!awaitExit(process, ceiling)) {
                process.destroyForcibly();
                awaitExit(process, KILL_GRACE);
                return WorkloadOutcome.stoppedEarly(scheduleId,
                        "Alarm exceeded maximum duration (" + ceiling.toSeconds() + "s)", elapsedSince(startNanos));
            }

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                return WorkloadOutcome.failed(scheduleId,
                        "Alarm script exited with code " + exitCode + ": " + stderrTail(stderrFile),
                        elapsedSince(startNanos));
            }
            return WorkloadOutcome.completed(scheduleId, elapsedSince(startNanos));
        } catch (IOException e) {
            return WorkloadOutcome.failed(scheduleId, "Unexpected error: " + e.getMessage(), elapsedSince(startNanos));
        } finally {
            deleteQuietly(stderrFile);
        }
    }

    /**
     * Waits up to the timeout for the child to exit. An interrupt does not end the wait; it is
     * restored once the wait is over.
     */
    private static boolean awaitExit(Process process, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean interrupted = false;
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                try {
                    return process.waitFor(Math.max(remaining, 0), TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static String stderrTail(Path stderrFile) throws IOException {
        String stderr = Files.readString(stderrFile, StandardCharsets.UTF_8).strip();
        return stderr.length() <= STDERR_TAIL_CHARS ? stderr : stderr.substring(stderr.length() - STDERR_TAIL_CHARS);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Could not delete {}: {}", file, e.getMessage());
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static void logOutcome(WorkloadOutcome outcome) {
        switch (outcome.status()) {
            case COMPLETED:
                logger.info("Alarm {} workload completed in {}s", outcome.scheduleId(), outcome.elapsed().toSeconds());
                break;
            case STOPPED_EARLY:
                logger.warn("Alarm {} workload stopped early: {}", outcome.scheduleId(), outcome.error());
                break;
            default:
                logger.error("Alarm {} workload failed: {}", outcome.scheduleId(), outcome.error());
                break;
        }
    }
}
