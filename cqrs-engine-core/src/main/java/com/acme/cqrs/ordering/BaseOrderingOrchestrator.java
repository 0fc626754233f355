package com.acme.cqrs.ordering;

import com.acme.cqrs.config.TimeoutConfig;
import com.acme.cqrs.core.NotFoundException;
import com.acme.cqrs.core.PredecessorTimeoutException;
import com.acme.cqrs.core.SubmissionTimeoutException;
import com.acme.cqrs.core.TransientException;
import com.acme.cqrs.domain.AggregateKey;
import com.acme.cqrs.domain.CommandRecord;
import com.acme.cqrs.domain.CommandStatus;
import com.acme.cqrs.repository.CommandRepository;
import com.acme.cqrs.repository.OrderingTaskRepository;
import com.acme.cqrs.sync.ChangeNotifier;
import com.acme.cqrs.sync.SyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-aggregate ordering engine. Version V of an aggregate is materialized and dispatched only
 * after version V-1 has finished (successfully or not); distinct aggregates never wait for each
 * other. Every step is a durable state change on an {@link OrderingTask}, so a version parked on its
 * predecessor survives restarts and is released by whichever process finishes the predecessor.
 *
 * <p>Subclasses provide infrastructure concerns (transactions, DI, threads).
 */
public abstract class BaseOrderingOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(BaseOrderingOrchestrator.class);

    // Template methods - subclasses provide infrastructure dependencies
    protected abstract OrderingTaskRepository getTaskRepository();

    protected abstract CommandRepository getCommandRepository();

    protected abstract WorkflowCallbacks getCallbacks();

    protected abstract ChangeNotifier getNotifier();

    protected abstract TimeoutConfig getTimeoutConfig();

    protected abstract Clock getClock();

    protected abstract void executeInTransaction(Runnable action);

    /** Run a started version's pipeline, detached from the caller that released it. */
    protected abstract void dispatch(Runnable pipeline);

    /**
     * Enter a committed command version into ordering. Idempotent: a redelivered version finds its
     * task already present and only re-checks whether it can be released.
     *
     * @return the task as stored after scheduling
     */
    public OrderingTask schedule(CommandRecord record) {
        AggregateKey key = record.aggregateKey();
        int version = record.getVersion();

        Optional<OrderingTask> existing = getTaskRepository().find(key, version);
        OrderingTask task;
        if (existing.isPresent()) {
            task = existing.get();
            LOG.debug("Version already scheduled: {} version={} state={}", key, version, task.state());
        } else {
            task = createWaitingTask(record);
        }

        if (task.state() == OrderingState.WAITING_FOR_PREDECESSOR) {
            tryRelease(task);
        }
        return getTaskRepository().find(key, version).orElse(task);
    }

    private OrderingTask createWaitingTask(CommandRecord record) {
        AggregateKey key = record.aggregateKey();
        int version = record.getVersion();
        Instant now = now();
        String token = getCallbacks().suspendWithToken(key, version);
        OrderingTask waiting =
                OrderingTask.waiting(
                        key, version, token, now.plus(getTimeoutConfig().getPredecessorWait()), now);

        AtomicBoolean inserted = new AtomicBoolean();
        executeInTransaction(
                () -> {
                    inserted.set(getTaskRepository().insertIfAbsent(waiting));
                    if (inserted.get()) {
                        getCommandRepository()
                                .updateStatus(record.commandKey(), CommandStatus.WAITING, token);
                    }
                });

        if (inserted.get()) {
            LOG.info("Scheduled version: {} version={} deadline={}", key, version, waiting.deadline());
            return waiting;
        }
        // lost the race against a concurrent delivery of the same version
        return getTaskRepository()
                .find(key, version)
                .orElseThrow(() -> new IllegalStateException("Task vanished after conflict: " + key + "@" + version));
    }

    private void tryRelease(OrderingTask task) {
        if (task.version() == 0) {
            start(task, null);
            return;
        }
        Optional<OrderingTask> predecessor =
                getTaskRepository().find(task.aggregateKey(), task.version() - 1);
        if (predecessor.isPresent() && predecessor.get().releasesSuccessor()) {
            start(task, predecessor.get());
        } else {
            LOG.debug(
                    "Waiting for predecessor: {} version={} predecessorState={}",
                    task.aggregateKey(),
                    task.version(),
                    predecessor.map(p -> p.state().name()).orElse("UNSCHEDULED"));
        }
    }

    private void start(OrderingTask task, OrderingTask predecessor) {
        if (!transition(task, EnumSet.of(OrderingState.WAITING_FOR_PREDECESSOR), OrderingState.MATERIALIZING, null)) {
            LOG.debug("Version already released: {} version={}", task.aggregateKey(), task.version());
            return;
        }
        if (predecessor != null && (predecessor.isFailed() || predecessor.signal() == PipelineSignal.FAILED)) {
            LOG.warn(
                    "Predecessor failed, proceeding: {} version={} predecessorError={}",
                    task.aggregateKey(),
                    task.version(),
                    predecessor.error());
        }
        dispatch(() -> runPipeline(task));
    }

    private void runPipeline(OrderingTask task) {
        AggregateKey commandKey = task.commandKey();
        CommandRecord record;
        try {
            record =
                    getCommandRepository()
                            .find(commandKey)
                            .orElseThrow(() -> new NotFoundException("No command record " + commandKey));
            getCommandRepository().updateStatus(commandKey, CommandStatus.PROCESSING, task.callbackToken());
            getNotifier().materialize(record);
        } catch (Exception e) {
            LOG.error("Materialization failed: {}", commandKey, e);
            failTask(task, "Materialization failed: " + e.getMessage(), OrderingState.ACTIVE);
            return;
        }

        if (!transition(task, EnumSet.of(OrderingState.MATERIALIZING), OrderingState.NOTIFYING, null)) {
            LOG.warn("Version no longer materializing, abandoning pipeline: {}", commandKey);
            return;
        }

        List<SyncResult> results = getNotifier().notifyHandlers(record);
        complete(task, results);
    }

    private void complete(OrderingTask task, List<SyncResult> results) {
        if (!transition(task, EnumSet.of(OrderingState.NOTIFYING), OrderingState.IDLE, null)) {
            LOG.warn("Version no longer notifying, not completing: {}", task.commandKey());
            return;
        }
        long failures = results.stream().filter(r -> !r.isSuccess()).count();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("version", task.version());
        payload.put("handlers", results.size());
        payload.put("handlerFailures", failures);

        executeInTransaction(
                () -> {
                    getCallbacks().resume(task.callbackToken(), payload);
                    getCommandRepository().updateStatus(task.commandKey(), CommandStatus.COMPLETED, null);
                });
        LOG.info(
                "Completed version: {} version={} handlers={} handlerFailures={}",
                task.aggregateKey(),
                task.version(),
                results.size(),
                failures);
        releaseSuccessor(task);
    }

    private boolean failTask(OrderingTask task, String error, Set<OrderingState> from) {
        AtomicBoolean failed = new AtomicBoolean();
        executeInTransaction(
                () -> {
                    failed.set(transition(task, from, OrderingState.FAILED, error));
                    if (failed.get()) {
                        getCallbacks().fail(task.callbackToken(), error);
                        getCommandRepository().updateStatus(task.commandKey(), CommandStatus.FAILED, null);
                    }
                });
        if (!failed.get()) {
            LOG.debug("Version already left {}, not failing: {}", from, task.commandKey());
            return false;
        }
        LOG.warn("Failed version: {} version={} error={}", task.aggregateKey(), task.version(), error);
        releaseSuccessor(task);
        return true;
    }

    private void releaseSuccessor(OrderingTask task) {
        getTaskRepository()
                .find(task.aggregateKey(), task.version() + 1)
                .filter(next -> next.state() == OrderingState.WAITING_FOR_PREDECESSOR)
                .ifPresent(this::tryRelease);
    }

    /**
     * Fail versions that outlived their limits: waiting past the predecessor deadline, or running
     * longer than one invocation may. Each failure releases the version's successor.
     *
     * @return number of versions failed
     */
    public int expireOverdue(int limit) {
        Instant now = now();
        int expired = 0;
        for (OrderingTask task : getTaskRepository().findWaitingPastDeadline(now, limit)) {
            String error =
                    new PredecessorTimeoutException(
                                    task.partitionKey(),
                                    task.sortKey(),
                                    task.version(),
                                    Duration.between(task.createdAt(), now))
                            .getMessage();
            if (failTask(task, error, EnumSet.of(OrderingState.WAITING_FOR_PREDECESSOR))) {
                expired++;
            }
        }

        Duration maxInvocation = getTimeoutConfig().getMaxInvocationDuration();
        for (OrderingTask task : getTaskRepository().findRunningUpdatedBefore(now.minus(maxInvocation), limit)) {
            String error = "InvocationTimeout: " + task.state() + " exceeded " + maxInvocation;
            if (failTask(task, error, OrderingState.RUNNING)) {
                expired++;
            }
        }
        if (expired > 0) {
            LOG.info("Expired {} overdue versions", expired);
        }
        return expired;
    }

    /**
     * Abort a version that has not finished. A version not yet scheduled gets a FAILED task, so a
     * late delivery of its command is a no-op.
     *
     * @return true when this call failed the version
     * @throws NotFoundException when no such command exists
     */
    public boolean abort(AggregateKey aggregateKey, int version, String reason) {
        String error = "Aborted: " + reason;
        Optional<OrderingTask> task = getTaskRepository().find(aggregateKey, version);
        if (task.isPresent()) {
            return failTask(task.get(), error, OrderingState.ACTIVE);
        }

        AggregateKey commandKey = aggregateKey.atVersion(version);
        if (getCommandRepository().find(commandKey).isEmpty()) {
            throw new NotFoundException("No command record " + commandKey);
        }
        OrderingTask failed =
                OrderingTask.failed(
                        aggregateKey, version, getCallbacks().suspendWithToken(aggregateKey, version), error, now());
        AtomicBoolean inserted = new AtomicBoolean();
        executeInTransaction(
                () -> {
                    inserted.set(getTaskRepository().insertIfAbsent(failed));
                    if (inserted.get()) {
                        getCommandRepository().updateStatus(commandKey, CommandStatus.FAILED, null);
                    }
                });
        if (!inserted.get()) {
            // scheduled concurrently, abort the task that won
            return abort(aggregateKey, version, reason);
        }
        LOG.warn("Aborted unscheduled version: {} version={} reason={}", aggregateKey, version, reason);
        releaseSuccessor(failed);
        return true;
    }

    /**
     * Block until the version reaches IDLE or FAILED.
     *
     * @throws SubmissionTimeoutException when {@code timeout} elapses first
     */
    public OrderingTask awaitTerminal(AggregateKey aggregateKey, int version, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        long pollMillis = Math.max(1L, getTimeoutConfig().getStatusPollIntervalMillis());
        while (true) {
            Optional<OrderingTask> task = getTaskRepository().find(aggregateKey, version);
            if (task.isPresent() && task.get().state().isTerminal()) {
                return task.get();
            }
            if (System.nanoTime() >= deadline) {
                throw new SubmissionTimeoutException(aggregateKey.versionedSortKey(version), timeout);
            }
            try {
                Thread.sleep(pollMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransientException(
                        "Interrupted while waiting for " + aggregateKey.versionedSortKey(version), e);
            }
        }
    }

    /**
     * Ordering state of an aggregate as a whole: the state of its oldest unfinished version, or the
     * final state of its latest version. IDLE when nothing was ever scheduled.
     */
    public OrderingState aggregateState(AggregateKey aggregateKey) {
        Optional<OrderingTask> latest = getTaskRepository().findLatest(aggregateKey);
        if (latest.isEmpty()) {
            return OrderingState.IDLE;
        }
        OrderingTask task = latest.get();
        while (task.state() == OrderingState.WAITING_FOR_PREDECESSOR && task.version() > 0) {
            Optional<OrderingTask> previous = getTaskRepository().find(aggregateKey, task.version() - 1);
            if (previous.isEmpty() || !OrderingState.ACTIVE.contains(previous.get().state())) {
                break;
            }
            task = previous.get();
        }
        return task.state();
    }

    public Optional<OrderingTask> findTask(AggregateKey aggregateKey, int version) {
        return getTaskRepository().find(aggregateKey, version);
    }

    private boolean transition(OrderingTask task, Set<OrderingState> from, OrderingState to, String error) {
        return getTaskRepository().transition(task.aggregateKey(), task.version(), from, to, error, now());
    }

    private Instant now() {
        return getClock().instant();
    }
}
