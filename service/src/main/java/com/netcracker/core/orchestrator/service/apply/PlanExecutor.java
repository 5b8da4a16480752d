package com.netcracker.core.orchestrator.service.apply;

import com.netcracker.core.orchestrator.model.ResourceId;
import com.netcracker.core.orchestrator.model.References;
import com.netcracker.core.orchestrator.service.OrchestratorException;
import com.netcracker.core.orchestrator.service.plan.PlannedAction;
import com.netcracker.core.orchestrator.service.plan.Plan;
import com.netcracker.core.orchestrator.service.provider.ProviderActionException;
import com.netcracker.core.orchestrator.service.provider.ResourceProvider;
import com.netcracker.core.orchestrator.service.state.ResourceState;
import com.netcracker.core.orchestrator.service.state.StateCorruptionException;
import com.netcracker.core.orchestrator.service.state.StateSnapshot;
import com.netcracker.core.orchestrator.service.state.StateStore;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Applies a {@link Plan} against the {@link ResourceProvider}.
 * <p>
 * Stages run one after another; the actions of a stage run concurrently on a bounded worker pool.
 * When an action fails, the rest of its stage still completes but no further stage starts.
 * Every completed action is committed to the {@link StateStore} immediately, so an interrupted or
 * failed run can simply be planned and applied again.
 */
@ApplicationScoped
@Slf4j
public class PlanExecutor {
    private static final long SHUTDOWN_GRACE_SECONDS = 300;
    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    private final ResourceProvider provider;
    private final StateStore stateStore;
    private final ExecutorService workers;
    private final AtomicReference<AtomicBoolean> currentRun = new AtomicReference<>();
    private volatile boolean shuttingDown;

    @Inject
    public PlanExecutor(ResourceProvider provider,
                        StateStore stateStore,
                        @ConfigProperty(name = "orchestrator.apply.parallelism", defaultValue = "4") int parallelism) {
        this(provider, stateStore, Executors.newFixedThreadPool(parallelism, r -> {
            Thread thread = new Thread(r, "apply-worker-" + THREAD_SEQ.incrementAndGet());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((th, ex) ->
                    log.error("Uncaught exception in '{}'", th.getName(), ex));
            return thread;
        }));
    }

    PlanExecutor(ResourceProvider provider, StateStore stateStore, ExecutorService workers) {
        this.provider = provider;
        this.stateStore = stateStore;
        this.workers = workers;
    }

    /**
     * Executes the plan that was computed from {@code snapshot}.
     */
    public ApplyReport execute(Plan plan, StateSnapshot snapshot) {
        AtomicBoolean cancelled = new AtomicBoolean();
        currentRun.set(cancelled);
        StateLedger ledger = new StateLedger(stateStore, snapshot);
        List<ActionOutcome> outcomes = new ArrayList<>(plan.size());
        boolean halted = false;

        try {
            for (List<PlannedAction> stage : plan.stages()) {
                if (shuttingDown) {
                    cancelled.set(true);
                }
                if (halted || cancelled.get()) {
                    stage.forEach(action -> outcomes.add(ActionOutcome.notAttempted(action)));
                    continue;
                }
                log.debug("Starting stage of {} actions", stage.size());
                List<Future<ActionOutcome>> futures = new ArrayList<>(stage.size());
                for (PlannedAction action : stage) {
                    futures.add(workers.submit(() -> run(action, ledger, cancelled)));
                }
                for (int i = 0; i < futures.size(); i++) {
                    ActionOutcome outcome = await(futures.get(i), stage.get(i));
                    outcomes.add(outcome);
                    if (outcome.status() == ActionStatus.FAILED) {
                        halted = true;
                    }
                }
            }
        } finally {
            currentRun.compareAndSet(cancelled, null);
        }

        ApplyReport report = new ApplyReport(outcomes, ledger.snapshot(), cancelled.get());
        log.info("Apply finished: {} succeeded, {} failed, {} not attempted",
                report.withStatus(ActionStatus.SUCCEEDED).size(),
                report.withStatus(ActionStatus.FAILED).size(),
                report.withStatus(ActionStatus.NOT_ATTEMPTED).size());
        return report;
    }

    /**
     * Stops the run in progress from scheduling new actions. Actions already running finish and are
     * committed. Has no effect on later runs.
     */
    public void cancel() {
        AtomicBoolean run = currentRun.get();
        if (run != null && run.compareAndSet(false, true)) {
            log.warn("Cancellation requested, waiting for in-flight actions to finish");
        }
    }

    @PreDestroy
    void shutdown() {
        shuttingDown = true;
        cancel();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.error("In-flight actions did not finish within {} seconds", SHUTDOWN_GRACE_SECONDS);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private ActionOutcome run(PlannedAction action, StateLedger ledger, AtomicBoolean cancelled) {
        if (cancelled.get()) {
            return ActionOutcome.notAttempted(action);
        }
        log.info("Starting {}", action.describe());
        try {
            perform(action, ledger);
            log.info("Completed {}", action.describe());
            return ActionOutcome.succeeded(action);
        } catch (RuntimeException e) {
            log.error("Failed to {}", action.describe(), e);
            return ActionOutcome.failed(action, e);
        }
    }

    private void perform(PlannedAction action, StateLedger ledger) {
        switch (action.type()) {
            case CREATE -> {
                Map<String, Object> attributes = resolve(action, ledger);
                Map<String, Object> outputs = callProvider(action, () -> provider.create(action.kind(), attributes));
                ledger.commitCreated(action, attributes, outputs, providerId(action, outputs));
            }
            case UPDATE -> {
                ensureDescribable(action);
                Map<String, Object> attributes = resolve(action, ledger);
                Map<String, Object> outputs = callProvider(action,
                        () -> provider.update(action.instanceId(), action.kind(), attributes));
                ledger.commitUpdated(action, attributes, outputs);
            }
            case DESTROY -> {
                ensureDescribable(action);
                callProvider(action, () -> {
                    provider.destroy(action.instanceId(), action.kind());
                    return null;
                });
                if (action.replacement()) {
                    ledger.removeDeposed(action.resourceId(), action.instanceId());
                } else {
                    ledger.remove(action.resourceId());
                }
            }
        }
    }

    private Map<String, Object> resolve(PlannedAction action, StateLedger ledger) {
        return References.substitute(action.attributes(), reference -> {
            ResourceId target = ResourceId.parse(reference.targetKey());
            ResourceState producer = ledger.find(target)
                    .filter(state -> state.has(reference.attribute()))
                    .orElseThrow(() -> new UnresolvedReferenceException(action.resourceId(), reference));
            return producer.lookup(reference.attribute()).orElse(null);
        });
    }

    private void ensureDescribable(PlannedAction action) {
        boolean known = callProvider(action, () -> provider.describe(action.instanceId(), action.kind())).isPresent();
        if (!known) {
            throw new StateCorruptionException("State of '" + action.resourceId() + "' refers to instance '"
                                               + action.instanceId() + "' which the provider no longer knows");
        }
    }

    private static String providerId(PlannedAction action, Map<String, Object> outputs) {
        Object id = outputs == null ? null : outputs.get(ResourceProvider.ID_OUTPUT);
        if (id == null) {
            throw new ProviderActionException("Provider returned no '" + ResourceProvider.ID_OUTPUT + "' for "
                                              + action.describe());
        }
        return String.valueOf(id);
    }

    private static <T> T callProvider(PlannedAction action, Supplier<T> call) {
        try {
            return call.get();
        } catch (OrchestratorException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderActionException("Provider failed to " + action.describe() + ": " + e.getMessage(), e);
        }
    }

    private ActionOutcome await(Future<ActionOutcome> future, PlannedAction action) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return future.get();
                } catch (InterruptedException e) {
                    interrupted = true;
                    cancel();
                } catch (ExecutionException e) {
                    return ActionOutcome.failed(action, e.getCause());
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
