package tech.yump.reconciler.reconcile;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import tech.yump.reconciler.audit.AuditHelper;
import tech.yump.reconciler.cluster.AlreadyExistsException;
import tech.yump.reconciler.cluster.ClusterApi;
import tech.yump.reconciler.cluster.ClusterException;
import tech.yump.reconciler.cluster.ConflictException;
import tech.yump.reconciler.cluster.ConnectivityException;
import tech.yump.reconciler.cluster.PermissionException;
import tech.yump.reconciler.cluster.SecretResource;
import tech.yump.reconciler.config.ReconcilerProperties;
import tech.yump.reconciler.model.KeySpec;
import tech.yump.reconciler.model.ReconcileAction;
import tech.yump.reconciler.model.ReconciliationResult;
import tech.yump.reconciler.model.ResolvedValue;
import tech.yump.reconciler.model.ResolvedValues;
import tech.yump.reconciler.model.SecretSpec;
import tech.yump.reconciler.model.SourceTier;
import tech.yump.reconciler.retry.Retrier;
import tech.yump.reconciler.retry.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Makes each declared secret in the cluster match its resolved values: create when absent,
 * update when the payload or managed labels differ, leave alone when identical.
 * <p>
 * Secrets are reconciled in parallel on a bounded pool; each one has its own timeout and its own
 * conflict-retry budget. A failure of one secret does not affect the others, except for
 * connectivity and permission failures, which abort the whole run.
 */
@Slf4j
@Component
public class SecretReconciler {

    private final ClusterApi clusterApi;
    private final ReconcilerProperties properties;
    private final Retrier conflictRetrier;
    private final AuditHelper auditHelper;

    public SecretReconciler(ClusterApi clusterApi, ReconcilerProperties properties,
                            Sleeper sleeper, Clock clock, AuditHelper auditHelper) {
        this.clusterApi = clusterApi;
        this.properties = properties;
        this.conflictRetrier = new Retrier(properties.conflictRetry().toPolicy(), sleeper, clock);
        this.auditHelper = auditHelper;
    }

    /**
     * Reconciles all specs and returns one result per spec, in spec order.
     *
     * @throws ConnectivityException if the API server became unreachable; no results are returned.
     * @throws PermissionException   if the credentials were rejected; no results are returned.
     */
    public List<ReconciliationResult> reconcile(List<SecretSpec> specs, ResolvedValues values) {
        if (specs.isEmpty()) {
            return List.of();
        }
        int workers = Math.min(properties.concurrency(), specs.size());
        Duration timeout = properties.secretTimeout();
        log.info("Reconciling {} secret(s) with {} worker(s), timeout {} s each", specs.size(), workers, timeout.toSeconds());

        ExecutorService pool = Executors.newFixedThreadPool(workers, new CustomizableThreadFactory("reconcile-"));
        ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("reconcile-watchdog-"));
        AtomicBoolean aborted = new AtomicBoolean(false);
        try {
            Map<SecretSpec, CompletableFuture<ReconciliationResult>> pending = new LinkedHashMap<>();
            for (SecretSpec spec : specs) {
                pending.put(spec, submit(pool, watchdog, timeout, aborted, () -> reconcileOne(spec, values)));
            }

            List<ReconciliationResult> results = new ArrayList<>();
            for (Map.Entry<SecretSpec, CompletableFuture<ReconciliationResult>> entry : pending.entrySet()) {
                results.add(await(entry.getKey(), entry.getValue(), timeout, aborted));
            }
            return results;
        } finally {
            pool.shutdownNow();
            watchdog.shutdownNow();
        }
    }

    /**
     * Computes what {@link #reconcile} would do, reading current state only.
     */
    public List<ReconciliationResult> plan(List<SecretSpec> specs, ResolvedValues values) {
        List<ReconciliationResult> planned = new ArrayList<>();
        for (SecretSpec spec : specs) {
            Optional<SecretResource> current = clusterApi.getSecret(spec.namespace(), spec.name());
            Decision decision = decide(spec, values, current);
            log.info("[dry-run] Secret '{}' would be {}", spec.name(), decision.action().label().toLowerCase());
            planned.add(ReconciliationResult.planned(spec.name(), decision.action()));
        }
        return planned;
    }

    private CompletableFuture<ReconciliationResult> submit(ExecutorService pool, ScheduledExecutorService watchdog,
                                                           Duration timeout, AtomicBoolean aborted,
                                                           Supplier<ReconciliationResult> work) {
        CompletableFuture<ReconciliationResult> result = new CompletableFuture<>();
        pool.execute(() -> {
            if (aborted.get()) {
                result.cancel(false);
                return;
            }
            // The timeout clock starts when a worker picks the secret up, not when it is queued
            WorkerInterruptGuard guard = new WorkerInterruptGuard(Thread.currentThread());
            ScheduledFuture<?> timer = watchdog.schedule(() -> {
                if (result.completeExceptionally(new TimeoutException())) {
                    guard.interruptIfRunning();
                }
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);
            try {
                result.complete(work.get());
            } catch (Throwable t) {
                result.completeExceptionally(t);
            } finally {
                timer.cancel(false);
                guard.release();
            }
        });
        return result;
    }

    private ReconciliationResult await(SecretSpec spec, CompletableFuture<ReconciliationResult> future,
                                       Duration timeout, AtomicBoolean aborted) {
        try {
            return future.join();
        } catch (CancellationException e) {
            return ReconciliationResult.failed(spec.name(), "not attempted; run aborted");
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ConnectivityException || cause instanceof PermissionException) {
                aborted.set(true);
                log.error("Aborting reconciliation: {}", cause.getMessage());
                throw (ClusterException) cause;
            }
            if (cause instanceof TimeoutException) {
                String error = "timed out after " + timeout.toSeconds() + " s";
                log.error("Reconciliation of secret '{}' {}", spec.name(), error);
                audit(spec, "failure", error);
                return ReconciliationResult.failed(spec.name(), error);
            }
            String error = "unexpected " + cause.getClass().getSimpleName();
            log.error("Reconciliation of secret '{}' failed unexpectedly", spec.name(), cause);
            audit(spec, "failure", error);
            return ReconciliationResult.failed(spec.name(), error);
        }
    }

    ReconciliationResult reconcileOne(SecretSpec spec, ResolvedValues values) {
        log.info("Managing secret '{}' in namespace '{}'...", spec.name(), spec.namespace());
        try {
            ReconcileAction action = conflictRetrier.call("reconcile of secret '" + spec.name() + "'",
                    () -> applyOnce(spec, values),
                    ConflictException.class::isInstance);
            log.info("Secret '{}': {}", spec.name(), action.label());
            audit(spec, action.label().toLowerCase(), null);
            return ReconciliationResult.of(spec.name(), action);
        } catch (ConnectivityException | PermissionException e) {
            audit(spec, "failure", e.getMessage());
            throw e;
        } catch (ConflictException e) {
            String error = "gave up after repeated resource version conflicts";
            log.error("Secret '{}': {}", spec.name(), error);
            audit(spec, "failure", error);
            return ReconciliationResult.failed(spec.name(), error);
        } catch (ClusterException e) {
            log.error("Secret '{}' could not be reconciled: {}", spec.name(), e.getMessage());
            audit(spec, "failure", e.getMessage());
            return ReconciliationResult.failed(spec.name(), e.getMessage());
        }
    }

    /**
     * One fetch-compare-write cycle. Every call re-reads the current state, so a retry after a
     * conflict recomputes against the latest version.
     */
    private ReconcileAction applyOnce(SecretSpec spec, ResolvedValues values) {
        Optional<SecretResource> current = clusterApi.getSecret(spec.namespace(), spec.name());
        Decision decision = decide(spec, values, current);
        switch (decision.action()) {
            case CREATED -> {
                try {
                    clusterApi.createSecret(decision.desired());
                } catch (AlreadyExistsException e) {
                    // Created by someone else since our read; re-fetch and compare on the next attempt
                    throw new ConflictException("Secret '" + spec.name() + "' appeared concurrently", e);
                }
            }
            case UPDATED -> clusterApi.updateSecret(decision.desired());
            default -> log.debug("Secret '{}' already matches the desired state", spec.name());
        }
        return decision.action();
    }

    Decision decide(SecretSpec spec, ResolvedValues values, Optional<SecretResource> current) {
        Map<String, String> currentData = current.map(SecretResource::data).orElse(Map.of());
        Map<String, String> desiredData = desiredPayload(spec, values, currentData);

        if (current.isEmpty()) {
            SecretResource desired = new SecretResource(spec.name(), spec.namespace(), desiredData, spec.managedLabels(), null);
            return new Decision(ReconcileAction.CREATED, desired);
        }

        // Foreign labels are kept; ours win on collision
        Map<String, String> mergedLabels = new LinkedHashMap<>(current.get().labels());
        mergedLabels.putAll(spec.managedLabels());

        SecretResource desired = new SecretResource(spec.name(), spec.namespace(), desiredData, mergedLabels,
                current.get().resourceVersion());
        boolean identical = desiredData.equals(currentData) && mergedLabels.equals(current.get().labels());
        return new Decision(identical ? ReconcileAction.UNCHANGED : ReconcileAction.UPDATED, desired);
    }

    private Map<String, String> desiredPayload(SecretSpec spec, ResolvedValues values, Map<String, String> currentData) {
        Map<String, ResolvedValue> resolved = values.forSecret(spec);
        Map<String, String> data = new LinkedHashMap<>();
        for (KeySpec key : spec.keys()) {
            ResolvedValue value = resolved.get(key.keyName());
            if (value == null) {
                throw new IllegalStateException("No resolved value for " + key.ref() + "; validation must run before reconciliation");
            }
            if (value.sourceTier() == SourceTier.GENERATED && currentData.containsKey(key.keyName())) {
                // A generated value only fills a gap; it never replaces what the cluster already holds
                data.put(key.keyName(), currentData.get(key.keyName()));
            } else {
                data.put(key.keyName(), SecretPayloads.encode(value.value()));
            }
        }
        return data;
    }

    private void audit(SecretSpec spec, String outcome, String error) {
        auditHelper.logSecretEvent("reconcile", outcome, spec.namespace(), spec.name(), spec.keyNames(), error);
    }

    record Decision(ReconcileAction action, SecretResource desired) {
    }
}
