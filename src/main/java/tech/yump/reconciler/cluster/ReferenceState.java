package tech.yump.reconciler.cluster;

import java.time.Instant;

/**
 * Observed synchronization state of an applied reference.
 *
 * @param createdAt creation timestamp reported by the orchestrator, may be {@code null}
 * @param ready     whether the external synchronizer reports the reference as Ready
 * @param reason    reason of the Ready condition when not ready, may be {@code null}
 */
public record ReferenceState(String name, Instant createdAt, boolean ready, String reason) {
}
