package tech.yump.reconciler.model;

import java.util.List;

/**
 * Structural verdict on one secret as it exists in the cluster.
 *
 * @param secretName   the verified secret
 * @param expectedKeys declared key names, sorted
 * @param presentKeys  key names found in the resource, sorted (empty when absent)
 * @param keysValid    whether every present declared key satisfies its validation rule
 * @param status       overall verdict
 * @param findings     human-readable problems, naming keys only
 */
public record VerificationReport(
        String secretName,
        List<String> expectedKeys,
        List<String> presentKeys,
        boolean keysValid,
        VerificationStatus status,
        List<String> findings
) {

    public VerificationReport {
        expectedKeys = List.copyOf(expectedKeys);
        presentKeys = List.copyOf(presentKeys);
        findings = List.copyOf(findings);
    }
}
