package tech.yump.reconciler.service;

/**
 * What one invocation was asked to do.
 *
 * @param namespace  target namespace of every declared secret
 * @param verifyOnly only run the verifier; resolve and mutate nothing
 * @param dryRun     resolve, validate and plan, but mutate nothing
 * @param strict     treat {@code Pending} verification results as failures
 */
public record RunRequest(String namespace, boolean verifyOnly, boolean dryRun, boolean strict) {
}
