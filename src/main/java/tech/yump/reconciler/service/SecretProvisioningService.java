package tech.yump.reconciler.service;

import tech.yump.reconciler.cluster.ConnectivityException;
import tech.yump.reconciler.cluster.PermissionException;
import tech.yump.reconciler.env.MissingValueException;
import tech.yump.reconciler.schema.ValidationException;

/**
 * Runs the provisioning pipeline: resolve, validate, ensure namespace, reconcile (or submit references), verify.
 */
public interface SecretProvisioningService {

    /**
     * Executes one run.
     *
     * @param request What to do and where.
     * @return The itemized results; the caller derives the exit status from it.
     * @throws MissingValueException If any required value has no source. Nothing has been mutated.
     * @throws ValidationException   If any value breaks its rules. Nothing has been mutated.
     * @throws ConnectivityException If the API server cannot be reached.
     * @throws PermissionException   If the credentials are rejected.
     */
    RunReport run(RunRequest request);
}
