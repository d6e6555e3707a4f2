package tech.yump.reconciler.cli;

import tech.yump.reconciler.core.ReconcilerException;

/**
 * Raised for a malformed command line.
 */
public class UsageException extends ReconcilerException {

    public UsageException(String message) {
        super(message);
    }
}
