package tech.yump.reconciler.core;

/**
 * Base exception for every failure raised by the reconciliation engine.
 * Messages name secrets and keys, never the values behind them.
 */
public class ReconcilerException extends RuntimeException {

    public ReconcilerException(String message) {
        super(message);
    }

    public ReconcilerException(String message, Throwable cause) {
        super(message, cause);
    }
}
