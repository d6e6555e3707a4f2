package tech.yump.reconciler.retry;

@FunctionalInterface
public interface RetryableOperation<T> {

    T run();
}
