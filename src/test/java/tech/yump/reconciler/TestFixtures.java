package tech.yump.reconciler;

import tech.yump.reconciler.config.ReconcilerProperties;
import tech.yump.reconciler.config.ReconcilerProperties.Backend;
import tech.yump.reconciler.config.ReconcilerProperties.ExternalProperties;
import tech.yump.reconciler.config.ReconcilerProperties.KeyDefinition;
import tech.yump.reconciler.config.ReconcilerProperties.RetryProperties;
import tech.yump.reconciler.config.ReconcilerProperties.SecretDefinition;
import tech.yump.reconciler.retry.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Shared builders for engine-level tests.
 */
public final class TestFixtures {

    public static final String NAMESPACE = "vibecode-test";
    public static final String MANAGED_BY = "test-platform";
    public static final String CREATED_BY = "test-suite";
    public static final String STORE_NAME = "test-store";

    /** Never actually waits, so retry tests run instantly. */
    public static final Sleeper NO_SLEEP = duration -> { };

    private TestFixtures() {
    }

    public static ReconcilerProperties properties(SecretDefinition... secrets) {
        return properties(Backend.NATIVE, secrets);
    }

    public static ReconcilerProperties properties(Backend backend, SecretDefinition... secrets) {
        return properties(backend, Duration.ofSeconds(5), secrets);
    }

    public static ReconcilerProperties properties(Backend backend, Duration secretTimeout, SecretDefinition... secrets) {
        return new ReconcilerProperties(
                NAMESPACE,
                "vibecode-",
                MANAGED_BY,
                CREATED_BY,
                List.of(),
                backend,
                4,
                secretTimeout,
                fastRetry(5),
                fastRetry(5),
                new ExternalProperties(null, STORE_NAME, null, Duration.ofMinutes(15), Duration.ofMinutes(5),
                        Map.of("vault", Map.of("server", "https://vault.example.test"))),
                List.of(secrets),
                null);
    }

    public static RetryProperties fastRetry(int attempts) {
        return new RetryProperties(attempts, Duration.ofMillis(1), Duration.ofMillis(5), 2.0, 0.0, Duration.ofMinutes(1));
    }

    public static SecretDefinition secret(String name, KeyDefinition... keys) {
        return new SecretDefinition(name, Map.of("app.kubernetes.io/component", "test"), List.of(keys));
    }

    public static KeyDefinition key(String name, String sourceVar) {
        return new KeyDefinition(name, sourceVar, null, null, false, "remote/" + name, null);
    }

    public static KeyDefinition key(String name, String sourceVar, Integer minLength, String pattern) {
        return new KeyDefinition(name, sourceVar, minLength, pattern, false, "remote/" + name, null);
    }

    public static KeyDefinition generatableKey(String name, String sourceVar) {
        return new KeyDefinition(name, sourceVar, null, null, true, "remote/" + name, null);
    }
}
