package tech.yump.reconciler.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import tech.yump.reconciler.config.validation.ValidSecretSchema;
import tech.yump.reconciler.retry.BackoffPolicy;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties of the reconciler under the 'reconciler' prefix.
 * Declares the secrets to provision; never holds secret values.
 */
@ConfigurationProperties(prefix = "reconciler")
@Validated
@ValidSecretSchema
public record ReconcilerProperties(

        @NotBlank(message = "Default namespace (reconciler.default-namespace) must be provided.")
        String defaultNamespace,

        String namespaceEnvironmentPrefix,

        @NotBlank(message = "Managed-by label value (reconciler.managed-by) must be provided.")
        String managedBy,

        @NotBlank(message = "Created-by label value (reconciler.created-by) must be provided.")
        String createdBy,

        List<String> overrideFiles,

        @NotNull(message = "Backend (reconciler.backend) must be 'native' or 'external'.")
        Backend backend,

        @Min(value = 1, message = "Concurrency (reconciler.concurrency) must be at least 1.")
        Integer concurrency,

        @NotNull(message = "Per-secret timeout (reconciler.secret-timeout) is required.")
        Duration secretTimeout,

        @Valid
        RetryProperties conflictRetry,

        @Valid
        RetryProperties namespaceReady,

        @Valid
        ExternalProperties external,

        @NotEmpty(message = "At least one secret definition (reconciler.secrets) must be provided.")
        @Valid
        List<SecretDefinition> secrets,

        @Valid
        AuditProperties audit
) {

    public ReconcilerProperties {
        if (namespaceEnvironmentPrefix == null) {
            namespaceEnvironmentPrefix = "";
        }
        if (overrideFiles == null) {
            overrideFiles = Collections.emptyList();
        }
        if (backend == null) {
            backend = Backend.NATIVE;
        }
        if (concurrency == null) {
            concurrency = 4;
        }
        if (secretTimeout == null) {
            secretTimeout = Duration.ofSeconds(10);
        }
        if (conflictRetry == null) {
            conflictRetry = new RetryProperties(5, Duration.ofMillis(100), Duration.ofSeconds(2), 2.0, 0.2, Duration.ofSeconds(8));
        }
        if (namespaceReady == null) {
            namespaceReady = new RetryProperties(10, Duration.ofMillis(200), Duration.ofSeconds(2), 2.0, 0.2, Duration.ofSeconds(30));
        }
        if (external == null) {
            external = new ExternalProperties(null, null, null, null, null, null);
        }
        if (audit == null) {
            audit = new AuditProperties(null, null);
        }
    }

    public enum Backend {
        NATIVE, EXTERNAL
    }

    /**
     * Exponential backoff settings, converted to a {@link BackoffPolicy} at wiring time.
     */
    @Validated
    public record RetryProperties(
            @Min(value = 1, message = "Retry max-attempts must be at least 1.")
            Integer maxAttempts,
            Duration initialDelay,
            Duration maxDelay,
            @DecimalMin(value = "1.0", message = "Retry multiplier must be at least 1.0.")
            Double multiplier,
            @DecimalMin(value = "0.0") @DecimalMax(value = "1.0", message = "Retry jitter must be between 0.0 and 1.0.")
            Double jitter,
            Duration deadline
    ) {
        public RetryProperties {
            if (maxAttempts == null) maxAttempts = 5;
            if (initialDelay == null) initialDelay = Duration.ofMillis(100);
            if (maxDelay == null) maxDelay = Duration.ofSeconds(2);
            if (multiplier == null) multiplier = 2.0;
            if (jitter == null) jitter = 0.2;
            if (deadline == null) deadline = Duration.ofSeconds(10);
        }

        public BackoffPolicy toPolicy() {
            return new BackoffPolicy(maxAttempts, initialDelay, maxDelay, multiplier, jitter, deadline);
        }
    }

    public enum StoreKind {
        SECRET_STORE("SecretStore"),
        CLUSTER_SECRET_STORE("ClusterSecretStore");

        private final String kind;

        StoreKind(String kind) {
            this.kind = kind;
        }

        public String kind() {
            return kind;
        }
    }

    /**
     * Settings of the external secret-store path.
     */
    @Validated
    public record ExternalProperties(
            StoreKind storeKind,
            String storeName,
            String apiVersion,
            Duration refreshInterval,
            Duration pendingGrace,
            Map<String, Object> provider
    ) {
        public ExternalProperties {
            if (storeKind == null) storeKind = StoreKind.SECRET_STORE;
            if (apiVersion == null) apiVersion = "external-secrets.io/v1beta1";
            if (refreshInterval == null) refreshInterval = Duration.ofHours(1);
            if (pendingGrace == null) pendingGrace = Duration.ofMinutes(5);
            if (provider == null) provider = Collections.emptyMap();
        }
    }

    /**
     * Declaration of one secret resource.
     */
    @Validated
    public record SecretDefinition(
            @NotBlank(message = "Secret name cannot be blank.")
            String name,

            // Keys with '/' must be bracket-quoted in YAML, e.g. "[app.kubernetes.io/component]"
            Map<String, String> labels,

            @NotEmpty(message = "A secret definition must declare at least one key.")
            @Valid
            List<KeyDefinition> keys
    ) {
        public SecretDefinition {
            if (labels == null) {
                labels = Collections.emptyMap();
            }
        }
    }

    /**
     * Declaration of one key of a secret.
     */
    @Validated
    public record KeyDefinition(
            @NotBlank(message = "Key name cannot be blank.")
            String name,

            @NotBlank(message = "Key source variable (source-var) cannot be blank.")
            String sourceVar,

            @PositiveOrZero(message = "Key min-length cannot be negative.")
            Integer minLength,

            String pattern,

            boolean generatable,

            String remoteKey,

            String remoteProperty
    ) {}

    @Validated
    public record AuditProperties(
            String backend,
            String principal
    ) {
        public AuditProperties {
            if (backend == null) backend = "slf4j";
            if (principal == null) principal = "secret-reconciler";
        }
    }
}
