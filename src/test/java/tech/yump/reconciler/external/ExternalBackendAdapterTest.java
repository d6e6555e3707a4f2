package tech.yump.reconciler.external;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.yump.reconciler.audit.AuditHelper;
import tech.yump.reconciler.cluster.ClusterException;
import tech.yump.reconciler.cluster.InMemoryClusterApi;
import tech.yump.reconciler.cluster.PermissionException;
import tech.yump.reconciler.cluster.ReferenceResource;
import tech.yump.reconciler.config.ReconcilerProperties;
import tech.yump.reconciler.config.ReconcilerProperties.Backend;
import tech.yump.reconciler.config.ReconcilerProperties.KeyDefinition;
import tech.yump.reconciler.core.ManagedLabels;
import tech.yump.reconciler.model.ReconcileAction;
import tech.yump.reconciler.model.ReconciliationResult;
import tech.yump.reconciler.model.SecretSpec;
import tech.yump.reconciler.schema.SchemaRegistry;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static tech.yump.reconciler.TestFixtures.NAMESPACE;
import static tech.yump.reconciler.TestFixtures.STORE_NAME;
import static tech.yump.reconciler.TestFixtures.key;
import static tech.yump.reconciler.TestFixtures.properties;
import static tech.yump.reconciler.TestFixtures.secret;

@ExtendWith(MockitoExtension.class)
class ExternalBackendAdapterTest {

    @Mock
    private AuditHelper auditHelper;

    private InMemoryClusterApi cluster;
    private ExternalBackendAdapter adapter;
    private List<SecretSpec> specs;

    @BeforeEach
    void setUp() {
        cluster = new InMemoryClusterApi();
        ReconcilerProperties properties = properties(Backend.EXTERNAL,
                secret("postgres-credentials",
                        new KeyDefinition("postgres-password", "POSTGRES_PASSWORD", null, null, false, "vibecode/postgres", "password"),
                        key("datadog-password", "DATADOG_POSTGRES_PASSWORD")),
                secret("datadog-secrets", key("api-key", "DD_API_KEY")));
        specs = new SchemaRegistry(properties).specsFor(NAMESPACE);
        adapter = new ExternalBackendAdapter(cluster, properties, auditHelper);
    }

    @Test
    @DisplayName("submit: Applies the store connection first, then one reference per secret")
    void submit_appliesStoreAndReferences() {
        List<ReconciliationResult> results = adapter.submit(NAMESPACE, specs);

        assertThat(results).extracting(ReconciliationResult::action).containsOnly(ReconcileAction.SUBMITTED);
        List<ReferenceResource> applied = cluster.appliedReferences();
        assertThat(applied).extracting(ReferenceResource::kind)
                .containsExactly("SecretStore", "ExternalSecret", "ExternalSecret");
        ReferenceResource store = applied.get(0);
        assertThat(store.name()).isEqualTo(STORE_NAME);
        assertThat(store.namespace()).isEqualTo(NAMESPACE);
        assertThat(store.spec()).containsKey("provider");
        assertThat(store.labels()).containsEntry(ManagedLabels.MANAGED_BY, "test-platform");
    }

    @Test
    @DisplayName("externalSecret: Maps each key to its remote reference and targets the secret name")
    @SuppressWarnings("unchecked")
    void externalSecret_mapsKeys() {
        ReferenceResource reference = adapter.externalSecret(specs.get(0));

        assertThat(reference.apiVersion()).isEqualTo("external-secrets.io/v1beta1");
        assertThat(reference.name()).isEqualTo("postgres-credentials");
        assertThat(reference.spec()).containsEntry("refreshInterval", "15m");
        assertThat((Map<String, Object>) reference.spec().get("secretStoreRef"))
                .containsEntry("name", STORE_NAME)
                .containsEntry("kind", "SecretStore");

        Map<String, Object> target = (Map<String, Object>) reference.spec().get("target");
        assertThat(target).containsEntry("name", "postgres-credentials").containsEntry("creationPolicy", "Owner");

        List<Map<String, Object>> data = (List<Map<String, Object>>) reference.spec().get("data");
        assertThat(data).hasSize(2);
        assertThat(data.get(0)).containsEntry("secretKey", "postgres-password")
                .containsEntry("remoteRef", Map.of("key", "vibecode/postgres", "property", "password"));
        assertThat(data.get(1)).containsEntry("remoteRef", Map.of("key", "remote/datadog-password"));
    }

    @Test
    @DisplayName("storeConnection: Cluster-wide stores are not namespaced")
    void storeConnection_clusterWide() {
        ReconcilerProperties base = properties(Backend.EXTERNAL, secret("s", key("k", "V")));
        ReconcilerProperties clusterWide = new ReconcilerProperties(base.defaultNamespace(), base.namespaceEnvironmentPrefix(),
                base.managedBy(), base.createdBy(), base.overrideFiles(), base.backend(), base.concurrency(),
                base.secretTimeout(), base.conflictRetry(), base.namespaceReady(),
                new ReconcilerProperties.ExternalProperties(ReconcilerProperties.StoreKind.CLUSTER_SECRET_STORE, STORE_NAME,
                        null, null, null, Map.of()),
                base.secrets(), base.audit());

        ReferenceResource store = new ExternalBackendAdapter(cluster, clusterWide, auditHelper).storeConnection(NAMESPACE);

        assertThat(store.kind()).isEqualTo("ClusterSecretStore");
        assertThat(store.namespaced()).isFalse();
    }

    @Test
    @DisplayName("submit: A rejected reference fails only its own secret")
    void submit_referenceFailureIsolated() {
        cluster.failWritesOf("datadog-secrets", new ClusterException("Failed to apply ExternalSecret 'datadog-secrets' (HTTP 422)"));

        List<ReconciliationResult> results = adapter.submit(NAMESPACE, specs);

        assertThat(results.get(0).action()).isEqualTo(ReconcileAction.SUBMITTED);
        assertThat(results.get(1).isFailed()).isTrue();
    }

    @Test
    @DisplayName("submit: Permission failure aborts")
    void submit_permissionAborts() {
        cluster.failWritesOf("postgres-credentials", new PermissionException("denied"));

        assertThatThrownBy(() -> adapter.submit(NAMESPACE, specs)).isInstanceOf(PermissionException.class);
    }

    @Test
    @DisplayName("plan: Builds references without applying them")
    void plan_doesNotApply() {
        List<ReconciliationResult> results = adapter.plan(NAMESPACE, specs);

        assertThat(results).allMatch(ReconciliationResult::dryRun);
        assertThat(cluster.appliedReferences()).isEmpty();
    }

    @Test
    @DisplayName("formatInterval: Uses the largest whole unit")
    void formatInterval() {
        assertThat(ExternalBackendAdapter.formatInterval(Duration.ofHours(2))).isEqualTo("2h");
        assertThat(ExternalBackendAdapter.formatInterval(Duration.ofMinutes(90))).isEqualTo("90m");
        assertThat(ExternalBackendAdapter.formatInterval(Duration.ofSeconds(45))).isEqualTo("45s");
        assertThat(ExternalBackendAdapter.formatInterval(Duration.ZERO)).isEqualTo("0s");
    }
}
