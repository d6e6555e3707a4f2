package tech.yump.reconciler.cluster;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.reconciler.core.ManagedLabels;
import tech.yump.reconciler.reconcile.SecretPayloads;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exercises the fabric8 implementation against a stateful mock API server.
 */
@EnableKubernetesMockClient(crud = true)
class Fabric8ClusterApiCrudTest {

    private static final String NAMESPACE = "vibecode-test";

    KubernetesClient client;

    private Fabric8ClusterApi clusterApi;

    @BeforeEach
    void setUp() {
        clusterApi = new Fabric8ClusterApi(client);
    }

    private static SecretResource secret(String name, String value) {
        return new SecretResource(name, NAMESPACE, Map.of("token", SecretPayloads.encode(value)),
                Map.of(ManagedLabels.MANAGED_BY, "vibecode-platform"), null);
    }

    @Test
    @DisplayName("getSecret: Absent secret is empty, not an error")
    void getSecret_absent() {
        assertThat(clusterApi.getSecret(NAMESPACE, "missing")).isEmpty();
    }

    @Test
    @DisplayName("createSecret/getSecret: Round trip keeps data, labels and assigns a resource version")
    void createAndGet() {
        clusterApi.createSecret(secret("alpha", "v1"));

        SecretResource stored = clusterApi.getSecret(NAMESPACE, "alpha").orElseThrow();
        assertThat(stored.data()).containsEntry("token", SecretPayloads.encode("v1"));
        assertThat(stored.labels()).containsEntry(ManagedLabels.MANAGED_BY, "vibecode-platform");
        assertThat(stored.resourceVersion()).isNotBlank();
        assertThat(client.secrets().inNamespace(NAMESPACE).withName("alpha").get().getType()).isEqualTo("Opaque");
    }

    @Test
    @DisplayName("createSecret: Creating an existing secret is AlreadyExists")
    void createSecret_duplicate() {
        clusterApi.createSecret(secret("alpha", "v1"));

        assertThatThrownBy(() -> clusterApi.createSecret(secret("alpha", "v1")))
                .isInstanceOf(AlreadyExistsException.class)
                .hasMessageContaining("secret 'alpha' in namespace 'vibecode-test'");
    }

    @Test
    @DisplayName("updateSecret: Replaces data when given the observed version")
    void updateSecret() {
        clusterApi.createSecret(secret("alpha", "v1"));
        SecretResource current = clusterApi.getSecret(NAMESPACE, "alpha").orElseThrow();

        clusterApi.updateSecret(secret("alpha", "v2").withResourceVersion(current.resourceVersion()));

        assertThat(clusterApi.getSecret(NAMESPACE, "alpha").orElseThrow().data())
                .containsEntry("token", SecretPayloads.encode("v2"));
    }

    @Test
    @DisplayName("updateSecret: Refuses an update without a resource version")
    void updateSecret_requiresVersion() {
        assertThatThrownBy(() -> clusterApi.updateSecret(secret("alpha", "v2")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("listSecrets: Filters by label selector")
    void listSecrets() {
        clusterApi.createSecret(secret("alpha", "v1"));
        clusterApi.createSecret(new SecretResource("other", NAMESPACE, Map.of(), Map.of("team", "x"), null));

        List<SecretResource> managed = clusterApi.listSecrets(NAMESPACE, ManagedLabels.selector("vibecode-platform"));

        assertThat(managed).extracting(SecretResource::name).containsExactly("alpha");
    }

    @Test
    @DisplayName("createNamespace: Second create is AlreadyExists; phase is readable")
    void namespaces() {
        assertThat(clusterApi.getNamespacePhase("vibecode-new")).isEmpty();

        clusterApi.createNamespace("vibecode-new", Map.of(ManagedLabels.ENVIRONMENT, "new"));

        assertThat(clusterApi.getNamespacePhase("vibecode-new")).isPresent();
        assertThat(client.namespaces().withName("vibecode-new").get().getMetadata().getLabels())
                .containsEntry(ManagedLabels.ENVIRONMENT, "new");
        assertThatThrownBy(() -> clusterApi.createNamespace("vibecode-new", Map.of()))
                .isInstanceOf(AlreadyExistsException.class);
    }
}
