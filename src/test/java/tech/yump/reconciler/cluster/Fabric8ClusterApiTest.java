package tech.yump.reconciler.cluster;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.kubernetes.client.server.mock.KubernetesMockServer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Error translation and custom resource reads, driven by canned API server responses.
 */
@EnableKubernetesMockClient
class Fabric8ClusterApiTest {

    private static final String NAMESPACE = "vibecode-test";

    KubernetesMockServer server;
    KubernetesClient client;

    private Fabric8ClusterApi clusterApi;

    @BeforeEach
    void setUp() {
        clusterApi = new Fabric8ClusterApi(client);
    }

    @Test
    @DisplayName("checkConnectivity: Reads the server version")
    void checkConnectivity_ok() {
        server.expect().get().withPath("/version")
                .andReturn(200, "{\"major\":\"1\",\"minor\":\"29\",\"gitVersion\":\"v1.29.0\"}")
                .once();

        clusterApi.checkConnectivity();
    }

    @Test
    @DisplayName("checkConnectivity: Unreachable server is a connectivity error")
    void checkConnectivity_unreachable() {
        Config config = new ConfigBuilder()
                .withMasterUrl("http://127.0.0.1:1")
                .withRequestRetryBackoffLimit(0)
                .withConnectionTimeout(500)
                .build();
        try (KubernetesClient unreachable = new KubernetesClientBuilder().withConfig(config).build()) {
            assertThatThrownBy(() -> new Fabric8ClusterApi(unreachable).checkConnectivity())
                    .isInstanceOf(ConnectivityException.class)
                    .hasMessageContaining("API server unreachable");
        }
    }

    @Test
    @DisplayName("getSecret: 403 is a permission error")
    void getSecret_forbidden() {
        server.expect().get().withPath("/api/v1/namespaces/" + NAMESPACE + "/secrets/alpha")
                .andReturn(403, "{\"kind\":\"Status\",\"code\":403,\"reason\":\"Forbidden\"}")
                .once();

        assertThatThrownBy(() -> clusterApi.getSecret(NAMESPACE, "alpha"))
                .isInstanceOf(PermissionException.class)
                .hasMessageContaining("HTTP 403");
    }

    @Test
    @DisplayName("getSecret: 500 is a generic cluster error")
    void getSecret_serverError() {
        server.expect().get().withPath("/api/v1/namespaces/" + NAMESPACE + "/secrets/alpha")
                .andReturn(500, "{\"kind\":\"Status\",\"code\":500}")
                .always();

        assertThatThrownBy(() -> clusterApi.getSecret(NAMESPACE, "alpha"))
                .isExactlyInstanceOf(ClusterException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    @DisplayName("getReferenceState: Parses creation time and the Ready condition")
    void getReferenceState() {
        server.expect().get()
                .withPath("/apis/external-secrets.io/v1beta1/namespaces/" + NAMESPACE + "/externalsecrets/alpha")
                .andReturn(200, "{\"apiVersion\":\"external-secrets.io/v1beta1\",\"kind\":\"ExternalSecret\","
                        + "\"metadata\":{\"name\":\"alpha\",\"namespace\":\"" + NAMESPACE + "\","
                        + "\"creationTimestamp\":\"2026-03-01T12:00:00Z\"},"
                        + "\"status\":{\"conditions\":[{\"type\":\"Ready\",\"status\":\"False\",\"reason\":\"SecretSyncedError\"}]}}")
                .once();

        ReferenceState state = clusterApi.getReferenceState("external-secrets.io/v1beta1", "ExternalSecret", NAMESPACE, "alpha")
                .orElseThrow();

        assertThat(state.createdAt()).isEqualTo(Instant.parse("2026-03-01T12:00:00Z"));
        assertThat(state.ready()).isFalse();
        assertThat(state.reason()).isEqualTo("SecretSyncedError");
    }

    @Test
    @DisplayName("getReferenceState: Absent reference is empty")
    void getReferenceState_absent() {
        server.expect().get()
                .withPath("/apis/external-secrets.io/v1beta1/namespaces/" + NAMESPACE + "/externalsecrets/missing")
                .andReturn(404, "{\"kind\":\"Status\",\"code\":404}")
                .once();

        assertThat(clusterApi.getReferenceState("external-secrets.io/v1beta1", "ExternalSecret", NAMESPACE, "missing")).isEmpty();
    }

    @Test
    @DisplayName("translate: Maps HTTP codes onto the error taxonomy")
    void translate() {
        assertThat(Fabric8ClusterApi.translate(new KubernetesClientException("x", 401, null), "read", "secret 'a'", false))
                .isInstanceOf(PermissionException.class);
        assertThat(Fabric8ClusterApi.translate(new KubernetesClientException("x", 409, null), "create", "secret 'a'", true))
                .isInstanceOf(AlreadyExistsException.class);
        assertThat(Fabric8ClusterApi.translate(new KubernetesClientException("x", 409, null), "update", "secret 'a'", false))
                .isInstanceOf(ConflictException.class);
        assertThat(Fabric8ClusterApi.translate(new KubernetesClientException("x", new IOException("refused")), "read", "secret 'a'", false))
                .isInstanceOf(ConnectivityException.class);
        assertThat(Fabric8ClusterApi.translate(new KubernetesClientException("x", 422, null), "update", "secret 'a'", false))
                .isExactlyInstanceOf(ClusterException.class)
                .hasMessage("Failed to update secret 'a' (HTTP 422)");
    }

    @Test
    @DisplayName("translate: Messages never carry the client's own message text")
    void translate_doesNotCopyClientMessage() {
        ClusterException translated = Fabric8ClusterApi.translate(
                new KubernetesClientException("payload s3cr3t-test-value-123", 500, null), "update", "secret 'a'", false);

        assertThat(translated.getMessage()).doesNotContain("s3cr3t-test-value-123");
    }
}
