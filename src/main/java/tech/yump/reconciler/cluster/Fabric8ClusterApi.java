package tech.yump.reconciler.cluster;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.VersionInfo;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ClusterApi} backed by the fabric8 Kubernetes client, authenticated with ambient credentials
 * (kubeconfig or in-cluster service account).
 */
@Slf4j
@RequiredArgsConstructor
public class Fabric8ClusterApi implements ClusterApi {

  private static final String SECRET_TYPE = "Opaque";
  private static final String READY_CONDITION = "Ready";

  private final KubernetesClient client;

  @Override
  public void checkConnectivity() {
    try {
      VersionInfo version = client.getKubernetesVersion();
      log.info("Connected to Kubernetes API at {} (server version {}.{})",
              client.getMasterUrl(), version.getMajor(), version.getMinor());
    } catch (KubernetesClientException e) {
      throw translate(e, "connect to", "API server " + client.getMasterUrl(), false);
    }
  }

  @Override
  public Optional<SecretResource> getSecret(String namespace, String name) {
    try {
      Secret secret = client.secrets().inNamespace(namespace).withName(name).get();
      return Optional.ofNullable(secret).map(this::toResource);
    } catch (KubernetesClientException e) {
      throw translate(e, "read", describe("secret", namespace, name), false);
    }
  }

  @Override
  public SecretResource createSecret(SecretResource secret) {
    try {
      Secret created = client.secrets().inNamespace(secret.namespace()).resource(toSecret(secret)).create();
      return toResource(created);
    } catch (KubernetesClientException e) {
      throw translate(e, "create", describe("secret", secret.namespace(), secret.name()), true);
    }
  }

  @Override
  public SecretResource updateSecret(SecretResource secret) {
    if (secret.resourceVersion() == null) {
      throw new IllegalArgumentException("Update of secret '" + secret.name() + "' requires an observed resource version.");
    }
    try {
      // The resource version in metadata makes the API server reject stale writes with 409
      Secret updated = client.secrets().inNamespace(secret.namespace()).resource(toSecret(secret)).update();
      return toResource(updated);
    } catch (KubernetesClientException e) {
      throw translate(e, "update", describe("secret", secret.namespace(), secret.name()), false);
    }
  }

  @Override
  public List<SecretResource> listSecrets(String namespace, Map<String, String> labelSelector) {
    try {
      return client.secrets().inNamespace(namespace).withLabels(labelSelector).list().getItems().stream()
              .map(this::toResource)
              .toList();
    } catch (KubernetesClientException e) {
      throw translate(e, "list", "secrets in namespace '" + namespace + "'", false);
    }
  }

  @Override
  public Optional<String> getNamespacePhase(String name) {
    try {
      Namespace namespace = client.namespaces().withName(name).get();
      if (namespace == null) {
        return Optional.empty();
      }
      String phase = namespace.getStatus() != null ? namespace.getStatus().getPhase() : null;
      return Optional.of(phase != null ? phase : "Unknown");
    } catch (KubernetesClientException e) {
      throw translate(e, "read", "namespace '" + name + "'", false);
    }
  }

  @Override
  public void createNamespace(String name, Map<String, String> labels) {
    Namespace namespace = new NamespaceBuilder()
            .withNewMetadata()
                .withName(name)
                .withLabels(labels)
            .endMetadata()
            .build();
    try {
      client.namespaces().resource(namespace).create();
    } catch (KubernetesClientException e) {
      throw translate(e, "create", "namespace '" + name + "'", true);
    }
  }

  @Override
  public void applyReference(ReferenceResource reference) {
    GenericKubernetesResource resource = new GenericKubernetesResource();
    resource.setApiVersion(reference.apiVersion());
    resource.setKind(reference.kind());
    resource.setMetadata(new ObjectMetaBuilder()
            .withName(reference.name())
            .withNamespace(reference.namespace())
            .withLabels(reference.labels())
            .build());
    resource.setAdditionalProperty("spec", reference.spec());

    String what = describe(reference.kind(), reference.namespace(), reference.name());
    try {
      genericOperation(reference.apiVersion(), reference.kind(), reference.namespace())
              .resource(resource)
              .forceConflicts()
              .serverSideApply();
      log.debug("Applied {}", what);
    } catch (KubernetesClientException e) {
      throw translate(e, "apply", what, false);
    }
  }

  @Override
  public Optional<ReferenceState> getReferenceState(String apiVersion, String kind, String namespace, String name) {
    try {
      GenericKubernetesResource resource = genericOperation(apiVersion, kind, namespace).withName(name).get();
      return Optional.ofNullable(resource).map(this::toReferenceState);
    } catch (KubernetesClientException e) {
      throw translate(e, "read", describe(kind, namespace, name), false);
    }
  }

  // --- Conversion helpers ---

  private Secret toSecret(SecretResource resource) {
    return new SecretBuilder()
            .withNewMetadata()
                .withName(resource.name())
                .withNamespace(resource.namespace())
                .withLabels(resource.labels())
                .withResourceVersion(resource.resourceVersion())
            .endMetadata()
            .withType(SECRET_TYPE)
            .withData(resource.data())
            .build();
  }

  private SecretResource toResource(Secret secret) {
    ObjectMeta metadata = secret.getMetadata();
    return new SecretResource(
            metadata.getName(),
            metadata.getNamespace(),
            secret.getData(),
            metadata.getLabels(),
            metadata.getResourceVersion());
  }

  private ReferenceState toReferenceState(GenericKubernetesResource resource) {
    ObjectMeta metadata = resource.getMetadata();
    Instant createdAt = parseTimestamp(metadata.getCreationTimestamp());
    boolean ready = false;
    String reason = null;

    Object status = resource.getAdditionalProperties().get("status");
    if (status instanceof Map<?, ?> statusMap && statusMap.get("conditions") instanceof List<?> conditions) {
      for (Object entry : conditions) {
        if (entry instanceof Map<?, ?> condition && READY_CONDITION.equals(condition.get("type"))) {
          ready = "True".equals(condition.get("status"));
          Object conditionReason = condition.get("reason");
          reason = conditionReason != null ? conditionReason.toString() : null;
        }
      }
    }
    return new ReferenceState(metadata.getName(), createdAt, ready, reason);
  }

  private static Instant parseTimestamp(String timestamp) {
    if (timestamp == null) {
      return null;
    }
    try {
      return Instant.parse(timestamp);
    } catch (DateTimeParseException e) {
      log.warn("Unparseable creation timestamp '{}'", timestamp);
      return null;
    }
  }

  private NonNamespaceOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> genericOperation(
          String apiVersion, String kind, String namespace) {
    int slash = apiVersion.indexOf('/');
    ResourceDefinitionContext context = new ResourceDefinitionContext.Builder()
            .withGroup(slash > 0 ? apiVersion.substring(0, slash) : "")
            .withVersion(apiVersion.substring(slash + 1))
            .withKind(kind)
            .withPlural(kind.toLowerCase(Locale.ROOT) + "s")
            .withNamespaced(namespace != null)
            .build();
    var operation = client.genericKubernetesResources(context);
    return namespace != null ? operation.inNamespace(namespace) : operation;
  }

  private static String describe(String kind, String namespace, String name) {
    return namespace == null ? kind + " '" + name + "'" : kind + " '" + name + "' in namespace '" + namespace + "'";
  }

  /**
   * Maps a client failure onto the engine's error taxonomy by HTTP status.
   * Only the resource identity and status code go into the message.
   */
  static ClusterException translate(KubernetesClientException e, String action, String what, boolean creating) {
    int code = e.getCode();
    String message = "Failed to " + action + " " + what;
    if (code == 401 || code == 403) {
      log.error("RBAC: not permitted to {} {} (HTTP {})", action, what, code);
      return new PermissionException(message + ": permission denied (HTTP " + code + ")", e);
    }
    if (code == 409) {
      return creating
              ? new AlreadyExistsException(message + ": already exists", e)
              : new ConflictException(message + ": resource version conflict", e);
    }
    if (code == 0 || e.getCause() instanceof IOException) {
      return new ConnectivityException(message + ": API server unreachable", e);
    }
    return new ClusterException(message + " (HTTP " + code + ")", e);
  }
}
