package tech.yump.reconciler.cluster;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Interface defining the operations this tool needs from the orchestrator's resource API.
 * All values travel inside structured payloads; nothing is ever assembled into command text.
 * Implementations translate transport failures into the {@link ClusterException} hierarchy.
 */
public interface ClusterApi {

  /**
   * Confirms the API server is reachable with the ambient credentials.
   *
   * @throws ConnectivityException if the server cannot be reached.
   * @throws PermissionException   if the credentials are rejected.
   */
  void checkConnectivity();

  /**
   * Fetches a secret by name.
   *
   * @return the secret including its resource version, or empty if it does not exist.
   */
  Optional<SecretResource> getSecret(String namespace, String name);

  /**
   * Creates a secret.
   *
   * @throws AlreadyExistsException if a secret with the same name already exists.
   */
  SecretResource createSecret(SecretResource secret);

  /**
   * Replaces a secret, conditioned on {@link SecretResource#resourceVersion()}.
   *
   * @throws ConflictException if the stored version no longer matches.
   */
  SecretResource updateSecret(SecretResource secret);

  /**
   * Lists secrets in a namespace carrying all of the given labels.
   */
  List<SecretResource> listSecrets(String namespace, Map<String, String> labelSelector);

  /**
   * Returns the lifecycle phase of a namespace (e.g. "Active"), or empty if it does not exist.
   */
  Optional<String> getNamespacePhase(String name);

  /**
   * Creates a namespace.
   *
   * @throws AlreadyExistsException if it already exists.
   */
  void createNamespace(String name, Map<String, String> labels);

  /**
   * Declaratively applies (creates or updates) a custom resource.
   */
  void applyReference(ReferenceResource resource);

  /**
   * Reads the synchronization state of a namespaced custom resource, or empty if it does not exist.
   */
  Optional<ReferenceState> getReferenceState(String apiVersion, String kind, String namespace, String name);
}
