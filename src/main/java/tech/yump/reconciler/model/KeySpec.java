package tech.yump.reconciler.model;

import lombok.Builder;

/**
 * One required key of a declared secret.
 *
 * @param secretName     name of the owning secret
 * @param keyName        data key inside the secret resource
 * @param sourceVar      environment / override-file variable the value is read from
 * @param validation     rules the value must satisfy
 * @param generatable    whether a random value may be generated when no source provides one
 * @param remoteKey      path in the external store (external backend only)
 * @param remoteProperty property at that path (external backend only, optional)
 */
@Builder
public record KeySpec(
        String secretName,
        String keyName,
        String sourceVar,
        KeyValidation validation,
        boolean generatable,
        String remoteKey,
        String remoteProperty
) {

    public KeySpec {
        if (validation == null) {
            validation = KeyValidation.NONE;
        }
    }

    public KeyRef ref() {
        return new KeyRef(secretName, keyName);
    }
}
