package tech.yump.reconciler.env;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.reconciler.model.KeyRef;
import tech.yump.reconciler.model.KeySpec;
import tech.yump.reconciler.model.ResolvedValue;
import tech.yump.reconciler.model.ResolvedValues;
import tech.yump.reconciler.model.SourceTier;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves raw values for required keys from layered sources:
 * the process environment, then the override file, then (opt-in per key) the generator.
 * Never stops at the first miss.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnvironmentResolver {

    private final RunEnvironment runEnvironment;
    private final ValueGenerator valueGenerator;

    public ResolutionResult resolve(List<KeySpec> required) {
        Map<KeyRef, ResolvedValue> resolved = new LinkedHashMap<>();
        List<MissingValue> missing = new ArrayList<>();

        for (KeySpec key : required) {
            Optional<ResolvedValue> value = lookup(key);
            if (value.isPresent()) {
                resolved.put(key.ref(), value.get());
                log.debug("Resolved {} from {}", key.ref(), value.get().sourceTier());
            } else {
                missing.add(new MissingValue(key.ref(), key.sourceVar()));
            }
        }

        if (!missing.isEmpty()) {
            log.error("{} required value(s) could not be resolved: {}", missing.size(), missing);
        } else {
            log.info("Resolved all {} required value(s)", resolved.size());
        }
        return new ResolutionResult(new ResolvedValues(resolved), missing);
    }

    private Optional<ResolvedValue> lookup(KeySpec key) {
        Optional<String> fromEnvironment = nonEmpty(runEnvironment.environmentValue(key.sourceVar()));
        if (fromEnvironment.isPresent()) {
            return Optional.of(new ResolvedValue(key.ref(), fromEnvironment.get(), SourceTier.ENVIRONMENT));
        }
        Optional<String> fromOverride = nonEmpty(runEnvironment.overrideValue(key.sourceVar()));
        if (fromOverride.isPresent()) {
            return Optional.of(new ResolvedValue(key.ref(), fromOverride.get(), SourceTier.OVERRIDE_FILE));
        }
        if (key.generatable()) {
            log.warn("No value provided for {} ({}); generating a random value because the key is marked generatable",
                    key.ref(), key.sourceVar());
            return Optional.of(new ResolvedValue(key.ref(), valueGenerator.generate(key), SourceTier.GENERATED));
        }
        return Optional.empty();
    }

    private static Optional<String> nonEmpty(Optional<String> value) {
        return value.filter(v -> !v.isEmpty());
    }
}
