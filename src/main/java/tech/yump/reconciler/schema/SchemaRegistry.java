package tech.yump.reconciler.schema;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tech.yump.reconciler.config.ReconcilerProperties;
import tech.yump.reconciler.core.ConfigurationException;
import tech.yump.reconciler.core.ManagedLabels;
import tech.yump.reconciler.model.KeySpec;
import tech.yump.reconciler.model.KeyValidation;
import tech.yump.reconciler.model.ResolvedValue;
import tech.yump.reconciler.model.ResolvedValues;
import tech.yump.reconciler.model.SecretSpec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Holds the compiled secret declarations and evaluates values against their rules.
 * Validation is pure: values are inspected as-is and nothing is mutated.
 */
@Slf4j
@Component
public class SchemaRegistry {

    private final ReconcilerProperties properties;
    private final Map<String, List<KeySpec>> keysBySecret;

    public SchemaRegistry(ReconcilerProperties properties) {
        this.properties = properties;
        this.keysBySecret = compile(properties.secrets());
        log.info("Schema registry compiled {} secret declaration(s)", keysBySecret.size());
    }

    /**
     * Declared secrets placed in the given namespace, with their managed labels.
     */
    public List<SecretSpec> specsFor(String namespace) {
        List<SecretSpec> specs = new ArrayList<>();
        for (ReconcilerProperties.SecretDefinition definition : properties.secrets()) {
            Map<String, String> labels = new LinkedHashMap<>(definition.labels());
            labels.put(ManagedLabels.NAME, definition.name());
            labels.put(ManagedLabels.MANAGED_BY, properties.managedBy());
            labels.put(ManagedLabels.CREATED_BY, properties.createdBy());
            specs.add(new SecretSpec(definition.name(), namespace, keysBySecret.get(definition.name()), labels));
        }
        return specs;
    }

    public static List<KeySpec> requiredKeys(List<SecretSpec> specs) {
        return specs.stream().flatMap(spec -> spec.keys().stream()).toList();
    }

    public ValidationResult validate(List<SecretSpec> specs, ResolvedValues values) {
        List<KeyValidationOutcome> outcomes = new ArrayList<>();
        for (KeySpec key : requiredKeys(specs)) {
            Optional<ResolvedValue> value = values.get(key.ref());
            if (value.isEmpty()) {
                outcomes.add(new KeyValidationOutcome(key.ref(), List.of("no value resolved")));
            } else {
                outcomes.add(check(key, value.get().value()));
            }
        }
        ValidationResult result = new ValidationResult(outcomes);
        if (result.passed()) {
            log.info("All {} value(s) passed validation", outcomes.size());
        } else {
            log.error("Validation failed for {} key(s): {}", result.failures().size(), result.failures());
        }
        return result;
    }

    /**
     * Evaluates one value against its key's rules.
     */
    public KeyValidationOutcome check(KeySpec key, String value) {
        List<String> violations = new ArrayList<>();
        KeyValidation rules = key.validation();
        if (value == null || value.isEmpty()) {
            violations.add("value is empty");
        } else {
            rules.minLengthRule()
                    .filter(min -> value.length() < min)
                    .ifPresent(min -> violations.add("shorter than minimum length " + min));
            rules.patternRule()
                    .filter(p -> !p.matcher(value).matches())
                    .ifPresent(p -> violations.add("does not match pattern '" + p.pattern() + "'"));
        }
        return new KeyValidationOutcome(key.ref(), violations);
    }

    private static Map<String, List<KeySpec>> compile(List<ReconcilerProperties.SecretDefinition> definitions) {
        Map<String, List<KeySpec>> compiled = new LinkedHashMap<>();
        for (ReconcilerProperties.SecretDefinition definition : definitions) {
            if (compiled.containsKey(definition.name())) {
                throw new ConfigurationException("Secret '" + definition.name() + "' is declared more than once.");
            }
            List<KeySpec> keys = new ArrayList<>();
            for (ReconcilerProperties.KeyDefinition key : definition.keys()) {
                keys.add(KeySpec.builder()
                        .secretName(definition.name())
                        .keyName(key.name())
                        .sourceVar(key.sourceVar())
                        .validation(new KeyValidation(key.minLength(), compilePattern(definition.name(), key)))
                        .generatable(key.generatable())
                        .remoteKey(key.remoteKey())
                        .remoteProperty(key.remoteProperty())
                        .build());
            }
            compiled.put(definition.name(), List.copyOf(keys));
        }
        return compiled;
    }

    private static Pattern compilePattern(String secretName, ReconcilerProperties.KeyDefinition key) {
        if (!StringUtils.hasText(key.pattern())) {
            return null;
        }
        try {
            return Pattern.compile(key.pattern());
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException(
                    "Pattern for secret '" + secretName + "', key '" + key.name() + "' does not compile.", e);
        }
    }
}
