package tech.yump.reconciler.env;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.reconciler.model.KeyRef;
import tech.yump.reconciler.model.KeySpec;
import tech.yump.reconciler.model.KeyValidation;
import tech.yump.reconciler.model.ResolvedValue;
import tech.yump.reconciler.model.SourceTier;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvironmentResolverTest {

    private static KeySpec key(String secret, String name, String sourceVar) {
        return KeySpec.builder().secretName(secret).keyName(name).sourceVar(sourceVar).build();
    }

    private static EnvironmentResolver resolver(Map<String, String> env, Map<String, String> overrides) {
        return new EnvironmentResolver(new RunEnvironment(env, Path.of(".env"), overrides), new ValueGenerator());
    }

    @Test
    @DisplayName("resolve: Process environment takes precedence over the override file")
    void resolve_environmentBeatsOverride() {
        EnvironmentResolver resolver = resolver(Map.of("TOKEN", "from-env"), Map.of("TOKEN", "from-file", "USER", "file-user"));

        ResolutionResult result = resolver.resolve(List.of(key("alpha", "token", "TOKEN"), key("beta", "user", "USER")));

        assertThat(result.isComplete()).isTrue();
        ResolvedValue token = result.values().get(new KeyRef("alpha", "token")).orElseThrow();
        assertThat(token.value()).isEqualTo("from-env");
        assertThat(token.sourceTier()).isEqualTo(SourceTier.ENVIRONMENT);
        ResolvedValue user = result.values().get(new KeyRef("beta", "user")).orElseThrow();
        assertThat(user.value()).isEqualTo("file-user");
        assertThat(user.sourceTier()).isEqualTo(SourceTier.OVERRIDE_FILE);
    }

    @Test
    @DisplayName("resolve: Empty environment value falls through to the override file")
    void resolve_emptyValueCountsAsAbsent() {
        EnvironmentResolver resolver = resolver(Map.of("TOKEN", ""), Map.of("TOKEN", "from-file"));

        ResolutionResult result = resolver.resolve(List.of(key("alpha", "token", "TOKEN")));

        assertThat(result.values().get(new KeyRef("alpha", "token")).orElseThrow().value()).isEqualTo("from-file");
    }

    @Test
    @DisplayName("resolve: Collects every miss instead of stopping at the first")
    void resolve_reportsAllMissing() {
        EnvironmentResolver resolver = resolver(Map.of(), Map.of());

        ResolutionResult result = resolver.resolve(List.of(key("s", "A", "VAR_A"), key("s", "B", "VAR_B")));

        assertThat(result.isComplete()).isFalse();
        assertThat(result.missing())
                .extracting(MissingValue::sourceVar)
                .containsExactly("VAR_A", "VAR_B");
        assertThatThrownBy(result::valuesOrThrow)
                .isInstanceOf(MissingValueException.class)
                .hasMessageContaining("s/A")
                .hasMessageContaining("s/B");
    }

    @Test
    @DisplayName("resolve: Generator is used only for keys marked generatable")
    void resolve_generatesOnlyWhenOptedIn() {
        EnvironmentResolver resolver = resolver(Map.of(), Map.of());
        KeySpec generatable = KeySpec.builder().secretName("db").keyName("password").sourceVar("DB_PASSWORD")
                .validation(new KeyValidation(40, null)).generatable(true).build();
        KeySpec plain = key("db", "user", "DB_USER");

        ResolutionResult result = resolver.resolve(List.of(generatable, plain));

        ResolvedValue generated = result.values().get(generatable.ref()).orElseThrow();
        assertThat(generated.sourceTier()).isEqualTo(SourceTier.GENERATED);
        assertThat(generated.value()).hasSize(40).matches("[A-Za-z0-9]+");
        assertThat(result.missing()).extracting(MissingValue::ref).containsExactly(plain.ref());
    }

    @Test
    @DisplayName("ResolvedValue.toString: Should never print the value")
    void resolvedValue_toStringRedacts() {
        ResolvedValue value = new ResolvedValue(new KeyRef("alpha", "token"), "s3cr3t-test-value-123", SourceTier.ENVIRONMENT);

        assertThat(value.toString()).doesNotContain("s3cr3t-test-value-123").contains("alpha/token");
    }
}
