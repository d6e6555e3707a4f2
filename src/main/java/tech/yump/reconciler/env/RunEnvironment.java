package tech.yump.reconciler.env;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of every ambient input a run may read values from, captured once at startup.
 * Components receive this instead of reading the process environment themselves.
 */
public final class RunEnvironment {

    private final Map<String, String> environment;
    private final Path overrideFile;
    private final Map<String, String> overrideValues;

    public RunEnvironment(Map<String, String> environment, Path overrideFile, Map<String, String> overrideValues) {
        this.environment = Map.copyOf(environment);
        this.overrideFile = overrideFile;
        this.overrideValues = Map.copyOf(overrideValues);
    }

    public static RunEnvironment of(Map<String, String> environment) {
        return new RunEnvironment(environment, null, Map.of());
    }

    public Optional<String> environmentValue(String name) {
        return Optional.ofNullable(environment.get(name));
    }

    public Optional<String> overrideValue(String name) {
        return Optional.ofNullable(overrideValues.get(name));
    }

    public Optional<Path> overrideFile() {
        return Optional.ofNullable(overrideFile);
    }

    @Override
    public String toString() {
        // Variable names only; values stay out of logs
        return "RunEnvironment[environmentVariables=" + environment.size()
                + ", overrideFile=" + overrideFile
                + ", overrideKeys=" + overrideValues.keySet() + "]";
    }
}
