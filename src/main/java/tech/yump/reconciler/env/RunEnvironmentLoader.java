package tech.yump.reconciler.env;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link RunEnvironment} from the process environment and the first override file that exists.
 */
@Slf4j
public final class RunEnvironmentLoader {

    private RunEnvironmentLoader() {
    }

    public static RunEnvironment load(Map<String, String> processEnvironment, List<String> overrideCandidates) {
        for (String candidate : overrideCandidates) {
            if (!StringUtils.hasText(candidate)) {
                continue;
            }
            Path path = Paths.get(candidate).toAbsolutePath().normalize();
            if (Files.isRegularFile(path)) {
                Map<String, String> overrides = OverrideFileParser.parse(path);
                log.info("Using override file {} ({} entries)", path, overrides.size());
                return new RunEnvironment(processEnvironment, path, overrides);
            }
            log.debug("Override file candidate {} not present", path);
        }
        log.info("No override file found; values come from the process environment only");
        return new RunEnvironment(processEnvironment, null, Map.of());
    }
}
