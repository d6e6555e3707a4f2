package tech.yump.reconciler.env;

import lombok.extern.slf4j.Slf4j;
import tech.yump.reconciler.core.ConfigurationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses a local override file of {@code KEY=value} lines.
 * Blank lines and {@code #} comments are skipped; an {@code export } prefix and matching quotes are stripped.
 */
@Slf4j
public final class OverrideFileParser {

    private static final String EXPORT_PREFIX = "export ";

    private OverrideFileParser() {
    }

    public static Map<String, String> parse(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Override file could not be read: " + file, e);
        }
        return parseLines(lines, file.toString());
    }

    static Map<String, String> parseLines(List<String> lines, String origin) {
        Map<String, String> values = new LinkedHashMap<>();
        int lineNumber = 0;
        for (String raw : lines) {
            lineNumber++;
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith(EXPORT_PREFIX)) {
                line = line.substring(EXPORT_PREFIX.length()).strip();
            }
            int eq = line.indexOf('=');
            if (eq <= 0) {
                // The line content may itself be a value, so only its position is reported
                log.warn("Ignoring malformed line {} in override file {}", lineNumber, origin);
                continue;
            }
            String key = line.substring(0, eq).strip();
            String value = unquote(line.substring(eq + 1).strip());
            values.put(key, value);
        }
        return values;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
