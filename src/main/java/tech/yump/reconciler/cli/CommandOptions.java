package tech.yump.reconciler.cli;

import org.springframework.boot.ApplicationArguments;
import tech.yump.reconciler.service.RunRequest;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parsed command line: {@code reconcile [<namespace>] [--verify-only] [--dry-run] [--strict] [--help]}.
 * <p>
 * Options that are Spring property overrides ({@code --spring.*}, {@code --logging.*}, {@code --reconciler.*})
 * are left to Spring. Anything else is rejected, so no value can ever be passed on the command line.
 */
public record CommandOptions(String namespace, boolean verifyOnly, boolean dryRun, boolean strict, boolean help) {

    public static final String COMMAND = "reconcile";

    private static final Set<String> PROPERTY_PREFIXES = Set.of("spring.", "logging.", "reconciler.");
    private static final Pattern NAMESPACE = Pattern.compile("[a-z0-9]([-a-z0-9]*[a-z0-9])?");
    private static final int NAMESPACE_MAX_LENGTH = 63;

    public static CommandOptions parse(ApplicationArguments args) {
        boolean verifyOnly = false;
        boolean dryRun = false;
        boolean strict = false;
        boolean help = false;

        for (String option : args.getOptionNames()) {
            switch (option) {
                case "verify-only" -> verifyOnly = true;
                case "dry-run" -> dryRun = true;
                case "strict" -> strict = true;
                case "help" -> help = true;
                default -> {
                    if (PROPERTY_PREFIXES.stream().noneMatch(option::startsWith)) {
                        throw new UsageException("Unknown option '--" + option + "'");
                    }
                }
            }
        }

        String command = null;
        String namespace = null;
        List<String> positional = args.getNonOptionArgs();
        for (String arg : positional) {
            // Short aliases; Spring only recognizes the double-dash form as options
            switch (arg) {
                case "-v" -> verifyOnly = true;
                case "-d" -> dryRun = true;
                case "-s" -> strict = true;
                case "-h" -> help = true;
                default -> {
                    if (arg.startsWith("-")) {
                        throw new UsageException("Unknown option '" + arg + "'");
                    }
                    if (command == null) {
                        command = arg;
                    } else if (namespace == null) {
                        namespace = arg;
                    } else {
                        throw new UsageException("Unexpected argument '" + arg + "'");
                    }
                }
            }
        }

        if (help) {
            return new CommandOptions(namespace, verifyOnly, dryRun, strict, true);
        }
        if (command == null) {
            throw new UsageException("Missing command");
        }
        if (!COMMAND.equals(command)) {
            throw new UsageException("Unknown command '" + command + "'");
        }
        if (verifyOnly && dryRun) {
            throw new UsageException("--verify-only and --dry-run cannot be combined");
        }
        if (namespace != null && (namespace.length() > NAMESPACE_MAX_LENGTH || !NAMESPACE.matcher(namespace).matches())) {
            throw new UsageException("Invalid namespace name '" + namespace + "'");
        }
        return new CommandOptions(namespace, verifyOnly, dryRun, strict, false);
    }

    public RunRequest toRequest(String defaultNamespace) {
        return new RunRequest(namespace != null ? namespace : defaultNamespace, verifyOnly, dryRun, strict);
    }
}
