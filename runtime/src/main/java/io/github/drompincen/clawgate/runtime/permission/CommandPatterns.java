package io.github.drompincen.clawgate.runtime.permission;

import io.github.drompincen.clawgate.protocol.api.PermissionRule;
import io.github.drompincen.clawgate.protocol.api.RuleKind;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Trust-pattern extraction and rule matching for command strings.
 *
 * <p>A glob rule is anchored: {@code *} stands for any run of characters (including none)
 * and the whole subject must be covered. A pattern ending in {@code " *"} also matches
 * its bare prefix, so {@code git status *} matches {@code git status}.
 */
public final class CommandPatterns {

    /** Executables that never get a glob rule; only the identical command can be trusted again. */
    public static final Set<String> DANGEROUS_COMMANDS = Set.of(
            "rm", "rmdir", "mv", "shred",
            "dd", "mkfs", "fdisk",
            "chmod", "chown", "chgrp",
            "sudo", "su", "doas",
            "sh", "bash", "zsh", "eval", "exec",
            "apt", "apt-get", "yum", "dnf");

    private static final Set<String> NODE_TOOLS = Set.of("npm", "pnpm", "yarn", "deno", "bun");
    private static final Set<String> NODE_VERBS = Set.of(
            "install", "i", "add", "remove", "test", "t", "build", "start", "dev");
    private static final Set<String> GIT_VERBS = Set.of(
            "commit", "push", "pull", "checkout", "add", "status", "diff", "branch",
            "merge", "rebase", "log", "fetch", "remote", "stash");
    private static final Set<String> PY_PACKAGE_TOOLS = Set.of("pip", "pip3", "poetry", "conda");
    private static final Set<String> PY_PACKAGE_VERBS = Set.of("install", "add", "remove", "test", "run");
    private static final Set<String> CARGO_VERBS = Set.of("build", "test", "run", "add", "check");
    private static final Set<String> GO_VERBS = Set.of("build", "test", "run", "get", "mod");
    private static final Set<String> DOCKER_VERBS = Set.of("run", "build", "ps", "exec", "up", "down");
    private static final Set<String> KUBECTL_VERBS = Set.of("get", "describe", "apply", "logs");
    private static final Set<String> TERRAFORM_VERBS = Set.of("plan", "apply", "destroy", "init");

    private static final Map<String, Pattern> GLOB_CACHE = new ConcurrentHashMap<>();

    private CommandPatterns() {
    }

    /**
     * Suggests a reusable glob for a single simple command, e.g. {@code npm install lodash}
     * gives {@code npm install *}. Empty for compound commands, dangerous executables and
     * tools without a known verb; callers then trust the exact string only.
     */
    public static Optional<String> smartPattern(String command) {
        List<String> parts = BashCommandParser.split(command);
        if (parts.size() != 1) return Optional.empty();

        String normalized = BashCommandParser.normalize(parts.get(0));
        if (normalized.isEmpty() || isDangerousBase(normalized)) return Optional.empty();

        String[] tokens = normalized.split("\\s+");
        return smartPrefix(tokens).map(prefix -> prefix + " *");
    }

    static Optional<String> smartPrefix(String[] tokens) {
        String exe = tokens[0];
        String sub = tokens.length > 1 ? tokens[1] : null;
        String third = tokens.length > 2 ? tokens[2] : null;

        if (NODE_TOOLS.contains(exe)) {
            if (NODE_VERBS.contains(sub)) return Optional.of(exe + " " + sub);
            if ("run".equals(sub) && third != null) return Optional.of(exe + " run " + third);
            return Optional.empty();
        }
        if ("git".equals(exe)) {
            return GIT_VERBS.contains(sub) ? Optional.of(exe + " " + sub) : Optional.empty();
        }
        if ("python".equals(exe) || "python3".equals(exe)) {
            if ("-m".equals(sub) && "pip".equals(third) && tokens.length > 3 && "install".equals(tokens[3])) {
                return Optional.of(exe + " -m pip install");
            }
            return Optional.empty();
        }
        if (PY_PACKAGE_TOOLS.contains(exe)) {
            return PY_PACKAGE_VERBS.contains(sub) ? Optional.of(exe + " " + sub) : Optional.empty();
        }
        if ("mvn".equals(exe) || "gradle".equals(exe)) {
            return sub != null && !sub.startsWith("-") ? Optional.of(exe + " " + sub) : Optional.empty();
        }
        if ("java".equals(exe)) {
            return "-jar".equals(sub) ? Optional.of("java -jar") : Optional.empty();
        }
        if ("cargo".equals(exe)) {
            return CARGO_VERBS.contains(sub) ? Optional.of(exe + " " + sub) : Optional.empty();
        }
        if ("go".equals(exe)) {
            return GO_VERBS.contains(sub) ? Optional.of(exe + " " + sub) : Optional.empty();
        }
        if ("docker".equals(exe) || "docker-compose".equals(exe)) {
            return DOCKER_VERBS.contains(sub) ? Optional.of(exe + " " + sub) : Optional.empty();
        }
        if ("kubectl".equals(exe)) {
            return KUBECTL_VERBS.contains(sub) ? Optional.of(exe + " " + sub) : Optional.empty();
        }
        if ("terraform".equals(exe)) {
            return TERRAFORM_VERBS.contains(sub) ? Optional.of(exe + " " + sub) : Optional.empty();
        }
        return Optional.empty();
    }

    /** True when the first simple command's executable is blacklisted. */
    public static boolean isDangerousBase(String command) {
        List<String> parts = BashCommandParser.split(command);
        String first = parts.isEmpty() ? command : parts.get(0);
        return executableOf(BashCommandParser.normalize(first))
                .map(DANGEROUS_COMMANDS::contains)
                .orElse(false);
    }

    /** True when any simple command of a compound command has a blacklisted executable. */
    public static boolean containsDangerousCommand(String command) {
        return BashCommandParser.split(command).stream()
                .map(BashCommandParser::normalize)
                .map(CommandPatterns::executableOf)
                .anyMatch(exe -> exe.map(DANGEROUS_COMMANDS::contains).orElse(false));
    }

    /** Base name of the first token, {@code /usr/bin/rm -f x} gives {@code rm}. */
    public static Optional<String> executableOf(String simpleCommand) {
        List<String> tokens = BashCommandParser.tokenize(simpleCommand);
        if (tokens.isEmpty()) return Optional.empty();
        String exe = tokens.get(0);
        int slash = exe.lastIndexOf('/');
        if (slash >= 0 && slash < exe.length() - 1) {
            exe = exe.substring(slash + 1);
        }
        return exe.isEmpty() ? Optional.empty() : Optional.of(exe);
    }

    public static boolean matches(String subject, PermissionRule rule) {
        if (subject == null) return false;
        if (rule.kind() == RuleKind.EXACT) {
            return subject.equals(rule.pattern());
        }
        return GLOB_CACHE.computeIfAbsent(rule.pattern(), CommandPatterns::compileGlob)
                .matcher(subject)
                .matches();
    }

    static Pattern compileGlob(String glob) {
        boolean optionalTail = glob.length() > 2 && glob.endsWith(" *");
        String body = optionalTail ? glob.substring(0, glob.length() - 2) : glob;

        StringBuilder regex = new StringBuilder();
        int start = 0;
        int star;
        while ((star = body.indexOf('*', start)) >= 0) {
            regex.append(Pattern.quote(body.substring(start, star))).append(".*");
            start = star + 1;
        }
        regex.append(Pattern.quote(body.substring(start)));
        if (optionalTail) {
            regex.append("(?:\\s.*)?");
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }
}
