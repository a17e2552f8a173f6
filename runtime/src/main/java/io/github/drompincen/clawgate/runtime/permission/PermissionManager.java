package io.github.drompincen.clawgate.runtime.permission;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.clawgate.protocol.api.ConfirmationRequestDto;
import io.github.drompincen.clawgate.protocol.api.ConfirmationResponse;
import io.github.drompincen.clawgate.protocol.api.PermissionDecision;
import io.github.drompincen.clawgate.protocol.api.PermissionMode;
import io.github.drompincen.clawgate.protocol.api.PermissionRule;
import io.github.drompincen.clawgate.protocol.api.RestrictedTools;
import io.github.drompincen.clawgate.protocol.api.RuleKind;
import io.github.drompincen.clawgate.protocol.api.RuleScope;
import io.github.drompincen.clawgate.runtime.config.ClawGateProperties;
import io.github.drompincen.clawgate.runtime.config.PermissionConfigurationResolver;
import io.github.drompincen.clawgate.runtime.config.RuleSet;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Decides whether a tool call may run. Checks, in order: restricted tool set, deny rules,
 * temporary rules, persisted allow rules, the authorization callback, the permission mode,
 * and finally the human through the {@link ConfirmationQueue}.
 *
 * <p>Bash commands are judged per simple command as well as whole: a deny rule hits if it
 * matches the command or any part of it, while allow rules must cover every part of a
 * compound command (read-only navigation such as {@code cd src} or {@code ls} is exempt
 * when it stays inside the working directory).
 */
@Service
public class PermissionManager {

    private static final Logger log = LoggerFactory.getLogger(PermissionManager.class);

    static final Set<String> SAFE_COMMANDS = Set.of("cd", "ls", "pwd", "true", "false");

    private final ClawGateProperties properties;
    private final PermissionConfigurationResolver resolver;
    private final ConfirmationQueue confirmationQueue;
    private final PermissionCallback callback;
    private final Path workdir;
    private final List<Consumer<PermissionMode>> modeChangeListeners = new CopyOnWriteArrayList<>();

    // immutable snapshots, replaced as a whole
    private volatile List<PermissionRule> allowRules = List.of();
    private volatile List<PermissionRule> denyRules = List.of();
    private volatile List<PermissionRule> temporaryRules = List.of();
    private volatile List<Path> additionalDirectories = List.of();
    private volatile PermissionMode configuredMode;

    public PermissionManager(ClawGateProperties properties,
                             PermissionConfigurationResolver resolver,
                             ConfirmationQueue confirmationQueue,
                             PermissionCallback callback) {
        this.properties = properties;
        this.resolver = resolver;
        this.confirmationQueue = confirmationQueue;
        this.callback = callback == null ? PermissionCallback.NONE : callback;
        this.workdir = properties.workdirPath();
    }

    @PostConstruct
    public void loadConfiguration() {
        updateRules(resolver.resolveRuleSets(workdir));
        updateConfiguredDefaultMode(resolver.resolveConfiguredMode(workdir).orElse(null));
        log.info("Permission engine ready for {}: {} allow rule(s), {} deny rule(s), mode {}",
                workdir, allowRules.size(), denyRules.size(), effectiveMode(null).configValue());
    }

    public CompletableFuture<PermissionDecision> checkPermission(String toolName, JsonNode toolInput) {
        return checkPermission(toolName, toolInput, null);
    }

    public CompletableFuture<PermissionDecision> checkPermission(String toolName, JsonNode toolInput,
                                                                 PermissionMode modeOverride) {
        return checkPermission(toolName, toolInput, modeOverride, null);
    }

    /**
     * @param modeOverride the call site's mode, or null to use the configured one
     * @param workingDirectory where the tool will run; relative paths and {@code cd} are
     *        resolved from here. Null means the configured working directory. The safe zone
     *        stays the configured working directory plus the additional directories.
     * @return completes once decided; fails with {@link ConfirmationCancelledException} if the
     *         human cancels instead of answering
     */
    public CompletableFuture<PermissionDecision> checkPermission(String toolName, JsonNode toolInput,
                                                                 PermissionMode modeOverride,
                                                                 Path workingDirectory) {
        Path cwd = startDirectory(workingDirectory);
        if (!RestrictedTools.isRestricted(toolName)) {
            log.debug("{} is not restricted; allowed", toolName);
            return CompletableFuture.completedFuture(PermissionDecision.allow());
        }
        Optional<String> subject = RuleSubjects.subjectOf(toolName, toolInput);

        Optional<PermissionRule> deny = findDenyRule(toolName, subject);
        if (deny.isPresent()) {
            log.debug("{} {} denied by rule {}", toolName, subject.orElse(""), deny.get().toRuleString());
            return CompletableFuture.completedFuture(PermissionDecision.deny(
                    "Permission to use " + toolName + " has been denied by rule " + deny.get().toRuleString()));
        }

        Optional<PermissionRule> grant = findAllowRule(temporaryRules, toolName, subject, cwd);
        if (grant.isEmpty()) grant = findAllowRule(rulesOfKind(RuleKind.EXACT), toolName, subject, cwd);
        if (grant.isEmpty()) grant = findAllowRule(rulesOfKind(RuleKind.GLOB), toolName, subject, cwd);
        if (grant.isPresent()) {
            log.debug("{} {} allowed by rule {}", toolName, subject.orElse(""), grant.get().toRuleString());
            return CompletableFuture.completedFuture(PermissionDecision.allow());
        }

        CompletableFuture<PermissionDecision> result = new CompletableFuture<>();
        consultCallback(toolName, toolInput).whenComplete((decision, error) -> {
            if (error != null) {
                result.complete(authorizationUnavailable(toolName));
            } else if (decision != null) {
                log.debug("{} decided by authorization callback: {}", toolName, decision.behavior());
                result.complete(decision);
            } else {
                decideByMode(toolName, toolInput, subject, modeOverride, cwd, result);
            }
        });
        return result;
    }

    /** CLI override first, then the call site's mode, then configuration, then {@code default}. */
    public PermissionMode effectiveMode(PermissionMode modeOverride) {
        if (properties.permissions().dangerouslySkipPermissions()) return PermissionMode.BYPASS_PERMISSIONS;
        if (modeOverride != null) return modeOverride;
        PermissionMode configured = configuredMode;
        return configured != null ? configured : PermissionMode.DEFAULT;
    }

    /** Takes effect for checks that reach the mode step afterwards; queued requests are unaffected. */
    public void updateConfiguredDefaultMode(PermissionMode mode) {
        PermissionMode previous = configuredMode;
        configuredMode = mode;
        if (previous != mode) {
            log.info("Configured permission mode changed from {} to {}", previous, mode);
            PermissionMode effective = effectiveMode(null);
            for (Consumer<PermissionMode> listener : modeChangeListeners) {
                listener.accept(effective);
            }
        }
    }

    public void addModeChangeListener(Consumer<PermissionMode> listener) {
        modeChangeListeners.add(listener);
    }

    public void updateRules(RuleSet rules) {
        synchronized (this) {
            allowRules = rules.allow();
            denyRules = rules.deny();
            additionalDirectories = rules.additionalDirectories();
        }
        log.debug("Rules updated: {} allow, {} deny, {} additional director(ies)",
                rules.allow().size(), rules.deny().size(), rules.additionalDirectories().size());
    }

    public List<PermissionRule> allowRules() {
        return allowRules;
    }

    public List<PermissionRule> denyRules() {
        return denyRules;
    }

    /** Grants never-persisted rules; only the {@link TemporaryRuleController} should call this. */
    public void addTemporaryRules(Collection<PermissionRule> rules) {
        if (rules.isEmpty()) return;
        synchronized (this) {
            List<PermissionRule> merged = new ArrayList<>(temporaryRules);
            for (PermissionRule rule : rules) {
                PermissionRule temporary = rule.withScope(null);
                if (merged.stream().noneMatch(temporary::sameRuleAs)) merged.add(temporary);
            }
            temporaryRules = List.copyOf(merged);
        }
        log.debug("Temporary rules granted: {}", rules.stream().map(PermissionRule::toRuleString).toList());
    }

    public void clearTemporaryRules() {
        if (!temporaryRules.isEmpty()) {
            log.debug("Clearing {} temporary rule(s)", temporaryRules.size());
        }
        temporaryRules = List.of();
    }

    public List<PermissionRule> temporaryRules() {
        return temporaryRules;
    }

    /**
     * Rules that "always allow" would store for this input. Empty when no reusable rule can be
     * offered, in which case only a one-time allow is possible. Dangerous commands only ever
     * get an exact rule.
     */
    public List<PermissionRule> proposeRules(String toolName, JsonNode toolInput) {
        return proposeRules(toolName, toolInput, workdir);
    }

    private List<PermissionRule> proposeRules(String toolName, JsonNode toolInput, Path cwd) {
        Optional<String> subject = RuleSubjects.subjectOf(toolName, toolInput);
        if (subject.isEmpty()) return List.of();
        String text = subject.get().trim();

        if (!RestrictedTools.BASH.equals(toolName)) {
            return exactRule(toolName, text);
        }
        if (BashCommandParser.hasCommandSubstitution(text)) {
            return exactRule(toolName, text);
        }

        List<String> parts = BashCommandParser.split(text);
        List<PermissionRule> proposals = new ArrayList<>();
        CommandWalk walk = new CommandWalk(cwd);
        for (String part : parts) {
            String normalized = BashCommandParser.normalize(part);
            if (walk.isSafe(normalized)) continue;

            Optional<String> smart = CommandPatterns.smartPattern(normalized);
            PermissionRule rule;
            if (smart.isPresent()) {
                rule = PermissionRule.glob(toolName, smart.get());
            } else {
                String exact = parts.size() == 1 ? text : normalized;
                if (exact.isEmpty() || exact.contains(PermissionRule.WILDCARD)) return List.of();
                rule = PermissionRule.exact(toolName, exact);
            }
            if (proposals.stream().noneMatch(rule::sameRuleAs)) proposals.add(rule);
        }
        return proposals.isEmpty() ? exactRule(toolName, text) : List.copyOf(proposals);
    }

    private static List<PermissionRule> exactRule(String toolName, String text) {
        if (text.isEmpty() || text.contains(PermissionRule.WILDCARD)) return List.of();
        return List.of(PermissionRule.exact(toolName, text));
    }

    private List<PermissionRule> rulesOfKind(RuleKind kind) {
        return allowRules.stream().filter(r -> r.kind() == kind).toList();
    }

    private Optional<PermissionRule> findDenyRule(String toolName, Optional<String> subject) {
        List<PermissionRule> candidates = forTool(denyRules, toolName);
        if (candidates.isEmpty()) return Optional.empty();

        List<String> subjects = new ArrayList<>();
        subject.ifPresent(command -> {
            subjects.add(command);
            if (RestrictedTools.BASH.equals(toolName)) {
                BashCommandParser.split(command).stream()
                        .map(BashCommandParser::normalize)
                        .filter(part -> !part.isEmpty())
                        .forEach(subjects::add);
            }
        });

        for (PermissionRule rule : candidates) {
            if (rule.matchesAnyInput()) return Optional.of(rule);
            for (String candidate : subjects) {
                if (CommandPatterns.matches(candidate, rule)) return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    private Optional<PermissionRule> findAllowRule(List<PermissionRule> rules, String toolName,
                                                   Optional<String> subject, Path cwd) {
        List<PermissionRule> candidates = forTool(rules, toolName);
        if (candidates.isEmpty()) return Optional.empty();

        for (PermissionRule rule : candidates) {
            if (rule.matchesAnyInput()) return Optional.of(rule);
        }
        if (subject.isEmpty()) return Optional.empty();
        String command = subject.get();

        for (PermissionRule rule : candidates) {
            if (rule.kind() == RuleKind.EXACT && CommandPatterns.matches(command, rule)) return Optional.of(rule);
        }
        if (!RestrictedTools.BASH.equals(toolName)) {
            return candidates.stream().filter(rule -> CommandPatterns.matches(command, rule)).findFirst();
        }
        // a glob never vouches for a substituted command, whatever text it expands to
        if (BashCommandParser.hasCommandSubstitution(command)) return Optional.empty();

        PermissionRule matched = null;
        CommandWalk walk = new CommandWalk(cwd);
        for (String part : BashCommandParser.split(command)) {
            String normalized = BashCommandParser.normalize(part);
            if (normalized.isEmpty()) return Optional.empty();
            if (walk.isSafe(normalized)) continue;

            Optional<PermissionRule> hit = candidates.stream()
                    .filter(rule -> CommandPatterns.matches(normalized, rule))
                    .findFirst();
            if (hit.isEmpty()) return Optional.empty();
            matched = hit.get();
        }
        return Optional.ofNullable(matched);
    }

    private static List<PermissionRule> forTool(List<PermissionRule> rules, String toolName) {
        return rules.stream().filter(r -> r.toolName().equals(toolName)).toList();
    }

    private CompletableFuture<PermissionDecision> consultCallback(String toolName, JsonNode toolInput) {
        CompletableFuture<PermissionDecision> pending;
        try {
            pending = callback.authorize(toolName, toolInput);
        } catch (RuntimeException e) {
            log.warn("Authorization callback threw for {}: {}", toolName, e.getMessage());
            return CompletableFuture.completedFuture(authorizationUnavailable(toolName));
        }
        if (pending == null) return CompletableFuture.completedFuture(null);

        return pending.handle((decision, error) -> {
            if (error != null) {
                log.warn("Authorization callback failed for {}: {}", toolName, error.getMessage());
                return authorizationUnavailable(toolName);
            }
            return decision;
        });
    }

    private static PermissionDecision authorizationUnavailable(String toolName) {
        return PermissionDecision.deny(String.format(
                "Authorization unavailable for tool '%s'; the request was denied.", toolName));
    }

    private void decideByMode(String toolName, JsonNode toolInput, Optional<String> subject,
                              PermissionMode modeOverride, Path cwd,
                              CompletableFuture<PermissionDecision> result) {
        PermissionMode mode = effectiveMode(modeOverride);
        if (mode == PermissionMode.BYPASS_PERMISSIONS) {
            log.debug("{} allowed by {}", toolName, mode.configValue());
            result.complete(PermissionDecision.allow());
            return;
        }
        if (mode == PermissionMode.ACCEPT_EDITS && RestrictedTools.isFileEditTool(toolName)
                && subject.map(path -> targetInsideSafeZone(cwd, path)).orElse(false)) {
            log.debug("{} {} allowed by {} inside the working directory", toolName, subject.get(), mode.configValue());
            result.complete(PermissionDecision.allow());
            return;
        }
        askHuman(toolName, toolInput, cwd, result);
    }

    private void askHuman(String toolName, JsonNode toolInput, Path cwd,
                          CompletableFuture<PermissionDecision> result) {
        List<PermissionRule> proposals = proposeRules(toolName, toolInput, cwd);
        ConfirmationRequestDto request = new ConfirmationRequestDto(
                UUID.randomUUID().toString(),
                toolName,
                toolInput,
                proposals.stream().map(PermissionRule::toRuleString).toList(),
                !proposals.isEmpty(),
                Instant.now());

        CompletableFuture<ConfirmationResponse> pending = confirmationQueue.enqueue(request);
        // a caller giving up withdraws the prompt
        result.whenComplete((decision, error) -> {
            if (result.isCancelled()) pending.cancel(false);
        });
        pending.whenComplete((response, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
                return;
            }
            try {
                result.complete(toDecision(toolName, response, proposals));
            } catch (RuntimeException e) {
                log.error("Applying the answer for {} failed", toolName, e);
                result.completeExceptionally(e);
            }
        });
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private PermissionDecision toDecision(String toolName, ConfirmationResponse response,
                                          List<PermissionRule> proposals) {
        return switch (response.choice()) {
            case ALLOW_ONCE -> PermissionDecision.allow();
            case ALLOW_ALWAYS -> {
                trust(proposals);
                yield PermissionDecision.allow();
            }
            case REDIRECT -> PermissionDecision.deny("The user doesn't want to proceed with this " + toolName
                    + " call and gave these instructions instead: " + response.message());
            case DENY -> {
                String reason = response.message();
                yield PermissionDecision.deny(reason == null || reason.isBlank()
                        ? "The user denied permission to use " + toolName + "."
                        : "The user denied permission to use " + toolName + ": " + reason);
            }
        };
    }

    private void trust(List<PermissionRule> proposals) {
        if (proposals.isEmpty()) {
            log.info("No reusable rule for this request; allowing once");
            return;
        }
        RuleScope scope = properties.permissions().persistScope();
        for (PermissionRule proposal : proposals) {
            PermissionRule rule = proposal.withScope(scope);
            addAllowRule(rule);
            try {
                resolver.persistRule(workdir, scope, rule);
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Could not persist rule {} to {} settings; it stays in effect for this process: {}",
                        rule.toRuleString(), scope, e.getMessage());
            }
        }
    }

    private synchronized void addAllowRule(PermissionRule rule) {
        if (allowRules.stream().anyMatch(rule::sameRuleAs)) return;
        List<PermissionRule> merged = new ArrayList<>(allowRules);
        merged.add(rule);
        allowRules = List.copyOf(merged);
    }

    private Path startDirectory(Path workingDirectory) {
        if (workingDirectory == null) return workdir;
        return workdir.resolve(workingDirectory).toAbsolutePath().normalize();
    }

    private boolean targetInsideSafeZone(Path base, String path) {
        try {
            return insideSafeZone(base.resolve(path));
        } catch (InvalidPathException e) {
            return false;
        }
    }

    private boolean insideSafeZone(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        if (normalized.startsWith(workdir)) return true;
        for (Path dir : additionalDirectories) {
            if (normalized.startsWith(dir)) return true;
        }
        return false;
    }

    /**
     * Follows {@code cd} through a compound command so that later {@code ls}/{@code cd}
     * arguments are resolved against the directory they would actually run in.
     */
    private final class CommandWalk {

        private Path cwd;

        CommandWalk(Path start) {
            this.cwd = start;
        }

        boolean isSafe(String simpleCommand) {
            List<String> tokens = BashCommandParser.tokenize(simpleCommand);
            if (tokens.isEmpty() || !SAFE_COMMANDS.contains(tokens.get(0))) return false;
            String exe = tokens.get(0);
            List<String> args = tokens.subList(1, tokens.size()).stream()
                    .filter(arg -> !arg.startsWith("-"))
                    .toList();

            if ("cd".equals(exe)) {
                if (args.size() != 1) return false;
                Optional<Path> target = resolve(args.get(0));
                if (target.isEmpty() || !insideSafeZone(target.get())) return false;
                cwd = target.get();
                return true;
            }
            if ("ls".equals(exe)) {
                return args.stream().map(this::resolve)
                        .allMatch(p -> p.isPresent() && insideSafeZone(p.get()));
            }
            return args.isEmpty();
        }

        private Optional<Path> resolve(String arg) {
            if (arg.isEmpty() || arg.contains("$") || arg.contains("*") || arg.contains("?")) {
                return Optional.empty();
            }
            try {
                if (arg.equals("~")) return Optional.of(properties.userHomePath());
                if (arg.startsWith("~/")) return Optional.of(properties.userHomePath().resolve(arg.substring(2)).normalize());
                return Optional.of(cwd.resolve(arg).toAbsolutePath().normalize());
            } catch (InvalidPathException e) {
                return Optional.empty();
            }
        }
    }
}
