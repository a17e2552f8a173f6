package io.github.drompincen.clawgate.runtime.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.clawgate.protocol.api.PermissionMode;
import io.github.drompincen.clawgate.protocol.api.PermissionRule;
import io.github.drompincen.clawgate.protocol.api.RestrictedTools;
import io.github.drompincen.clawgate.protocol.api.RuleKind;
import io.github.drompincen.clawgate.protocol.api.RuleScope;
import io.github.drompincen.clawgate.runtime.permission.CommandPatterns;
import io.github.drompincen.clawgate.runtime.permission.RuleParser;
import io.github.drompincen.clawgate.runtime.permission.RuleSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reads and writes the permission section of the user, project and local settings files.
 *
 * <p>Scalar settings (the default mode) come from the most specific scope that sets a valid
 * value. Rule lists are unioned across scopes. Configuration problems are logged and skipped,
 * never thrown, so one bad file cannot disable the others.
 */
@Component
public class PermissionConfigurationResolver {

    private static final Logger log = LoggerFactory.getLogger(PermissionConfigurationResolver.class);

    private static final RuleScope[] MOST_SPECIFIC_FIRST = {RuleScope.LOCAL, RuleScope.PROJECT, RuleScope.USER};
    private static final RuleScope[] LEAST_SPECIFIC_FIRST = {RuleScope.USER, RuleScope.PROJECT, RuleScope.LOCAL};

    // shared by every resolver in the process: two instances must not interleave writes to one file
    private static final Map<Path, ReentrantLock> FILE_LOCKS = new ConcurrentHashMap<>();

    private final ClawGateProperties properties;
    private final ObjectMapper objectMapper;

    public PermissionConfigurationResolver(ClawGateProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public ConfigurationPaths configurationPaths(Path workdir) {
        return new ConfigurationPaths(properties.userHomePath(), workdir.toAbsolutePath().normalize());
    }

    public PermissionMode resolveDefaultMode() {
        PermissionMode explicit = properties.permissions().dangerouslySkipPermissions()
                ? PermissionMode.BYPASS_PERMISSIONS : null;
        return resolveDefaultMode(properties.workdirPath(), explicit);
    }

    /** {@code explicit} (the CLI or API argument) wins over every settings file. */
    public PermissionMode resolveDefaultMode(Path workdir, PermissionMode explicit) {
        if (explicit != null) return explicit;
        return resolveConfiguredMode(workdir).orElse(PermissionMode.DEFAULT);
    }

    /** The first valid {@code defaultMode} found from local to user scope. */
    public Optional<PermissionMode> resolveConfiguredMode(Path workdir) {
        ConfigurationPaths paths = configurationPaths(workdir);
        for (RuleScope scope : MOST_SPECIFIC_FIRST) {
            Path file = paths.forScope(scope);
            Optional<JsonNode> settings = readSettings(file);
            if (settings.isEmpty()) continue;

            JsonNode value = settings.get().path("permissions").path("defaultMode");
            if (value.isMissingNode() || value.isNull()) {
                value = settings.get().path("defaultMode");
            }
            if (value.isMissingNode() || value.isNull()) continue;

            Optional<PermissionMode> mode = value.isTextual()
                    ? PermissionMode.fromConfigValue(value.asText())
                    : Optional.empty();
            if (mode.isPresent()) {
                log.debug("Default mode {} from {} settings {}", mode.get().configValue(), scope, file);
                return mode;
            }
            log.warn("Ignoring invalid defaultMode {} in {}; falling back to a less specific scope", value, file);
        }
        return Optional.empty();
    }

    public RuleSet resolveRuleSets() {
        return resolveRuleSets(properties.workdirPath());
    }

    public RuleSet resolveRuleSets(Path workdir) {
        ConfigurationPaths paths = configurationPaths(workdir);
        List<PermissionRule> allow = new ArrayList<>();
        List<PermissionRule> deny = new ArrayList<>();
        List<Path> directories = new ArrayList<>();

        for (RuleScope scope : LEAST_SPECIFIC_FIRST) {
            Path file = paths.forScope(scope);
            readSettings(file).ifPresent(settings -> {
                JsonNode permissions = settings.path("permissions");
                collectRules(permissions.path("allow"), scope, file, allow);
                collectRules(permissions.path("deny"), scope, file, deny);
                collectDirectories(permissions.path("additionalDirectories"), paths.workdir(), file, directories);
            });
        }
        log.debug("Resolved {} allow and {} deny rule(s) for {}", allow.size(), deny.size(), paths.workdir());
        return new RuleSet(allow, deny, directories);
    }

    public boolean persistRule(RuleScope scope, PermissionRule rule) throws IOException {
        return persistRule(properties.workdirPath(), scope, rule);
    }

    /**
     * Adds {@code rule} to the allow list of {@code scope}'s settings file, creating the file if
     * needed. The file is re-read under a per-file lock right before writing, so concurrent
     * persists never drop each other's rules, and keys other than the allow list are preserved.
     *
     * @return false if an equivalent rule was already present
     * @throws IllegalArgumentException for a wildcard rule over a dangerous command
     * @throws IOException if the file is malformed or cannot be written
     */
    public boolean persistRule(Path workdir, RuleScope scope, PermissionRule rule) throws IOException {
        if (rule.kind() == RuleKind.GLOB && RestrictedTools.BASH.equals(rule.toolName())
                && CommandPatterns.containsDangerousCommand(rule.pattern())) {
            throw new IllegalArgumentException("Refusing to persist wildcard rule for a dangerous command: "
                    + rule.toRuleString());
        }

        Path file = configurationPaths(workdir).forScope(scope);
        ReentrantLock lock = FILE_LOCKS.computeIfAbsent(file, f -> new ReentrantLock());
        lock.lock();
        try {
            ObjectNode root = readForUpdate(file);
            ArrayNode allow = allowList(root, file);
            for (JsonNode existing : allow) {
                if (existing.isTextual() && sameRule(existing.asText(), rule)) {
                    log.debug("Rule {} already present in {}", rule.toRuleString(), file);
                    return false;
                }
            }
            allow.add(rule.toRuleString());
            write(file, root);
            log.info("Persisted rule {} to {} settings {}", rule.toRuleString(), scope, file);
            return true;
        } finally {
            lock.unlock();
        }
    }

    Optional<JsonNode> readSettings(Path file) {
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            if (root == null || !root.isObject()) {
                log.warn("Ignoring settings file {}: top level is not a JSON object", file);
                return Optional.empty();
            }
            return Optional.of(root);
        } catch (IOException e) {
            log.warn("Ignoring malformed settings file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private void collectRules(JsonNode list, RuleScope scope, Path file, List<PermissionRule> into) {
        if (list.isMissingNode() || list.isNull()) return;
        if (!list.isArray()) {
            log.warn("Ignoring non-array rule list in {}", file);
            return;
        }
        for (JsonNode entry : list) {
            if (!entry.isTextual()) {
                log.warn("Skipping non-string rule {} in {}", entry, file);
                continue;
            }
            try {
                PermissionRule rule = RuleParser.parse(entry.asText(), scope);
                if (into.stream().noneMatch(rule::sameRuleAs)) {
                    into.add(rule);
                }
            } catch (RuleSyntaxException | IllegalArgumentException e) {
                log.warn("Skipping rule in {}: {}", file, e.getMessage());
            }
        }
    }

    private void collectDirectories(JsonNode list, Path workdir, Path file, List<Path> into) {
        if (list.isMissingNode() || list.isNull()) return;
        if (!list.isArray()) {
            log.warn("Ignoring non-array additionalDirectories in {}", file);
            return;
        }
        for (JsonNode entry : list) {
            if (!entry.isTextual() || entry.asText().isBlank()) {
                log.warn("Skipping additional directory {} in {}", entry, file);
                continue;
            }
            try {
                Path dir = expand(entry.asText(), workdir);
                if (!into.contains(dir)) into.add(dir);
            } catch (InvalidPathException e) {
                log.warn("Skipping additional directory {} in {}: {}", entry.asText(), file, e.getMessage());
            }
        }
    }

    private Path expand(String raw, Path workdir) {
        if (raw.equals("~")) return properties.userHomePath();
        if (raw.startsWith("~/")) return properties.userHomePath().resolve(raw.substring(2)).normalize();
        return workdir.resolve(raw).toAbsolutePath().normalize();
    }

    private ObjectNode readForUpdate(Path file) throws IOException {
        if (!Files.exists(file)) return objectMapper.createObjectNode();
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new IOException("Refusing to overwrite malformed settings file " + file, e);
        }
        if (root == null || root.isMissingNode()) return objectMapper.createObjectNode();
        if (!(root instanceof ObjectNode object)) {
            throw new IOException("Refusing to overwrite settings file " + file + ": top level is not a JSON object");
        }
        return object;
    }

    private ArrayNode allowList(ObjectNode root, Path file) throws IOException {
        JsonNode permissions = root.get("permissions");
        ObjectNode section;
        if (permissions == null || permissions.isNull()) {
            section = root.putObject("permissions");
        } else if (permissions instanceof ObjectNode object) {
            section = object;
        } else {
            throw new IOException("Refusing to overwrite settings file " + file + ": permissions is not an object");
        }

        JsonNode allow = section.get("allow");
        if (allow == null || allow.isNull()) return section.putArray("allow");
        if (allow instanceof ArrayNode array) return array;
        throw new IOException("Refusing to overwrite settings file " + file + ": permissions.allow is not an array");
    }

    private boolean sameRule(String text, PermissionRule rule) {
        try {
            return RuleParser.parse(text).sameRuleAs(rule);
        } catch (RuleSyntaxException | IllegalArgumentException e) {
            return false;
        }
    }

    private void write(Path file, ObjectNode root) throws IOException {
        Path dir = file.getParent();
        Files.createDirectories(dir);
        Path temp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), root);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
