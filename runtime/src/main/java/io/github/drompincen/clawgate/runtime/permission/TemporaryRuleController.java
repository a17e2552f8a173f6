package io.github.drompincen.clawgate.runtime.permission;

import io.github.drompincen.clawgate.protocol.api.PermissionRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.function.Supplier;

/**
 * Scopes pre-authorized rules to one top-level response cycle. Only depth 0 grants and
 * revokes; nested steps inherit the grant untouched.
 */
@Component
public class TemporaryRuleController {

    private static final Logger log = LoggerFactory.getLogger(TemporaryRuleController.class);

    private final PermissionManager permissionManager;

    public TemporaryRuleController(PermissionManager permissionManager) {
        this.permissionManager = permissionManager;
    }

    public <T> T withTemporaryRules(int recursionDepth, Collection<PermissionRule> rules, Supplier<T> cycle) {
        if (recursionDepth < 0) {
            throw new IllegalArgumentException("recursionDepth must be >= 0: " + recursionDepth);
        }
        if (recursionDepth > 0) {
            return cycle.get();
        }

        if (rules != null && !rules.isEmpty()) {
            permissionManager.addTemporaryRules(rules);
            log.debug("Granted {} temporary rule(s) for this cycle", rules.size());
        }
        try {
            return cycle.get();
        } finally {
            permissionManager.clearTemporaryRules();
        }
    }

    public void runWithTemporaryRules(int recursionDepth, Collection<PermissionRule> rules, Runnable cycle) {
        withTemporaryRules(recursionDepth, rules, () -> {
            cycle.run();
            return null;
        });
    }
}
