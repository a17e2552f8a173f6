package io.github.drompincen.clawgate.runtime.permission;

public class RuleSyntaxException extends RuntimeException {

    private final String ruleText;

    public RuleSyntaxException(String ruleText, String reason) {
        super("Invalid permission rule '" + ruleText + "': " + reason);
        this.ruleText = ruleText;
    }

    public String getRuleText() {
        return ruleText;
    }
}
