package io.github.drompincen.clawgate.runtime.permission;

import io.github.drompincen.clawgate.protocol.api.PermissionRule;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CommandPatternsTest {

    @Test
    void smartPatternUsesKnownVerbs() {
        assertThat(CommandPatterns.smartPattern("npm install lodash")).contains("npm install *");
        assertThat(CommandPatterns.smartPattern("npm run build")).contains("npm run build *");
        assertThat(CommandPatterns.smartPattern("git commit -m 'fix'")).contains("git commit *");
        assertThat(CommandPatterns.smartPattern("mvn clean install")).contains("mvn clean *");
        assertThat(CommandPatterns.smartPattern("python -m pip install requests")).contains("python -m pip install *");
        assertThat(CommandPatterns.smartPattern("java -jar app.jar")).contains("java -jar *");
        assertThat(CommandPatterns.smartPattern("kubectl get pods")).contains("kubectl get *");
    }

    @Test
    void smartPatternIgnoresEnvAndRedirections() {
        assertThat(CommandPatterns.smartPattern("NODE_ENV=test npm test > out.log")).contains("npm test *");
    }

    @Test
    void smartPatternRefusesDangerousCommands() {
        assertThat(CommandPatterns.smartPattern("rm -rf ./tmp")).isEmpty();
        assertThat(CommandPatterns.smartPattern("/bin/rm -rf ./tmp")).isEmpty();
        assertThat(CommandPatterns.smartPattern("sudo npm install -g x")).isEmpty();
        assertThat(CommandPatterns.smartPattern("chmod -R 777 .")).isEmpty();
    }

    @Test
    void smartPatternIsEmptyForUnknownOrCompoundCommands() {
        assertThat(CommandPatterns.smartPattern("./deploy.sh prod")).isEmpty();
        assertThat(CommandPatterns.smartPattern("git frobnicate")).isEmpty();
        assertThat(CommandPatterns.smartPattern("npm test && npm run lint")).isEmpty();
        assertThat(CommandPatterns.smartPattern("mvn -q")).isEmpty();
    }

    @Test
    void globIsAnchoredAndTrailingWildcardIsOptional() {
        PermissionRule rule = PermissionRule.glob("Bash", "npm install *");

        assertThat(CommandPatterns.matches("npm install express", rule)).isTrue();
        assertThat(CommandPatterns.matches("npm install", rule)).isTrue();
        assertThat(CommandPatterns.matches("npm installer", rule)).isFalse();
        assertThat(CommandPatterns.matches("npm test", rule)).isFalse();
        assertThat(CommandPatterns.matches("sudo npm install x", rule)).isFalse();
    }

    @Test
    void wildcardMayAppearAnywhere() {
        assertThat(CommandPatterns.matches("node --version", PermissionRule.glob("Bash", "* --version"))).isTrue();
        assertThat(CommandPatterns.matches("node --version --verbose", PermissionRule.glob("Bash", "* --version"))).isFalse();
        assertThat(CommandPatterns.matches("git push origin main", PermissionRule.glob("Bash", "git * main"))).isTrue();
        assertThat(CommandPatterns.matches("git push origin dev", PermissionRule.glob("Bash", "git * main"))).isFalse();
    }

    @Test
    void regexCharactersInPatternsAreLiteral() {
        PermissionRule rule = PermissionRule.glob("Bash", "grep -E (a|b) *");

        assertThat(CommandPatterns.matches("grep -E (a|b) file.txt", rule)).isTrue();
        assertThat(CommandPatterns.matches("grep -E a file.txt", rule)).isFalse();
    }

    @Test
    void exactRuleRequiresIdenticalString() {
        PermissionRule rule = PermissionRule.exact("Bash", "rm -rf ./tmp");

        assertThat(CommandPatterns.matches("rm -rf ./tmp", rule)).isTrue();
        assertThat(CommandPatterns.matches("rm -rf ./tmp2", rule)).isFalse();
        assertThat(CommandPatterns.matches(null, rule)).isFalse();
    }

    @Test
    void dangerousBaseLooksAtTheExecutable() {
        assertThat(CommandPatterns.isDangerousBase("rm -rf build")).isTrue();
        assertThat(CommandPatterns.isDangerousBase("/usr/bin/sudo ls")).isTrue();
        assertThat(CommandPatterns.isDangerousBase("FOO=1 dd if=/dev/zero of=x")).isTrue();
        assertThat(CommandPatterns.isDangerousBase("git rm file")).isFalse();
        assertThat(CommandPatterns.containsDangerousCommand("npm test && rm -rf dist")).isTrue();
        assertThat(CommandPatterns.containsDangerousCommand("npm test && git status")).isFalse();
    }

    @Test
    void executableIsTheBaseName() {
        assertThat(CommandPatterns.executableOf("/usr/bin/git status")).contains("git");
        assertThat(CommandPatterns.executableOf("")).isEmpty();
    }
}
