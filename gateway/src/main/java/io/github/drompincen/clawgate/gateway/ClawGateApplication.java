package io.github.drompincen.clawgate.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Arrays;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.clawgate")
public class ClawGateApplication {

    static final String SKIP_PERMISSIONS_FLAG = "--dangerously-skip-permissions";
    static final String SKIP_PERMISSIONS_PROPERTY = "--clawgate.permissions.dangerously-skip-permissions=true";

    public static void main(String[] args) {
        SpringApplication.run(ClawGateApplication.class, translateArgs(args));
    }

    /** Maps the CLI flag onto its property; every other argument passes through. */
    static String[] translateArgs(String[] args) {
        return Arrays.stream(args)
                .map(arg -> SKIP_PERMISSIONS_FLAG.equals(arg) ? SKIP_PERMISSIONS_PROPERTY : arg)
                .toArray(String[]::new);
    }
}
