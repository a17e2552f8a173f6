package io.github.drompincen.clawgate.gateway.config;

import io.github.drompincen.clawgate.runtime.config.ClawGateProperties;
import io.github.drompincen.clawgate.runtime.permission.PermissionCallback;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ClawGateProperties.class)
public class PermissionEngineConfig {

    /** Embedding applications replace this with their own authorization hook. */
    @Bean
    @ConditionalOnMissingBean
    PermissionCallback permissionCallback() {
        return PermissionCallback.NONE;
    }
}
