package io.github.drompincen.clawgate.runtime.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.lang.reflect.Method;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tools are discovered with {@link ServiceLoader}; each single-argument {@code set*} method is
 * satisfied from the application context when a bean of that type exists. That is how gated
 * tools receive their {@link ToolExecutionGateway}.
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);
    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final ApplicationContext applicationContext;

    public ToolRegistry(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @PostConstruct
    public void loadTools() {
        ServiceLoader<Tool> loader = ServiceLoader.load(Tool.class);
        for (Tool tool : loader) {
            injectDependencies(tool);
            register(tool);
        }
        log.info("Loaded {} tools via SPI: {}", tools.size(), new TreeSet<>(tools.keySet()));
    }

    public void register(Tool tool) {
        Tool previous = tools.put(tool.name(), tool);
        if (previous != null && previous != tool) {
            log.warn("Tool {} registered twice; {} replaces {}", tool.name(),
                    tool.getClass().getSimpleName(), previous.getClass().getSimpleName());
        }
        log.debug("Registered tool: {}", tool.name());
    }

    public Optional<Tool> get(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Collection<Tool> all() {
        return Collections.unmodifiableCollection(tools.values());
    }

    void injectDependencies(Tool tool) {
        for (Method method : tool.getClass().getMethods()) {
            if (method.getName().startsWith("set") && method.getParameterCount() == 1) {
                Class<?> paramType = method.getParameterTypes()[0];
                try {
                    Object bean = applicationContext.getBean(paramType);
                    method.invoke(tool, bean);
                    log.debug("Injected {} into {}.{}", paramType.getSimpleName(),
                            tool.getClass().getSimpleName(), method.getName());
                } catch (NoSuchBeanDefinitionException e) {
                    log.warn("No bean of type {} for {}.{}", paramType.getSimpleName(),
                            tool.getClass().getSimpleName(), method.getName());
                } catch (Exception e) {
                    log.warn("Failed to inject {} into {}.{}: {}", paramType.getSimpleName(),
                            tool.getClass().getSimpleName(), method.getName(), e.getMessage());
                }
            }
        }
    }
}
