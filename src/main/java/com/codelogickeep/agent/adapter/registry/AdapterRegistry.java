package com.codelogickeep.agent.adapter.registry;

import com.codelogickeep.agent.adapter.config.AdapterConfig;
import com.codelogickeep.agent.adapter.exception.AdapterException;
import com.codelogickeep.agent.adapter.exception.AdapterException.ErrorCode;
import com.codelogickeep.agent.adapter.framework.AdapterContext;
import com.codelogickeep.agent.adapter.framework.TestFrameworkAdapter;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ClasspathHelper;
import org.reflections.util.ConfigurationBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Adapters by name. Not a singleton: build one per application, either by hand with
 * {@link #register} or by classpath scanning with {@link #discover}.
 */
public class AdapterRegistry {
    private static final Logger log = LoggerFactory.getLogger(AdapterRegistry.class);
    static final String ADAPTER_PACKAGE = "com.codelogickeep.agent.adapter.framework";

    private final Map<String, TestFrameworkAdapter> adapters = new LinkedHashMap<>();

    /**
     * Registers every concrete {@link TestFrameworkAdapter} under the adapter package, sorted
     * by name. When {@code config.adapters} is set, only those names are kept.
     */
    public static AdapterRegistry discover(AdapterConfig config) {
        return discover(AdapterContext.from(config));
    }

    public static AdapterRegistry discover(AdapterContext context) {
        Reflections reflections = new Reflections(new ConfigurationBuilder()
                .setUrls(ClasspathHelper.forPackage(ADAPTER_PACKAGE))
                .setScanners(Scanners.SubTypes));
        Set<Class<? extends TestFrameworkAdapter>> adapterClasses = reflections.getSubTypesOf(TestFrameworkAdapter.class);

        List<String> enabled = context.config().getAdapters();
        List<TestFrameworkAdapter> found = new ArrayList<>();
        for (Class<? extends TestFrameworkAdapter> clazz : adapterClasses) {
            if (clazz.isInterface() || Modifier.isAbstract(clazz.getModifiers())
                    || !Modifier.isPublic(clazz.getModifiers()) || !clazz.getName().startsWith(ADAPTER_PACKAGE)) {
                continue;
            }
            instantiate(clazz, context).ifPresent(adapter -> {
                if (enabled == null || enabled.contains(adapter.name())) {
                    found.add(adapter);
                } else {
                    log.debug("Adapter {} disabled by configuration", adapter.name());
                }
            });
        }

        AdapterRegistry registry = new AdapterRegistry();
        found.stream().sorted(Comparator.comparing(TestFrameworkAdapter::name)).forEach(registry::register);
        log.info("Discovered {} test framework adapter(s): {}", registry.adapters.size(), registry.names());
        return registry;
    }

    private static Optional<TestFrameworkAdapter> instantiate(Class<? extends TestFrameworkAdapter> clazz,
                                                              AdapterContext context) {
        try {
            try {
                Constructor<? extends TestFrameworkAdapter> withContext = clazz.getConstructor(AdapterContext.class);
                return Optional.of(withContext.newInstance(context));
            } catch (NoSuchMethodException e) {
                return Optional.of(clazz.getDeclaredConstructor().newInstance());
            }
        } catch (ReflectiveOperationException | RuntimeException e) {
            log.warn("Failed to instantiate adapter {}: {}", clazz.getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Adds an adapter, replacing any previous one with the same name.
     */
    public AdapterRegistry register(TestFrameworkAdapter adapter) {
        TestFrameworkAdapter previous = adapters.put(adapter.name(), adapter);
        if (previous != null) {
            log.warn("Adapter {} replaced {} with {}", adapter.name(), previous, adapter);
        }
        return this;
    }

    public Optional<TestFrameworkAdapter> get(String name) {
        return Optional.ofNullable(adapters.get(name));
    }

    public TestFrameworkAdapter require(String name) {
        return get(name).orElseThrow(() -> new AdapterException(ErrorCode.ADAPTER_NOT_FOUND,
                "No adapter registered under '" + name + "'", "available: " + String.join(", ", names())));
    }

    public List<String> names() {
        return List.copyOf(adapters.keySet());
    }

    public List<TestFrameworkAdapter> all() {
        return List.copyOf(adapters.values());
    }

    /**
     * Adapters whose {@code detect} accepts the project, in registration order.
     */
    public List<TestFrameworkAdapter> detectAll(Path projectRoot) {
        List<TestFrameworkAdapter> detected = new ArrayList<>();
        for (TestFrameworkAdapter adapter : adapters.values()) {
            try {
                if (adapter.detect(projectRoot)) {
                    detected.add(adapter);
                }
            } catch (RuntimeException e) {
                log.warn("Detection by {} failed: {}", adapter.name(), e.getMessage());
            }
        }
        return detected;
    }
}
