package com.raidxp.infra.metrics.internal;

import com.raidxp.infra.metrics.MetricsRegistry;
import com.raidxp.infra.metrics.api.MetricsRegistryProvider;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Resolves the process-wide registry once, on first access.
 *
 * <p>Internal; use {@link MetricsRegistry#getInstance()}.
 */
public final class MetricsRegistryHolder {
    private static final Logger logger = Logger.getLogger(MetricsRegistryHolder.class.getName());

    static final String SELECTOR = "RAIDXP_METRICS";
    static final String NONE = "none";

    public static final MetricsRegistry INSTANCE = resolve();

    private MetricsRegistryHolder() {
    }

    private static MetricsRegistry resolve() {
        List<MetricsRegistryProvider> providers = StreamSupport
                .stream(ServiceLoader.load(MetricsRegistryProvider.class).spliterator(), false)
                .collect(Collectors.toList());
        String requested = System.getenv(SELECTOR);
        if (requested == null || requested.isBlank()) {
            requested = System.getProperty(SELECTOR);
        }
        Optional<MetricsRegistryProvider> provider = select(providers, requested);
        if (provider.isEmpty()) {
            logger.info("Metrics disabled (providers: " + ids(providers) + ", requested: " + requested + ")");
            return NoOpMetricsRegistry.INSTANCE;
        }
        logger.info("Metrics provider: " + provider.get().id());
        return provider.get().create();
    }

    /**
     * Picks the provider named by {@code requested}, or the highest-priority one
     * when nothing is requested. {@code none} or an unknown id disables metrics.
     */
    static Optional<MetricsRegistryProvider> select(List<MetricsRegistryProvider> providers, String requested) {
        if (requested == null || requested.isBlank()) {
            return providers.stream().max(Comparator.comparingInt(MetricsRegistryProvider::priority));
        }
        String id = requested.trim();
        if (id.equalsIgnoreCase(NONE)) {
            return Optional.empty();
        }
        Optional<MetricsRegistryProvider> match = providers.stream()
                .filter(p -> p.id().equalsIgnoreCase(id))
                .findFirst();
        if (match.isEmpty()) {
            logger.warning("Unknown metrics provider '" + id + "', available: " + ids(providers));
        }
        return match;
    }

    private static String ids(List<MetricsRegistryProvider> providers) {
        return providers.stream().map(MetricsRegistryProvider::id).collect(Collectors.joining(", ", "[", "]"));
    }
}
