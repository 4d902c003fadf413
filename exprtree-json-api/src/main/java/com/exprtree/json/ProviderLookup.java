package com.exprtree.json;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Selection rules behind the static lookups of {@link ExprJsonProvider}.
 */
final class ProviderLookup {

    private static final Logger logger = LoggerFactory.getLogger(ExprJsonProvider.class);

    private ProviderLookup() {
    }

    static List<ExprJsonProvider> load() {
        List<ExprJsonProvider> providers = new ArrayList<>();
        for (ExprJsonProvider provider : ServiceLoader.load(ExprJsonProvider.class)) {
            providers.add(provider);
        }
        return List.copyOf(providers);
    }

    static ExprJsonProvider select(List<ExprJsonProvider> providers, String preferred) {
        if (preferred != null && !preferred.isBlank()) {
            return byName(providers, preferred.trim());
        }
        if (providers.isEmpty()) {
            throw new IllegalStateException(
                "No ExprJsonProvider found on the classpath. " +
                "Add exprtree-jackson (or another provider) to your dependencies.");
        }
        if (providers.size() > 1) {
            throw new IllegalStateException(
                "Several ExprJsonProviders found on the classpath: " + names(providers) + ". " +
                "Set -D" + ExprJsonProvider.PROVIDER_PROPERTY + "=<name> or call getProvider(name).");
        }
        ExprJsonProvider provider = providers.get(0);
        logger.debug("Using ExprJsonProvider {} ({})", provider.getName(), provider.getClass().getName());
        return provider;
    }

    static ExprJsonProvider byName(List<ExprJsonProvider> providers, String name) {
        List<ExprJsonProvider> matching = providers.stream()
            .filter(p -> p.getName().equalsIgnoreCase(name))
            .collect(Collectors.toList());
        if (matching.isEmpty()) {
            throw new IllegalStateException(
                "No ExprJsonProvider found with name '" + name + "'; registered: " + names(providers));
        }
        ExprJsonProvider provider = matching.get(0);
        if (matching.size() > 1) {
            logger.warn("{} ExprJsonProviders are named '{}', using {}",
                matching.size(), name, provider.getClass().getName());
        } else {
            logger.debug("Using ExprJsonProvider {} ({})", provider.getName(), provider.getClass().getName());
        }
        return provider;
    }

    private static String names(List<ExprJsonProvider> providers) {
        return providers.stream().map(ExprJsonProvider::getName).collect(Collectors.joining(", ", "[", "]"));
    }
}
