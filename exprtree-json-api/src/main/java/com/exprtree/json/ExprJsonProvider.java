package com.exprtree.json;

import java.util.List;

/**
 * Converts expression trees to and from JSON. Implementations are registered in
 * {@code META-INF/services/com.exprtree.json.ExprJsonProvider} and found with
 * {@link java.util.ServiceLoader}.
 *
 * <p>When several implementations are on the classpath, {@link #getProvider()}
 * uses the one named by the {@value #PROVIDER_PROPERTY} system property and
 * refuses to guess otherwise.</p>
 *
 * <pre>{@code
 * ExprJsonProvider provider = ExprJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(node);
 * ExprNode copy = provider.getDeserializer().deserialize(json);
 * }</pre>
 */
public interface ExprJsonProvider {

    /**
     * System property holding the name of the provider to use, e.g. {@code -Dexprtree.json.provider=Jackson}.
     */
    String PROVIDER_PROPERTY = "exprtree.json.provider";

    ExprJsonSerializer getSerializer();

    ExprJsonDeserializer getDeserializer();

    /**
     * Name used to select this provider, e.g. "Jackson". Compared ignoring case.
     */
    String getName();

    /**
     * Returns the provider named by {@value #PROVIDER_PROPERTY}, or the only
     * registered provider when the property is not set.
     *
     * @throws IllegalStateException if no provider is registered, the named one is
     *                               missing, or several are registered and none is named
     */
    static ExprJsonProvider getProvider() {
        return ProviderLookup.select(ProviderLookup.load(), System.getProperty(PROVIDER_PROPERTY));
    }

    /**
     * Returns the registered provider with the given name.
     *
     * @throws IllegalStateException if no registered provider has that name
     */
    static ExprJsonProvider getProvider(String name) {
        return ProviderLookup.byName(ProviderLookup.load(), name);
    }

    /**
     * All registered providers, in classpath order.
     */
    static List<ExprJsonProvider> providers() {
        return ProviderLookup.load();
    }

    static boolean isProviderAvailable() {
        return !ProviderLookup.load().isEmpty();
    }
}
