package com.treewalk.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * JSON back end for node trees, discovered through {@link ServiceLoader}.
 *
 * <p>Putting an implementation jar such as {@code treewalk-jackson} on the classpath is enough:</p>
 * <pre>{@code
 * String json = AstJsonProvider.getProvider().getSerializer().serialize(result.program());
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    /**
     * Short provider name, e.g. {@code "Jackson"}.
     */
    String getName();

    /**
     * The first provider found on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        Iterator<AstJsonProvider> iterator = ServiceLoader.load(AstJsonProvider.class).iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. Add treewalk-jackson (or another provider) to your dependencies.");
    }

    /**
     * The provider whose {@link #getName()} matches {@code name}, ignoring case.
     *
     * @throws IllegalStateException if no provider has that name
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No AstJsonProvider named '" + name + "' on the classpath");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).iterator().hasNext();
    }
}
