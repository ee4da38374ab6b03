package com.astrepr.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Provider interface for repr tree JSON support.
 * Implementations are discovered via Java's ServiceLoader mechanism.
 *
 * <p>Adding an implementation JAR (e.g., astrepr-jackson) to the classpath is enough
 * for the provider to be found.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ReprJsonProvider provider = ReprJsonProvider.getProvider();
 * String json = provider.getSerializer().serializePretty(ReprParser.parse(text));
 * }</pre>
 */
public interface ReprJsonProvider {

    ReprJsonSerializer getSerializer();

    /**
     * Returns the name of this provider (e.g., "Jackson").
     */
    String getName();

    /**
     * Gets the first available provider via ServiceLoader.
     *
     * @throws IllegalStateException if no provider is found on the classpath
     */
    static ReprJsonProvider getProvider() {
        ServiceLoader<ReprJsonProvider> loader = ServiceLoader.load(ReprJsonProvider.class);
        Iterator<ReprJsonProvider> iterator = loader.iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        throw new IllegalStateException(
            "No ReprJsonProvider found on the classpath. " +
            "Add astrepr-jackson (or another provider) to your dependencies."
        );
    }
}
