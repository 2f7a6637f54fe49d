package com.saika.json;

import java.util.ServiceLoader;

/**
 * A JSON binding for the syntax tree, located at runtime through {@link ServiceLoader}.
 *
 * <p>Putting {@code saika-jackson} on the classpath registers the Jackson binding:</p>
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(program);
 * Program copy = provider.getDeserializer().deserializeProgram(json);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    DialectJsonReader getDialectReader();

    /** Short name used to select a provider, such as "Jackson". */
    String getName();

    /**
     * The first provider registered on the classpath.
     *
     * @throws IllegalStateException if none is registered
     */
    static AstJsonProvider getProvider() {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            return provider;
        }
        throw new IllegalStateException(
            "No AstJsonProvider registered; add saika-jackson (or another binding) to the classpath");
    }

    /**
     * The registered provider whose {@link #getName()} matches, ignoring case.
     *
     * @throws IllegalStateException if no provider has that name
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No AstJsonProvider named '" + name + "' is registered");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).iterator().hasNext();
    }
}
