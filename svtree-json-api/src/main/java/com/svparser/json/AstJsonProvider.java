package com.svparser.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Entry point to a JSON binding for the syntax tree. The parser core has no JSON dependency;
 * a binding module such as {@code svtree-jackson} registers itself under
 * {@code META-INF/services} and is picked up at runtime.
 *
 * <pre>{@code
 * Source tree = Parser.parse(Files.readString(path));
 * String json = AstJsonProvider.getProvider().getSerializer().serializePretty(tree);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /** Short binding name, matched case-insensitively by {@link #getProvider(String)}. */
    String getName();

    /**
     * @throws IllegalStateException when no binding is registered
     */
    static AstJsonProvider getProvider() {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        Iterator<AstJsonProvider> iterator = loader.iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        throw new IllegalStateException(
            "No JSON binding registered for the syntax tree; add svtree-jackson to the classpath"
        );
    }

    /**
     * @throws IllegalStateException when no registered binding has this name
     */
    static AstJsonProvider getProvider(String name) {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        for (AstJsonProvider provider : loader) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException(
            "No JSON binding named '" + name + "' is registered"
        );
    }

    static boolean isProviderAvailable() {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        return loader.iterator().hasNext();
    }
}
