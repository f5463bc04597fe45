package dev.personalagent.services.registry;

import java.io.IOException;
import java.io.InputStream;

/**
 * Where a registry reads its JSON catalogue from.
 */
@FunctionalInterface
public interface CatalogSource {

    InputStream open() throws IOException;

    static CatalogSource classpath(String resource) {
        return () -> {
            InputStream in = CatalogSource.class.getClassLoader().getResourceAsStream(resource);
            if (in == null) {
                throw new IOException("Catalogue not found on classpath: " + resource);
            }
            return in;
        };
    }
}
