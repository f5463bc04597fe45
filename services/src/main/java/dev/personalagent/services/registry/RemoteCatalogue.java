package dev.personalagent.services.registry;

import java.io.IOException;

/**
 * A catalogue downloaded from a registry on the network.
 */
@FunctionalInterface
public interface RemoteCatalogue<T> {

    T fetch() throws IOException;
}
