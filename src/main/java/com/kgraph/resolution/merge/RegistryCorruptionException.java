package com.kgraph.resolution.merge;

/**
 * The registry's parent index is inconsistent (a cycle or a parent pointing at no entity).
 * Fatal: ingestion must stop.
 */
public class RegistryCorruptionException extends RuntimeException {

    public RegistryCorruptionException(String message) {
        super(message);
    }
}
