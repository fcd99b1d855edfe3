package com.stg2va.core.generator;

import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Lookup of the {@link ModelGenerator}s registered through {@link ServiceLoader}.
 */
public final class ModelGenerators {

    private ModelGenerators() {
        // Utility class
    }

    /**
     * Returns every registered generator.
     *
     * @return generators in registration order
     */
    public static List<ModelGenerator> all() {
        return ServiceLoader.load(ModelGenerator.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();
    }

    /**
     * Finds a generator by id.
     *
     * @param id generator id
     * @return generator, or empty if none is registered under that id
     */
    public static Optional<ModelGenerator> byId(String id) {
        return all().stream()
            .filter(generator -> generator.getId().equals(id))
            .findFirst();
    }
}
