package com.staticpress.core.generator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Discovers {@link SiteGenerator}s registered through {@link ServiceLoader}.
 */
public final class SiteGenerators {

    private SiteGenerators() {
        // Utility class
    }

    /**
     * Returns every registered generator.
     *
     * @return generators sorted by {@link SiteGenerator#order()}, then id
     */
    public static List<SiteGenerator> discover() {
        List<SiteGenerator> generators = new ArrayList<>();
        ServiceLoader.load(SiteGenerator.class).forEach(generators::add);
        generators.sort(Comparator.comparingInt(SiteGenerator::order).thenComparing(SiteGenerator::getId));
        return generators;
    }
}
