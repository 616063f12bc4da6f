package com.staticpress.core.renderer;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Looks up {@link OutputRenderer}s registered through {@link ServiceLoader}.
 */
public final class OutputRenderers {

    public static final String FILESYSTEM = "filesystem";
    public static final String CONSOLE = "console";

    private OutputRenderers() {
        // Utility class
    }

    /**
     * Returns all registered renderers.
     *
     * @return renderers in registration order
     */
    public static List<OutputRenderer> all() {
        List<OutputRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(OutputRenderer.class).forEach(renderers::add);
        return renderers;
    }

    /**
     * Returns the renderer with the given id.
     *
     * @param id renderer identifier
     * @return renderer
     * @throws IllegalArgumentException if no renderer has that id
     */
    public static OutputRenderer byId(String id) {
        return all().stream()
            .filter(renderer -> renderer.getId().equals(id))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No output renderer with id: " + id));
    }
}
