package com.staticpress.cli;

import com.staticpress.core.SiteBuildException;
import com.staticpress.core.config.SiteConfig;
import com.staticpress.core.content.ContentKind;
import com.staticpress.core.content.FileSystemContentStore;
import com.staticpress.core.generator.SiteGenerator;
import com.staticpress.core.generator.SiteGenerators;
import com.staticpress.core.renderer.OutputRenderer;
import com.staticpress.core.renderer.OutputRenderers;
import com.staticpress.core.url.UrlResolver;
import com.staticpress.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list posts, pages, generators, or renderers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List posts with the URL each will be published at
 * staticpress list posts
 *
 * # List pages of another project
 * staticpress list pages ~/blog
 *
 * # List site generators
 * staticpress list generators
 * }</pre>
 */
@Command(
    name = "list",
    description = "List posts, pages, generators, or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: posts, pages, generators, or renderers"
    )
    private String type;

    @Parameters(
        index = "1",
        arity = "0..1",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Mixin
    private ConfigOption configOption = new ConfigOption();

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "posts", "post" -> listContent(ContentKind.POSTS);
            case "pages", "page" -> listContent(ContentKind.PAGES);
            case "generators", "generator" -> listGenerators();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: posts, pages, generators, or renderers", type);
                yield 1;
            }
        };
    }

    private int listContent(ContentKind kind) {
        Path projectRoot = configOption.projectRoot(projectPath);
        SiteConfig config;
        try {
            config = configOption.loadConfig(projectPath).validate();
        } catch (SiteBuildException e) {
            System.err.println("✗ " + e.getMessage());
            return 1;
        }

        Path inputDirectory = config.inputDirectory(projectRoot);
        FileSystemContentStore store = new FileSystemContentStore(inputDirectory, config.charset());
        UrlResolver urls = new UrlResolver(config, store.directory(ContentKind.PAGES));
        List<Path> files = store.list(kind);

        System.out.println((kind == ContentKind.POSTS ? "Posts" : "Pages") + " in " + store.directory(kind) + ":");
        System.out.println();

        int invalid = 0;
        for (Path file : files) {
            String name = FileUtils.toUnixPath(store.directory(kind).relativize(file));
            try {
                String target = kind == ContentKind.POSTS ? urls.postUrl(file) : urls.siteUrl(file);
                System.out.printf("  • %s -> %s%n", name, target);
            } catch (SiteBuildException e) {
                invalid++;
                System.out.printf("  ✗ %s (%s)%n", name, e.getMessage());
            }
        }

        if (files.isEmpty()) {
            System.out.println("  None found.");
        }
        return invalid == 0 ? 0 : 1;
    }

    private int listGenerators() {
        System.out.println("Available Generators:");
        System.out.println();

        List<SiteGenerator> generators = SiteGenerators.discover();
        for (SiteGenerator generator : generators) {
            System.out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            System.out.printf("    Order: %d%n", generator.order());
        }

        if (generators.isEmpty()) {
            System.out.println("  No generators found.");
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        List<OutputRenderer> renderers = OutputRenderers.all();
        for (OutputRenderer renderer : renderers) {
            System.out.printf("  • %s%n", renderer.getId());
        }

        if (renderers.isEmpty()) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }
}
