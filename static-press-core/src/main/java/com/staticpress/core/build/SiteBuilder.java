package com.staticpress.core.build;

import com.staticpress.core.config.ConfigurationException;
import com.staticpress.core.config.SiteConfig;
import com.staticpress.core.content.ContentKind;
import com.staticpress.core.content.ContentUnit;
import com.staticpress.core.content.FileSystemContentStore;
import com.staticpress.core.generator.GenerationContext;
import com.staticpress.core.generator.SiteGenerator;
import com.staticpress.core.generator.SiteGenerators;
import com.staticpress.core.generator.impl.LatestPostsGenerator;
import com.staticpress.core.renderer.GeneratedFile;
import com.staticpress.core.renderer.GeneratedOutput;
import com.staticpress.core.renderer.OutputRenderer;
import com.staticpress.core.renderer.OutputRenderers;
import com.staticpress.core.renderer.RenderContext;
import com.staticpress.core.template.TemplateEngine;
import com.staticpress.core.template.TemplateLoader;
import com.staticpress.core.url.UrlResolver;
import com.staticpress.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a whole site.
 *
 * <p><b>Phases:</b>
 * <ol>
 *   <li>Validate the configuration and resolve the default template.</li>
 *   <li>Render every post and page, and run every {@link SiteGenerator}, as independent tasks
 *       on a pool of {@code build-threads} workers.</li>
 *   <li>Gather the {@link TaskResult}s in submission order.</li>
 *   <li>Clear the output directory (filesystem output only) and write the output of every
 *       successful task.</li>
 * </ol>
 *
 * <p>A {@link ConfigurationException} from any task aborts the build before anything is
 * cleared or written. An output directory that holds the input directory or the project root
 * is refused up front. Any other task failure is collected; the remaining output is written and a
 * {@link BuildFailedException} is raised at the end.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * SiteConfig config = ConfigLoader.load(root.resolve("staticpress.yaml"));
 * BuildReport report = new SiteBuilder(config, root, new FileSystemRenderer()).build();
 * }</pre>
 */
public class SiteBuilder {

    private static final Logger log = LoggerFactory.getLogger(SiteBuilder.class);

    private static final Pattern LATEST_POSTS_PAGE =
        Pattern.compile(Pattern.quote(LatestPostsGenerator.DIRECTORY) + "/(\\d+)/index\\.html");

    private final SiteConfig config;
    private final Path projectRoot;
    private final OutputRenderer renderer;
    private final Map<String, String> rendererSettings;
    private final List<SiteGenerator> generators;

    /**
     * Creates a builder using every generator registered through SPI.
     *
     * @param config site configuration
     * @param projectRoot directory that {@code in-dir} and {@code out-dir} are relative to
     * @param renderer output destination
     */
    public SiteBuilder(SiteConfig config, Path projectRoot, OutputRenderer renderer) {
        this(config, projectRoot, renderer, Map.of(), SiteGenerators.discover());
    }

    /**
     * Creates a builder.
     *
     * @param config site configuration
     * @param projectRoot directory that {@code in-dir} and {@code out-dir} are relative to
     * @param renderer output destination
     * @param rendererSettings settings passed to the renderer
     * @param generators site generators, run in list order
     */
    public SiteBuilder(SiteConfig config, Path projectRoot, OutputRenderer renderer,
                       Map<String, String> rendererSettings, List<SiteGenerator> generators) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.rendererSettings = Map.copyOf(rendererSettings);
        this.generators = List.copyOf(generators);
    }

    /**
     * Runs the build.
     *
     * @return report of the build
     * @throws ConfigurationException if the configuration or a template reference is invalid
     * @throws BuildFailedException if any unit or generator failed; the rest has been written
     */
    public BuildReport build() {
        long started = System.nanoTime();

        config.validate();
        Path inputDirectory = config.inputDirectory(projectRoot);
        Path outputDirectory = config.outputDirectory(projectRoot);
        checkOutputDirectory(inputDirectory, outputDirectory);

        FileSystemContentStore store = new FileSystemContentStore(inputDirectory, config.charset());
        UrlResolver urls = new UrlResolver(config, store.directory(ContentKind.PAGES));
        TemplateEngine templates = new TemplateEngine(
            new TemplateLoader(inputDirectory.resolve(TemplateLoader.DIRECTORY_NAME), config.charset()),
            config.defaultTemplate());
        templates.verify(config.defaultTemplate());

        List<Path> posts = store.list(ContentKind.POSTS);
        List<Path> pages = store.list(ContentKind.PAGES);
        log.info("Building {} posts and {} pages from {}", posts.size(), pages.size(), inputDirectory);

        List<TaskResult> results;
        ExecutorService taskExecutor = Executors.newFixedThreadPool(config.buildThreads());
        ExecutorService itemExecutor = Executors.newFixedThreadPool(config.buildThreads());
        try {
            GenerationContext generation = new GenerationContext(config, store, urls, templates, itemExecutor);

            List<Callable<TaskResult>> tasks = new ArrayList<>();
            for (Path post : posts) {
                tasks.add(() -> renderUnit(post, ContentKind.POSTS, inputDirectory, store, urls, templates));
            }
            for (Path page : pages) {
                tasks.add(() -> renderUnit(page, ContentKind.PAGES, inputDirectory, store, urls, templates));
            }
            for (SiteGenerator generator : generators) {
                tasks.add(() -> runGenerator(generator, generation));
            }
            results = runAll(taskExecutor, tasks);
        } finally {
            taskExecutor.shutdown();
            itemExecutor.shutdown();
        }
        log.info("Rendered {} units and {} generators in {} secs",
            posts.size() + pages.size(), generators.size(), BuildReport.seconds(elapsedSince(started)));

        for (TaskResult result : results) {
            if (result.failure() instanceof ConfigurationException configurationError) {
                log.error("Aborting build, nothing was written: {}", result.describeFailure());
                throw configurationError;
            }
        }

        List<GeneratedOutput> outputs = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        int unitsRendered = 0;
        int unitCount = posts.size() + pages.size();
        for (int i = 0; i < results.size(); i++) {
            TaskResult result = results.get(i);
            if (result.isSuccess()) {
                outputs.add(result.output());
                if (i < unitCount) {
                    unitsRendered++;
                }
            } else {
                log.error("Failed: {}", result.describeFailure());
                failures.add(result.describeFailure());
            }
        }

        GeneratedOutput site = GeneratedOutput.concat(outputs);
        if (config.blogAsIndex()) {
            site = withBlogIndex(site);
        }

        long writeStarted = System.nanoTime();
        if (OutputRenderers.FILESYSTEM.equals(renderer.getId())) {
            clearOutputDirectory(outputDirectory);
        }
        renderer.render(site, new RenderContext(outputDirectory, rendererSettings));
        log.info("Wrote {} files in {} secs", site.size(), BuildReport.seconds(elapsedSince(writeStarted)));

        BuildReport report = new BuildReport(unitsRendered, site.size(), failures, elapsedSince(started));
        if (report.hasFailures()) {
            throw new BuildFailedException(report);
        }
        log.info("{}", report);
        return report;
    }

    private static TaskResult renderUnit(Path path, ContentKind kind, Path inputDirectory,
                                         FileSystemContentStore store, UrlResolver urls, TemplateEngine templates) {
        String taskName = FileUtils.toUnixPath(inputDirectory.relativize(path));
        try {
            ContentUnit unit = store.read(path).withMetadata(ContentUnit.TYPE, kind.typeName());
            if (unit.body().isBlank()) {
                log.warn("{} has an empty body", taskName);
            }
            String outputPath = kind == ContentKind.POSTS
                ? urls.postOutputPath(path)
                : urls.siteUrl(path, unit.extension() != null ? unit.extension() : UrlResolver.DEFAULT_EXTENSION);
            String rendered = templates.render(unit);
            log.debug("Rendered {} -> {}", taskName, outputPath);
            return TaskResult.success(taskName, GeneratedOutput.of(GeneratedFile.html(outputPath, rendered)));
        } catch (RuntimeException e) {
            return TaskResult.failure(taskName, e);
        }
    }

    private static TaskResult runGenerator(SiteGenerator generator, GenerationContext context) {
        try {
            long started = System.nanoTime();
            GeneratedOutput output = generator.generate(context);
            log.debug("{} generated {} files in {} secs",
                generator.getDisplayName(), output.size(), BuildReport.seconds(elapsedSince(started)));
            return TaskResult.success(generator.getId(), output);
        } catch (RuntimeException e) {
            return TaskResult.failure(generator.getId(), e);
        }
    }

    private static List<TaskResult> runAll(ExecutorService executor, List<Callable<TaskResult>> tasks) {
        List<Future<TaskResult>> futures = new ArrayList<>(tasks.size());
        for (Callable<TaskResult> task : tasks) {
            futures.add(executor.submit(task));
        }

        List<TaskResult> results = new ArrayList<>(futures.size());
        try {
            for (Future<TaskResult> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Build interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Build task failed unexpectedly", e.getCause());
        }
        return results;
    }

    /**
     * Adds {@code index.html} as a copy of the newest latest-posts page, if there is one.
     */
    static GeneratedOutput withBlogIndex(GeneratedOutput site) {
        GeneratedFile newest = null;
        int newestIndex = -1;
        for (GeneratedFile file : site.files()) {
            Matcher matcher = LATEST_POSTS_PAGE.matcher(file.relativePath());
            if (matcher.matches() && Integer.parseInt(matcher.group(1)) > newestIndex) {
                newestIndex = Integer.parseInt(matcher.group(1));
                newest = file;
            }
        }
        if (newest == null) {
            return site;
        }
        List<GeneratedFile> files = new ArrayList<>(site.files());
        files.add(GeneratedFile.html("index.html", newest.content()));
        return new GeneratedOutput(files);
    }

    private void checkOutputDirectory(Path inputDirectory, Path outputDirectory) {
        Path root = projectRoot.toAbsolutePath().normalize();
        if (inputDirectory.startsWith(outputDirectory) || root.startsWith(outputDirectory)) {
            throw new ConfigurationException("out-dir " + outputDirectory
                + " must not contain the input directory " + inputDirectory + " or the project root " + root
                + "; it is cleared on every build");
        }
    }

    private static void clearOutputDirectory(Path outputDirectory) {
        try {
            FileUtils.deleteRecursively(outputDirectory);
            log.debug("Cleared {}", outputDirectory);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to clear output directory: " + outputDirectory, e);
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
