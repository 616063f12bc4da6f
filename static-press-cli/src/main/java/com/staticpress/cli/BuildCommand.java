package com.staticpress.cli;

import com.staticpress.core.build.BuildFailedException;
import com.staticpress.core.build.BuildReport;
import com.staticpress.core.build.SiteBuilder;
import com.staticpress.core.config.SiteConfig;
import com.staticpress.core.generator.SiteGenerators;
import com.staticpress.core.renderer.OutputRenderer;
import com.staticpress.core.renderer.OutputRenderers;
import com.staticpress.core.renderer.impl.ConsoleRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to build the site.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Build the project in the current directory
 * staticpress build
 *
 * # Build another project into a different directory
 * staticpress build ~/blog -o /tmp/blog-html
 *
 * # Print what would be written
 * staticpress build --dry-run
 * }</pre>
 */
@Command(
    name = "build",
    description = "Build the static site",
    mixinStandardHelpOptions = true
)
public class BuildCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BuildCommand.class);

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Mixin
    private ConfigOption configOption = new ConfigOption();

    @Option(
        names = {"-o", "--out"},
        description = "Output directory (overrides out-dir)"
    )
    private Path outputPath;

    @Option(
        names = {"--threads"},
        description = "Worker threads (overrides build-threads)"
    )
    private Integer threads;

    @Option(
        names = {"--dry-run"},
        description = "Print the files that would be written instead of writing them"
    )
    private boolean dryRun;

    @Option(
        names = {"--show-content"},
        description = "With --dry-run, print file contents too"
    )
    private boolean showContent;

    @Override
    public Integer call() {
        try {
            Path projectRoot = configOption.projectRoot(projectPath);
            SiteConfig config = configOption.loadConfig(projectPath);
            if (outputPath != null) {
                config = config.withOutDir(outputPath.toAbsolutePath().normalize().toString());
            }
            if (threads != null) {
                config = config.withBuildThreads(threads);
            }

            System.out.println("Building site: " + projectRoot);
            if (dryRun) {
                System.out.println("Running in dry-run mode (nothing will be written)");
            }
            System.out.println();

            OutputRenderer renderer = OutputRenderers.byId(dryRun ? OutputRenderers.CONSOLE : OutputRenderers.FILESYSTEM);
            Map<String, String> settings = Map.of(ConsoleRenderer.SHOW_CONTENT, Boolean.toString(showContent));

            BuildReport report = new SiteBuilder(config, projectRoot, renderer, settings,
                SiteGenerators.discover()).build();

            System.out.println("✓ Rendered " + report.unitsRendered() + " posts and pages");
            System.out.println("✓ " + (dryRun ? "Listed " : "Wrote ") + report.filesWritten() + " files to: "
                + config.outputDirectory(projectRoot));
            System.out.println("✓ Build complete in " + BuildReport.seconds(report.elapsed()) + " secs");
            return 0;

        } catch (BuildFailedException e) {
            BuildReport report = e.getReport();
            System.err.println("✗ Build finished with " + report.failures().size() + " failure(s); "
                + report.filesWritten() + " files were written");
            report.failures().forEach(failure -> System.err.println("  " + failure));
            return 1;
        } catch (Exception e) {
            log.error("Build failed: {}", e.getMessage());
            System.err.println("✗ Build failed: " + e.getMessage());
            if (log.isDebugEnabled()) {
                log.debug("Stack trace:", e);
            }
            return 1;
        }
    }
}
