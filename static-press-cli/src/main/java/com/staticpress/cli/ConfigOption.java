package com.staticpress.cli;

import com.staticpress.core.config.ConfigLoader;
import com.staticpress.core.config.SiteConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * The {@code -c/--config} option shared by commands that work on a site project.
 *
 * <p>Relative {@code in-dir} and {@code out-dir} values resolve against the directory holding
 * the configuration file.
 */
public class ConfigOption {

    private static final Logger log = LoggerFactory.getLogger(ConfigOption.class);

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: <project>/" + ConfigLoader.DEFAULT_FILE_NAME + ")"
    )
    Path configPath;

    /**
     * Returns the configuration file to load.
     *
     * @param projectPath project directory
     * @return absolute config path
     */
    public Path configFile(Path projectPath) {
        Path file = configPath != null ? configPath : projectPath.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        return file.toAbsolutePath().normalize();
    }

    /**
     * Returns the directory that relative input and output directories resolve against.
     *
     * @param projectPath project directory
     * @return absolute project root
     */
    public Path projectRoot(Path projectPath) {
        Path parent = configFile(projectPath).getParent();
        return parent != null ? parent : projectPath.toAbsolutePath().normalize();
    }

    /**
     * Loads the configuration.
     *
     * @param projectPath project directory
     * @return configuration with defaults applied
     */
    public SiteConfig loadConfig(Path projectPath) {
        Path file = configFile(projectPath);
        log.debug("Loading configuration from: {}", file);
        return ConfigLoader.load(file);
    }
}
