package com.staticpress.core.generator;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SiteGenerators}.
 */
class SiteGeneratorsTest {

    @Test
    void discover_findsBuiltInGeneratorsInOrder() {
        List<SiteGenerator> generators = SiteGenerators.discover();

        assertThat(generators).extracting(SiteGenerator::getId)
            .containsExactly("tags", "archives", "latest-posts", "rss", "sitemap");
        assertThat(generators).allSatisfy(generator -> assertThat(generator.getDisplayName()).isNotBlank());
    }
}
