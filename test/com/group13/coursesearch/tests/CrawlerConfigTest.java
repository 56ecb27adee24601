package com.group13.coursesearch.tests;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

import com.group13.coursesearch.config.CrawlerConfig;
import com.group13.coursesearch.config.ResourceLoader;
import com.group13.coursesearch.model.KeywordCategories;

import java.util.Collections;
import java.util.Set;

/**
 * Bundled configuration resources and the crawler settings builder.
 */
class CrawlerConfigTest {

    @Test
    void testBundledDefaults() {
        CrawlerConfig config = CrawlerConfig.defaults();

        assertEquals(10, config.getMaxPages(), "Default page budget");
        assertEquals("educacionvirtual.javeriana.edu.co", config.getDomain());
        assertFalse(config.getSeeds().isEmpty(), "A default seed is configured");
        assertTrue(config.getCoursePattern().matcher("https://educacionvirtual.javeriana.edu.co/gestion-proyectos-agiles").matches(),
                "Hyphenated slugs under the site root are course pages");
        assertFalse(config.getCoursePattern().matcher("https://educacionvirtual.javeriana.edu.co/cursos").matches(),
                "Single-word paths are listing pages");
        assertTrue(config.getExcludedPaths().contains("/buscar"));
        assertEquals(3, config.getMinWords());
    }

    @Test
    void testBuilderOverridesAndValidation() {
        CrawlerConfig config = CrawlerConfig.builder().maxPages(25).seeds("https://example.edu/a").build();
        assertEquals(25, config.getMaxPages());
        assertEquals(Collections.singletonList("https://example.edu/a"), config.getSeeds());
        assertEquals(config.getDomain(), config.toBuilder().build().getDomain(), "toBuilder keeps every value");

        assertThrows(IllegalArgumentException.class, () -> CrawlerConfig.builder().maxPages(-1).build(),
                "Negative budget is rejected");
        assertThrows(IllegalArgumentException.class, () -> CrawlerConfig.builder().seeds().build(),
                "A crawl needs at least one seed");
        assertThrows(IllegalArgumentException.class, () -> CrawlerConfig.builder().coursePattern("[unclosed"),
                "Invalid regular expressions are rejected");
    }

    @Test
    void testStopWordsAndCategories() {
        Set<String> stopWords = ResourceLoader.stopWords();
        assertTrue(stopWords.contains("de") && stopWords.contains("the"), "Spanish and English stop words are loaded");
        assertFalse(stopWords.stream().anyMatch(w -> w.startsWith("#")), "Comments are skipped");
        assertSame(stopWords, ResourceLoader.stopWords(), "Resources are loaded once");

        KeywordCategories categories = ResourceLoader.keywordCategories();
        assertEquals(8, categories.size());
        assertTrue(categories.terms("marketing").contains("publicidad"));
        assertEquals(Collections.singleton("tecnologia"),
                categories.categoriesOf(Set.of("python", "cocina")), "Only categories with a hit are reported");
    }
}
