package com.group13.coursesearch.tests;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

import com.group13.coursesearch.config.ResourceLoader;
import com.group13.coursesearch.core.MemoryProbe;
import com.group13.coursesearch.impl.CombinedSimilarity;
import com.group13.coursesearch.impl.InvertedIndexBuilder;
import com.group13.coursesearch.impl.KeywordSemanticSimilarity;
import com.group13.coursesearch.impl.NoOpMemoryProbe;
import com.group13.coursesearch.impl.RuntimeMemoryProbe;
import com.group13.coursesearch.model.CourseDictionary;
import com.group13.coursesearch.model.CourseRecord;
import com.group13.coursesearch.model.PerformanceMetrics;
import com.group13.coursesearch.model.ScoreResult;
import com.group13.coursesearch.model.SimilarityMethod;
import com.group13.coursesearch.model.UnknownCourseException;
import com.group13.coursesearch.pipeline.CourseComparator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Similarity metrics and their instrumentation.
 */
class CourseComparatorTest {

    private final CourseRecord marketing = TestCourses.course("marketing-digital", "Marketing Digital",
            "marketing", "digital", "redes", "sociales");
    private final CourseRecord ventas = TestCourses.course("publicidad-ventas", "Publicidad y Ventas",
            "publicidad", "ventas", "marketing", "estrategia");
    private final CourseRecord python = TestCourses.course("python-datos", "Python para Datos",
            "python", "datos", "programacion", "analisis");
    private final CourseRecord gestion = TestCourses.course("gestion-proyectos", "Gestión de Proyectos",
            "gestion", "proyectos", "liderazgo");
    private final CourseRecord basico = TestCourses.course("marketing-basico", "Marketing Básico",
            "marketing", "digital");

    private final CourseDictionary dictionary = TestCourses.dictionary(marketing, ventas, python, gestion, basico);

    private CourseComparator comparator(MemoryProbe probe) {
        return new CourseComparator(dictionary, InvertedIndexBuilder.build(dictionary),
                ResourceLoader.keywordCategories(), probe);
    }

    private final CourseComparator comparator = comparator(new NoOpMemoryProbe());

    // --- TEST 1: Jaccard identity, symmetry and disjoint sets ---
    @Test
    void testJaccard() {
        assertEquals(1.0, comparator.compare(marketing, marketing, SimilarityMethod.JACCARD), 1e-12,
                "A course is identical to itself");
        assertEquals(0.0, comparator.compare(marketing, python, SimilarityMethod.JACCARD), 1e-12,
                "Disjoint word sets score exactly 0");
        assertEquals(1.0 / 7.0, comparator.compare(marketing, ventas, SimilarityMethod.JACCARD), 1e-12,
                "One shared word out of seven");
    }

    // --- TEST 2: Every method is symmetric and bounded ---
    @Test
    void testSymmetryAndRange() {
        List<CourseRecord> all = new ArrayList<>(dictionary.records());
        for (SimilarityMethod method : SimilarityMethod.values()) {
            for (CourseRecord a : all) {
                for (CourseRecord b : all) {
                    double ab = comparator.compare(a, b, method);
                    double ba = comparator.compare(b, a, method);
                    assertEquals(ab, ba, 1e-12, method + " must be symmetric for " + a.getCourseId() + "/" + b.getCourseId());
                    assertTrue(ab >= 0.0 && ab <= 1.0 + 1e-12, method + " must stay in [0, 1]");
                }
            }
        }
    }

    // --- TEST 3: Cosine and overlap ---
    @Test
    void testCosineAndOverlap() {
        assertEquals(1.0, comparator.compare(marketing, marketing, SimilarityMethod.COSINE), 1e-9,
                "Identical vectors have cosine 1");
        assertEquals(0.0, comparator.compare(marketing, python, SimilarityMethod.COSINE), 1e-12);
        assertEquals(1.0, comparator.compare(basico, marketing, SimilarityMethod.OVERLAP), 1e-12,
                "A subset fully overlaps its superset");
    }

    // --- TEST 4: Keyword category similarity ---
    @Test
    void testSemantic() {
        assertEquals(0.6 + 0.4 / 7.0, comparator.compare(marketing, ventas, SimilarityMethod.SEMANTIC), 1e-12,
                "Same category: 0.6 * 1 + 0.4 * jaccard");
        assertEquals(0.0, comparator.compare(python, gestion, SimilarityMethod.SEMANTIC), 1e-12,
                "Different categories and no shared words");

        CourseRecord cocina = TestCourses.course("cocina-casera", "Cocina Casera", "cocina", "recetas");
        CourseRecord jardin = TestCourses.course("jardin-urbano", "Jardín Urbano", "jardin", "plantas");
        assertEquals(KeywordSemanticSimilarity.KEYWORD_WEIGHT, comparator.compare(cocina, jardin, SimilarityMethod.SEMANTIC),
                1e-12, "No category hits on either side counts as full keyword agreement");
        assertEquals(1.0, comparator.compare(cocina, cocina, SimilarityMethod.SEMANTIC), 1e-12,
                "A course without category hits is still identical to itself");
        assertEquals(0.0, comparator.compare(marketing, cocina, SimilarityMethod.SEMANTIC), 1e-12,
                "Category hits on one side only score 0");
    }

    // --- TEST 5: Combined is the weighted sum of its parts ---
    @Test
    void testCombinedFormula() {
        double jaccard = comparator.compare(marketing, ventas, SimilarityMethod.JACCARD);
        double cosine = comparator.compare(marketing, ventas, SimilarityMethod.COSINE);
        double semantic = comparator.compare(marketing, ventas, SimilarityMethod.SEMANTIC);

        double expected = CombinedSimilarity.JACCARD_WEIGHT * jaccard
                + CombinedSimilarity.COSINE_WEIGHT * cosine
                + CombinedSimilarity.SEMANTIC_WEIGHT * semantic;
        assertEquals(expected, comparator.compare(marketing, ventas, SimilarityMethod.COMBINED), 1e-12,
                "combined = 0.3 * jaccard + 0.3 * cosine + 0.4 * semantic");
    }

    // --- TEST 6: Metrics figures ---
    @Test
    void testMeasure() {
        PerformanceMetrics metrics = comparator.measure(marketing, ventas, SimilarityMethod.JACCARD);

        assertEquals(comparator.compare(marketing, ventas, SimilarityMethod.JACCARD), metrics.getSimilarityScore(), 1e-12,
                "Instrumentation must not change the score");
        assertEquals(4, metrics.getCourse1WordCount());
        assertEquals(4, metrics.getCourse2WordCount());
        assertEquals(1, metrics.getSharedWords());
        assertEquals(1.0 / 7.0, metrics.getVocabularyOverlap(), 1e-12);
        assertEquals(0L, metrics.getMemoryDeltaBytes(), "No-op probe reports no memory");
        assertEquals("O(n + m)", metrics.getComplexity());
        assertTrue(metrics.getElapsedNanos() >= 0L);
    }

    // --- TEST 7: Memory probe behaviour ---
    @Test
    void testMemoryProbeDegradesToZero() {
        MemoryProbe failing = () -> {
            throw new IllegalStateException("heap statistics unavailable");
        };
        PerformanceMetrics failed = comparator(failing).measure(marketing, ventas, SimilarityMethod.COMBINED);
        assertEquals(0L, failed.getMemoryDeltaBytes(), "A failing probe reads as zero");
        assertEquals(comparator.compare(marketing, ventas, SimilarityMethod.COMBINED), failed.getSimilarityScore(), 1e-12,
                "A failing probe never blocks scoring");

        long[] readings = {5_000L, 1_000L};
        int[] call = {0};
        MemoryProbe shrinking = () -> readings[Math.min(call[0]++, 1)];
        assertEquals(0L, comparator(shrinking).measure(marketing, ventas, SimilarityMethod.JACCARD).getMemoryDeltaBytes(),
                "A heap that shrank during the call reports zero");

        long[] growing = {1_000L, 5_000L};
        int[] next = {0};
        MemoryProbe grow = () -> growing[Math.min(next[0]++, 1)];
        assertEquals(4_000L, comparator(grow).measure(marketing, ventas, SimilarityMethod.JACCARD).getMemoryDeltaBytes());

        assertTrue(new RuntimeMemoryProbe().usedBytes() >= 0L, "Platform probe never reports a negative value");
    }

    // --- TEST 8: compareAll covers every method ---
    @Test
    void testCompareAll() {
        Map<SimilarityMethod, PerformanceMetrics> all = comparator.compareAll("marketing-digital", "publicidad-ventas");

        assertEquals(Arrays.asList(SimilarityMethod.values()), new ArrayList<>(all.keySet()),
                "One entry per method, in declaration order");
        for (Map.Entry<SimilarityMethod, PerformanceMetrics> entry : all.entrySet()) {
            assertEquals(comparator.compare(marketing, ventas, entry.getKey()), entry.getValue().getSimilarityScore(), 1e-12,
                    entry.getKey() + " score must match compare()");
        }
    }

    // --- TEST 9: Unknown ids ---
    @Test
    void testUnknownCourse() {
        UnknownCourseException e = assertThrows(UnknownCourseException.class,
                () -> comparator.compare("marketing-digital", "curso-fantasma", SimilarityMethod.JACCARD));
        assertEquals("curso-fantasma", e.getCourseId());
        assertThrows(UnknownCourseException.class, () -> comparator.findSimilar("curso-fantasma", 3, SimilarityMethod.DEFAULT));
    }

    // --- TEST 10: Most similar courses ---
    @Test
    void testFindSimilar() {
        List<ScoreResult> similar = comparator.findSimilar("marketing-digital", 2, SimilarityMethod.JACCARD);

        assertEquals(2, similar.size());
        assertEquals("marketing-basico", similar.get(0).getCourseId(), "Subset course is the closest");
        assertEquals(0.5, similar.get(0).getScore(), 1e-12);
        assertEquals("publicidad-ventas", similar.get(1).getCourseId());
        assertTrue(comparator.findSimilar("marketing-digital", 0, SimilarityMethod.JACCARD).isEmpty());
        for (ScoreResult r : comparator.findSimilar("marketing-digital", 10, SimilarityMethod.COMBINED)) {
            assertNotEquals("marketing-digital", r.getCourseId(), "A course is never similar to itself");
        }
    }

    @Test
    void testMethodNames() {
        assertEquals(SimilarityMethod.JACCARD, SimilarityMethod.fromName("JACCARD"));
        assertEquals(SimilarityMethod.COMBINED, SimilarityMethod.fromName(""));
        assertThrows(IllegalArgumentException.class, () -> SimilarityMethod.fromName("levenshtein"));
    }
}
