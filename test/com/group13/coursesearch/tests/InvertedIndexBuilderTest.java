package com.group13.coursesearch.tests;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

import com.group13.coursesearch.impl.InvertedIndexBuilder;
import com.group13.coursesearch.model.CourseDictionary;
import com.group13.coursesearch.model.CourseRecord;
import com.group13.coursesearch.model.IdfTable;
import com.group13.coursesearch.model.IndexRow;
import com.group13.coursesearch.model.InvertedIndex;
import com.group13.coursesearch.model.UnknownCourseException;

import java.util.Collections;
import java.util.List;

class InvertedIndexBuilderTest {

    private final CourseDictionary dictionary = TestCourses.dictionary(
            TestCourses.course("gestion-proyectos-agiles", "Gestión de Proyectos Ágiles", "gestion", "proyectos", "agiles"),
            TestCourses.course("marketing-digital", "Marketing Digital", "marketing", "digital", "proyectos"));

    // --- TEST 1: Completeness and closure ---
    @Test
    void testIndexIsCompleteAndClosed() {
        InvertedIndex index = InvertedIndexBuilder.build(dictionary);

        for (CourseRecord course : dictionary.records()) {
            for (String word : course.getWords()) {
                assertTrue(index.postings(word).contains(course.getCourseId()),
                        "Word '" + word + "' must point to " + course.getCourseId());
            }
        }
        for (String word : index.vocabulary()) {
            for (String id : index.postings(word)) {
                assertTrue(dictionary.require(id).contains(word), "Posting " + word + " -> " + id + " must be real");
            }
        }
        assertEquals(2, index.documentFrequency("proyectos"), "Shared word is posted for both courses");
        assertTrue(index.postings("inexistente").isEmpty(), "Unknown word has no postings");
        assertEquals(6, index.entryCount());
    }

    // --- TEST 2: Rows are unique and sorted per course ---
    @Test
    void testRows() {
        List<IndexRow> rows = InvertedIndexBuilder.rows(dictionary);

        assertEquals(6, rows.size());
        assertEquals(new IndexRow("gestion-proyectos-agiles", "agiles"), rows.get(0),
                "Rows are grouped by course and sorted by word");
        assertEquals("marketing-digital|digital", rows.get(3).toString());
    }

    // --- TEST 3: Rebuilding from rows ---
    @Test
    void testFromRows() {
        InvertedIndex fromRows = InvertedIndexBuilder.fromRows(InvertedIndexBuilder.rows(dictionary), dictionary);
        assertEquals(InvertedIndexBuilder.build(dictionary).asMap(), fromRows.asMap(),
                "Index rebuilt from rows must equal the direct build");

        List<IndexRow> bad = Collections.singletonList(new IndexRow("curso-fantasma", "gestion"));
        assertThrows(UnknownCourseException.class, () -> InvertedIndexBuilder.fromRows(bad, dictionary),
                "Rows naming an unknown course must be rejected");
    }

    // --- TEST 4: IDF weights ---
    @Test
    void testIdf() {
        IdfTable idf = IdfTable.from(dictionary, InvertedIndexBuilder.build(dictionary));

        assertEquals(0.0, idf.idf("proyectos"), 1e-12, "A word in every course has zero weight");
        assertEquals(Math.log(2), idf.idf("gestion"), 1e-12);
        assertEquals(0.0, idf.idf("inexistente"), 1e-12, "Unknown words weigh 0");
    }

    @Test
    void testEmptyDictionary() {
        CourseDictionary empty = CourseDictionary.of(Collections.<CourseRecord>emptyList());
        assertTrue(InvertedIndexBuilder.build(empty).vocabulary().isEmpty());
        assertTrue(InvertedIndexBuilder.rows(empty).isEmpty());
    }
}
