package com.group13.coursesearch.tests;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

import com.group13.coursesearch.config.CrawlerConfig;
import com.group13.coursesearch.impl.CoursePageParser;
import com.group13.coursesearch.impl.LayeredPageValidator;
import com.group13.coursesearch.impl.TextNormalizer;
import com.group13.coursesearch.model.CoursePage;
import com.group13.coursesearch.model.ValidationLayer;
import com.group13.coursesearch.model.ValidationResult;
import com.group13.coursesearch.utils.CourseIds;

import java.util.Collections;

/**
 * HTML extraction and the three validation layers.
 */
class PageValidationTest {

    private static final String URL = "https://educacionvirtual.javeriana.edu.co/gestion-proyectos-agiles";

    private final CrawlerConfig config = CrawlerConfig.defaults();
    private final CoursePageParser parser = new CoursePageParser(config);
    private final LayeredPageValidator validator =
            new LayeredPageValidator(config, TextNormalizer.withDefaultStopWords());

    // --- TEST 1: Description strategies ---
    @Test
    void testDescriptionStrategies() {
        String justified = "<h1>Gestión de Proyectos</h1>"
                + "<div class=\"description\"><p>Texto del contenedor configurado para el curso.</p></div>"
                + "<p style=\"text-align: justify\">Descripción justificada y completa del curso virtual.</p>";
        assertEquals("Descripción justificada y completa del curso virtual.",
                parser.parse(URL, justified).getDescription(), "Justified paragraphs win over other containers");

        String container = "<h1>Gestión de Proyectos</h1>"
                + "<div class=\"description\"><p>Texto del contenedor configurado para el curso.</p></div>";
        assertEquals("Texto del contenedor configurado para el curso.", parser.parse(URL, container).getDescription());

        String meta = "<html><head><meta name=\"description\" content=\"Resumen corto\"></head>"
                + "<body><h1>Gestión de Proyectos</h1><p>Duración: 40 horas</p></body></html>";
        assertEquals("Resumen corto", parser.parse(URL, meta).getDescription(), "Meta description is the last resort");
    }

    // --- TEST 2: Title and links ---
    @Test
    void testTitleAndLinks() {
        String html = "<html><head><title>Titulo de la pestaña</title></head><body>"
                + "<b class=\"card-title\">Marketing Digital Estratégico</b>"
                + "<a href=\"/marketing-digital#inicio\">a</a><a href=\"/marketing-digital\">b</a>"
                + "<a href=\"https://other.org/x\">c</a><script>var x = 1;</script></body></html>";
        CoursePage page = parser.parse(URL, html);

        assertEquals("Marketing Digital Estratégico", page.getTitle(), "Configured title selector is used first");
        assertEquals(2, page.getLinks().size(), "Fragments are removed and duplicates merged");
        assertEquals("https://educacionvirtual.javeriana.edu.co/marketing-digital", page.getLinks().get(0),
                "Relative links are resolved against the page URL");

        String noHeading = "<html><head><title>Pestaña del navegador</title></head><body><p>texto</p></body></html>";
        assertEquals("Pestaña del navegador", parser.parse(URL, noHeading).getTitle(),
                "Document title is the fallback when no heading matches");
    }

    // --- TEST 3: Layers ---
    @Test
    void testValidationLayers() {
        String description = "Aprende metodologías ágiles como Scrum para dirigir equipos.";

        ValidationResult ok = validator.validate(new CoursePage(URL, "Gestión de Proyectos Ágiles", description,
                Collections.emptyList()));
        assertTrue(ok.isAccepted(), "A real course page passes every layer");
        assertTrue(ok.getWords().contains("scrum"));

        assertLayer(ValidationLayer.SYNTACTIC, "https://educacionvirtual.javeriana.edu.co/cursos",
                "Gestión de Proyectos Ágiles", description);
        assertLayer(ValidationLayer.SYNTACTIC, "https://educacionvirtual.javeriana.edu.co/buscar-cursos",
                "Gestión de Proyectos Ágiles", description);
        assertLayer(ValidationLayer.STRUCTURAL, URL, "", description);
        assertLayer(ValidationLayer.STRUCTURAL, URL, "Gestión de Proyectos Ágiles", "  ");
        assertLayer(ValidationLayer.STRUCTURAL, URL, "TIPO", description);
        assertLayer(ValidationLayer.STRUCTURAL, URL, "2024", description);
        assertLayer(ValidationLayer.STRUCTURAL, URL, "Curso Web", description);
        assertLayer(ValidationLayer.SEMANTIC, URL, "Curso para el curso", "de la de la de la de la del");
    }

    private void assertLayer(ValidationLayer expected, String url, String title, String description) {
        ValidationResult result = validator.validate(new CoursePage(url, title, description, Collections.emptyList()));
        assertFalse(result.isAccepted(), "Page '" + title + "' at " + url + " must be rejected");
        assertEquals(expected, result.getFailedLayer(), "Wrong layer for '" + title + "': " + result.getReason());
    }

    // --- TEST 4: Course indicators or a substantial title ---
    @Test
    void testCourseIndicatorHeuristic() {
        String generic = "Enlaces a todas las secciones del portal institucional.";
        assertLayer(ValidationLayer.STRUCTURAL, URL, "Mapa del sitio web", generic);

        ValidationResult withIndicator = validator.validate(new CoursePage(URL, "Mapa del sitio web",
                "Consulta cada programa virtual disponible en el portal institucional.", Collections.emptyList()));
        assertTrue(withIndicator.isAccepted(), "A course word in the description rescues a short title");

        ValidationResult substantial = validator.validate(new CoursePage(URL, "Liderazgo y Negociación",
                generic, Collections.emptyList()));
        assertTrue(substantial.isAccepted(), "Two title words longer than four characters are enough");

        LayeredPageValidator custom = new LayeredPageValidator(config, TextNormalizer.withDefaultStopWords(),
                Collections.singleton("portal"));
        assertTrue(custom.validate(new CoursePage(URL, "Mapa del sitio web", generic, Collections.emptyList()))
                .isAccepted(), "The indicator list is configurable");
    }

    // --- TEST 5: Course ids ---
    @Test
    void testCourseIds() {
        assertEquals("gestion-proyectos-agiles", CourseIds.slugFromUrl(URL));
        assertEquals("gestion-proyectos-agiles", CourseIds.slugFromUrl(URL + "/?utm=1#temario"),
                "Query, fragment and trailing slash do not change the id");
        assertEquals("diseno-grafico", CourseIds.slugFromUrl("https://example.edu/cursos/Diseño-Gráfico.html"));
        assertEquals(CourseIds.slugFromUrl(URL), CourseIds.slugFromUrl(URL), "Ids are deterministic");
    }
}
