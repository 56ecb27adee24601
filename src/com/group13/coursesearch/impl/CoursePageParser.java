package com.group13.coursesearch.impl;

import com.group13.coursesearch.config.CrawlerConfig;
import com.group13.coursesearch.model.CoursePage;
import com.group13.coursesearch.utils.CourseIds;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts title, description and outbound links from course HTML with jsoup.
 * The description is looked up with several strategies, the first one that yields text wins.
 */
public class CoursePageParser {

    private static final List<String> METADATA_MARKERS = Arrays.asList(
        "Duración:", "Nivel:", "Fecha:", "Precio:", "Modalidad:", "Horario:", "Copyright", "©"
    );
    private static final int MAX_DESCRIPTION_PARTS = 3;

    private final String titleSelector;
    private final String descriptionSelector;

    public CoursePageParser(CrawlerConfig config) {
        this(config.getTitleSelector(), config.getDescriptionSelector());
    }

    public CoursePageParser(String titleSelector, String descriptionSelector) {
        this.titleSelector = titleSelector;
        this.descriptionSelector = descriptionSelector;
    }

    public CoursePage parse(String url, String html) {
        Document doc = Jsoup.parse(html, url);
        doc.select("script, style, noscript").remove();
        return new CoursePage(url, extractTitle(doc), extractDescription(doc), extractLinks(doc));
    }

    private String extractTitle(Document doc) {
        Element titleElement = doc.selectFirst(titleSelector);
        if (titleElement != null && !titleElement.text().isBlank()) {
            return titleElement.text().trim();
        }
        return doc.title().trim();
    }

    private String extractDescription(Document doc) {
        List<String> parts = new ArrayList<>();

        // Strategy 1: justified paragraphs hold the real course descriptions on the catalog
        for (Element p : doc.select("p[style*=justify]")) {
            addIfSubstantial(parts, p.text(), 20);
        }

        // Strategy 2: configured description containers
        if (parts.isEmpty() && descriptionSelector != null && !descriptionSelector.isBlank()) {
            for (Element e : doc.select(descriptionSelector)) {
                addIfSubstantial(parts, e.text(), 20);
            }
        }

        // Strategy 3: long plain paragraphs that are not metadata lines
        if (parts.isEmpty()) {
            for (Element p : doc.select("p")) {
                String text = p.text();
                if (!isMetadata(text)) {
                    addIfSubstantial(parts, text, 50);
                }
            }
        }

        // Strategy 4: meta description
        if (parts.isEmpty()) {
            Element meta = doc.selectFirst("meta[name=description]");
            if (meta != null) {
                addIfSubstantial(parts, meta.attr("content"), 1);
            }
        }

        List<String> kept = parts.subList(0, Math.min(parts.size(), MAX_DESCRIPTION_PARTS));
        return String.join(" ", kept).replace('\u00a0', ' ').replaceAll("\\s+", " ").trim();
    }

    private List<String> extractLinks(Document doc) {
        Set<String> links = new LinkedHashSet<>();
        for (Element a : doc.select("a[href]")) {
            String absolute = a.absUrl("href");
            if (absolute.isEmpty()) continue;
            links.add(CourseIds.removeFragment(absolute));
        }
        return new ArrayList<>(links);
    }

    private static void addIfSubstantial(List<String> parts, String text, int minLength) {
        String trimmed = text != null ? text.trim() : "";
        if (trimmed.length() > minLength && !parts.contains(trimmed)) {
            parts.add(trimmed);
        }
    }

    private static boolean isMetadata(String text) {
        for (String marker : METADATA_MARKERS) {
            if (text.contains(marker)) return true;
        }
        return false;
    }
}
