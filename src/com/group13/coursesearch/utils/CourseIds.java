package com.group13.coursesearch.utils;

import java.net.URI;
import java.net.URISyntaxException;
import java.text.Normalizer;
import java.util.Locale;

/**
 * Derives course identifiers and canonical URL forms.
 * The id of a course is the slug of the last non-empty path segment of its URL,
 * so crawling the same URL again always yields the same id.
 */
public final class CourseIds {

    private CourseIds() {
    }

    /*
      Examples:
      https://site/gestion-proyectos-agiles        -> gestion-proyectos-agiles
      https://site/cursos/Diseño%20Gráfico/?x=1    -> diseno-grafico
      https://site/                                -> site host slug
     */
    public static String slugFromUrl(String url) {
        String path;
        String host = "";
        try {
            URI uri = new URI(url);
            path = uri.getPath() != null ? uri.getPath() : "";
            host = uri.getHost() != null ? uri.getHost() : "";
        } catch (URISyntaxException e) {
            path = stripQueryAndFragment(url);
        }

        String segment = "";
        for (String part : path.split("/")) {
            if (!part.isBlank()) segment = part;
        }
        if (segment.isEmpty()) segment = host;

        // Drop a trailing .html / .htm extension
        segment = segment.replaceFirst("(?i)\\.html?$", "");
        return slugify(segment);
    }

    public static String slugify(String text) {
        String slug = Normalizer.normalize(text.toLowerCase(Locale.ROOT), Normalizer.Form.NFD)
                .replaceAll("\\p{M}+", "")
                .replaceAll("[^a-z0-9]+", "-");
        return slug.replaceAll("^-+|-+$", "");
    }

    // Removes the #fragment; the crawler treats URLs differing only there as the same page.
    public static String removeFragment(String url) {
        int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }

    private static String stripQueryAndFragment(String url) {
        String clean = removeFragment(url);
        int query = clean.indexOf('?');
        return query >= 0 ? clean.substring(0, query) : clean;
    }
}
