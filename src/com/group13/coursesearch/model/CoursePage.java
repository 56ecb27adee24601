package com.group13.coursesearch.model;

import java.util.Collections;
import java.util.List;

/*
  The fields extracted from a fetched HTML page before validation:
  title, description text and the absolute outbound links found on the page.
 */
public class CoursePage {

    private final String url;
    private final String title;
    private final String description;
    private final List<String> links;

    public CoursePage(String url, String title, String description, List<String> links) {
        this.url = url;
        this.title = title != null ? title : "";
        this.description = description != null ? description : "";
        this.links = links != null ? Collections.unmodifiableList(links) : Collections.emptyList();
    }

    public String getUrl() { return url; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public List<String> getLinks() { return links; }

    // Text that feeds the course word set.
    public String indexableText() {
        return title + " " + description;
    }
}
