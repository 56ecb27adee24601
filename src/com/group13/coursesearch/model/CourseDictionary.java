package com.group13.coursesearch.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/*
  The finished mapping course_id -> CourseRecord produced by a crawl.
  Keys are unique and keep the order in which the crawler accepted the courses.
  Read-only once constructed, so it can be shared by concurrent searches and comparisons.
 */
public class CourseDictionary {

    private final Map<String, CourseRecord> courses;

    public CourseDictionary(Map<String, CourseRecord> courses) {
        this.courses = Collections.unmodifiableMap(new LinkedHashMap<>(courses));
    }

    public static CourseDictionary of(Collection<CourseRecord> records) {
        Map<String, CourseRecord> map = new LinkedHashMap<>();
        for (CourseRecord record : records) {
            map.put(record.getCourseId(), record);
        }
        return new CourseDictionary(map);
    }

    // Returns null when the id is not present.
    public CourseRecord get(String courseId) {
        return courses.get(courseId);
    }

    /**
     * Looks up a course that the caller expects to exist.
     *
     * @throws UnknownCourseException if the id is not in the dictionary
     */
    public CourseRecord require(String courseId) {
        CourseRecord record = courses.get(courseId);
        if (record == null) {
            throw new UnknownCourseException(courseId);
        }
        return record;
    }

    public boolean contains(String courseId) {
        return courses.containsKey(courseId);
    }

    public Set<String> ids() {
        return courses.keySet();
    }

    public Collection<CourseRecord> records() {
        return courses.values();
    }

    public int size() {
        return courses.size();
    }

    public boolean isEmpty() {
        return courses.isEmpty();
    }

    public Map<String, CourseRecord> asMap() {
        return courses;
    }
}
