package com.clusterops.command.lookup;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Location inside a command document: {@code /}-separated segments, e.g. {@code ambariLevelParams/java_home}.
 * Empty segments are dropped, so {@code /a//b/} and {@code a/b} address the same node.
 */
public final class FieldPath {

    private static final String SEPARATOR = "/";

    private final List<String> segments;

    private FieldPath(List<String> segments) {
        this.segments = List.copyOf(segments);
    }

    /**
     * Parses a slash-delimited path.
     *
     * @param path the path string; must not be null
     * @return the parsed path (no segments for an empty or all-slash string)
     */
    public static FieldPath of(String path) {
        Objects.requireNonNull(path, "path");
        List<String> parts = new ArrayList<>();
        for (String s : path.split(SEPARATOR)) {
            if (!s.isEmpty()) parts.add(s);
        }
        return new FieldPath(parts);
    }

    /**
     * Path made of literal segments. Segments are not split, so keys containing {@code /} can be addressed.
     * Empty segments are still dropped.
     */
    public static FieldPath ofSegments(String... segments) {
        List<String> parts = new ArrayList<>();
        for (String s : segments) {
            if (s != null && !s.isEmpty()) parts.add(s);
        }
        return new FieldPath(parts);
    }

    public List<String> getSegments() {
        return segments;
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return segments.equals(((FieldPath) o).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return String.join(SEPARATOR, segments);
    }
}
