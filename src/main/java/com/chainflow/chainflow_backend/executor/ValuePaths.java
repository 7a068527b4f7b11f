package com.chainflow.chainflow_backend.executor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Walks Map/List trees (as produced by Jackson) by path.
 * Accepts {@code $.user.tags[0]}, {@code user.tags.0} and {@code $['user']} forms; {@code $} is the root.
 */
public final class ValuePaths {

    private static final Pattern SEGMENT = Pattern.compile("\\[(\\d+)]|\\['([^']*)']|\\[\"([^\"]*)\"]|([^.\\[\\]]+)");

    private ValuePaths() {}

    /** Value at the path, or null if any step is missing. */
    public static Object extract(Object root, String path) {
        if (path == null || path.isBlank()) return root;
        Object current = root;
        for (String seg : segments(path)) {
            if (current == null) return null;
            if (current instanceof Map<?, ?> map) {
                current = map.get(seg);
            } else if (current instanceof List<?> list && seg.matches("\\d+")) {
                int idx = Integer.parseInt(seg);
                if (idx >= list.size()) return null;
                current = list.get(idx);
            } else {
                return null;
            }
        }
        return current;
    }

    static List<String> segments(String path) {
        String p = path.trim();
        if (p.startsWith("$")) p = p.substring(1);
        List<String> segments = new ArrayList<>();
        Matcher m = SEGMENT.matcher(p);
        while (m.find()) {
            for (int g = 1; g <= 4; g++) {
                if (m.group(g) != null) {
                    segments.add(m.group(g).trim());
                    break;
                }
            }
        }
        return segments;
    }
}
