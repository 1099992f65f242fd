package com.pdftranslator.backend.services.translation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Packs several segments into one request text separated by numbered marker lines, and splits
 * the translated reply back by the same markers.
 */
public final class SegmentCodec {

    static final String MARKER_EXAMPLE = "<<<1>>>";

    private static final Pattern MARKER = Pattern.compile("^\\s*<<<(\\d+)>>>\\s*$");

    private SegmentCodec() {
    }

    public static String encode(List<String> segments) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) sb.append('\n');
            sb.append("<<<").append(i + 1).append(">>>\n");
            sb.append(segments.get(i));
        }
        return sb.toString();
    }

    /**
     * Empty when the reply does not contain exactly the markers 1..expected in order.
     */
    public static Optional<List<String>> decode(String reply, int expected) {
        if (reply == null || expected <= 0) return Optional.empty();

        List<String> parts = new ArrayList<>();
        StringBuilder current = null;
        int next = 1;

        for (String line : reply.split("\\R", -1)) {
            Matcher m = MARKER.matcher(line);
            if (m.matches()) {
                int n;
                try {
                    n = Integer.parseInt(m.group(1));
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
                if (n != next) return Optional.empty();
                if (current != null) parts.add(current.toString().strip());
                current = new StringBuilder();
                next++;
                continue;
            }
            if (current == null) {
                // Text before the first marker is only acceptable for a single segment.
                if (line.isBlank()) continue;
                if (expected != 1) return Optional.empty();
                current = new StringBuilder();
                next = 2;
            }
            if (current.length() > 0) current.append('\n');
            current.append(line);
        }
        if (current != null) parts.add(current.toString().strip());

        if (parts.size() != expected) return Optional.empty();
        if (parts.stream().anyMatch(String::isBlank)) return Optional.empty();
        return Optional.of(parts);
    }
}
