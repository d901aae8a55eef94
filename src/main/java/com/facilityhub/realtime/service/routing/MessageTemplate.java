package com.facilityhub.realtime.service.routing;

import com.facilityhub.realtime.model.domain.ChangeEvent;
import com.facilityhub.realtime.model.domain.ChangeEvent.RowSide;

import java.util.ArrayList;
import java.util.List;

/**
 * Text with row placeholders. {@code {new.title}} reads the new row,
 * {@code {old.justice}} the old row, and {@code {new.justice|Unassigned}} falls
 * back to the text after the bar when the value is missing or blank. Dotted
 * paths walk into nested maps.
 */
public final class MessageTemplate {

    private final String source;
    private final List<Segment> segments;

    private MessageTemplate(String source, List<Segment> segments) {
        this.source = source;
        this.segments = segments;
    }

    public static MessageTemplate of(String source) {
        if (source == null) {
            throw new IllegalArgumentException("Template source must not be null");
        }
        return new MessageTemplate(source, parse(source));
    }

    public String render(ChangeEvent event) {
        StringBuilder out = new StringBuilder();
        for (Segment segment : segments) {
            out.append(segment.render(event));
        }
        return out.toString();
    }

    public String source() {
        return source;
    }

    private static List<Segment> parse(String source) {
        List<Segment> segments = new ArrayList<>();
        int pos = 0;
        while (pos < source.length()) {
            int open = source.indexOf('{', pos);
            if (open < 0) {
                segments.add(new Literal(source.substring(pos)));
                break;
            }
            int close = source.indexOf('}', open);
            if (close < 0) {
                throw new IllegalArgumentException("Unclosed placeholder in template: " + source);
            }
            if (open > pos) {
                segments.add(new Literal(source.substring(pos, open)));
            }
            segments.add(Placeholder.parse(source.substring(open + 1, close), source));
            pos = close + 1;
        }
        return List.copyOf(segments);
    }

    @Override
    public String toString() {
        return source;
    }

    private interface Segment {
        String render(ChangeEvent event);
    }

    private record Literal(String text) implements Segment {
        @Override
        public String render(ChangeEvent event) {
            return text;
        }
    }

    private record Placeholder(RowSide side, String path, String fallback) implements Segment {

        static Placeholder parse(String expression, String source) {
            String fallback = "";
            int bar = expression.indexOf('|');
            if (bar >= 0) {
                fallback = expression.substring(bar + 1);
                expression = expression.substring(0, bar);
            }
            int dot = expression.indexOf('.');
            if (dot < 0) {
                throw new IllegalArgumentException("Placeholder {" + expression + "} needs a row prefix in: " + source);
            }
            RowSide side = switch (expression.substring(0, dot)) {
                case "new" -> RowSide.NEW;
                case "old" -> RowSide.OLD;
                default -> throw new IllegalArgumentException(
                        "Placeholder {" + expression + "} must start with new. or old. in: " + source);
            };
            return new Placeholder(side, expression.substring(dot + 1), fallback);
        }

        @Override
        public String render(ChangeEvent event) {
            Object value = event.value(side, path);
            if (value == null) {
                return fallback;
            }
            String text = String.valueOf(value);
            return text.isBlank() ? fallback : text;
        }
    }
}
