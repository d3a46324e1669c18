package app.mediarouter.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Extracts the rendered video's dimensions and duration from provider metadata.
 * Missing or malformed values fall back to the default resolution and the requested duration.
 */
final class GenerationMetadataReader {

    static final int DEFAULT_WIDTH = 1920;
    static final int DEFAULT_HEIGHT = 1080;

    private GenerationMetadataReader() {
    }

    record VideoDimensions(int width, int height, double durationSeconds) {
        String resolution() {
            return width + "x" + height;
        }
    }

    static VideoDimensions read(JsonNode metadata, double requestedDuration) {
        int width = DEFAULT_WIDTH;
        int height = DEFAULT_HEIGHT;
        double duration = requestedDuration;
        if (metadata == null || !metadata.isObject()) {
            return new VideoDimensions(width, height, duration);
        }

        Integer w = positiveInt(metadata.get("width"));
        Integer h = positiveInt(metadata.get("height"));
        if (w != null && h != null) {
            width = w;
            height = h;
        } else {
            int[] parsed = parseSize(text(metadata, "size"));
            if (parsed == null) {
                parsed = parseSize(text(metadata, "resolution"));
            }
            if (parsed != null) {
                width = parsed[0];
                height = parsed[1];
            }
        }

        Double seconds = positiveDouble(metadata.get("duration"));
        if (seconds == null) {
            seconds = positiveDouble(metadata.get("seconds"));
        }
        if (seconds != null) {
            duration = seconds;
        }
        return new VideoDimensions(width, height, duration);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static int[] parseSize(String value) {
        if (value == null) {
            return null;
        }
        String[] parts = value.trim().toLowerCase().split("x");
        if (parts.length != 2) {
            return null;
        }
        try {
            int w = Integer.parseInt(parts[0].trim());
            int h = Integer.parseInt(parts[1].trim());
            return w > 0 && h > 0 ? new int[]{w, h} : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static Integer positiveInt(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            int value = node.asInt();
            return value > 0 ? value : null;
        }
        if (node.isTextual()) {
            try {
                int value = Integer.parseInt(node.asText().trim());
                return value > 0 ? value : null;
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    private static Double positiveDouble(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            double value = node.asDouble();
            return value > 0 ? value : null;
        }
        if (node.isTextual()) {
            try {
                double value = Double.parseDouble(node.asText().trim());
                return value > 0 ? value : null;
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }
}
