package com.tabletop.workstation.game;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Typed reads over the {@code data} object of an inbound frame. Anything malformed is an
 * {@link ErrorKind#INVALID_ACTION}.
 */
class ActionPayload {

    private final JsonNode data;

    ActionPayload(JsonNode data) {
        this.data = data;
    }

    boolean has(String field) {
        return data != null && data.has(field);
    }

    private JsonNode field(String field) {
        if (data == null) {
            return null;
        }
        JsonNode node = data.get(field);
        return node == null || node.isNull() ? null : node;
    }

    String requireText(String field) {
        String value = optionalText(field);
        if (value == null || value.isBlank()) {
            throw GameException.invalidAction("Field '" + field + "' is required");
        }
        return value;
    }

    String optionalText(String field) {
        JsonNode node = field(field);
        if (node == null) {
            return null;
        }
        if (!node.isValueNode()) {
            throw GameException.invalidAction("Field '" + field + "' must be a string");
        }
        return node.asText();
    }

    String textOr(String field, String fallback) {
        String value = optionalText(field);
        return value == null || value.isBlank() ? fallback : value;
    }

    Integer optionalInt(String field) {
        JsonNode node = field(field);
        if (node == null) {
            return null;
        }
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            return node.intValue();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                throw GameException.invalidAction("Field '" + field + "' must be an integer");
            }
        }
        throw GameException.invalidAction("Field '" + field + "' must be an integer");
    }

    int requireInt(String field) {
        Integer value = optionalInt(field);
        if (value == null) {
            throw GameException.invalidAction("Field '" + field + "' is required");
        }
        return value;
    }

    int intOr(String field, int fallback) {
        Integer value = optionalInt(field);
        return value == null ? fallback : value;
    }

    /**
     * Board coordinates may arrive as fractional pixels from drag and drop; they are rounded.
     */
    Integer optionalCoordinate(String field) {
        JsonNode node = field(field);
        if (node == null) {
            return null;
        }
        if (!node.isNumber()) {
            throw GameException.invalidAction("Field '" + field + "' must be a number");
        }
        return (int) Math.round(node.asDouble());
    }

    int requireCoordinate(String field) {
        Integer value = optionalCoordinate(field);
        if (value == null) {
            throw GameException.invalidAction("Field '" + field + "' is required");
        }
        return value;
    }
}
