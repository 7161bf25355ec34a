package com.phillippitts.freefleet.service.provider;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/** Lenient org.json accessors for provider payloads. */
final class JsonFields {

    private JsonFields() {}

    static String optString(JSONObject obj, String key) {
        if (!obj.has(key) || obj.isNull(key)) {
            return null;
        }
        String value = String.valueOf(obj.get(key));
        return value.isBlank() ? null : value;
    }

    static Integer optInt(JSONObject obj, String key) {
        if (!obj.has(key) || obj.isNull(key)) {
            return null;
        }
        Object value = obj.get(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.valueOf(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Parses every object of {@code body[arrayKey]} that has an {@code id}; other entries are skipped. */
    static <M> List<M> parseArray(String body, String arrayKey, Function<JSONObject, M> parser) {
        JSONObject root = new JSONObject(body);
        JSONArray arr = root.optJSONArray(arrayKey);
        if (arr == null) {
            return List.of();
        }
        List<M> models = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            JSONObject entry = arr.optJSONObject(i);
            if (entry != null && entry.has("id")) {
                models.add(parser.apply(entry));
            }
        }
        return models;
    }
}
