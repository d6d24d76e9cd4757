package com.goodnews.core.render;

import org.json.JSONException;
import org.json.JSONObject;

import java.awt.Color;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * News templates keyed by type, read from the {@code news-templates.json} classpath resource.
 * <p>
 * Each template may override the {@code textBox} and {@code fontSizes} sections given under
 * {@code defaults}.
 */
public final class TemplateRegistry {
    static final String RESOURCE = "/news-templates.json";

    private final Map<String, NewsTemplate> templates;

    private TemplateRegistry(Map<String, NewsTemplate> templates) {
        this.templates = Collections.unmodifiableMap(templates);
    }

    public static TemplateRegistry loadDefault() {
        try (InputStream stream = TemplateRegistry.class.getResourceAsStream(RESOURCE)) {
            if (stream == null) {
                throw new IllegalStateException("Template resource not found on classpath: " + RESOURCE);
            }
            return fromJson(new String(stream.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read templates from " + RESOURCE + ": " + e.getMessage(), e);
        }
    }

    public static TemplateRegistry fromJson(String json) {
        try {
            JSONObject root = new JSONObject(json);
            JSONObject defaults = root.optJSONObject("defaults");
            if (defaults == null) {
                defaults = new JSONObject();
            }
            JSONObject entries = root.getJSONObject("templates");
            Map<String, NewsTemplate> templates = new LinkedHashMap<>();
            for (String type : entries.keySet()) {
                String key = type.toLowerCase(Locale.ROOT);
                templates.put(key, parseTemplate(key, entries.getJSONObject(type), defaults));
            }
            if (templates.isEmpty()) {
                throw new IllegalStateException("No news templates defined");
            }
            return new TemplateRegistry(templates);
        } catch (JSONException e) {
            throw new IllegalStateException("Malformed news template configuration: " + e.getMessage(), e);
        }
    }

    public NewsTemplate forType(String type) {
        NewsTemplate template = type == null ? null : templates.get(type.toLowerCase(Locale.ROOT));
        if (template == null) {
            throw new IllegalArgumentException("Unsupported news type: " + type);
        }
        return template;
    }

    public Set<String> types() {
        return templates.keySet();
    }

    private static NewsTemplate parseTemplate(String type, JSONObject node, JSONObject defaults) {
        JSONObject textBox = section("textBox", node, defaults);
        JSONObject fontSizes = section("fontSizes", node, defaults);
        return new NewsTemplate(
            type,
            node.getString("image"),
            parseColor(node.optString("fontColor", "#000000")),
            parseColor(node.optString("strokeColor", "#000000")),
            node.optInt("strokeWidth", 0),
            textBox.optDouble("widthRatio", 0.8),
            textBox.optDouble("heightRatio", 0.6),
            fontSizes.optInt("initial", 100),
            fontSizes.optInt("min", 20),
            fontSizes.optInt("step", 5)
        );
    }

    private static JSONObject section(String name, JSONObject node, JSONObject defaults) {
        JSONObject merged = new JSONObject();
        JSONObject base = defaults.optJSONObject(name);
        if (base != null) {
            base.keySet().forEach(key -> merged.put(key, base.get(key)));
        }
        JSONObject override = node.optJSONObject(name);
        if (override != null) {
            override.keySet().forEach(key -> merged.put(key, override.get(key)));
        }
        return merged;
    }

    private static Color parseColor(String hex) {
        try {
            return Color.decode(hex.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid color value: " + hex, e);
        }
    }
}
