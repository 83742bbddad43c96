package com.ttennebkram.rmstripes.processors;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.ttennebkram.rmstripes.ConfigurationException;
import org.opencv.core.Mat;

/**
 * Abstract base class for raster processors.
 * Provides common functionality and helper methods.
 */
public abstract class RasterProcessorBase implements RasterProcessor {

    /**
     * Standard null/empty check for input validation.
     * Call at the start of process() method.
     */
    protected void requireInput(Mat input) {
        if (input == null || input.empty()) {
            throw new ConfigurationException(getNodeType() + ": input image is empty");
        }
    }

    /**
     * Helper to safely get an int from JSON.
     */
    protected int getJsonInt(JsonObject json, String key, int defaultValue) {
        JsonElement value = get(json, key);
        return value != null ? value.getAsInt() : defaultValue;
    }

    /**
     * Helper to safely get an optional int from JSON; JSON null or a missing key gives the default.
     */
    protected Integer getJsonInteger(JsonObject json, String key, Integer defaultValue) {
        JsonElement value = get(json, key);
        return value != null ? Integer.valueOf(value.getAsInt()) : defaultValue;
    }

    /**
     * Helper to safely get a double from JSON.
     */
    protected double getJsonDouble(JsonObject json, String key, double defaultValue) {
        JsonElement value = get(json, key);
        return value != null ? value.getAsDouble() : defaultValue;
    }

    /**
     * Helper to safely get a boolean from JSON.
     */
    protected boolean getJsonBoolean(JsonObject json, String key, boolean defaultValue) {
        JsonElement value = get(json, key);
        return value != null ? value.getAsBoolean() : defaultValue;
    }

    /**
     * Helper to safely get a String from JSON.
     */
    protected String getJsonString(JsonObject json, String key, String defaultValue) {
        JsonElement value = get(json, key);
        return value != null ? value.getAsString() : defaultValue;
    }

    private JsonElement get(JsonObject json, String key) {
        if (json == null || !json.has(key) || json.get(key).isJsonNull()) {
            return null;
        }
        JsonElement value = json.get(key);
        if (!value.isJsonPrimitive()) {
            throw new ConfigurationException(getNodeType() + ": property '" + key + "' must be a plain value");
        }
        return value;
    }

    @Override
    public String toString() {
        JsonObject json = new JsonObject();
        serializeProperties(json);
        return getNodeType() + json;
    }
}
