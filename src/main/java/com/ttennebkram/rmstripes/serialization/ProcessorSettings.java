package com.ttennebkram.rmstripes.serialization;

import com.google.gson.*;
import com.ttennebkram.rmstripes.processors.ProcessorRegistry;
import com.ttennebkram.rmstripes.processors.RasterProcessor;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Processor settings stored as JSON, one entry per processor type:
 * <pre>
 * {
 *   "processors": [
 *     { "type": "RemoveStripes", "properties": { "wavelet": "db10", "level": 6, "sigma": 10.0 } }
 *   ]
 * }
 * </pre>
 */
public class ProcessorSettings {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    // Node type to its properties, in file order
    private final Map<String, JsonObject> properties = new LinkedHashMap<>();

    /**
     * Store the current properties of a processor, replacing an earlier entry of the same type.
     */
    public void put(RasterProcessor processor) {
        JsonObject json = new JsonObject();
        processor.serializeProperties(json);
        properties.put(processor.getNodeType(), json);
    }

    /**
     * Configure a processor from the stored entry of its type.
     *
     * @return true if an entry existed
     */
    public boolean applyTo(RasterProcessor processor) {
        JsonObject json = properties.get(processor.getNodeType());
        if (json == null) {
            return false;
        }
        processor.deserializeProperties(json);
        return true;
    }

    public boolean has(String nodeType) {
        return properties.containsKey(nodeType);
    }

    public Set<String> getTypes() {
        return Collections.unmodifiableSet(properties.keySet());
    }

    public String toJson() {
        JsonObject root = new JsonObject();
        JsonArray processors = new JsonArray();
        for (Map.Entry<String, JsonObject> entry : properties.entrySet()) {
            JsonObject processorJson = new JsonObject();
            processorJson.addProperty("type", entry.getKey());
            processorJson.add("properties", entry.getValue().deepCopy());
            processors.add(processorJson);
        }
        root.add("processors", processors);
        return GSON.toJson(root);
    }

    /**
     * Save settings to a JSON file.
     */
    public void save(File file) throws IOException {
        try (Writer writer = new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8)) {
            writer.write(toJson());
        }
    }

    /**
     * Load settings from a JSON file.
     *
     * @throws IOException if the file cannot be read, is not valid JSON, or names a
     *                     processor type that is not registered
     */
    public static ProcessorSettings load(File file) throws IOException {
        try (Reader reader = new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8)) {
            return parse(reader, file.getPath());
        }
    }

    static ProcessorSettings parse(Reader reader, String source) throws IOException {
        JsonObject root;
        try {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (parsed == null || !parsed.isJsonObject()) {
                throw new IOException("Invalid settings file " + source + ": not a JSON object");
            }
            root = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IOException("Invalid settings file " + source + ": " + e.getMessage(), e);
        }

        // Validate this looks like a settings file
        if (!root.has("processors") || !root.get("processors").isJsonArray()) {
            throw new IOException("Invalid settings file " + source + ": missing 'processors' array");
        }

        ProcessorSettings settings = new ProcessorSettings();
        for (JsonElement elem : root.getAsJsonArray("processors")) {
            if (!elem.isJsonObject() || !elem.getAsJsonObject().has("type")) {
                throw new IOException("Invalid settings file " + source + ": processor entry without 'type'");
            }
            JsonObject processorJson = elem.getAsJsonObject();
            String type = processorJson.get("type").getAsString();
            if (!ProcessorRegistry.hasProcessor(type)) {
                throw new IOException("Invalid settings file " + source + ": unknown processor type '" + type + "'");
            }

            JsonObject props = new JsonObject();
            if (processorJson.has("properties")) {
                JsonElement propsElem = processorJson.get("properties");
                if (!propsElem.isJsonObject()) {
                    throw new IOException("Invalid settings file " + source + ": properties of " + type + " must be an object");
                }
                props = propsElem.getAsJsonObject();
            }
            settings.properties.put(type, props);
        }
        return settings;
    }
}
