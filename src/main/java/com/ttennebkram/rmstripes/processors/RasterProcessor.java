package com.ttennebkram.rmstripes.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.rmstripes.processing.ImageProcessor;
import org.opencv.core.Mat;

/**
 * Interface for self-contained raster processors.
 * Each processor encapsulates:
 * - Processing logic (delegating to the core transforms)
 * - Serialization/deserialization of its settings (JSON)
 */
public interface RasterProcessor {

    /**
     * Get the node type name (e.g., "RemoveStripes", "FillMaskExpand").
     * Must match the type name used in settings files.
     */
    String getNodeType();

    /**
     * Get the category for grouping (e.g., "Destripe", "Fill").
     */
    String getCategory();

    /**
     * Get a description of this processor for help output.
     */
    String getDescription();

    /**
     * Process an input image and return the result.
     *
     * @param input The input Mat (do not modify or release)
     * @return The processed output Mat (caller will release)
     */
    Mat process(Mat input);

    /**
     * Create an ImageProcessor lambda for use in a ProcessingPipeline.
     * Default implementation wraps the process() method.
     */
    default ImageProcessor createImageProcessor() {
        return this::process;
    }

    /**
     * Check if this processor has configurable properties.
     */
    default boolean hasProperties() {
        return true;
    }

    /**
     * Serialize processor-specific properties to JSON.
     * Called when saving a settings file.
     *
     * @param json The JSON object to add properties to
     */
    void serializeProperties(JsonObject json);

    /**
     * Deserialize processor-specific properties from JSON.
     * Missing keys leave the current value unchanged.
     *
     * @param json The JSON object to read properties from
     */
    void deserializeProperties(JsonObject json);
}
