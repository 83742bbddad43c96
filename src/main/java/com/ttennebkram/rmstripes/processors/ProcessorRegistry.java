package com.ttennebkram.rmstripes.processors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Modifier;
import java.util.*;

/**
 * Registry for RasterProcessor implementations.
 * Processors must be annotated with @ProcessorInfo to be registered.
 *
 * Usage:
 *   RasterProcessor processor = ProcessorRegistry.createProcessor("RemoveStripes");
 *   processor.deserializeProperties(json);
 *   Mat output = processor.process(input);
 */
public class ProcessorRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ProcessorRegistry.class);

    // Map from node type to processor class, in registration order
    private static final Map<String, Class<? extends RasterProcessor>> processorClasses = new LinkedHashMap<>();

    // Map from node type to its annotation
    private static final Map<String, ProcessorInfo> infos = new HashMap<>();

    // Initialization flag
    private static boolean initialized = false;

    /**
     * Register the built-in processors.
     * Safe to call multiple times - only initializes once.
     */
    public static synchronized void initialize() {
        if (initialized) return;

        add(RemoveStripesProcessor.class);
        add(FillMaskExpandProcessor.class);
        add(FillMaskNearestProcessor.class);

        initialized = true;
    }

    /**
     * Register a processor class under the node type of its @ProcessorInfo annotation.
     *
     * @throws IllegalArgumentException if the class is abstract, not annotated, or its node
     *                                  type is already taken by another class
     */
    public static synchronized void register(Class<? extends RasterProcessor> processorClass) {
        initialize();
        add(processorClass);
    }

    private static void add(Class<? extends RasterProcessor> processorClass) {
        if (Modifier.isAbstract(processorClass.getModifiers()) || processorClass.isInterface()) {
            throw new IllegalArgumentException(processorClass.getName() + " is not a concrete class");
        }
        ProcessorInfo info = processorClass.getAnnotation(ProcessorInfo.class);
        if (info == null) {
            throw new IllegalArgumentException(processorClass.getName() + " is missing @ProcessorInfo");
        }
        if (info.dualInput() != RasterDualInputProcessor.class.isAssignableFrom(processorClass)) {
            throw new IllegalArgumentException(processorClass.getName()
                    + ": dualInput must match whether it extends RasterDualInputProcessor");
        }

        String nodeType = info.nodeType();
        Class<? extends RasterProcessor> existing = processorClasses.get(nodeType);
        if (existing != null && existing != processorClass) {
            throw new IllegalArgumentException("Node type " + nodeType + " is already registered by " + existing.getName());
        }
        processorClasses.put(nodeType, processorClass);
        infos.put(nodeType, info);
        logger.debug("Registered processor {} ({})", nodeType, processorClass.getSimpleName());
    }

    /**
     * Check if a processor exists for the given node type.
     */
    public static boolean hasProcessor(String nodeType) {
        initialize();
        return processorClasses.containsKey(nodeType);
    }

    /**
     * Check if a node type is a dual-input processor.
     */
    public static boolean isDualInput(String nodeType) {
        initialize();
        ProcessorInfo info = infos.get(nodeType);
        return info != null && info.dualInput();
    }

    /**
     * Display name of a node type, falling back to the node type itself.
     */
    public static String getDisplayName(String nodeType) {
        initialize();
        ProcessorInfo info = infos.get(nodeType);
        if (info == null || info.displayName().isEmpty()) {
            return nodeType;
        }
        return info.displayName();
    }

    /**
     * Create a new processor instance for the given node type.
     * Returns null if no processor is registered for this type.
     */
    public static RasterProcessor createProcessor(String nodeType) {
        initialize();
        Class<? extends RasterProcessor> processorClass = processorClasses.get(nodeType);
        if (processorClass == null) {
            return null;
        }
        try {
            return processorClass.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Failed to create processor for " + nodeType, e);
        }
    }

    /**
     * Get all registered node types, in registration order.
     */
    public static Set<String> getRegisteredTypes() {
        initialize();
        return Collections.unmodifiableSet(processorClasses.keySet());
    }

    /**
     * Get the count of registered processors.
     */
    public static int getRegisteredCount() {
        initialize();
        return processorClasses.size();
    }
}
