package com.ttennebkram.rmstripes.processors;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation for RasterProcessor classes to declare their metadata.
 * The ProcessorRegistry reads it when a class is registered.
 *
 * Example usage:
 * <pre>
 * {@literal @}ProcessorInfo(
 *     nodeType = "RemoveStripes",
 *     displayName = "Remove Stripes",
 *     category = "Destripe"
 * )
 * public class RemoveStripesProcessor extends RasterProcessorBase { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface ProcessorInfo {

    /**
     * The node type name used in settings files.
     */
    String nodeType();

    /**
     * Display name for help output. If empty, defaults to nodeType.
     */
    String displayName() default "";

    String category();

    /**
     * Whether this processor needs a mask as second input.
     * Dual-input processors extend RasterDualInputProcessor.
     */
    boolean dualInput() default false;
}
