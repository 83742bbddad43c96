package com.ttennebkram.rmstripes.fill;

import com.ttennebkram.rmstripes.ConfigurationException;
import com.ttennebkram.rmstripes.util.MatUtils;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Assigns every masked pixel the value of its nearest unmasked pixel.
 *
 * Uses the labelled distance transform: every unmasked pixel gets its own label and
 * every masked pixel inherits the label of the closest unmasked one under a 5x5
 * chamfer approximation of the Euclidean distance.
 */
public class NearestNeighborFill {

    public Mat fill(MaskedImage maskedImage) {
        int rows = maskedImage.rows();
        int cols = maskedImage.cols();
        double[] values = maskedImage.values();
        boolean[] mask = maskedImage.mask();

        if (maskedImage.maskedCount() == mask.length) {
            throw new ConfigurationException("Mask leaves no valid pixel to copy values from");
        }

        // distanceTransform measures the distance to the nearest zero pixel: zero = valid
        Mat source = MatUtils.fromBooleanArray(mask, rows, cols);
        Mat distances = new Mat();
        Mat labels = new Mat();
        int[] labelData = new int[values.length];
        try {
            Imgproc.distanceTransformWithLabels(source, distances, labels,
                    Imgproc.DIST_L2, Imgproc.DIST_MASK_5, Imgproc.DIST_LABEL_PIXEL);
            if (labels.type() != CvType.CV_32S) {
                throw new IllegalStateException("Unexpected label type " + CvType.typeToString(labels.type()));
            }
            labels.get(0, 0, labelData);
        } finally {
            MatUtils.release(source, distances, labels);
        }

        int maxLabel = 0;
        for (int label : labelData) {
            maxLabel = Math.max(maxLabel, label);
        }
        double[] valueByLabel = new double[maxLabel + 1];
        for (int i = 0; i < values.length; i++) {
            if (!mask[i]) {
                valueByLabel[labelData[i]] = values[i];
            }
        }

        double[] output = values.clone();
        for (int i = 0; i < output.length; i++) {
            if (mask[i]) {
                output[i] = valueByLabel[labelData[i]];
            }
        }
        return MatUtils.fromDoubleArray(output, rows, cols);
    }
}
