package com.ttennebkram.rmstripes.io;

import com.ttennebkram.rmstripes.ConfigurationException;
import com.ttennebkram.rmstripes.util.MatUtils;
import org.opencv.core.Core;
import org.opencv.core.CvException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.File;
import java.io.IOException;

/**
 * Reads single bands from raster files and writes single-band float results,
 * using the OpenCV codecs.
 *
 * Bands are numbered from 1 in the channel order OpenCV stores them in
 * (for 3-channel 8-bit images that is B, G, R).
 */
public final class RasterIO {

    private RasterIO() {
    }

    /**
     * Read one band as CV_64F.
     *
     * @param band 1-based band index
     * @throws IOException            if the file is missing or cannot be decoded
     * @throws ConfigurationException if the file has no such band
     */
    public static Mat readBand(File file, int band) throws IOException {
        Mat raw = read(file);
        try {
            Mat channel = extractBand(raw, band, file);
            Mat output = MatUtils.toDouble(channel);
            if (channel != raw) {
                channel.release();
            }
            return output;
        } finally {
            raw.release();
        }
    }

    /**
     * Read one band of a mask file. Pixels equal to 1 are invalid; every other value is valid.
     *
     * @return CV_8UC1 mask, 255 where invalid
     */
    public static Mat readMask(File file, int band) throws IOException {
        Mat raw = read(file);
        try {
            Mat channel = extractBand(raw, band, file);
            Mat mask = new Mat();
            Core.compare(channel, new Scalar(1), mask, Core.CMP_EQ);
            if (channel != raw) {
                channel.release();
            }
            return mask;
        } finally {
            raw.release();
        }
    }

    /**
     * Write a single-band image as 32-bit float. The file format follows the extension
     * and must be one that stores float samples, such as .tif.
     */
    public static void write(File file, Mat image) throws IOException {
        MatUtils.requireSingleChannel(image);
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.isDirectory()) {
            throw new IOException("Output directory does not exist: " + parent);
        }

        Mat floats = new Mat();
        try {
            image.convertTo(floats, CvType.CV_32F);
            boolean written = Imgcodecs.imwrite(file.getPath(), floats);
            if (!written) {
                throw new IOException("Failed to write " + file);
            }
        } catch (CvException e) {
            throw new IOException("Failed to write " + file + ": " + e.getMessage(), e);
        } finally {
            floats.release();
        }
    }

    private static Mat read(File file) throws IOException {
        if (!file.isFile()) {
            throw new IOException("No such file: " + file);
        }
        Mat raw = Imgcodecs.imread(file.getPath(), Imgcodecs.IMREAD_UNCHANGED);
        if (raw.empty()) {
            raw.release();
            throw new IOException("Cannot decode image: " + file);
        }
        return raw;
    }

    private static Mat extractBand(Mat raw, int band, File file) {
        int channels = raw.channels();
        if (band < 1 || band > channels) {
            throw new ConfigurationException(String.format(
                    "Band %d does not exist in %s (%d band%s)", band, file, channels, channels == 1 ? "" : "s"));
        }
        if (channels == 1) {
            return raw;
        }
        Mat channel = new Mat();
        Core.extractChannel(raw, channel, band - 1);
        return channel;
    }
}
