package org.learningjava.photosearch.domain.service.image;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.learningjava.photosearch.domain.error.ImageReadException;
import org.learningjava.photosearch.domain.model.photo.CanonicalImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

/**
 * Turns raw image bytes into the canonical transport form sent to the provider:
 * 8-bit colour without alpha, longer edge at most {@value #MAX_EDGE} pixels, PNG, Base64.
 */
@Component
public class ImagePreprocessor {

    private static final Logger log = LoggerFactory.getLogger(ImagePreprocessor.class);

    public static final int MAX_EDGE = 1024;

    public CanonicalImage normalize(Path file) {
        byte[] raw;
        try {
            raw = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new ImageReadException("Cannot read image " + file + ": " + e.getMessage(), e);
        }
        return normalize(raw);
    }

    public CanonicalImage normalize(byte[] raw) {
        if (raw == null || raw.length == 0) {
            throw new ImageReadException("Empty image data");
        }

        Mat decoded = decode(raw);
        try {
            if (decoded.empty()) {
                throw new ImageReadException("Unsupported or corrupt image data (" + raw.length + " bytes)");
            }

            Mat bgr = toBgr8(decoded);
            try {
                int[] target = scaledSize(bgr.cols(), bgr.rows(), MAX_EDGE);
                Mat sized = new Mat();
                try {
                    if (target[0] == bgr.cols() && target[1] == bgr.rows()) {
                        bgr.copyTo(sized);
                    } else {
                        opencv_imgproc.resize(bgr, sized, new Size(target[0], target[1]),
                                0, 0, opencv_imgproc.INTER_AREA);
                    }

                    byte[] png = encodePng(sized);
                    if (log.isDebugEnabled()) {
                        log.debug("Normalized image {}x{} -> {}x{} ({} bytes png)",
                                decoded.cols(), decoded.rows(), sized.cols(), sized.rows(), png.length);
                    }
                    return new CanonicalImage(Base64.getEncoder().encodeToString(png), sized.cols(), sized.rows());
                } finally {
                    sized.release();
                }
            } finally {
                bgr.release();
            }
        } finally {
            decoded.release();
        }
    }

    /** Target {width, height} with the longer edge fitted to {@code maxEdge}; smaller images keep their size. */
    static int[] scaledSize(int width, int height, int maxEdge) {
        int longer = Math.max(width, height);
        if (longer <= maxEdge) {
            return new int[]{width, height};
        }
        double scale = (double) maxEdge / longer;
        return new int[]{
                Math.max(1, (int) Math.round(width * scale)),
                Math.max(1, (int) Math.round(height * scale))
        };
    }

    private static Mat decode(byte[] raw) {
        BytePointer data = new BytePointer(raw);
        Mat buf = new Mat(1, raw.length, opencv_core.CV_8UC1, data);
        try {
            return opencv_imgcodecs.imdecode(buf, opencv_imgcodecs.IMREAD_UNCHANGED);
        } catch (RuntimeException e) {
            // cv::Exception from the native decoder
            throw new ImageReadException("Cannot decode image: " + e.getMessage(), e);
        } finally {
            buf.release();
            data.close();
        }
    }

    // OpenCV keeps colour as BGR; imencode writes it back out as RGB
    private static Mat toBgr8(Mat src) {
        Mat depth8 = new Mat();
        if (src.depth() == opencv_core.CV_8U) {
            src.copyTo(depth8);
        } else {
            double alpha = src.depth() == opencv_core.CV_16U ? 1.0 / 257.0 : 1.0;
            src.convertTo(depth8, opencv_core.CV_8U, alpha, 0.0);
        }

        int channels = depth8.channels();
        if (channels == 3) {
            return depth8;
        }
        if (channels != 1 && channels != 4) {
            depth8.release();
            throw new ImageReadException("Unsupported channel count: " + channels);
        }
        int code = channels == 1 ? opencv_imgproc.COLOR_GRAY2BGR : opencv_imgproc.COLOR_BGRA2BGR;
        Mat bgr = new Mat();
        try {
            opencv_imgproc.cvtColor(depth8, bgr, code);
        } finally {
            depth8.release();
        }
        return bgr;
    }

    private static byte[] encodePng(Mat image) {
        BytePointer out = new BytePointer();
        try {
            if (!opencv_imgcodecs.imencode(".png", image, out)) {
                throw new ImageReadException("Cannot encode image as PNG");
            }
            byte[] png = new byte[(int) out.capacity()];
            out.get(png);
            return png;
        } finally {
            out.close();
        }
    }
}
