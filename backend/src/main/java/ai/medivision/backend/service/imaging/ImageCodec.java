package ai.medivision.backend.service.imaging;

import ai.medivision.backend.service.exception.ImageDecodeException;
import ai.medivision.backend.service.exception.ImageProcessingException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Converts between encoded image bytes and {@link ImageBuffer}s.
 *
 * Images with a single colour component decode to a one-channel buffer (higher bit
 * depths are scaled down to 8 bits); everything else decodes to RGB with alpha dropped.
 * Output is always PNG.
 */
@Component
public class ImageCodec {

    private static final Logger logger = LoggerFactory.getLogger(ImageCodec.class);

    private static final String OUTPUT_FORMAT = "png";

    /**
     * Decodes raw bytes into a pixel buffer.
     *
     * @param imageBytes encoded image (PNG, JPEG, BMP, GIF, ...)
     * @return the decoded buffer
     * @throws ImageDecodeException if the bytes are empty or not a readable image
     */
    public ImageBuffer decode(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new ImageDecodeException("Image bytes are null or empty");
        }

        BufferedImage image;
        try (ByteArrayInputStream in = new ByteArrayInputStream(imageBytes)) {
            image = ImageIO.read(in);
        } catch (IOException e) {
            throw new ImageDecodeException("Failed to read image bytes: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // Some ImageIO readers fail on corrupt input with unchecked exceptions
            throw new ImageDecodeException("Corrupt image data: " + e.getMessage(), e);
        }

        if (image == null) {
            throw new ImageDecodeException("Unsupported or corrupt image format");
        }

        ImageBuffer buffer = image.getColorModel().getNumColorComponents() == 1
                ? readGray(image)
                : readRgb(image);
        logger.debug("Decoded {} image bytes into {}", imageBytes.length, buffer);
        return buffer;
    }

    /**
     * Encodes a buffer as PNG.
     *
     * @throws ImageProcessingException if no PNG writer is available or writing fails
     */
    public byte[] encodePng(ImageBuffer buffer) {
        int width = buffer.getWidth();
        int height = buffer.getHeight();
        BufferedImage image = new BufferedImage(width, height,
                buffer.isColor() ? BufferedImage.TYPE_INT_RGB : BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = image.getRaster();
        raster.setPixels(0, 0, width, height, buffer.samples());

        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, OUTPUT_FORMAT, out)) {
                throw new ImageProcessingException("No ImageIO writer available for " + OUTPUT_FORMAT);
            }
            byte[] encoded = out.toByteArray();
            logger.debug("Encoded {} as {} bytes of {}", buffer, encoded.length, OUTPUT_FORMAT);
            return encoded;
        } catch (IOException e) {
            throw new ImageProcessingException("Failed to encode image as " + OUTPUT_FORMAT, e);
        }
    }

    private ImageBuffer readGray(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        Raster raster = image.getRaster();
        int bits = raster.getSampleModel().getSampleSize(0);
        int max = (1 << bits) - 1;

        int[] samples = raster.getSamples(0, 0, width, height, 0, new int[width * height]);
        if (max != ImageBuffer.MAX_SAMPLE) {
            for (int i = 0; i < samples.length; i++) {
                samples[i] = (int) Math.round(samples[i] * (double) ImageBuffer.MAX_SAMPLE / max);
            }
        }
        return ImageBuffer.wrap(width, height, 1, samples);
    }

    private ImageBuffer readRgb(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] argb = image.getRGB(0, 0, width, height, null, 0, width);
        int[] samples = new int[width * height * 3];
        for (int i = 0; i < argb.length; i++) {
            samples[i * 3] = (argb[i] >> 16) & 0xFF;
            samples[i * 3 + 1] = (argb[i] >> 8) & 0xFF;
            samples[i * 3 + 2] = argb[i] & 0xFF;
        }
        return ImageBuffer.wrap(width, height, 3, samples);
    }
}
