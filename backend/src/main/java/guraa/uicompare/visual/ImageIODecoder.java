package guraa.uicompare.visual;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * {@link ImageDecoder} backed by the ImageIO readers available on the classpath (PNG, JPEG, GIF, BMP).
 */
@Slf4j
@Component
public class ImageIODecoder implements ImageDecoder {

    @Override
    public BufferedImage decode(byte[] imageBytes) throws ImageDecodeException {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new ImageDecodeException("Image data is empty");
        }

        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(imageBytes));
        } catch (IOException e) {
            throw new ImageDecodeException("Unreadable image data: " + e.getMessage(), e);
        }

        if (image == null) {
            throw new ImageDecodeException("Unsupported or corrupt image format (" + imageBytes.length + " bytes)");
        }
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new ImageDecodeException("Image has zero area");
        }

        log.debug("Decoded {}x{} image from {} bytes", image.getWidth(), image.getHeight(), imageBytes.length);
        return image;
    }
}
