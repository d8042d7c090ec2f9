package com.example.inkbatch;

import com.example.inkbatch.error.MalformedImageException;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;

/**
 * Decodes source images and encodes results as PNG at a configured compression level.
 */
public class ImageCodec {
    public static final String OUTPUT_EXTENSION = ".png";

    public BufferedImage read(Path path) throws IOException, MalformedImageException {
        return decode(Files.readAllBytes(path), path.toString());
    }

    public BufferedImage decode(byte[] data, String source) throws IOException, MalformedImageException {
        try (ByteArrayInputStream input = new ByteArrayInputStream(data)) {
            BufferedImage image = ImageIO.read(input);
            if (image == null) {
                throw new MalformedImageException(source);
            }
            return image;
        }
    }

    /**
     * @param level deflate level from 1 (fastest) to 9 (smallest)
     */
    public byte[] encode(BufferedImage image, int level) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("png");
        if (!writers.hasNext()) {
            throw new IOException("No PNG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ImageOutputStream output = ImageIO.createImageOutputStream(bytes)) {
            writer.setOutput(output);
            ImageWriteParam param = writer.getDefaultWriteParam();
            if (param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                if (param.getCompressionType() == null && param.getCompressionTypes() != null) {
                    param.setCompressionType(param.getCompressionTypes()[0]);
                }
                // The PNG writer truncates 9 * (1 - quality) to pick its deflate level.
                param.setCompressionQuality(Math.max(0.0f, (8.5f - level) / 9.0f));
            }
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        return bytes.toByteArray();
    }

    /**
     * Writes through a sibling temp file so a failed write never leaves a partial output behind.
     */
    public void write(Path destination, byte[] data) throws IOException {
        Path parent = destination.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, ".ink-", ".tmp");
        try {
            Files.write(temp, data);
            Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    public static String outputName(String name) {
        int dot = name.lastIndexOf('.');
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        String stem = dot > slash ? name.substring(0, dot) : name;
        return stem + OUTPUT_EXTENSION;
    }
}
