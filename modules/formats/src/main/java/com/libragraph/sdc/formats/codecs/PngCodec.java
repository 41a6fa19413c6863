package com.libragraph.sdc.formats.codecs;

import com.libragraph.sdc.formats.api.CodecException;
import com.libragraph.sdc.formats.api.ItemCodec;
import com.libragraph.sdc.util.ContentHash;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.security.MessageDigest;

/**
 * Codec for PNG images (.png), backed by {@link ImageIO}.
 * Only registered when the runtime ships {@code java.desktop}.
 */
public class PngCodec implements ItemCodec<BufferedImage> {

    /**
     * Returns true if ImageIO is present and can write PNG.
     */
    public static boolean isSupported() {
        try {
            Class.forName("javax.imageio.ImageIO");
            return ImageIO.getImageWritersByFormatName("png").hasNext();
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }

    @Override
    public Class<BufferedImage> valueType() {
        return BufferedImage.class;
    }

    @Override
    public byte[] encode(BufferedImage value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(value, "png", out)) {
                throw new CodecException("No PNG writer for image type " + value.getType());
            }
        } catch (IOException e) {
            throw new CodecException("Failed to encode PNG", e);
        }
        return out.toByteArray();
    }

    @Override
    public BufferedImage decode(byte[] data) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(data));
            if (image == null) {
                throw new CodecException("Not a readable PNG image");
            }
            return image;
        } catch (IOException e) {
            throw new CodecException("Failed to decode PNG", e);
        }
    }

    /**
     * Digests dimensions and ARGB pixels, so the same image compressed
     * differently hashes identically.
     */
    @Override
    public ContentHash hash(byte[] data) {
        BufferedImage image = decode(data);
        int width = image.getWidth();
        int height = image.getHeight();
        MessageDigest md = ContentHash.newDigest();
        md.update(ByteBuffer.allocate(8).putInt(width).putInt(height).array());

        int[] row = new int[width];
        ByteBuffer rowBytes = ByteBuffer.allocate(width * 4);
        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            rowBytes.clear();
            rowBytes.asIntBuffer().put(row);
            md.update(rowBytes.array());
        }
        return new ContentHash(md.digest());
    }
}
