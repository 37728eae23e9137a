package org.janelia.focusstack.client;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.io.Opener;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.FileImageOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads focus stack source images from a directory and writes fused results.
 */
public class StackImageIO {

    public static final String JPEG_FORMAT = "jpg";
    public static final String PNG_FORMAT = "png";
    public static final String TIFF_FORMAT = "tiff";
    public static final String TIF_FORMAT = "tif";

    private StackImageIO() {
    }

    /**
     * @return all visible regular files in the directory sorted by name.
     *
     * @throws IOException
     *   if the directory cannot be listed.
     */
    public static List<File> listImageFiles(final File stackDirectory)
            throws IOException {
        final File[] files = stackDirectory.listFiles(file -> file.isFile() && (! file.isHidden()));
        if (files == null) {
            throw new IOException("failed to list files in " + stackDirectory.getAbsolutePath());
        }
        Arrays.sort(files);
        return Arrays.asList(files);
    }

    /**
     * Opens each file with ImageJ.  Files ImageJ cannot open are skipped.
     *
     * @return processors for all files that could be opened (in file order).
     */
    public static List<ImageProcessor> openProcessors(final List<File> files) {
        final Opener opener = new Opener();
        final List<ImageProcessor> processors = new ArrayList<>(files.size());
        for (final File file : files) {
            final ImagePlus imagePlus = opener.openImage(file.getAbsolutePath());
            if (imagePlus == null) {
                LOG.warn("openProcessors: skipping {} because it cannot be opened as an image", file);
            } else {
                processors.add(imagePlus.getProcessor());
            }
        }
        return processors;
    }

    /**
     * Saves the image in the format implied by the target file's extension.
     *
     * @param  quality  JPEG compression quality in [0, 1] (ignored for other formats).
     *
     * @throws IOException
     *   if the image cannot be written.
     */
    public static void saveImage(final ColorProcessor image,
                                 final File toFile,
                                 final float quality)
            throws IOException {

        final File parentDirectory = toFile.getAbsoluteFile().getParentFile();
        if ((parentDirectory != null) && (! parentDirectory.exists()) && (! parentDirectory.mkdirs())) {
            throw new IOException("failed to create directory " + parentDirectory.getAbsolutePath());
        }

        final String format = getFormat(toFile);
        if (TIFF_FORMAT.equals(format) || TIF_FORMAT.equals(format)) {
            final FileSaver fileSaver = new FileSaver(new ImagePlus(toFile.getName(), image));
            if (! fileSaver.saveAsTiff(toFile.getAbsolutePath())) {
                throw new IOException("failed to save " + toFile.getAbsolutePath());
            }
        } else {
            writeImage(image.getBufferedImage(), format, quality, toFile);
        }

        LOG.info("saveImage: exit, saved {}", toFile.getAbsolutePath());
    }

    static String getFormat(final File file) {
        final String name = file.getName();
        final int dotIndex = name.lastIndexOf('.');
        if (dotIndex < 0) {
            throw new IllegalArgumentException("cannot derive image format for " + file.getAbsolutePath());
        }
        final String format = name.substring(dotIndex + 1).toLowerCase();
        return "jpeg".equals(format) ? JPEG_FORMAT : format;
    }

    private static void writeImage(final BufferedImage image,
                                   final String format,
                                   final float quality,
                                   final File toFile)
            throws IOException {

        final Iterator<ImageWriter> writersForFormat = ImageIO.getImageWritersByFormatName(format);
        if ((writersForFormat == null) || (! writersForFormat.hasNext())) {
            throw new IOException("no ImageIO writers exist for the '" + format + "' format");
        }

        // stream writes do not truncate, so remove any previous result first
        Files.deleteIfExists(toFile.toPath());

        final ImageWriter writer = writersForFormat.next();
        try (final FileImageOutputStream outputStream = new FileImageOutputStream(toFile)) {
            writer.setOutput(outputStream);
            if (JPEG_FORMAT.equals(format)) {
                final ImageWriteParam param = writer.getDefaultWriteParam();
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionQuality(quality);
                writer.write(null, new IIOImage(image, null, null), param);
            } else {
                writer.write(image);
            }
        } finally {
            writer.dispose();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(StackImageIO.class);
}
