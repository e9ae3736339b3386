package com.largomodo.photosheet.core;

import com.largomodo.photosheet.core.layout.GridDensity;
import com.largomodo.photosheet.core.transform.FitPolicy;
import com.largomodo.photosheet.core.transform.VerticalAlignment;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Built-in export settings loaded from the classpath.
 * <p>
 * Defaults bundled at build time from {@value #RESOURCE_PATH}. The resource is read once
 * per JVM; {@link #from(Properties)} parses an arbitrary property set for tests and hosts
 * that keep their own settings file.
 *
 * @param density           default grid density
 * @param fitPolicy         default fit policy
 * @param size              default size preset
 * @param marginMm          page margin in millimetres
 * @param gapMm             gap between cells in millimetres
 * @param dpi               composite rasterization resolution
 * @param jpegQuality       composite JPEG quality in (0, 1]
 * @param verticalAlignment letterbox vertical alignment
 * @param allowUpscale      whether letterboxing may enlarge small photos
 */
public record ExportDefaults(GridDensity density, FitPolicy fitPolicy, SizeOption size,
                             double marginMm, double gapMm, int dpi, float jpegQuality,
                             VerticalAlignment verticalAlignment, boolean allowUpscale) {

    public static final String RESOURCE_PATH = "/photosheet/export-defaults.properties";

    private static final class Holder {
        private static final ExportDefaults INSTANCE = loadFromClasspath();
    }

    /**
     * Defaults bundled with the application.
     *
     * @throws ConfigurationException if the bundled resource is missing or malformed
     */
    public static ExportDefaults get() {
        return Holder.INSTANCE;
    }

    /**
     * Parses defaults from a property set.
     *
     * @throws ConfigurationException if a property is missing or has an invalid value
     */
    public static ExportDefaults from(Properties props) {
        try {
            return new ExportDefaults(
                    GridDensity.fromPhotosPerPage(Integer.parseInt(required(props, "photos.per.page"))),
                    FitPolicy.fromCliArgument(required(props, "fit.policy")),
                    SizeOption.valueOf(required(props, "size").toUpperCase(Locale.ROOT)),
                    Double.parseDouble(required(props, "margin.mm")),
                    Double.parseDouble(required(props, "gap.mm")),
                    Integer.parseInt(required(props, "dpi")),
                    Float.parseFloat(required(props, "jpeg.quality")),
                    VerticalAlignment.valueOf(required(props, "vertical.alignment").toUpperCase(Locale.ROOT)),
                    Boolean.parseBoolean(required(props, "allow.upscale")));
        } catch (IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException
            throw new ConfigurationException("Invalid export defaults: " + e.getMessage(), e);
        }
    }

    private static ExportDefaults loadFromClasspath() {
        // Resource path is absolute classpath reference (leading slash required)
        try (InputStream in = ExportDefaults.class.getResourceAsStream(RESOURCE_PATH)) {
            if (in == null) {
                throw new ConfigurationException("Internal resource " + RESOURCE_PATH
                        + " not found. Ensure application is built correctly.");
            }
            Properties props = new Properties();
            props.load(in);
            return from(props);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + RESOURCE_PATH + ": " + e.getMessage(), e);
        }
    }

    private static String required(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Missing export default: " + key);
        }
        return value.trim();
    }
}
