package com.largomodo.photosheet.core;

import com.largomodo.photosheet.core.layout.GridDensity;
import com.largomodo.photosheet.core.layout.PaperSize;
import com.largomodo.photosheet.core.transform.FitPolicy;
import com.largomodo.photosheet.core.transform.VerticalAlignment;

import java.nio.file.Path;

/**
 * Immutable settings for one export run.
 * <p>
 * Construct with {@link #builder()}, which starts from {@link ExportDefaults#get()}.
 * Geometry-level validation (margins leaving no room, cells rounding to zero pixels)
 * happens in the layout calculator; the compact constructor rejects values that are
 * invalid on their own.
 *
 * @param density           photos per page and grid shape
 * @param fitPolicy         how photos are fitted into cells
 * @param sizeFactor        fraction of the nominal cell used by content, in (0, 1]
 * @param pageMarginMm      page margin on every side, millimetres
 * @param gapMm             spacing between cells, millimetres
 * @param dpi               composite rasterization resolution
 * @param jpegQuality       composite JPEG quality in (0, 1]
 * @param verticalAlignment letterbox vertical alignment
 * @param allowUpscale      whether letterboxing may enlarge photos smaller than their cell
 * @param paperSize         document paper size
 * @param outputPath        destination .docx file
 */
public record ExportConfiguration(GridDensity density, FitPolicy fitPolicy, double sizeFactor,
                                  double pageMarginMm, double gapMm, int dpi, float jpegQuality,
                                  VerticalAlignment verticalAlignment, boolean allowUpscale,
                                  PaperSize paperSize, Path outputPath) {

    public ExportConfiguration {
        if (density == null) {
            throw new ConfigurationException("Grid density must be specified");
        }
        if (fitPolicy == null) {
            throw new ConfigurationException("Fit policy must be specified");
        }
        if (verticalAlignment == null) {
            throw new ConfigurationException("Vertical alignment must be specified");
        }
        if (paperSize == null) {
            throw new ConfigurationException("Paper size must be specified");
        }
        if (outputPath == null) {
            throw new ConfigurationException("Output path must be specified");
        }
        if (!(sizeFactor > 0.0 && sizeFactor <= 1.0)) {
            throw new ConfigurationException("Size factor must be in (0, 1], got: " + sizeFactor);
        }
        if (!(jpegQuality > 0.0f && jpegQuality <= 1.0f)) {
            throw new ConfigurationException("JPEG quality must be in (0, 1], got: " + jpegQuality);
        }
    }

    public static Builder builder() {
        return new Builder(ExportDefaults.get());
    }

    public static Builder builder(ExportDefaults defaults) {
        return new Builder(defaults);
    }

    public static final class Builder {
        private GridDensity density;
        private FitPolicy fitPolicy;
        private double sizeFactor;
        private double pageMarginMm;
        private double gapMm;
        private int dpi;
        private float jpegQuality;
        private VerticalAlignment verticalAlignment;
        private boolean allowUpscale;
        private PaperSize paperSize = PaperSize.A4;
        private Path outputPath;

        private Builder(ExportDefaults defaults) {
            this.density = defaults.density();
            this.fitPolicy = defaults.fitPolicy();
            this.sizeFactor = defaults.size().getFactor();
            this.pageMarginMm = defaults.marginMm();
            this.gapMm = defaults.gapMm();
            this.dpi = defaults.dpi();
            this.jpegQuality = defaults.jpegQuality();
            this.verticalAlignment = defaults.verticalAlignment();
            this.allowUpscale = defaults.allowUpscale();
        }

        public Builder density(GridDensity density) {
            this.density = density;
            return this;
        }

        public Builder photosPerPage(int photosPerPage) {
            this.density = GridDensity.fromPhotosPerPage(photosPerPage);
            return this;
        }

        public Builder fitPolicy(FitPolicy fitPolicy) {
            this.fitPolicy = fitPolicy;
            return this;
        }

        public Builder size(SizeOption size) {
            this.sizeFactor = size.getFactor();
            return this;
        }

        public Builder sizeFactor(double sizeFactor) {
            this.sizeFactor = sizeFactor;
            return this;
        }

        public Builder pageMarginMm(double pageMarginMm) {
            this.pageMarginMm = pageMarginMm;
            return this;
        }

        public Builder gapMm(double gapMm) {
            this.gapMm = gapMm;
            return this;
        }

        public Builder dpi(int dpi) {
            this.dpi = dpi;
            return this;
        }

        public Builder jpegQuality(float jpegQuality) {
            this.jpegQuality = jpegQuality;
            return this;
        }

        public Builder verticalAlignment(VerticalAlignment verticalAlignment) {
            this.verticalAlignment = verticalAlignment;
            return this;
        }

        public Builder allowUpscale(boolean allowUpscale) {
            this.allowUpscale = allowUpscale;
            return this;
        }

        public Builder paperSize(PaperSize paperSize) {
            this.paperSize = paperSize;
            return this;
        }

        public Builder outputPath(Path outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        public ExportConfiguration build() {
            return new ExportConfiguration(density, fitPolicy, sizeFactor, pageMarginMm, gapMm, dpi,
                    jpegQuality, verticalAlignment, allowUpscale, paperSize, outputPath);
        }
    }
}
