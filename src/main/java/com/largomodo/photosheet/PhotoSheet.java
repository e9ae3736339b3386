package com.largomodo.photosheet;

import com.largomodo.photosheet.collection.PhotoCollection;
import com.largomodo.photosheet.collection.Rotation;
import com.largomodo.photosheet.core.ConfigurationException;
import com.largomodo.photosheet.core.ExportConfiguration;
import com.largomodo.photosheet.core.ExportListener;
import com.largomodo.photosheet.core.ExportOrchestrator;
import com.largomodo.photosheet.core.ExportOutcome;
import com.largomodo.photosheet.core.PhotoExporter;
import com.largomodo.photosheet.core.SizeOption;
import com.largomodo.photosheet.core.compose.SequentialPagePacker;
import com.largomodo.photosheet.core.transform.FitPolicy;
import com.largomodo.photosheet.core.transform.VerticalAlignment;
import com.largomodo.photosheet.service.ImageIoCodec;
import com.largomodo.photosheet.service.docx.XwpfDocumentWriter;
import com.largomodo.photosheet.util.PhotoMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

/**
 * CLI entry point for exporting photos to a printable grid document.
 * <p>
 * Uses Picocli framework for argument parsing with automatic help generation
 * and type-safe validation. Inputs are photo files or folders; folders contribute their
 * photos (non-recursive, sorted by name). Photos keep argument order, duplicates are dropped.
 * <p>
 * Smart defaults:
 * - Layout options default to the bundled export defaults (6 per page, letterbox, 2.4 mm gap)
 * - Without -o the document is written to photos.docx in the current directory
 */
@Command(
        name = "photosheet",
        mixinStandardHelpOptions = true,
        resourceBundle = "photosheet.photosheet",
        version = "${bundle:application.version}",
        header = "Lays out photos as a fixed grid and exports them to a Word document.",
        description = {
                "Places 4, 6 or 9 photos per A4 page, fitted by cropping, letterboxing or dynamic row",
                "heights, and writes one composite image per page to a .docx file.",
                "",
                "Unreadable photos do not stop the export: their cells show an error marker."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion (possibly with marked photos)",
                "1:Export failed (I/O, layout, output not writable)",
                "2:Invalid command line arguments"
        }
)
public class PhotoSheet implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PhotoSheet.class);

    @Parameters(index = "0..*", arity = "1..*", paramLabel = "INPUT",
            description = {
                    "Photo files (.jpg, .jpeg, .png) or folders containing them.",
                    "Folders are scanned without recursion; hidden files are skipped."
            })
    List<File> inputs;

    @Option(names = {"-o", "--output"}, defaultValue = "photos.docx",
            description = "Destination document. Default: ${DEFAULT-VALUE}")
    File output;

    @Option(names = {"-p", "--per-page"},
            description = "Photos per page: 4, 6 or 9. Default: from bundled export defaults (6)")
    Integer photosPerPage;

    @Option(names = "--fit", converter = FitPolicyConverter.class,
            description = {
                    "How photos fill their cell.",
                    "Valid values: FILL_CROP, FIT_LETTERBOX, FIT_WIDTH_DYNAMIC",
                    "Default: FIT_LETTERBOX"
            })
    FitPolicy fitPolicy;

    @Option(names = "--size",
            description = "Share of each cell used by the photo. Valid values: ${COMPLETION-CANDIDATES}. Default: FULL")
    SizeOption size;

    @Option(names = "--size-factor",
            description = "Exact share of each cell in (0, 1]; overrides --size")
    Double sizeFactor;

    @Option(names = "--margin", description = "Page margin in millimetres. Default: 0")
    Double marginMm;

    @Option(names = "--gap", description = "Gap between photos in millimetres. Default: 2.4")
    Double gapMm;

    @Option(names = "--dpi", description = "Composite resolution. Default: 150")
    Integer dpi;

    @Option(names = "--quality", description = "JPEG quality in (0, 1]. Default: 0.95")
    Float quality;

    @Option(names = "--align",
            description = "Vertical alignment for letterboxed photos. Valid values: ${COMPLETION-CANDIDATES}. Default: TOP")
    VerticalAlignment alignment;

    @Option(names = "--upscale", description = "Let letterboxed photos grow beyond their original size")
    boolean upscale;

    @Option(names = {"-r", "--rotate"}, paramLabel = "INDEX=DEGREES",
            description = "Rotate photo INDEX (1-based, after de-duplication) clockwise by DEGREES (multiple of 90)")
    Map<Integer, Integer> rotations = new TreeMap<>();

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        CommandLine cmd = new CommandLine(new PhotoSheet());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        int exitCode = cmd.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        PhotoCollection photos = collectPhotos();
        applyRotations(photos);
        ExportConfiguration config = buildConfiguration();

        PhotoExporter exporter = new PhotoExporter(new ImageIoCodec(), new XwpfDocumentWriter(), new SequentialPagePacker());
        ExportOutcome outcome;
        try (ExportOrchestrator orchestrator = new ExportOrchestrator(exporter)) {
            outcome = orchestrator.start(photos.snapshot(), config, new ExportListener() {
            }).get();
        } catch (ExecutionException e) {
            throw new IOException("Export worker failed", e.getCause());
        }

        if (!outcome.isSuccess()) {
            log.error("Export failed: {}", outcome.failureMessage());
            return 1;
        }
        if (outcome.failedPhotos().isEmpty()) {
            log.info("Export complete: {} photo(s) on {} page(s) -> {}",
                    photos.size(), outcome.pageCount(), outcome.output());
        } else {
            log.info("Export complete with {} unreadable photo(s): {} page(s) -> {}",
                    outcome.failedPhotos().size(), outcome.pageCount(), outcome.output());
            outcome.failedPhotos().forEach(failed -> log.info("  Marked: {}", failed));
        }
        return 0;
    }

    private PhotoCollection collectPhotos() throws IOException {
        PhotoCollection photos = new PhotoCollection();
        for (File input : inputs) {
            Path path = input.toPath();
            if (!Files.exists(path)) {
                throw new ParameterException(spec.commandLine(),
                        "Input path does not exist: " + path.toAbsolutePath());
            }
            if (!Files.isReadable(path)) {
                throw new ParameterException(spec.commandLine(),
                        "Input path is not readable (check permissions): " + path.toAbsolutePath());
            }
            if (Files.isDirectory(path)) {
                int added = photos.addFolder(path);
                log.debug("Added {} photo(s) from {}", added, path);
            } else if (PhotoMatcher.isPhoto(path)) {
                photos.add(path);
            } else {
                throw new ParameterException(spec.commandLine(),
                        "Input file is not a supported photo (.jpg, .jpeg, .png): " + path.toAbsolutePath());
            }
        }
        if (photos.isEmpty()) {
            throw new ParameterException(spec.commandLine(), "No photos found in the given inputs");
        }
        return photos;
    }

    private void applyRotations(PhotoCollection photos) {
        for (Map.Entry<Integer, Integer> rotation : rotations.entrySet()) {
            int index = rotation.getKey();
            if (index < 1 || index > photos.size()) {
                throw new ParameterException(spec.commandLine(),
                        "Rotate index out of range: " + index + " (1-" + photos.size() + ")");
            }
            Rotation target;
            try {
                target = Rotation.fromDegrees(rotation.getValue());
            } catch (IllegalArgumentException e) {
                throw new ParameterException(spec.commandLine(), e.getMessage(), e);
            }
            for (int step = 0; step < target.quarterTurns(); step++) {
                photos.rotate(index - 1);
            }
        }
    }

    private ExportConfiguration buildConfiguration() {
        try {
            ExportConfiguration.Builder builder = ExportConfiguration.builder()
                    .outputPath(output.toPath().toAbsolutePath());
            if (photosPerPage != null) {
                builder.photosPerPage(photosPerPage);
            }
            if (fitPolicy != null) {
                builder.fitPolicy(fitPolicy);
            }
            if (size != null) {
                builder.size(size);
            }
            if (sizeFactor != null) {
                builder.sizeFactor(sizeFactor);
            }
            if (marginMm != null) {
                builder.pageMarginMm(marginMm);
            }
            if (gapMm != null) {
                builder.gapMm(gapMm);
            }
            if (dpi != null) {
                builder.dpi(dpi);
            }
            if (quality != null) {
                builder.jpegQuality(quality);
            }
            if (alignment != null) {
                builder.verticalAlignment(alignment);
            }
            if (upscale) {
                builder.allowUpscale(true);
            }
            return builder.build();
        } catch (ConfigurationException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    /**
     * Accepts fit policies in any case, with dashes or underscores.
     */
    static class FitPolicyConverter implements ITypeConverter<FitPolicy> {
        @Override
        public FitPolicy convert(String value) {
            try {
                return FitPolicy.fromCliArgument(value);
            } catch (IllegalArgumentException e) {
                throw new TypeConversionException(e.getMessage());
            }
        }
    }
}
