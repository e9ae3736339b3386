package com.largomodo.photosheet.core.transform;

import com.largomodo.photosheet.TestImages;
import com.largomodo.photosheet.collection.PhotoEntry;
import com.largomodo.photosheet.collection.Rotation;
import com.largomodo.photosheet.core.PhotoDecodeException;
import com.largomodo.photosheet.service.ImageCodec;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ImageTransformerTest {

    private static final Path PHOTO = Path.of("photo.jpg");

    private final ImageCodec codec = mock(ImageCodec.class);
    private final ImageTransformer topAligned = new ImageTransformer(codec, VerticalAlignment.TOP, false);
    private final ImageTransformer upscaling = new ImageTransformer(codec, VerticalAlignment.TOP, true);

    private static void assertSamePixels(BufferedImage expected, BufferedImage actual) {
        assertEquals(expected.getWidth(), actual.getWidth(), "width");
        assertEquals(expected.getHeight(), actual.getHeight(), "height");
        for (int y = 0; y < expected.getHeight(); y++) {
            for (int x = 0; x < expected.getWidth(); x++) {
                assertEquals(expected.getRGB(x, y), actual.getRGB(x, y), "pixel " + x + "," + y);
            }
        }
    }

    @Test
    void testRotate90IsClockwiseAndSwapsAxes() {
        BufferedImage source = new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB);
        source.setRGB(0, 0, 0xFF0000);   // top-left
        source.setRGB(2, 1, 0x0000FF);   // bottom-right

        BufferedImage rotated = ImageTransformer.rotate(source, Rotation.R90);

        assertEquals(2, rotated.getWidth());
        assertEquals(3, rotated.getHeight());
        assertEquals(0xFF0000, rotated.getRGB(1, 0) & 0xFFFFFF, "Top-left moves to top-right");
        assertEquals(0x0000FF, rotated.getRGB(0, 2) & 0xFFFFFF, "Bottom-right moves to bottom-left");
    }

    @Test
    void testRotate180And270() {
        BufferedImage source = new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB);
        source.setRGB(0, 0, 0xFF0000);

        BufferedImage half = ImageTransformer.rotate(source, Rotation.R180);
        BufferedImage threeQuarter = ImageTransformer.rotate(source, Rotation.R270);

        assertEquals(0xFF0000, half.getRGB(2, 1) & 0xFFFFFF);
        assertEquals(2, threeQuarter.getWidth());
        assertEquals(0xFF0000, threeQuarter.getRGB(0, 2) & 0xFFFFFF, "Top-left moves to bottom-left");
    }

    @Test
    void testFourQuarterTurnsAreLossless() {
        BufferedImage source = TestImages.gradient(37, 23);

        BufferedImage turned = source;
        for (int i = 0; i < 4; i++) {
            turned = ImageTransformer.rotate(turned, Rotation.R90);
        }

        assertSamePixels(source, turned);
    }

    @Test
    void testFourRotateActionsGiveIdenticalPlacement() {
        BufferedImage source = TestImages.gradient(300, 200);
        PhotoEntry entry = PhotoEntry.of(PHOTO);
        PhotoEntry turned = entry.rotated().rotated().rotated().rotated();

        PlacementResult original = topAligned.place(PHOTO, source, entry.rotation(), 120, 90, FitPolicy.FILL_CROP);
        PlacementResult afterFour = topAligned.place(PHOTO, source, turned.rotation(), 120, 90, FitPolicy.FILL_CROP);

        assertEquals(Rotation.R0, turned.rotation());
        assertSamePixels(original.bitmap(), afterFour.bitmap());
    }

    @Test
    void testRotationAppliesBeforeFitting() {
        // Landscape photo turned portrait: letterbox binds on height instead of width
        PlacementResult result = topAligned.place(PHOTO, TestImages.gradient(400, 200), Rotation.R90,
                100, 100, FitPolicy.FIT_LETTERBOX);

        assertEquals(50, result.width());
        assertEquals(100, result.height());
        assertEquals(25, result.offsetX());
    }

    @Test
    void testFillCropMatchesRotatingTheWholePhotoFirst() {
        BufferedImage source = TestImages.gradient(40, 30);

        for (Rotation rotation : Rotation.values()) {
            BufferedImage rotated = ImageTransformer.rotate(source, rotation);
            int cellWidth = rotated.getWidth();
            int cellHeight = rotated.getHeight() / 2 - 3;

            PlacementResult result = topAligned.place(PHOTO, source, rotation, cellWidth, cellHeight, FitPolicy.FILL_CROP);

            int cropY = (rotated.getHeight() - cellHeight) / 2;
            assertSamePixels(rotated.getSubimage(0, cropY, cellWidth, cellHeight), result.bitmap());
        }
    }

    @Test
    void testLargePhotoIsScaledBeforeRotating() {
        int cellWidth = 551;
        int cellHeight = 517;
        BufferedImage large = new BufferedImage(3000, 2000, BufferedImage.TYPE_INT_RGB) {
            @Override
            public int[] getRGB(int startX, int startY, int w, int h, int[] rgbArray, int offset, int scansize) {
                if ((long) w * h > (long) cellWidth * cellHeight) {
                    throw new AssertionError("Pixel copy of " + w + "x" + h + " exceeds the cell");
                }
                return super.getRGB(startX, startY, w, h, rgbArray, offset, scansize);
            }
        };

        for (FitPolicy policy : FitPolicy.values()) {
            PlacementResult result = topAligned.place(PHOTO, large, Rotation.R90, cellWidth, cellHeight, policy);
            assertFalse(result.isFailed(), policy.name());
            assertTrue(result.width() <= cellWidth, policy.name());
        }
    }

    @Test
    void testOutOfMemoryBecomesFailedPlacement() throws Exception {
        when(codec.decode(PHOTO)).thenThrow(new OutOfMemoryError("Java heap space"));

        PlacementResult result = topAligned.place(PHOTO, Rotation.R90, 100, 100, FitPolicy.FILL_CROP);

        assertTrue(result.isFailed());
        assertEquals("Not enough memory to place photo.jpg", result.failure());
    }

    @Test
    void testTransparentPixelsFlattenOntoWhite() {
        BufferedImage transparent = new BufferedImage(20, 20, BufferedImage.TYPE_INT_ARGB);

        BufferedImage flattened = ImageTransformer.toOpaqueRgb(transparent);

        assertEquals(BufferedImage.TYPE_INT_RGB, flattened.getType());
        assertEquals(0xFFFFFF, flattened.getRGB(10, 10) & 0xFFFFFF);
    }

    @Test
    void testIndexedAndGrayscaleBecomeRgb() {
        IndexColorModel palette = new IndexColorModel(8, 2,
                new byte[]{0, (byte) 255}, new byte[]{0, 0}, new byte[]{0, 0});
        BufferedImage indexed = new BufferedImage(4, 4, BufferedImage.TYPE_BYTE_INDEXED, palette);
        indexed.getRaster().setSample(1, 1, 0, 1);
        BufferedImage gray = new BufferedImage(4, 4, BufferedImage.TYPE_BYTE_GRAY);

        BufferedImage fromIndexed = ImageTransformer.toOpaqueRgb(indexed);

        assertEquals(BufferedImage.TYPE_INT_RGB, fromIndexed.getType());
        assertEquals(0xFF0000, fromIndexed.getRGB(1, 1) & 0xFFFFFF);
        assertEquals(BufferedImage.TYPE_INT_RGB, ImageTransformer.toOpaqueRgb(gray).getType());
    }

    @Test
    void testOpaqueRgbIsNotCopied() {
        BufferedImage rgb = TestImages.solid(5, 5, Color.BLUE);
        assertSame(rgb, ImageTransformer.toOpaqueRgb(rgb));
    }

    @Test
    void testPlacedBitmapNeverCarriesAlpha() {
        BufferedImage argb = new BufferedImage(50, 40, BufferedImage.TYPE_INT_ARGB);

        for (FitPolicy policy : FitPolicy.values()) {
            PlacementResult result = topAligned.place(PHOTO, argb, Rotation.R0, 30, 30, policy);
            assertFalse(result.bitmap().getColorModel().hasAlpha(), policy.name());
        }
    }

    @Test
    void testFillCropCentersTheCrop() {
        // Red | blue | red stripes; a centered crop of the wide image keeps only blue
        BufferedImage stripes = TestImages.solid(300, 100, Color.RED);
        for (int y = 0; y < 100; y++) {
            for (int x = 100; x < 200; x++) {
                stripes.setRGB(x, y, 0x0000FF);
            }
        }

        PlacementResult result = topAligned.place(PHOTO, stripes, Rotation.R0, 50, 100, FitPolicy.FILL_CROP);

        assertEquals(50, result.width());
        assertEquals(100, result.height());
        int center = result.bitmap().getRGB(25, 50);
        assertTrue((center & 0xFF) > 200 && ((center >> 16) & 0xFF) < 50, "Center should be blue");
    }

    @Test
    void testLetterboxNeverUpscalesByDefault() {
        PlacementResult result = topAligned.place(PHOTO, TestImages.gradient(40, 30), Rotation.R0,
                200, 200, FitPolicy.FIT_LETTERBOX);

        assertEquals(40, result.width());
        assertEquals(30, result.height());
        assertEquals(80, result.offsetX(), "Centered horizontally");
        assertEquals(0, result.offsetY(), "Top aligned");
    }

    @Test
    void testLetterboxUpscalesWhenAllowed() {
        PlacementResult result = upscaling.place(PHOTO, TestImages.gradient(40, 30), Rotation.R0,
                200, 200, FitPolicy.FIT_LETTERBOX);

        assertEquals(200, result.width());
        assertEquals(150, result.height());
    }

    @Test
    void testLetterboxCenterAlignment() {
        ImageTransformer centered = new ImageTransformer(codec, VerticalAlignment.CENTER, false);

        PlacementResult result = centered.place(PHOTO, TestImages.gradient(400, 200), Rotation.R0,
                100, 100, FitPolicy.FIT_LETTERBOX);

        assertEquals(50, result.height());
        assertEquals(25, result.offsetY());
        assertEquals(0, result.offsetX());
    }

    @Test
    void testFitWidthFollowsAspectRatio() {
        PlacementResult result = topAligned.place(PHOTO, TestImages.gradient(400, 300), Rotation.R0,
                100, 10, FitPolicy.FIT_WIDTH_DYNAMIC);

        assertEquals(100, result.width());
        assertEquals(75, result.height(), "Height ignores the target and follows the photo");
    }

    @Test
    void testDecodeFailureBecomesFailedPlacement() throws Exception {
        when(codec.decode(PHOTO)).thenThrow(new PhotoDecodeException(PHOTO, "Unsupported image format: photo.jpg"));

        PlacementResult result = topAligned.place(PHOTO, Rotation.R0, 100, 100, FitPolicy.FILL_CROP);

        assertTrue(result.isFailed());
        assertEquals(PHOTO, result.source());
        assertEquals("Unsupported image format: photo.jpg", result.failure());
        assertNull(result.bitmap());
        assertEquals(0, result.width());
    }

    @Test
    void testPlaceDecodesThroughCodec() throws Exception {
        when(codec.decode(PHOTO)).thenReturn(TestImages.gradient(200, 100));

        PlacementResult result = topAligned.place(PHOTO, Rotation.R0, 80, 80, FitPolicy.FILL_CROP);

        assertFalse(result.isFailed());
        assertEquals(80, result.width());
        verify(codec).decode(PHOTO);
    }

    @Test
    void testMeasureUsesHeaderAndRotation() throws Exception {
        when(codec.probe(PHOTO)).thenReturn(new Dimension(400, 300));

        assertEquals(75, topAligned.measureHeightAtWidth(PHOTO, Rotation.R0, 100));
        assertEquals(133, topAligned.measureHeightAtWidth(PHOTO, Rotation.R90, 100));
        verify(codec, never()).decode(any());
    }

    @Test
    void testRejectsEmptyTarget() {
        BufferedImage image = TestImages.gradient(10, 10);
        assertThrows(IllegalArgumentException.class,
                () -> topAligned.place(PHOTO, image, Rotation.R0, 0, 10, FitPolicy.FILL_CROP));
    }

    @Property(tries = 60)
    void fillCropAlwaysCoversTheCell(@ForAll("sides") int width, @ForAll("sides") int height,
                                     @ForAll("cells") int cellWidth, @ForAll("cells") int cellHeight,
                                     @ForAll Rotation rotation) {
        BufferedImage red = TestImages.solid(width, height, Color.RED);

        PlacementResult result = topAligned.place(PHOTO, red, rotation, cellWidth, cellHeight, FitPolicy.FILL_CROP);

        assertEquals(cellWidth, result.width());
        assertEquals(cellHeight, result.height());
        assertEquals(0, result.offsetX());
        assertEquals(0, result.offsetY());
        for (int[] corner : new int[][]{{0, 0}, {cellWidth - 1, 0}, {0, cellHeight - 1}, {cellWidth - 1, cellHeight - 1}}) {
            int rgb = result.bitmap().getRGB(corner[0], corner[1]);
            assertTrue(((rgb >> 8) & 0xFF) < 60, "No white border at " + corner[0] + "," + corner[1]);
        }
    }

    @Property(tries = 60)
    void letterboxStaysInsideAndTouchesOneEdge(@ForAll("sides") int width, @ForAll("sides") int height,
                                               @ForAll("cells") int cellWidth, @ForAll("cells") int cellHeight,
                                               @ForAll Rotation rotation) {
        PlacementResult result = upscaling.place(PHOTO, TestImages.solid(width, height, Color.GREEN), rotation,
                cellWidth, cellHeight, FitPolicy.FIT_LETTERBOX);

        assertTrue(result.offsetX() >= 0 && result.offsetX() + result.width() <= cellWidth);
        assertTrue(result.offsetY() >= 0 && result.offsetY() + result.height() <= cellHeight);
        assertTrue(result.width() == cellWidth || result.height() == cellHeight,
                "Fitted " + result.width() + "x" + result.height() + " into " + cellWidth + "x" + cellHeight);
    }

    @Property(tries = 60)
    void letterboxWithoutUpscaleNeverGrows(@ForAll("sides") int width, @ForAll("sides") int height,
                                           @ForAll("cells") int cellWidth, @ForAll("cells") int cellHeight) {
        PlacementResult result = topAligned.place(PHOTO, TestImages.solid(width, height, Color.GREEN), Rotation.R0,
                cellWidth, cellHeight, FitPolicy.FIT_LETTERBOX);

        assertTrue(result.width() <= Math.max(1, Math.min(width, cellWidth)));
        assertTrue(result.height() <= Math.max(1, Math.min(height, cellHeight)));
    }

    @Provide
    Arbitrary<Integer> sides() {
        return Arbitraries.integers().between(1, 400);
    }

    @Provide
    Arbitrary<Integer> cells() {
        return Arbitraries.integers().between(1, 160);
    }
}
