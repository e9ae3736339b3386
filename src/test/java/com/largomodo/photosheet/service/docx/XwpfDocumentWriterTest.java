package com.largomodo.photosheet.service.docx;

import com.largomodo.photosheet.TestImages;
import com.largomodo.photosheet.core.layout.PaperSize;
import com.largomodo.photosheet.service.ImageIoCodec;
import com.largomodo.photosheet.service.PagedDocument;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPageMar;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPageSz;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class XwpfDocumentWriterTest {

    @TempDir
    Path tempDir;

    private XwpfDocumentWriter writer;
    private byte[] jpeg;

    @BeforeEach
    void setUp() throws IOException {
        writer = new XwpfDocumentWriter();
        jpeg = new ImageIoCodec().encodeJpeg(TestImages.gradient(30, 40), 0.9f);
    }

    private static XWPFDocument read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return new XWPFDocument(in);
        }
    }

    @Test
    void testOnePicturePerPageWithBreaksBetweenPages() throws IOException {
        Path target = tempDir.resolve("out.docx");
        try (PagedDocument document = writer.create(PaperSize.A4, 0)) {
            document.embedImage(jpeg, 100, 140);
            document.addPageBreak();
            document.embedImage(jpeg, 100, 140);
            document.addPageBreak();
            document.embedImage(jpeg, 100, 140);
            assertEquals(3, document.imageCount());
            document.save(target);
        }

        try (XWPFDocument saved = read(target)) {
            List<XWPFParagraph> paragraphs = saved.getParagraphs();
            assertEquals(3, paragraphs.size(), "No empty paragraphs between pages");
            assertFalse(paragraphs.get(0).isPageBreak(), "First page starts without a break");
            assertTrue(paragraphs.get(1).isPageBreak());
            assertTrue(paragraphs.get(2).isPageBreak());
            for (XWPFParagraph paragraph : paragraphs) {
                assertEquals(ParagraphAlignment.CENTER, paragraph.getAlignment());
                assertEquals(1, paragraph.getRuns().get(0).getEmbeddedPictures().size());
            }
            assertEquals(3, saved.getAllPictures().size());
        }
    }

    @Test
    void testSectionCarriesPaperSizeAndMargins() throws IOException {
        Path target = tempDir.resolve("margins.docx");
        try (PagedDocument document = writer.create(PaperSize.A4, 10)) {
            document.embedImage(jpeg, 50, 50);
            document.save(target);
        }

        try (XWPFDocument saved = read(target)) {
            CTPageSz size = saved.getDocument().getBody().getSectPr().getPgSz();
            assertEquals("11906", size.getW().toString());
            assertEquals("16838", size.getH().toString());
            CTPageMar margins = saved.getDocument().getBody().getSectPr().getPgMar();
            assertEquals("567", margins.getTop().toString());
            assertEquals("567", margins.getBottom().toString());
            assertEquals("567", margins.getLeft().toString());
            assertEquals("567", margins.getRight().toString());
        }
    }

    @Test
    void testPictureExtentFollowsRequestedSize() throws IOException {
        Path target = tempDir.resolve("extent.docx");
        try (PagedDocument document = writer.create(PaperSize.A4, 0)) {
            document.embedImage(jpeg, 25.4, 50.8);
            document.save(target);
        }

        try (XWPFDocument saved = read(target)) {
            var extent = saved.getParagraphs().get(0).getRuns().get(0).getCTR()
                    .getDrawingArray(0).getInlineArray(0).getExtent();
            assertEquals(914400L, extent.getCx());
            assertEquals(1828800L, extent.getCy());
        }
    }

    @Test
    void testNothingWrittenBeforeSave() throws IOException {
        try (PagedDocument document = writer.create(PaperSize.A4, 0)) {
            document.embedImage(jpeg, 10, 10);
        }

        try (var files = Files.list(tempDir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void testSaveReplacesExistingFile() throws IOException {
        Path target = tempDir.resolve("existing.docx");
        Files.writeString(target, "stale");
        try (PagedDocument document = writer.create(PaperSize.A4, 0)) {
            document.embedImage(jpeg, 10, 10);
            document.save(target);
        }

        try (XWPFDocument saved = read(target)) {
            assertEquals(1, saved.getAllPictures().size());
        }
    }

    @Test
    void testUnitConversions() {
        assertEquals(914400, XwpfDocumentWriter.emu(25.4));
        assertEquals("1440", XwpfDocumentWriter.twips(25.4).toString());
        assertEquals("0", XwpfDocumentWriter.twips(0).toString());
    }
}
