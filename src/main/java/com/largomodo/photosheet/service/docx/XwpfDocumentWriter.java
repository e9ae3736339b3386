package com.largomodo.photosheet.service.docx;

import com.largomodo.photosheet.core.layout.PaperSize;
import com.largomodo.photosheet.service.DocumentWriter;
import com.largomodo.photosheet.service.PagedDocument;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.util.Units;
import org.apache.poi.xwpf.usermodel.Document;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTBody;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPageMar;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPageSz;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSectPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STPageOrientation;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Word (.docx) documents built with Apache POI XWPF.
 * <p>
 * Layout of the generated body: one centered paragraph per page holding a single inline
 * picture, zero spacing before and after. Pages after the first set "page break before"
 * on their paragraph instead of inserting a separate break paragraph, so no empty line
 * ever precedes a picture on its page. The single section carries the paper size and
 * margins.
 */
public class XwpfDocumentWriter implements DocumentWriter {

    /** 1 inch = 1440 twentieths of a point (twips). */
    static final double TWIPS_PER_MM = 1440.0 / 25.4;

    static final double EMU_PER_MM = Units.EMU_PER_CENTIMETER / 10.0;

    @Override
    public PagedDocument create(PaperSize paper, double marginMm) throws IOException {
        XWPFDocument document = new XWPFDocument();
        configureSection(document, paper, marginMm);
        return new XwpfPagedDocument(document);
    }

    private static void configureSection(XWPFDocument document, PaperSize paper, double marginMm) {
        CTBody body = document.getDocument().getBody();
        CTSectPr section = body.isSetSectPr() ? body.getSectPr() : body.addNewSectPr();

        CTPageSz pageSize = section.isSetPgSz() ? section.getPgSz() : section.addNewPgSz();
        pageSize.setW(twips(paper.getWidthMm()));
        pageSize.setH(twips(paper.getHeightMm()));
        pageSize.setOrient(STPageOrientation.PORTRAIT);

        CTPageMar margins = section.isSetPgMar() ? section.getPgMar() : section.addNewPgMar();
        BigInteger margin = twips(marginMm);
        margins.setTop(margin);
        margins.setBottom(margin);
        margins.setLeft(margin);
        margins.setRight(margin);
        margins.setHeader(BigInteger.ZERO);
        margins.setFooter(BigInteger.ZERO);
        margins.setGutter(BigInteger.ZERO);
    }

    static BigInteger twips(double mm) {
        return BigInteger.valueOf(Math.round(mm * TWIPS_PER_MM));
    }

    static int emu(double mm) {
        return (int) Math.round(mm * EMU_PER_MM);
    }

    private static final class XwpfPagedDocument implements PagedDocument {

        private final XWPFDocument document;
        private boolean breakPending;
        private int imageCount;

        private XwpfPagedDocument(XWPFDocument document) {
            this.document = document;
        }

        @Override
        public void addPageBreak() {
            breakPending = true;
        }

        @Override
        public void embedImage(byte[] jpeg, double widthMm, double heightMm) throws IOException {
            XWPFParagraph paragraph = document.createParagraph();
            paragraph.setAlignment(ParagraphAlignment.CENTER);
            paragraph.setSpacingBefore(0);
            paragraph.setSpacingAfter(0);
            if (breakPending) {
                paragraph.setPageBreak(true);
                breakPending = false;
            }

            XWPFRun run = paragraph.createRun();
            String name = "page-" + (imageCount + 1) + ".jpg";
            try {
                run.addPicture(new ByteArrayInputStream(jpeg), Document.PICTURE_TYPE_JPEG, name,
                        emu(widthMm), emu(heightMm));
            } catch (InvalidFormatException e) {
                throw new IOException("Cannot embed " + name + ": " + e.getMessage(), e);
            }
            imageCount++;
        }

        @Override
        public int imageCount() {
            return imageCount;
        }

        @Override
        public void save(Path target) throws IOException {
            try (OutputStream out = Files.newOutputStream(target)) {
                document.write(out);
            }
        }

        @Override
        public void close() throws IOException {
            document.close();
        }
    }
}
