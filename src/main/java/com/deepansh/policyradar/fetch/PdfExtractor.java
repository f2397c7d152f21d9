package com.deepansh.policyradar.fetch;

import com.deepansh.policyradar.tool.ToolImage;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * PDFBox text extraction. Pages are rendered to images only when the document has
 * no text layer, so scanned documents still reach a vision-capable model.
 */
@Slf4j
public class PdfExtractor {

    private static final int MAX_RENDERED_PAGES = 3;
    private static final float RENDER_DPI = 72f;

    private final boolean renderImages;

    public PdfExtractor(boolean renderImages) {
        this.renderImages = renderImages;
    }

    public FetchedContent extract(String url, byte[] bytes) {
        try (PDDocument document = Loader.loadPDF(bytes)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            String text = stripper.getText(document).trim();
            String title = document.getDocumentInformation() != null
                    ? document.getDocumentInformation().getTitle() : null;

            List<ToolImage> images = List.of();
            if (text.isEmpty() && renderImages) {
                images = renderPages(url, document);
                log.info("PDF has no text layer, rendered {} page images [url={}]", images.size(), url);
            }
            return new FetchedContent(url, title, text, FetchedContent.TYPE_PDF, images, null);
        } catch (IOException e) {
            log.warn("PDF extraction failed [url={}]: {}", url, e.getMessage());
            return FetchedContent.failure(url, "Could not read PDF: " + e.getMessage());
        }
    }

    private List<ToolImage> renderPages(String url, PDDocument document) throws IOException {
        PDFRenderer renderer = new PDFRenderer(document);
        int pages = Math.min(MAX_RENDERED_PAGES, document.getNumberOfPages());
        List<ToolImage> images = new ArrayList<>(pages);
        for (int page = 0; page < pages; page++) {
            BufferedImage image = renderer.renderImageWithDPI(page, RENDER_DPI, ImageType.GRAY);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ImageIO.write(image, "png", out);
            images.add(new ToolImage("page-" + (page + 1), page + 1, url, "image/png",
                    image.getWidth(), image.getHeight(), out.toByteArray()));
        }
        return images;
    }
}
