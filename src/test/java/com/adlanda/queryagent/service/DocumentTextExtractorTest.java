package com.adlanda.queryagent.service;

import com.adlanda.queryagent.exception.UnsupportedDocumentException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentTextExtractorTest {

    private final DocumentTextExtractor extractor = new DocumentTextExtractor();

    @Test
    void extractText_plainText_decodesUtf8() {
        byte[] bytes = "Grüße aus Köln".getBytes(StandardCharsets.UTF_8);

        assertThat(extractor.extractText("notes.txt", "text/plain", bytes)).isEqualTo("Grüße aus Köln");
    }

    @Test
    void extractText_markdownByExtension_withoutContentType() {
        byte[] bytes = "# Title\n\nBody".getBytes(StandardCharsets.UTF_8);

        assertThat(extractor.extractText("README.md", null, bytes)).isEqualTo("# Title\n\nBody");
    }

    @Test
    void extractText_emptyFile_returnsEmptyString() {
        assertThat(extractor.extractText("empty.txt", "text/plain", new byte[0])).isEmpty();
    }

    @Test
    void extractText_unsupportedFormat_throws() {
        byte[] bytes = {0x50, 0x4B, 0x03, 0x04};

        assertThatThrownBy(() -> extractor.extractText("slides.pptx",
                "application/vnd.openxmlformats-officedocument.presentationml.presentation", bytes))
                .isInstanceOf(UnsupportedDocumentException.class)
                .hasMessageContaining("slides.pptx");
    }

    @Test
    void extractText_corruptPdf_throwsUnsupportedDocument() {
        byte[] bytes = "not really a pdf".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> extractor.extractText("broken.pdf", "application/pdf", bytes))
                .isInstanceOf(UnsupportedDocumentException.class)
                .hasMessageContaining("broken.pdf");
    }

    @Test
    void extractText_pdf_readsPageText() throws IOException {
        byte[] pdf = singlePagePdf("Attention is all you need");

        String text = extractor.extractText("paper.pdf", "application/pdf", pdf);

        assertThat(text).contains("Attention");
    }

    private static byte[] singlePagePdf(String line) throws IOException {
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDPage page = new PDPage();
            document.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.beginText();
                content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                content.newLineAtOffset(72, 700);
                content.showText(line);
                content.endText();
            }
            document.save(out);
            return out.toByteArray();
        }
    }
}
