package com.adlanda.queryagent.service;

import com.adlanda.queryagent.exception.UnsupportedDocumentException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Extracts plain text from uploaded documents.
 *
 * PDFs are read with Apache PDFBox; text-like formats are decoded as UTF-8.
 */
@Service
public class DocumentTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(DocumentTextExtractor.class);

    private static final List<String> TEXT_EXTENSIONS = List.of(".txt", ".md", ".markdown", ".csv", ".json", ".xml", ".html");

    /**
     * @param fileName    Original file name, may be null
     * @param contentType Declared MIME type, may be null
     * @param content     Raw file bytes
     * @return Extracted text; empty if the file has no text
     * @throws UnsupportedDocumentException if the format is neither PDF nor text
     */
    public String extractText(String fileName, String contentType, byte[] content) {
        String fn = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        String mt = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);

        if (content == null || content.length == 0) {
            return "";
        }

        if (mt.equals("application/pdf") || fn.endsWith(".pdf")) {
            return extractPdf(fileName, content);
        }
        if (mt.startsWith("text/") || TEXT_EXTENSIONS.stream().anyMatch(fn::endsWith)) {
            return new String(content, StandardCharsets.UTF_8);
        }

        throw new UnsupportedDocumentException(fileName, contentType);
    }

    private String extractPdf(String fileName, byte[] content) {
        try (PDDocument document = Loader.loadPDF(content)) {
            String text = new PDFTextStripper().getText(document);
            log.info("Extracted {} characters from {} PDF pages of {}", text.length(), document.getNumberOfPages(), fileName);
            return text;
        } catch (IOException e) {
            throw new UnsupportedDocumentException("Could not read PDF '" + fileName + "': " + e.getMessage(), e);
        }
    }
}
