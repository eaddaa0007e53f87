package dev.pekelund.zuvp.processor.ingestion;

import dev.pekelund.zuvp.permits.MediaKind;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls plain text out of submitted documents. PDFs are read with PDFBox, DOCX files by reading the
 * document part of the package. Images carry no text layer.
 */
public class DocumentTextReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentTextReader.class);

    private static final String DOCX_DOCUMENT_PART = "word/document.xml";
    private static final Pattern PARAGRAPH_END = Pattern.compile("</w:p>");
    private static final Pattern TAB = Pattern.compile("<w:tab/>");
    private static final Pattern XML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern CHARACTER_REFERENCE = Pattern.compile("&#(?:([0-9]{1,7})|[xX]([0-9a-fA-F]{1,6}));");

    /**
     * Returns the text content, or an empty string when the document has none or cannot be parsed.
     */
    public String readText(byte[] content, MediaKind mediaKind) {
        return switch (mediaKind) {
            case TEXT -> decodeText(content);
            case PDF -> readPdf(content);
            case DOCX -> readDocx(content);
            case IMAGE -> "";
        };
    }

    private String decodeText(byte[] content) {
        String text = new String(content, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return text.trim();
    }

    private String readPdf(byte[] content) {
        try (PDDocument document = PDDocument.load(content)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            return stripper.getText(document).trim();
        } catch (IOException ex) {
            LOGGER.warn("Failed to read text layer from PDF: {}", ex.getMessage());
            return "";
        }
    }

    private String readDocx(byte[] content) {
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(content))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (DOCX_DOCUMENT_PART.equals(entry.getName())) {
                    String xml = new String(zip.readAllBytes(), StandardCharsets.UTF_8);
                    return unescape(stripMarkup(xml)).trim();
                }
            }
            LOGGER.warn("DOCX package did not contain {}", DOCX_DOCUMENT_PART);
            return "";
        } catch (IOException ex) {
            LOGGER.warn("Failed to read DOCX package: {}", ex.getMessage());
            return "";
        }
    }

    private static String stripMarkup(String xml) {
        String withBreaks = PARAGRAPH_END.matcher(xml).replaceAll("\n");
        String withTabs = TAB.matcher(withBreaks).replaceAll("\t");
        return XML_TAG.matcher(withTabs).replaceAll("");
    }

    private static String unescape(String text) {
        return decodeCharacterReferences(text)
            .replace("&lt;", "<")
            .replace("&gt;", ">")
            .replace("&quot;", "\"")
            .replace("&apos;", "'")
            .replace("&amp;", "&");
    }

    private static String decodeCharacterReferences(String text) {
        return CHARACTER_REFERENCE.matcher(text).replaceAll(match -> {
            int codePoint = match.group(1) != null
                ? Integer.parseInt(match.group(1))
                : Integer.parseInt(match.group(2), 16);
            if (!Character.isValidCodePoint(codePoint) || Character.getType(codePoint) == Character.SURROGATE) {
                return Matcher.quoteReplacement(match.group());
            }
            return Matcher.quoteReplacement(new String(Character.toChars(codePoint)));
        });
    }
}
