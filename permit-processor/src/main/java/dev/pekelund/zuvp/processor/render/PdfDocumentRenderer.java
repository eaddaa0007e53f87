package dev.pekelund.zuvp.processor.render;

import dev.pekelund.zuvp.drafts.DraftDocuments;
import dev.pekelund.zuvp.permits.CanonicalRecord;
import dev.pekelund.zuvp.render.DocumentRenderer;
import dev.pekelund.zuvp.render.RenderException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Renders the consent document and the payment instructions for a validated permit as PDF files named
 * {@code consent_<id>.pdf} and {@code payment_<id>.pdf}. Rendering the same request again overwrites them.
 *
 * <p>The standard Type 1 fonts only cover WinAnsi, so Czech diacritics are folded to their base letters.
 */
public class PdfDocumentRenderer implements DocumentRenderer {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfDocumentRenderer.class);

    static final int PAYMENT_DUE_DAYS = 30;

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd.MM.yyyy");
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]+");
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private static final float MARGIN = 56f;
    private static final float LEADING = 1.45f;
    private static final int WRAP_COLUMNS = 90;

    private static final List<String> CONDITIONS = List.of(
        "Žadatel je povinen dodržovat všechny platné právní předpisy.",
        "Užívání je povoleno pouze v uvedeném rozsahu a době.",
        "Žadatel odpovídá za případné škody způsobené užíváním.",
        "Poplatek je splatný do " + PAYMENT_DUE_DAYS + " dnů od vystavení tohoto souhlasu.");

    private final Path outputDirectory;
    private final String paymentAccount;
    private final Clock clock;

    public PdfDocumentRenderer(Path outputDirectory, String paymentAccount, Clock clock) {
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
        this.paymentAccount = Objects.requireNonNull(paymentAccount, "paymentAccount");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Map<String, Path> render(CanonicalRecord record, String requestId) {
        Objects.requireNonNull(record, "record");
        if (requestId == null || !SAFE_ID.matcher(requestId).matches()) {
            throw new RenderException("Request id is not usable as a file name: " + requestId);
        }
        try {
            Files.createDirectories(outputDirectory);
        } catch (IOException ex) {
            throw new RenderException("Failed to create output directory " + outputDirectory, ex);
        }

        LocalDate issued = LocalDate.now(clock);
        Map<String, Path> documents = new LinkedHashMap<>();
        documents.put(DraftDocuments.CONSENT,
            write(outputDirectory.resolve("consent_" + requestId + ".pdf"), consentLines(record, requestId, issued)));
        documents.put(DraftDocuments.PAYMENT,
            write(outputDirectory.resolve("payment_" + requestId + ".pdf"), paymentLines(record, requestId, issued)));
        return documents;
    }

    private List<Line> consentLines(CanonicalRecord record, String requestId, LocalDate issued) {
        List<Line> lines = new ArrayList<>();
        lines.add(Line.title("SOUHLAS K ZVLÁŠTNÍMU UŽÍVÁNÍ VEŘEJNÉHO PROSTRANSTVÍ"));
        lines.add(Line.blank());
        lines.add(Line.text("Číslo žádosti: " + requestId));
        lines.add(Line.text("Datum vystavení: " + DATE_FORMAT.format(issued)));
        lines.add(Line.blank());

        lines.add(Line.heading("Údaje žadatele:"));
        lines.add(Line.text("Jméno/Název: " + orPlaceholder(record.applicantName())));
        if (StringUtils.hasText(record.companyId())) {
            lines.add(Line.text("IČO: " + record.companyId()));
        }
        if (StringUtils.hasText(record.contactDetails())) {
            lines.add(Line.text("Kontakt: " + record.contactDetails()));
        }
        lines.add(Line.blank());

        lines.add(Line.heading("Údaje o užívání:"));
        lines.add(Line.text("Účel užívání: " + orPlaceholder(record.purposeOfUse())));
        lines.add(Line.text("Místo: " + orPlaceholder(record.location())));
        lines.add(Line.text("Doba užívání: " + describePeriod(record)));
        if (record.areaStated()) {
            lines.add(Line.text("Výměra: " + record.areaSqm().stripTrailingZeros().toPlainString() + " m2"));
        }
        lines.add(Line.text("Poplatek: " + record.feeCzk() + " Kč"));
        lines.add(Line.blank());

        lines.add(Line.heading("Podmínky:"));
        for (String condition : CONDITIONS) {
            lines.add(Line.text("- " + condition));
        }
        return lines;
    }

    private List<Line> paymentLines(CanonicalRecord record, String requestId, LocalDate issued) {
        List<Line> lines = new ArrayList<>();
        lines.add(Line.title("PLATEBNÍ INSTRUKCE"));
        lines.add(Line.blank());
        lines.add(Line.text("Číslo žádosti: " + requestId));
        lines.add(Line.text("Částka k úhradě: " + record.feeCzk() + " Kč"));
        lines.add(Line.text("Variabilní symbol: " + orPlaceholder(record.variableSymbol())));
        lines.add(Line.text("Číslo účtu: " + paymentAccount));
        lines.add(Line.text("Splatnost: " + DATE_FORMAT.format(issued.plusDays(PAYMENT_DUE_DAYS))));
        lines.add(Line.blank());
        lines.add(Line.text("Prosím uhraďte poplatek ve stanovené lhůtě."));
        return lines;
    }

    private static String describePeriod(CanonicalRecord record) {
        String days = record.durationDays() + " dní";
        if (record.startDate() != null && record.endDate() != null) {
            return DATE_FORMAT.format(record.startDate()) + " - " + DATE_FORMAT.format(record.endDate())
                + " (" + days + ")";
        }
        if (StringUtils.hasText(record.statedDuration())) {
            return record.statedDuration() + " (" + days + ")";
        }
        return days;
    }

    private static String orPlaceholder(String value) {
        return StringUtils.hasText(value) ? value : "N/A";
    }

    private Path write(Path target, List<Line> lines) {
        try (PDDocument document = new PDDocument()) {
            PDRectangle pageSize = PDRectangle.A4;
            PDPage page = new PDPage(pageSize);
            document.addPage(page);
            PDPageContentStream stream = new PDPageContentStream(document, page);
            try {
                float y = pageSize.getHeight() - MARGIN;
                for (Line line : lines) {
                    for (String segment : wrap(toWinAnsi(line.text()))) {
                        float step = line.size() * LEADING;
                        if (y - step < MARGIN) {
                            stream.close();
                            page = new PDPage(pageSize);
                            document.addPage(page);
                            stream = new PDPageContentStream(document, page);
                            y = pageSize.getHeight() - MARGIN;
                        }
                        y -= step;
                        if (!segment.isEmpty()) {
                            stream.beginText();
                            stream.setFont(line.font(), line.size());
                            stream.newLineAtOffset(MARGIN, y);
                            stream.showText(segment);
                            stream.endText();
                        }
                    }
                }
            } finally {
                stream.close();
            }
            document.save(target.toFile());
        } catch (IOException | IllegalArgumentException ex) {
            throw new RenderException("Failed to render " + target.getFileName(), ex);
        }
        LOGGER.info("Rendered {}", target);
        return target;
    }

    static String toWinAnsi(String text) {
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        String folded = COMBINING_MARKS.matcher(decomposed).replaceAll("")
            .replace('\u00A0', ' ')
            .replaceAll("[\\r\\n\\t]+", " ");
        StringBuilder encodable = new StringBuilder(folded.length());
        for (int i = 0; i < folded.length(); i++) {
            char c = folded.charAt(i);
            encodable.append((c >= 0x20 && c < 0x7F) || (c >= 0xA0 && c <= 0xFF) ? c : '?');
        }
        return encodable.toString();
    }

    private static List<String> wrap(String text) {
        if (text.length() <= WRAP_COLUMNS) {
            return List.of(text);
        }
        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String word : text.split(" ")) {
            if (current.length() > 0 && current.length() + word.length() + 1 > WRAP_COLUMNS) {
                segments.add(current.toString());
                current.setLength(0);
            }
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(word);
        }
        if (current.length() > 0) {
            segments.add(current.toString());
        }
        return segments;
    }

    private record Line(String text, PDFont font, float size) {

        static Line title(String text) {
            return new Line(text, PDType1Font.HELVETICA_BOLD, 14f);
        }

        static Line heading(String text) {
            return new Line(text, PDType1Font.HELVETICA_BOLD, 12f);
        }

        static Line text(String text) {
            return new Line(text, PDType1Font.HELVETICA, 11f);
        }

        static Line blank() {
            return new Line("", PDType1Font.HELVETICA, 11f);
        }
    }
}
