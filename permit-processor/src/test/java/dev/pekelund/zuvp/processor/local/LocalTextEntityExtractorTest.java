package dev.pekelund.zuvp.processor.local;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.zuvp.permits.ExtractionResult;
import dev.pekelund.zuvp.permits.MediaKind;
import dev.pekelund.zuvp.processor.ingestion.DocumentTextReader;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class LocalTextEntityExtractorTest {

    private final LocalTextEntityExtractor extractor = new LocalTextEntityExtractor(new DocumentTextReader());

    @Test
    void readsKeyValueLines() {
        byte[] content = """
            Žádost o zábor
            applicant_name: Jan Novák
            purpose_of_use: Předzahrádka
            location: Náměstí Míru 1
            duration: 2025-07-01 - 2025-07-10
            applicant_name: ignored duplicate
            """.getBytes(StandardCharsets.UTF_8);

        ExtractionResult result = extractor.extract(content, MediaKind.TEXT, "zadost.txt");

        assertThat(result.failed()).isFalse();
        assertThat(result.fields())
            .containsEntry("applicant_name", "Jan Novák")
            .containsEntry("purpose_of_use", "Předzahrádka")
            .containsEntry("location", "Náměstí Míru 1")
            .containsEntry("duration", "2025-07-01 - 2025-07-10")
            .hasSize(4);
    }

    @Test
    void cannotReadImages() {
        ExtractionResult result = extractor.extract(new byte[] {1, 2}, MediaKind.IMAGE, "scan.png");

        assertThat(result.failed()).isTrue();
        assertThat(result.error()).isEqualTo("Local extractor cannot read images");
    }

    @Test
    void reportsEmptyDocuments() {
        ExtractionResult result = extractor.extract(" \n ".getBytes(StandardCharsets.UTF_8), MediaKind.TEXT,
            "empty.txt");

        assertThat(result.error()).isEqualTo("No text content found in document");
    }
}
