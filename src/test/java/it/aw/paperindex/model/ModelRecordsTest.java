package it.aw.paperindex.model;

import it.aw.paperindex.model.DocumentResult.Status;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelRecordsTest {

    @Test
    void textUnitIsStrippedAndNeverBlank() {
        assertThat(new TextUnit("  Dunes move.\n", 1).text()).isEqualTo("Dunes move.");
        assertThatThrownBy(() -> new TextUnit(" \n ", 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TextUnit("Text.", 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void phraseNumberStartsAtOne() {
        assertThatThrownBy(() -> new SegmentMetadata("T", List.of(), "2020", "C", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void authorsAreCopied() {
        List<String> authors = new ArrayList<>(List.of("Smith, J."));
        DocumentMetadata metadata = new DocumentMetadata("T", authors, null, null);
        authors.add("Doe, A.");

        assertThat(metadata.authors()).containsExactly("Smith, J.");
        assertThat(new DocumentMetadata("T", null, null, null).authors()).isEmpty();
    }

    @Test
    void reportCountsSegmentsAndFailures() {
        IngestionReport report = new IngestionReport("/papers", List.of(
                DocumentResult.ingested("a.pdf", 4, 2),
                DocumentResult.empty("b.pdf"),
                DocumentResult.failed("c.pdf", Status.LOAD_FAILED, new IllegalStateException("corrotto")),
                new DocumentResult("d.pdf", Status.STORE_FAILED, 3, 1, "disco pieno")),
                List.of("notes.txt"));

        assertThat(report.totalSegments()).isEqualTo(7);
        assertThat(report.failedDocuments()).isEqualTo(2);
        assertThat(report.documents().get(2).error()).isEqualTo("corrotto");
    }
}
