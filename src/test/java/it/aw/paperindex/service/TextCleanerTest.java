package it.aw.paperindex.service;

import it.aw.paperindex.service.TextCleaner.HeaderFooter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TextCleanerTest {

    @Nested
    @DisplayName("Rilevamento di intestazione e piè di pagina")
    class Detection {

        @Test
        @DisplayName("sceglie la prima e l'ultima riga più frequenti")
        void majorityLines() {
            HeaderFooter hf = TextCleaner.detect(List.of(
                    "H\nBody1\nF", "H\nBody2\nF", "H\nBody3\nOther"));

            assertThat(hf.header()).isEqualTo("H");
            assertThat(hf.footer()).isEqualTo("F");
        }

        @Test
        @DisplayName("ignora righe vuote iniziali e finali della pagina")
        void skipsBlankEdges() {
            HeaderFooter hf = TextCleaner.detect(List.of("\n\nH\nBody\nF\n", "  \nH\nMore\nF\n\n"));

            assertThat(hf.header()).isEqualTo("H");
            assertThat(hf.footer()).isEqualTo("F");
        }

        @Test
        @DisplayName("in un documento di più pagine ignora le righe che compaiono una sola volta")
        void nonRecurringLinesAreNotHeaders() {
            HeaderFooter hf = TextCleaner.detect(List.of(
                    "Abstract\nWe study dunes.\nThey move fast.",
                    "More text here.\nFinal words.",
                    "Even more.\nThe end."));

            assertThat(hf.header()).isNull();
            assertThat(hf.footer()).isNull();
        }

        @Test
        @DisplayName("restituisce null se non ci sono righe")
        void emptyDocument() {
            HeaderFooter hf = TextCleaner.detect(List.of("", "   "));

            assertThat(hf.header()).isNull();
            assertThat(hf.footer()).isNull();
        }
    }

    @Nested
    @DisplayName("Pulizia delle pagine")
    class Cleaning {

        @Test
        @DisplayName("rimuove intestazione e piè di pagina maggioritari da ogni pagina")
        void removesMajorityHeaderAndFooter() {
            List<String> pages = List.of("H\nBody1\nF", "H\nBody2\nF", "H\nBody3\nOther");

            assertThat(pages.stream().map(p -> TextCleaner.clean(p, pages)))
                    .containsExactly("Body1", "Body2", "Body3\nOther");
        }

        @Test
        @DisplayName("senza righe ricorrenti ogni pagina resta invariata e l'abstract viene trovato")
        void distinctEdgesKeepEveryPage() {
            List<String> pages = List.of(
                    "Abstract\nWe study dunes.\nThey move fast.",
                    "More text here.\nFinal words.",
                    "Even more.\nThe end.");

            assertThat(pages.stream().map(p -> TextCleaner.clean(p, pages)))
                    .containsExactlyElementsOf(pages);
            assertThat(SectionExtractor.extract(TextCleaner.clean(pages.get(0), pages)).text())
                    .startsWith("Abstract");
        }

        @Test
        @DisplayName("gestisce i fine riga Windows")
        void windowsLineEndings() {
            List<String> pages = List.of("H\r\nBody1\r\nF", "H\r\nBody2\r\nF");

            assertThat(TextCleaner.clean(pages.get(1), pages)).isEqualTo("Body2");
        }

        @Test
        @DisplayName("non svuota mai una pagina di una sola riga")
        void singleLinePageUntouched() {
            List<String> pages = List.of("Only line");

            assertThat(TextCleaner.clean("Only line", pages)).isEqualTo("Only line");
        }

        @Test
        @DisplayName("con due righe rimuove l'intestazione ma conserva l'ultima riga rimasta")
        void neverRemovesLastRemainingLine() {
            List<String> pages = List.of("H\nF", "H\nF");

            assertThat(TextCleaner.clean("H\nF", pages)).isEqualTo("F");
        }

        @Test
        @DisplayName("documento di una pagina: rimuove la prima riga solo se segue altro testo")
        void singlePageDocument() {
            List<String> pages = List.of("Title\nText body\nclosing");

            assertThat(TextCleaner.clean(pages.get(0), pages)).isEqualTo("Text body");
        }

        @Test
        @DisplayName("restituisce invariata la pagina senza righe ricorrenti")
        void untouchedWhenNothingMatches() {
            String page = "Alpha\nBeta\nGamma\n";
            HeaderFooter hf = new HeaderFooter("H", "F");

            assertThat(TextCleaner.clean(page, hf)).isSameAs(page);
        }

        @Test
        @DisplayName("una pagina vuota resta vuota")
        void blankPage() {
            assertThat(TextCleaner.clean("", List.of("H\nBody\nF"))).isEmpty();
        }
    }
}
