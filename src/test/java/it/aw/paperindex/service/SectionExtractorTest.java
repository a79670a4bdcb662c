package it.aw.paperindex.service;

import it.aw.paperindex.model.SectionWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SectionExtractorTest {

    @Test
    @DisplayName("finestra da Abstract a References esclusa, con segnale di stop")
    void startAndEnd() {
        SectionWindow window = SectionExtractor.extract(
                "Title page junk\nAbstract\nReal content\nReferences\n[1] ...");

        assertThat(window.text()).isEqualTo("Abstract\nReal content\n");
        assertThat(window.stopSignal()).isTrue();
    }

    @Test
    @DisplayName("senza marcatori restituisce tutto il testo senza stop")
    void noMarkers() {
        String text = "Plain body text.\nNothing to see here.";

        SectionWindow window = SectionExtractor.extract(text);

        assertThat(window.text()).isEqualTo(text);
        assertThat(window.stopSignal()).isFalse();
    }

    @Test
    @DisplayName("solo marcatore di inizio: testo fino alla fine, senza stop")
    void onlyStart() {
        SectionWindow window = SectionExtractor.extract("Cover\nINTRODUCTION\nBody goes on");

        assertThat(window.text()).isEqualTo("INTRODUCTION\nBody goes on");
        assertThat(window.stopSignal()).isFalse();
    }

    @Test
    @DisplayName("solo bibliografia: testo fino alla bibliografia, con stop")
    void onlyEnd() {
        SectionWindow window = SectionExtractor.extract("Last findings.\nBibliography\n[1] Doe (2001)");

        assertThat(window.text()).isEqualTo("Last findings.\n");
        assertThat(window.stopSignal()).isTrue();
    }

    @Test
    @DisplayName("riconosce i marcatori in spagnolo")
    void spanishMarkers() {
        SectionWindow window = SectionExtractor.extract("Portada\nResumen\nContenido\nReferencias\n[1] ...");

        assertThat(window.text()).isEqualTo("Resumen\nContenido\n");
        assertThat(window.stopSignal()).isTrue();
    }

    @Test
    @DisplayName("cerca la bibliografia solo dopo il marcatore di inizio")
    void endBeforeStartIgnored() {
        SectionWindow window = SectionExtractor.extract("References to prior work\nAbstract\nContent");

        assertThat(window.text()).isEqualTo("Abstract\nContent");
        assertThat(window.stopSignal()).isFalse();
    }

    @Test
    @DisplayName("non confonde parole che contengono un marcatore")
    void wholeWordsOnly() {
        String text = "An abstraction layer for introductions.";

        SectionWindow window = SectionExtractor.extract(text);

        assertThat(window.text()).isEqualTo(text);
        assertThat(window.stopSignal()).isFalse();
    }

    @Test
    @DisplayName("lascia nella finestra la citazione del documento stesso")
    void ownCitationLeftToPipeline() {
        SectionWindow window = SectionExtractor.extract(
                "Abstract\nSmith, J. (2020). Dunes. Journal of Sand.\nDunes move.");

        assertThat(window.text()).contains("Smith, J. (2020). Dunes. Journal of Sand.");
        assertThat(window.stopSignal()).isFalse();
    }

    @Test
    @DisplayName("testo vuoto")
    void emptyText() {
        SectionWindow window = SectionExtractor.extract("");

        assertThat(window.text()).isEmpty();
        assertThat(window.stopSignal()).isFalse();
    }
}
