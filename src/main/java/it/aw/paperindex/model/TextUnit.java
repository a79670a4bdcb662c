package it.aw.paperindex.model;

/**
 * Paragrafo o frase estratto da una pagina, già ripulito e filtrato.
 * <p>
 * Il testo è sempre trimmato e non vuoto; {@code position} è la posizione 1-based
 * tra le sole unità emesse dal Segmenter nella stessa chiamata.
 */
public record TextUnit(String text, int position) {

    public TextUnit {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Il testo di una TextUnit non può essere vuoto");
        }
        if (position < 1) {
            throw new IllegalArgumentException("position deve essere >= 1 (ricevuto: " + position + ")");
        }
        text = text.strip();
    }
}
