package it.aw.paperindex.model;

import java.util.List;

/**
 * Metadati bibliografici di un articolo, prodotti una sola volta per documento
 * dall'estrattore esterno e condivisi in sola lettura da tutti i suoi segmenti.
 * <p>
 * Ogni campo può essere null se l'estrattore non lo ha individuato;
 * la lista autori è sempre non-null (eventualmente vuota) e immutabile.
 */
public record DocumentMetadata(
        String       title,
        List<String> authors,   // ordine di comparsa nell'articolo
        String       year,
        String       citation   // citazione formattata (APA)
) {
    public DocumentMetadata {
        authors = authors == null ? List.of() : List.copyOf(authors);
    }
}
