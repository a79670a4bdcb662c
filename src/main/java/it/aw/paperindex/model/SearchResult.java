package it.aw.paperindex.model;

/**
 * Risultato di una ricerca per similarità sull'indice.
 * Contiene l'identificativo content-addressed, il testo memorizzato e i suoi metadati.
 */
public record SearchResult(
        double          score,
        String          id,
        String          text,
        SegmentMetadata metadata
) {}
