package it.aw.paperindex.model;

/**
 * Unità di testo pronta per l'indicizzazione: frase o paragrafo con i metadati del documento.
 */
public record SegmentRecord(String sentence, SegmentMetadata metadata) {}
