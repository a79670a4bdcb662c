package it.aw.paperindex.model;

/**
 * Strategia di segmentazione del testo estratto.
 */
public enum SegmentationMode {
    /** Punto, esclamativo o interrogativo seguito da spazi e da maiuscola o cifra. */
    SENTENCE,
    /** Punto seguito da spazi opzionali e da un a capo. */
    PARAGRAPH
}
