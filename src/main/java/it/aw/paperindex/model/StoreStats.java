package it.aw.paperindex.model;

/**
 * Statistiche sullo stato dell'indice vettoriale caricato.
 */
public record StoreStats(
        String  indexName,
        int     totalEntries,
        String  embeddingModel,
        boolean persisted       // true se esiste una copia salvata su disco con lo stesso nome
) {}
