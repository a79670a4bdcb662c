package it.aw.paperindex.service;

import it.aw.paperindex.model.DocumentMetadata;

/**
 * Estrae titolo, autori, anno e citazione dal testo iniziale della prima pagina.
 */
public interface MetadataExtractor {

    /**
     * @param snippet testo grezzo della prima pagina (tipicamente i primi 1000 caratteri)
     * @throws MetadataExtractionException se l'estrazione non produce un risultato valido
     */
    DocumentMetadata extract(String snippet);
}
