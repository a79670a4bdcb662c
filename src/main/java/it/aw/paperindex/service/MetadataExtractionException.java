package it.aw.paperindex.service;

/**
 * Estrazione dei metadati fallita: il documento corrente viene abbandonato,
 * l'esecuzione prosegue con il successivo.
 */
public class MetadataExtractionException extends RuntimeException {

    public MetadataExtractionException(String message) {
        super(message);
    }

    public MetadataExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
