package it.aw.paperindex.model;

import java.util.List;

/**
 * Riepilogo di un'esecuzione della pipeline su una directory.
 *
 * @param documents  esito per ciascun documento riconosciuto, in ordine di elaborazione
 * @param otherFiles file con estensione non riconosciuta: elencati ma mai aperti
 */
public record IngestionReport(
        String               directory,
        List<DocumentResult> documents,
        List<String>         otherFiles
) {
    public IngestionReport {
        documents = List.copyOf(documents);
        otherFiles = List.copyOf(otherFiles);
    }

    public int totalSegments() {
        return documents.stream().mapToInt(DocumentResult::segmentCount).sum();
    }

    public long failedDocuments() {
        return documents.stream().filter(DocumentResult::isFailure).count();
    }
}
