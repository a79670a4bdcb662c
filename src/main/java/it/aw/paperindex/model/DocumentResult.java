package it.aw.paperindex.model;

/**
 * Esito dell'elaborazione di un singolo documento.
 * <p>
 * Un errore su un documento non interrompe l'esecuzione: l'orchestratore
 * registra l'esito e passa al documento successivo.
 */
public record DocumentResult(
        String file,
        Status status,
        int    segmentCount,   // segmenti emessi verso il sink
        int    pagesRead,      // pagine elaborate prima dell'eventuale stop sulla bibliografia
        String error           // messaggio della causa, null se INGESTED o EMPTY
) {

    public enum Status {
        INGESTED,
        EMPTY,
        LOAD_FAILED,
        METADATA_FAILED,
        STORE_FAILED
    }

    public static DocumentResult ingested(String file, int segmentCount, int pagesRead) {
        return new DocumentResult(file, Status.INGESTED, segmentCount, pagesRead, null);
    }

    public static DocumentResult empty(String file) {
        return new DocumentResult(file, Status.EMPTY, 0, 0, null);
    }

    public static DocumentResult failed(String file, Status status, Throwable cause) {
        return new DocumentResult(file, status, 0, 0, cause.getMessage());
    }

    public boolean isFailure() {
        return status != Status.INGESTED && status != Status.EMPTY;
    }
}
