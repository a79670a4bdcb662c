package it.aw.paperindex.service;

import it.aw.paperindex.model.SegmentRecord;

/**
 * Riceve i segmenti man mano che la pipeline li emette.
 * <p>
 * Il chiamante sceglie dove vanno i risultati di un'esecuzione (buffer in memoria,
 * indice vettoriale, entrambi): la pipeline non conserva stato tra esecuzioni.
 */
@FunctionalInterface
public interface SegmentSink {

    void accept(SegmentRecord record);

    default SegmentSink andThen(SegmentSink next) {
        return record -> {
            accept(record);
            next.accept(record);
        };
    }
}
