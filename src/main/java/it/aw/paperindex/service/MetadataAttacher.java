package it.aw.paperindex.service;

import it.aw.paperindex.model.DocumentMetadata;
import it.aw.paperindex.model.SegmentMetadata;
import it.aw.paperindex.model.SegmentRecord;
import it.aw.paperindex.model.TextUnit;

import java.util.List;

/**
 * Unico punto in cui si costruisce la forma dei metadati di un segmento.
 */
public class MetadataAttacher {

    private MetadataAttacher() {}

    public static SegmentRecord attach(TextUnit unit, String title, List<String> authors,
                                       String year, String citation, int phraseNumber) {
        return new SegmentRecord(unit.text(),
                new SegmentMetadata(title, authors, year, citation, phraseNumber));
    }

    public static SegmentRecord attach(TextUnit unit, DocumentMetadata metadata, int phraseNumber) {
        return attach(unit, metadata.title(), metadata.authors(), metadata.year(),
                metadata.citation(), phraseNumber);
    }
}
