package it.aw.paperindex.service;

import it.aw.paperindex.model.SegmentRecord;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumula in memoria i segmenti di un'esecuzione e li esporta in formato testuale
 * leggibile, un blocco per segmento:
 * <pre>
 * Sentence: ...
 * Metadata: {title=..., authors=[...], year=..., citation=..., phrase_number=N}
 *
 * </pre>
 * L'export serve al debug, non è pensato per essere riletto.
 */
public class SegmentBuffer implements SegmentSink {

    private final List<SegmentRecord> records = new ArrayList<>();

    @Override
    public void accept(SegmentRecord record) {
        records.add(record);
    }

    public List<SegmentRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public int size() {
        return records.size();
    }

    public void writeTo(Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (BufferedWriter w = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            for (SegmentRecord r : records) {
                w.write("Sentence: " + r.sentence() + "\n");
                w.write("Metadata: " + r.metadata().toMap() + "\n");
                w.write("\n");
            }
        }
    }
}
