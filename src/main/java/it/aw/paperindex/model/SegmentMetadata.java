package it.aw.paperindex.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metadati associati a un singolo segmento: i campi del documento di origine
 * più il numero progressivo del segmento all'interno del documento.
 * <p>
 * {@code phraseNumber} è 1-based e riparte da 1 per ogni documento elaborato.
 * Fa parte dei metadati (e quindi dell'hash del contenuto), non è una chiave di identità.
 */
public record SegmentMetadata(
        String       title,
        List<String> authors,
        String       year,
        String       citation,
        @JsonProperty("phrase_number") int phraseNumber
) {
    public SegmentMetadata {
        authors = authors == null ? List.of() : List.copyOf(authors);
        if (phraseNumber < 1) {
            throw new IllegalArgumentException("phraseNumber deve essere >= 1 (ricevuto: " + phraseNumber + ")");
        }
    }

    /** Vista a mappa ordinata, usata nell'export testuale. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("title", title);
        map.put("authors", authors);
        map.put("year", year);
        map.put("citation", citation);
        map.put("phrase_number", phraseNumber);
        return map;
    }
}
