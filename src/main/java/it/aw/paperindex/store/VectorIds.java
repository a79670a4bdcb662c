package it.aw.paperindex.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import it.aw.paperindex.model.SegmentMetadata;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Calcola l'identificativo content-addressed di una voce dell'indice.
 * <p>
 * id = SHA-256 esadecimale di: testo normalizzato (trim e spazi compattati), un separatore
 * {@code \n}, serializzazione JSON canonica dei metadati (proprietà in ordine alfabetico).
 * Stesso testo e stessi metadati producono sempre lo stesso id.
 */
public final class VectorIds {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private VectorIds() {}

    public static String of(String text, SegmentMetadata metadata) {
        if (text == null) {
            throw new IllegalArgumentException("Il testo da indicizzare non può essere null");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("I metadati da indicizzare non possono essere null");
        }
        return sha256(normalize(text) + "\n" + canonicalJson(metadata));
    }

    static String normalize(String text) {
        return text.strip().replaceAll("\\s+", " ");
    }

    static String canonicalJson(SegmentMetadata metadata) {
        try {
            return CANONICAL.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Serializzazione metadati fallita", e);
        }
    }

    private static String sha256(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 non disponibile", e);
        }
    }
}
