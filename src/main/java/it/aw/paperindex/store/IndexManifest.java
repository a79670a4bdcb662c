package it.aw.paperindex.store;

import java.util.List;

/**
 * Descrittore salvato accanto all'indice: elenco degli id nell'ordine di inserimento.
 * <p>
 * Serve a ricostruire l'insieme degli id noti dopo un {@code load}, dato che
 * l'embedding store non espone le proprie voci.
 */
public record IndexManifest(
        String       name,
        String       savedAt,   // ISO-8601
        List<String> ids
) {}
