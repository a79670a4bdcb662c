package it.aw.paperindex.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import it.aw.paperindex.model.SearchResult;
import it.aw.paperindex.model.SegmentMetadata;
import it.aw.paperindex.model.SegmentRecord;
import it.aw.paperindex.model.StoreStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Indice vettoriale deduplicato e persistente.
 * <p>
 * L'identità di ogni voce è {@link VectorIds#of(String, SegmentMetadata)}: reinserire la stessa
 * coppia (testo, metadati) è un no-op e restituisce lo stesso id. Il controllo di esistenza
 * e l'inserimento avvengono sotto lo stesso lock.
 * <p>
 * Persistenza: ogni indice è un'unità con nome sotto la radice {@code store.databases.root}:
 * <pre>
 * &lt;root&gt;/&lt;name&gt;/index.json     : InMemoryEmbeddingStore serializzato
 * &lt;root&gt;/&lt;name&gt;/manifest.json  : id noti, in ordine di inserimento
 * </pre>
 */
@Component
public class ContentAddressedStore {

    private static final Logger log = LoggerFactory.getLogger(ContentAddressedStore.class);

    static final String INDEX_FILE    = "index.json";
    static final String MANIFEST_FILE = "manifest.json";

    private static final String KEY_TITLE    = "title";
    private static final String KEY_AUTHORS  = "authors";
    private static final String KEY_YEAR     = "year";
    private static final String KEY_CITATION = "citation";
    private static final String KEY_PHRASE   = "phrase_number";

    private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {};

    private final EmbeddingModel embeddingModel;
    private final ObjectMapper objectMapper;
    private final Path databasesRoot;

    private InMemoryEmbeddingStore<TextSegment> index = new InMemoryEmbeddingStore<>();
    private final Set<String> ids = new LinkedHashSet<>();
    private String loadedName;

    public ContentAddressedStore(EmbeddingModel embeddingModel,
                                 ObjectMapper objectMapper,
                                 @Value("${store.databases.root:databases}") String databasesRoot) {
        this.embeddingModel = embeddingModel;
        this.objectMapper = objectMapper;
        this.databasesRoot = Paths.get(databasesRoot);
    }

    public String upsert(SegmentRecord record) {
        return upsert(record.sentence(), record.metadata());
    }

    /**
     * Inserisce la coppia (testo, metadati) se non già presente.
     * L'embedding viene calcolato solo per le voci nuove; un suo errore si propaga
     * al chiamante lasciando l'indice invariato.
     *
     * @return id content-addressed della voce
     * @throws IllegalArgumentException se testo o metadati sono null, o il testo è vuoto
     */
    public synchronized String upsert(String text, SegmentMetadata metadata) {
        String id = VectorIds.of(text, metadata);
        if (text.isBlank()) {
            throw new IllegalArgumentException("Il testo da indicizzare non può essere vuoto");
        }
        if (ids.contains(id)) {
            log.debug("Voce già presente, inserimento ignorato: {}", id);
            return id;
        }
        Embedding embedding = embeddingModel.embed(text).content();
        index.add(id, embedding, toSegment(text, metadata));
        ids.add(id);
        return id;
    }

    /**
     * Restituisce le k voci più simili al testo, in ordine di score decrescente.
     * Su indice vuoto restituisce una lista vuota senza interrogare il modello.
     */
    public synchronized List<SearchResult> query(String text, int k) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("La query non può essere vuota");
        }
        if (k < 1) {
            throw new IllegalArgumentException("k deve essere >= 1 (ricevuto: " + k + ")");
        }
        if (ids.isEmpty()) {
            return List.of();
        }
        Embedding queryEmbedding = embeddingModel.embed(text).content();
        List<EmbeddingMatch<TextSegment>> matches = index.search(
                EmbeddingSearchRequest.builder()
                        .queryEmbedding(queryEmbedding)
                        .maxResults(k)
                        .build()
        ).matches();

        List<SearchResult> results = new ArrayList<>(matches.size());
        for (EmbeddingMatch<TextSegment> m : matches) {
            results.add(new SearchResult(m.score(), m.embeddingId(), m.embedded().text(),
                    toMetadata(m.embedded().metadata())));
        }
        return results;
    }

    /** Salva l'intero indice con il nome dato, sovrascrivendo un eventuale salvataggio precedente. */
    public synchronized void save(String name) throws IOException {
        Path dir = directoryOf(name);
        Files.createDirectories(dir);
        index.serializeToFile(dir.resolve(INDEX_FILE));
        objectMapper.writeValue(dir.resolve(MANIFEST_FILE).toFile(),
                new IndexManifest(name, Instant.now().toString(), new ArrayList<>(ids)));
        loadedName = name;
        log.info("Indice '{}' salvato: {} ({} voci)", name, dir.toAbsolutePath(), ids.size());
    }

    /**
     * Sostituisce il contenuto in memoria con l'indice salvato.
     *
     * @throws NoSuchFileException se non esiste un indice con quel nome
     */
    public synchronized void load(String name) throws IOException {
        Path dir = directoryOf(name);
        Path indexFile = dir.resolve(INDEX_FILE);
        Path manifestFile = dir.resolve(MANIFEST_FILE);
        if (!Files.exists(indexFile) || !Files.exists(manifestFile)) {
            throw new NoSuchFileException(dir.toAbsolutePath().toString());
        }
        IndexManifest manifest = objectMapper.readValue(manifestFile.toFile(), IndexManifest.class);
        InMemoryEmbeddingStore<TextSegment> loaded = InMemoryEmbeddingStore.fromFile(indexFile);

        index = loaded;
        ids.clear();
        ids.addAll(manifest.ids());
        loadedName = name;
        log.info("Indice '{}' caricato da {} ({} voci)", name, dir.toAbsolutePath(), ids.size());
    }

    public boolean exists(String name) {
        Path dir = directoryOf(name);
        return Files.exists(dir.resolve(INDEX_FILE)) && Files.exists(dir.resolve(MANIFEST_FILE));
    }

    /**
     * Cancella l'indice salvato. Se è quello attualmente caricato, svuota anche la memoria.
     *
     * @return true se esisteva qualcosa da cancellare
     */
    public synchronized boolean delete(String name) throws IOException {
        boolean removed = FileSystemUtils.deleteRecursively(directoryOf(name));
        if (name.equals(loadedName)) {
            clear();
        }
        if (removed) log.info("Indice '{}' cancellato", name);
        return removed;
    }

    /** Svuota l'indice in memoria senza toccare i salvataggi. */
    public synchronized void clear() {
        index = new InMemoryEmbeddingStore<>();
        ids.clear();
        loadedName = null;
    }

    public synchronized boolean contains(String id) {
        return ids.contains(id);
    }

    public synchronized int size() {
        return ids.size();
    }

    public synchronized StoreStats stats(String name) {
        return new StoreStats(name, ids.size(), embeddingModel.getClass().getSimpleName(), exists(name));
    }

    private Path directoryOf(String name) {
        if (name == null || name.isBlank() || name.contains("/") || name.contains("\\") || name.startsWith(".")) {
            throw new IllegalArgumentException("Nome indice non valido: " + name);
        }
        return databasesRoot.resolve(name);
    }

    // Metadata di LangChain4j accetta solo valori scalari: gli autori sono salvati come array JSON
    private TextSegment toSegment(String text, SegmentMetadata metadata) {
        Metadata meta = new Metadata();
        if (metadata.title() != null)    meta.put(KEY_TITLE, metadata.title());
        if (metadata.year() != null)     meta.put(KEY_YEAR, metadata.year());
        if (metadata.citation() != null) meta.put(KEY_CITATION, metadata.citation());
        meta.put(KEY_PHRASE, String.valueOf(metadata.phraseNumber()));
        try {
            meta.put(KEY_AUTHORS, objectMapper.writeValueAsString(metadata.authors()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Serializzazione autori fallita", e);
        }
        return TextSegment.from(text, meta);
    }

    private SegmentMetadata toMetadata(Metadata meta) {
        List<String> authors;
        String rawAuthors = meta.getString(KEY_AUTHORS);
        try {
            authors = rawAuthors == null ? List.of() : objectMapper.readValue(rawAuthors, STRING_LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Autori non leggibili nei metadati dell'indice", e);
        }
        return new SegmentMetadata(
                meta.getString(KEY_TITLE),
                authors,
                meta.getString(KEY_YEAR),
                meta.getString(KEY_CITATION),
                Integer.parseInt(meta.getString(KEY_PHRASE)));
    }
}
