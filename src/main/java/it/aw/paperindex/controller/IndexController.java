package it.aw.paperindex.controller;

import it.aw.paperindex.config.StoreLifecycle;
import it.aw.paperindex.model.IngestionReport;
import it.aw.paperindex.model.SearchResult;
import it.aw.paperindex.model.SegmentationMode;
import it.aw.paperindex.model.StoreStats;
import it.aw.paperindex.service.IngestionService;
import it.aw.paperindex.service.SegmentBuffer;
import it.aw.paperindex.service.SegmentSink;
import it.aw.paperindex.store.ContentAddressedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Espone ingestione, ricerca e gestione dell'indice vettoriale.
 *
 * Endpoint disponibili:
 *   POST /api/index/ingest?directory=&mode=&export=   indicizza gli articoli di una directory
 *   GET  /api/index/search?q=&k=                     ricerca per similarità
 *   POST /api/index/save                             salva l'indice su disco
 *   GET  /api/index/stats                            statistiche dell'indice
 */
@RestController
@RequestMapping("/api/index")
public class IndexController {

    private static final Logger log = LoggerFactory.getLogger(IndexController.class);

    private final IngestionService ingestionService;
    private final ContentAddressedStore store;
    private final StoreLifecycle storeLifecycle;

    public IndexController(IngestionService ingestionService,
                           ContentAddressedStore store,
                           StoreLifecycle storeLifecycle) {
        this.ingestionService = ingestionService;
        this.store = store;
        this.storeLifecycle = storeLifecycle;
    }

    // -------------------------------------------------------------------------
    // POST /api/index/ingest
    // -------------------------------------------------------------------------

    /**
     * Indicizza tutti i PDF della directory (ricorsivamente) e salva l'indice.
     * Se {@code export} è valorizzato, scrive anche il dump testuale dei segmenti.
     *
     * Esempio:
     *   curl -X POST "http://localhost:8889/api/index/ingest?directory=/data/papers&mode=SENTENCE"
     */
    @PostMapping("/ingest")
    public ResponseEntity<IngestionReport> ingest(
            @RequestParam("directory") String directory,
            @RequestParam(value = "mode", required = false) SegmentationMode mode,
            @RequestParam(value = "export", required = false) String export) {
        SegmentationMode effectiveMode = mode != null ? mode : ingestionService.defaultMode();
        SegmentBuffer buffer = new SegmentBuffer();
        SegmentSink sink = store::upsert;
        if (export != null && !export.isBlank()) {
            sink = sink.andThen(buffer);
        }
        try {
            IngestionReport report = ingestionService.ingestDirectory(Paths.get(directory), effectiveMode, sink);
            storeLifecycle.persist();
            if (export != null && !export.isBlank()) {
                Path output = Paths.get(export);
                buffer.writeTo(output);
                log.info("Export di {} segmenti scritto in {}", buffer.size(), output.toAbsolutePath());
            }
            return ResponseEntity.ok(report);
        } catch (NoSuchFileException e) {
            return ResponseEntity.notFound().build();
        } catch (IOException e) {
            log.error("Errore durante l'ingestione: {}", directory, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    // -------------------------------------------------------------------------
    // GET /api/index/search?q=...&k=5
    // -------------------------------------------------------------------------

    /**
     * Esempio:
     *   curl "http://localhost:8889/api/index/search?q=shorelines+on+Mars&k=5"
     */
    @GetMapping("/search")
    public ResponseEntity<List<SearchResult>> search(
            @RequestParam("q") String query,
            @RequestParam(value = "k", defaultValue = "5") int k) {
        if (query.isBlank() || k < 1) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(store.query(query, k));
    }

    // -------------------------------------------------------------------------
    // POST /api/index/save
    // -------------------------------------------------------------------------

    @PostMapping("/save")
    public ResponseEntity<StoreStats> save() {
        try {
            storeLifecycle.persist();
        } catch (IOException e) {
            log.error("Errore durante il salvataggio dell'indice '{}'", storeLifecycle.indexName(), e);
            return ResponseEntity.internalServerError().build();
        }
        return ResponseEntity.ok(store.stats(storeLifecycle.indexName()));
    }

    // -------------------------------------------------------------------------
    // GET /api/index/stats
    // -------------------------------------------------------------------------

    @GetMapping("/stats")
    public ResponseEntity<StoreStats> stats() {
        return ResponseEntity.ok(store.stats(storeLifecycle.indexName()));
    }
}
