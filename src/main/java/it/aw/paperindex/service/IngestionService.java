package it.aw.paperindex.service;

import it.aw.paperindex.model.DocumentMetadata;
import it.aw.paperindex.model.DocumentResult;
import it.aw.paperindex.model.DocumentResult.Status;
import it.aw.paperindex.model.IngestionReport;
import it.aw.paperindex.model.SectionWindow;
import it.aw.paperindex.model.SegmentationMode;
import it.aw.paperindex.model.TextUnit;
import it.aw.paperindex.service.TextCleaner.HeaderFooter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Orchestra l'ingestione degli articoli di una directory.
 * <p>
 * Pipeline per documento:
 * <ol>
 *   <li>Load: testo pagina per pagina tramite {@link DocumentLoader}</li>
 *   <li>Metadata: una sola chiamata al {@link MetadataExtractor} sui primi caratteri della prima pagina</li>
 *   <li>Per ogni pagina: TextCleaner → SectionExtractor → Segmenter → filtro auto-citazioni → MetadataAttacher</li>
 *   <li>Emissione dei segmenti verso il {@link SegmentSink} fornito dal chiamante</li>
 * </ol>
 * Quando il SectionExtractor segnala la bibliografia le pagine rimanenti del documento
 * non vengono elaborate. Un errore su un documento viene registrato nel suo
 * {@link DocumentResult} e l'esecuzione prosegue con il successivo.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final DocumentLoader documentLoader;
    private final MetadataExtractor metadataExtractor;
    private final String documentExtension;
    private final int snippetLength;
    private final double citationThreshold;
    private final SegmentationMode defaultMode;

    public IngestionService(DocumentLoader documentLoader,
                            MetadataExtractor metadataExtractor,
                            @Value("${ingest.document-extension:.pdf}") String documentExtension,
                            @Value("${ingest.metadata-snippet-length:1000}") int snippetLength,
                            @Value("${ingest.citation-threshold:0.8}") double citationThreshold,
                            @Value("${ingest.segmentation-mode:PARAGRAPH}") SegmentationMode defaultMode) {
        this.documentLoader = documentLoader;
        this.metadataExtractor = metadataExtractor;
        this.documentExtension = documentExtension.toLowerCase(Locale.ROOT);
        this.snippetLength = snippetLength;
        this.citationThreshold = citationThreshold;
        this.defaultMode = defaultMode;
    }

    public SegmentationMode defaultMode() {
        return defaultMode;
    }

    /**
     * Elabora ricorsivamente tutti i documenti della directory, in ordine di percorso.
     * I file con altra estensione sono elencati nel report ma non aperti.
     *
     * @throws NoSuchFileException se la directory non esiste
     */
    public IngestionReport ingestDirectory(Path directory, SegmentationMode mode, SegmentSink sink)
            throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new NoSuchFileException(directory.toString());
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }

        List<Path> documents = new ArrayList<>();
        List<String> otherFiles = new ArrayList<>();
        for (Path file : files) {
            if (isDocument(file)) documents.add(file);
            else otherFiles.add(file.toString());
        }
        log.info("Inizio ingestione di {}: {} documenti, {} altri file, modalità {}",
                directory, documents.size(), otherFiles.size(), mode);

        List<DocumentResult> results = new ArrayList<>(documents.size());
        for (Path document : documents) {
            results.add(ingestDocument(document, mode, sink));
        }

        IngestionReport report = new IngestionReport(directory.toString(), results, otherFiles);
        log.info("Ingestione completata per {}: {} segmenti, {} documenti falliti",
                directory, report.totalSegments(), report.failedDocuments());
        return report;
    }

    /**
     * Elabora un singolo documento. La numerazione dei segmenti riparte da 1.
     */
    public DocumentResult ingestDocument(Path file, SegmentationMode mode, SegmentSink sink) {
        String name = file.toString();

        // [1] Load
        List<String> pages;
        try {
            pages = documentLoader.load(file);
        } catch (DocumentLoadException | RuntimeException e) {
            log.error("Documento non leggibile, ignorato: {}", name, e);
            return DocumentResult.failed(name, Status.LOAD_FAILED, e);
        }
        if (pages.isEmpty()) {
            log.warn("Documento senza pagine: {}", name);
            return DocumentResult.empty(name);
        }

        // [2] Metadata
        DocumentMetadata metadata;
        try {
            metadata = metadataExtractor.extract(snippet(pages.get(0)));
        } catch (MetadataExtractionException e) {
            log.error("Estrazione metadati fallita, documento ignorato: {}", name, e);
            return DocumentResult.failed(name, Status.METADATA_FAILED, e);
        }

        // [3] Pagine
        HeaderFooter headerFooter = TextCleaner.detect(pages);
        int phraseNumber = 0;
        int pagesRead = 0;
        try {
            for (String page : pages) {
                pagesRead++;
                SectionWindow window = SectionExtractor.extract(TextCleaner.clean(page, headerFooter));
                for (TextUnit unit : Segmenter.segment(window.text(), mode)) {
                    if (CitationSimilarity.isOwnCitation(unit.text(), metadata.citation(), citationThreshold)) {
                        log.debug("Auto-citazione scartata a pagina {}: {}", pagesRead, unit.text());
                        continue;
                    }
                    sink.accept(MetadataAttacher.attach(unit, metadata, phraseNumber + 1));
                    phraseNumber++;
                }
                if (window.stopSignal()) {
                    log.debug("Bibliografia raggiunta a pagina {}/{}: {}", pagesRead, pages.size(), name);
                    break;
                }
            }
        } catch (RuntimeException e) {
            // I segmenti già emessi restano nel sink
            log.error("Errore nel salvataggio dei segmenti di {} (pagina {})", name, pagesRead, e);
            return new DocumentResult(name, Status.STORE_FAILED, phraseNumber, pagesRead, e.getMessage());
        }

        log.info("Documento elaborato {}: {} segmenti da {} pagine", name, phraseNumber, pagesRead);
        return DocumentResult.ingested(name, phraseNumber, pagesRead);
    }

    private String snippet(String firstPage) {
        if (firstPage == null) return "";
        return firstPage.length() > snippetLength ? firstPage.substring(0, snippetLength) : firstPage;
    }

    private boolean isDocument(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(documentExtension);
    }
}
