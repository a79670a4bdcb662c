package it.aw.paperindex.service;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsatore PDF pagina per pagina via PDFBox.
 * <p>
 * Produce il testo di ogni pagina separatamente, perché la pulizia di intestazioni
 * e piè di pagina e l'interruzione sulla bibliografia lavorano a livello di pagina.
 */
@Component
public class PdfPageParser implements DocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(PdfPageParser.class);

    @Override
    public List<String> load(Path file) throws DocumentLoadException {
        try (InputStream is = Files.newInputStream(file)) {
            return parse(is);
        } catch (IOException | RuntimeException e) {
            throw new DocumentLoadException(file, e);
        }
    }

    /**
     * Esegue il parsing del PDF dall'input stream.
     * L'input stream NON viene chiuso dal metodo: la responsabilità è del chiamante.
     */
    public static List<String> parse(InputStream inputStream) throws IOException {
        try (PDDocument doc = PDDocument.load(inputStream)) {
            int totalPages = doc.getNumberOfPages();
            log.debug("PdfPageParser: {} pagine trovate", totalPages);

            PDFTextStripper stripper = new PDFTextStripper();
            List<String> pages = new ArrayList<>(totalPages);
            for (int p = 1; p <= totalPages; p++) {
                stripper.setStartPage(p);
                stripper.setEndPage(p);
                pages.add(stripper.getText(doc));
            }
            return pages;
        }
    }
}
