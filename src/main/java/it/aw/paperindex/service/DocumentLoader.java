package it.aw.paperindex.service;

import java.nio.file.Path;
import java.util.List;

/**
 * Trasforma un file in una sequenza ordinata di testi di pagina.
 */
public interface DocumentLoader {

    /**
     * @param file percorso del documento
     * @return testo di ogni pagina, nell'ordine del documento
     * @throws DocumentLoadException se il file è illeggibile o corrotto
     */
    List<String> load(Path file) throws DocumentLoadException;
}
