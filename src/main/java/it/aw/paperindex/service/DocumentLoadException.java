package it.aw.paperindex.service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Il documento non può essere letto. Non ha senso ritentare: un file corrotto resta corrotto.
 */
public class DocumentLoadException extends IOException {

    private final transient Path file;

    public DocumentLoadException(Path file, Throwable cause) {
        super("Impossibile leggere il documento " + file + ": " + cause.getMessage(), cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
