package it.aw.paperindex.model;

/**
 * Porzione di testo di interesse individuata dal SectionExtractor.
 *
 * @param text       testo della finestra (può essere vuoto)
 * @param stopSignal true se è stata raggiunta la bibliografia: le pagine successive
 *                   del documento non vanno più elaborate
 */
public record SectionWindow(String text, boolean stopSignal) {}
