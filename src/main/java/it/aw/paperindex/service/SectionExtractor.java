package it.aw.paperindex.service;

import it.aw.paperindex.model.SectionWindow;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Individua la finestra di contenuto di un articolo scientifico: dal primo marcatore
 * di inizio (Abstract / Introduction e traduzioni) al primo marcatore di bibliografia
 * (References / Bibliography e traduzioni), esclusa la bibliografia.
 * <p>
 * La ricerca è case-insensitive e limitata a parole intere. Quando la bibliografia
 * viene raggiunta la finestra restituita porta {@code stopSignal = true}: l'orchestratore
 * smette di leggere le pagine successive dello stesso documento.
 * <p>
 * Casi gestiti:
 * <ul>
 *   <li>inizio e fine: testo da inizio (incluso) a fine (escluso), stop</li>
 *   <li>solo inizio: testo da inizio alla fine dell'input, nessuno stop</li>
 *   <li>solo fine: testo dall'inizio dell'input alla bibliografia, stop</li>
 *   <li>nessuno dei due: intero input, nessuno stop</li>
 * </ul>
 * La bibliografia è cercata solo dopo il marcatore di inizio, se presente.
 * <p>
 * Non filtra le auto-citazioni: il confronto con la citazione del documento
 * ({@link CitationSimilarity}) è applicato da {@link IngestionService} alle singole unità
 * prodotte dal {@link Segmenter}.
 */
public class SectionExtractor {

    private static final Pattern START = Pattern.compile(
            "\\b(abstract|resumen|introduction|introducción)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern END = Pattern.compile(
            "\\b(references|bibliography|referencias|bibliografía)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);

    private SectionExtractor() {}

    /**
     * Estrae la finestra di interesse da una pagina già ripulita.
     *
     * @param text testo della pagina
     * @return finestra e segnale di stop
     */
    public static SectionWindow extract(String text) {
        if (text == null || text.isEmpty()) {
            return new SectionWindow("", false);
        }
        Matcher start = START.matcher(text);
        int from = start.find() ? start.start() : 0;

        Matcher end = END.matcher(text);
        if (end.find(from)) {
            return new SectionWindow(text.substring(from, end.start()), true);
        }
        return new SectionWindow(text.substring(from), false);
    }
}
