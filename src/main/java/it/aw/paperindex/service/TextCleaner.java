package it.aw.paperindex.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rimuove intestazioni e piè di pagina ripetuti tra le pagine di uno stesso documento.
 * <p>
 * L'intestazione è la prima riga più frequente tra le pagine, il piè di pagina
 * l'ultima riga più frequente (conteggio sulle sole righe non vuote). Nei documenti
 * di più pagine una riga conta come ricorrente solo se compare in almeno due pagine.
 * Da ogni pagina si rimuove al più una riga in testa e una in coda, e mai
 * l'ultima riga rimasta: una pagina non viene mai svuotata.
 */
public class TextCleaner {

    private static final String LINE_BREAK = "\\r?\\n";

    private static final int MIN_RECURRENCE = 2;

    /**
     * Righe ricorrenti rilevate su un documento.
     * I valori sono null se il documento non ha righe non vuote.
     */
    public record HeaderFooter(String header, String footer) {}

    private TextCleaner() {}

    /**
     * Pulisce una pagina calcolando intestazione e piè di pagina su tutte le pagine del documento.
     */
    public static String clean(String page, List<String> allPages) {
        return clean(page, detect(allPages));
    }

    /** Rileva intestazione e piè di pagina maggioritari. */
    public static HeaderFooter detect(List<String> pages) {
        Map<String, Integer> firstLines = new LinkedHashMap<>();
        Map<String, Integer> lastLines  = new LinkedHashMap<>();
        for (String page : pages) {
            List<String> lines = lines(page);
            if (lines.isEmpty()) continue;
            String first = lines.get(0).strip();
            String last  = lines.get(lines.size() - 1).strip();
            if (!first.isEmpty()) firstLines.merge(first, 1, Integer::sum);
            if (!last.isEmpty())  lastLines.merge(last, 1, Integer::sum);
        }
        int minCount = pages.size() > 1 ? MIN_RECURRENCE : 1;
        return new HeaderFooter(mostFrequent(firstLines, minCount), mostFrequent(lastLines, minCount));
    }

    /**
     * Applica alla pagina le righe ricorrenti già rilevate.
     * Se nulla viene rimosso la pagina è restituita invariata.
     */
    public static String clean(String page, HeaderFooter headerFooter) {
        if (page == null || page.isBlank()) return page == null ? "" : page;
        List<String> lines = new ArrayList<>(lines(page));
        boolean changed = false;

        if (lines.size() > 1 && lines.get(0).strip().equals(headerFooter.header())) {
            lines.remove(0);
            changed = true;
        }
        if (lines.size() > 1 && lines.get(lines.size() - 1).strip().equals(headerFooter.footer())) {
            lines.remove(lines.size() - 1);
            changed = true;
        }
        return changed ? String.join("\n", lines) : page;
    }

    private static List<String> lines(String page) {
        if (page == null || page.isBlank()) return List.of();
        return Arrays.asList(page.strip().split(LINE_BREAK, -1));
    }

    // A parità di frequenza vince la riga incontrata per prima
    private static String mostFrequent(Map<String, Integer> counts, int minCount) {
        String best = null;
        int bestCount = minCount - 1;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }
}
