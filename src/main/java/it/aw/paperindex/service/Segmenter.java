package it.aw.paperindex.service;

import it.aw.paperindex.model.SegmentationMode;
import it.aw.paperindex.model.TextUnit;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Divide il testo estratto in frasi o paragrafi e scarta il rumore non discorsivo.
 * <p>
 * Dopo lo split si applicano, nell'ordine, due filtri:
 * <ol>
 *   <li>didascalie di figure e tabelle ("Figure 3.", "Table 1.", "Fig. 2.", "Figura 4.", "Tabla 5.")</li>
 *   <li>righe bibliografiche nude: numerazione opzionale, testo libero e anno tra parentesi in coda</li>
 * </ol>
 * Le unità vuote o scartate non consumano posizioni: la numerazione delle unità
 * emesse è 1-based e senza buchi.
 */
public class Segmenter {

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+(?=[A-Z0-9])");

    private static final Pattern PARAGRAPH_BOUNDARY = Pattern.compile("(?<=\\.)[ \\t]*\\r?\\n");

    private static final Pattern CAPTION = Pattern.compile(
            "^(Figure|Table|Fig\\.?|Figura|Tabla)\\s*\\d+\\.");

    private static final Pattern CITATION_LINE = Pattern.compile(
            "^(\\d+\\.)?.*\\(\\d{4}\\)\\.?$",
            Pattern.DOTALL);

    private Segmenter() {}

    /**
     * Segmenta il testo secondo la strategia indicata.
     *
     * @return unità non vuote sopravvissute ai filtri, numerate da 1
     */
    public static List<TextUnit> segment(String text, SegmentationMode mode) {
        List<TextUnit> units = new ArrayList<>();
        if (text == null || text.isBlank()) return units;

        Pattern boundary = mode == SegmentationMode.SENTENCE ? SENTENCE_BOUNDARY : PARAGRAPH_BOUNDARY;
        int position = 1;
        for (String piece : boundary.split(text)) {
            String unit = piece.strip();
            if (unit.isEmpty() || isCaption(unit) || isCitationLine(unit)) continue;
            units.add(new TextUnit(unit, position++));
        }
        return units;
    }

    public static boolean isCaption(String unit) {
        return CAPTION.matcher(unit.strip()).lookingAt();
    }

    public static boolean isCitationLine(String unit) {
        return CITATION_LINE.matcher(unit.strip()).matches();
    }
}
