package it.aw.paperindex.service;

/**
 * Confronta una citazione candidata con la citazione del documento stesso
 * per riconoscere le auto-citazioni.
 * <p>
 * Il rapporto di similarità è {@code 2 * LCS / (|a| + |b|)}, dove LCS è la lunghezza
 * della più lunga sottosequenza comune di caratteri, calcolata dopo aver normalizzato
 * gli spazi di entrambe le stringhe. Vale 1.0 per due stringhe vuote.
 */
public class CitationSimilarity {

    public static final double DEFAULT_THRESHOLD = 0.8;

    private CitationSimilarity() {}

    public static boolean isOwnCitation(String candidate, String ownCitation) {
        return isOwnCitation(candidate, ownCitation, DEFAULT_THRESHOLD);
    }

    /**
     * @return true se la similarità supera strettamente la soglia;
     *         false se una delle due citazioni è null
     */
    public static boolean isOwnCitation(String candidate, String ownCitation, double threshold) {
        if (candidate == null || ownCitation == null) return false;
        String x = normalize(candidate);
        String y = normalize(ownCitation);
        int total = x.length() + y.length();
        // Limite superiore del rapporto: evita la LCS su paragrafi molto più lunghi della citazione
        if (total > 0 && 2.0 * Math.min(x.length(), y.length()) / total <= threshold) return false;
        return ratio(x, y) > threshold;
    }

    /** Similarità in [0, 1] tra due stringhe, dopo normalizzazione degli spazi. */
    public static double ratio(String a, String b) {
        String x = normalize(a);
        String y = normalize(b);
        int total = x.length() + y.length();
        if (total == 0) return 1.0;
        return 2.0 * lcsLength(x, y) / total;
    }

    static String normalize(String s) {
        return s.strip().replaceAll("\\s+", " ");
    }

    // Programmazione dinamica su due sole righe
    private static int lcsLength(String x, String y) {
        int[] prev = new int[y.length() + 1];
        int[] curr = new int[y.length() + 1];
        for (int i = 1; i <= x.length(); i++) {
            char c = x.charAt(i - 1);
            for (int j = 1; j <= y.length(); j++) {
                curr[j] = c == y.charAt(j - 1)
                        ? prev[j - 1] + 1
                        : Math.max(prev[j], curr[j - 1]);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[y.length()];
    }
}
