package com.tony.npbStats.model;

/**
 * Notation NPB des manches lancées : "172.1" = 172 manches et 1/3, "172.2" = 172 et 2/3.
 * En interne on ne manipule que des retraits (outs) pour éviter les arrondis.
 */
public final class Innings {

    private Innings() {
    }

    public static int toOuts(String notation) {
        if (notation == null || notation.isBlank()) return 0;
        String value = notation.replace(" ", "").trim();
        if (value.startsWith(".")) {
            value = "0" + value;
        }
        String[] parts = value.split("\\.", 2);
        try {
            int whole = parts[0].isEmpty() ? 0 : Integer.parseInt(parts[0]);
            int thirds = parts.length > 1 && !parts[1].isEmpty() ? Integer.parseInt(parts[1]) : 0;
            if (whole < 0 || thirds < 0 || thirds > 2) {
                throw new IllegalArgumentException("Manches invalides : " + notation);
            }
            return whole * 3 + thirds;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Manches invalides : " + notation, e);
        }
    }

    public static String format(int outs) {
        int thirds = outs % 3;
        return thirds == 0 ? String.valueOf(outs / 3) : (outs / 3) + "." + thirds;
    }
}
