package com.tony.npbStats.metrics;

/**
 * Constantes d'environnement offensif propres à la NPB (approximations).
 */
public final class NpbConstants {

    private NpbConstants() {
    }

    // La NPB tourne un peu plus bas que la MLB (~3.20)
    public static final double FIP_CONSTANT = 3.10;

    // Poids linéaires du wOBA
    public static final double WOBA_BB = 0.69;
    public static final double WOBA_HBP = 0.72;
    public static final double WOBA_1B = 0.88;
    public static final double WOBA_2B = 1.24;
    public static final double WOBA_3B = 1.56;
    public static final double WOBA_HR = 1.95;

    public static final double LEAGUE_OPS = 0.750;
    public static final double LEAGUE_ERA = 3.50;
}
