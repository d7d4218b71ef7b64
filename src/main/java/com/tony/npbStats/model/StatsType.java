package com.tony.npbStats.model;

public enum StatsType {
    BATTING,
    PITCHING;

    public StatsType other() {
        return this == BATTING ? PITCHING : BATTING;
    }
}
