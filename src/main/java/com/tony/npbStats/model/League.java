package com.tony.npbStats.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum League {
    CENTRAL("Central League", "c"),
    PACIFIC("Pacific League", "p");

    private final String displayName;
    // Suffixe utilisé dans les URLs du site officiel (bat_c.html, std_p.html...)
    private final String pageSuffix;
}
