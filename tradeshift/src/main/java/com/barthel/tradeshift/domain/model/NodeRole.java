package com.barthel.tradeshift.domain.model;

/**
 * Functional role of a country within the community structure
 * (Guimerà &amp; Nunes Amaral, 2005).
 */
public enum NodeRole {
    ULTRA_PERIPHERAL("R1"),
    PERIPHERAL("R2"),
    NON_HUB_CONNECTOR("R3"),
    NON_HUB_KINLESS("R4"),
    PROVINCIAL_HUB("R5"),
    CONNECTOR_HUB("R6"),
    KINLESS_HUB("R7"),
    UNDEFINED("-");

    private final String code;

    NodeRole(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isHub() {
        return this == PROVINCIAL_HUB || this == CONNECTOR_HUB || this == KINLESS_HUB;
    }
}
