package com.premiergroup.ad_optimizer.enums;

public enum EntityType {
    AD_SET("AdSet"),
    AD("Ad");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    /**
     * Short kind name used in cycle error lines, e.g. {@code "AdSet 123: ..."}.
     */
    public String getLabel() {
        return label;
    }
}
