package org.ohnlp.ir.ase.structs;

import java.util.Locale;

public enum LabCategory {
    CREATININE("creatinine"),
    BILIRUBIN("bilirubin_total"),
    PLATELETS("platelet_count"),
    LACTATE("lactate");

    private final String clifName;

    LabCategory(String clifName) {
        this.clifName = clifName;
    }

    public String getClifName() {
        return clifName;
    }

    /**
     * @param clifName a CLIF {@code lab_category} value
     * @return the matching category, or null for lab categories not used by ASE detection
     */
    public static LabCategory fromClifName(String clifName) {
        if (clifName == null) {
            return null;
        }
        String normalized = clifName.trim().toLowerCase(Locale.ROOT);
        for (LabCategory c : values()) {
            if (c.clifName.equals(normalized)) {
                return c;
            }
        }
        return null;
    }
}
