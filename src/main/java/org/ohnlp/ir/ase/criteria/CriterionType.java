package org.ohnlp.ir.ase.criteria;

import java.util.Locale;

/**
 * Organ dysfunction criteria. Declaration order is the tie-break priority when two criteria qualify
 * at the same instant.
 */
public enum CriterionType {
    VASOPRESSOR,
    IMV,
    AKI,
    HYPERBILIRUBINEMIA,
    THROMBOCYTOPENIA,
    LACTATE;

    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
