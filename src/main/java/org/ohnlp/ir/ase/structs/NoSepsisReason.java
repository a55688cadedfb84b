package org.ohnlp.ir.ase.structs;

import java.util.Locale;

public enum NoSepsisReason {
    NO_PRESUMED_INFECTION,
    NO_ORGAN_DYSFUNCTION;

    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
