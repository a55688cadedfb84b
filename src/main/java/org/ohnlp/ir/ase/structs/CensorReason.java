package org.ohnlp.ir.ase.structs;

import java.util.Locale;

public enum CensorReason {
    NONE,
    DEATH,
    HOSPICE_TRANSFER,
    ACUTE_TRANSFER;

    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
