package org.ohnlp.ir.ase.structs;

import java.util.Locale;

public enum OnsetType {
    COMMUNITY,
    HOSPITAL;

    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
