package org.ohnlp.ir.ase.structs;

public enum BaselineBasis {
    COMMUNITY,
    HOSPITAL
}
