package org.ohnlp.ir.ase.structs;

import java.io.Serializable;

public final class Baseline implements Serializable {
    private final LabCategory category;
    private final Double communityValue;
    private final Double hospitalValue;
    private final BaselineBasis selectionBasis;

    public Baseline(LabCategory category, Double communityValue, Double hospitalValue, BaselineBasis selectionBasis) {
        this.category = category;
        this.communityValue = communityValue;
        this.hospitalValue = hospitalValue;
        this.selectionBasis = selectionBasis;
    }

    public LabCategory getCategory() {
        return category;
    }

    public Double getCommunityValue() {
        return communityValue;
    }

    public Double getHospitalValue() {
        return hospitalValue;
    }

    public Double getSelectedValue() {
        return selectionBasis == BaselineBasis.COMMUNITY ? communityValue : hospitalValue;
    }

    public BaselineBasis getSelectionBasis() {
        return selectionBasis;
    }
}
