package org.ohnlp.ir.ase.criteria;

import org.ohnlp.ir.ase.structs.LabCategory;

/**
 * Creatinine at least double the baseline. Never applies to ESRD patients.
 */
public class AkiCriterion extends LabCriterion {

    @Override
    public CriterionType getType() {
        return CriterionType.AKI;
    }

    @Override
    public LabCategory getLabCategory() {
        return LabCategory.CREATININE;
    }

    @Override
    public boolean isApplicable(AnchorContext ctx) {
        return !ctx.getRecord().isEsrd() && ctx.getBaselineValue(LabCategory.CREATININE) != null;
    }

    @Override
    public boolean matches(double value, Double baseline) {
        return baseline != null && value >= 2 * baseline;
    }
}
