package org.ohnlp.ir.ase.criteria;

import org.ohnlp.ir.ase.structs.LabCategory;

/**
 * Platelets below 100 and at most half the baseline. A baseline of at least 100 is required.
 */
public class ThrombocytopeniaCriterion extends LabCriterion {
    public static final double PLATELET_THRESHOLD = 100;

    @Override
    public CriterionType getType() {
        return CriterionType.THROMBOCYTOPENIA;
    }

    @Override
    public LabCategory getLabCategory() {
        return LabCategory.PLATELETS;
    }

    @Override
    public boolean isApplicable(AnchorContext ctx) {
        Double baseline = ctx.getBaselineValue(LabCategory.PLATELETS);
        return ctx.isThrombocytopeniaEnabled() && baseline != null && baseline >= PLATELET_THRESHOLD;
    }

    @Override
    public boolean matches(double value, Double baseline) {
        return baseline != null && value < PLATELET_THRESHOLD && value <= 0.5 * baseline;
    }
}
