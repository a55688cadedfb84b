package org.ohnlp.ir.ase.criteria;

import org.ohnlp.ir.ase.structs.LabCategory;

/**
 * Lactate of at least 2.0 mmol/L, evaluated only when lactate is enabled.
 */
public class LactateCriterion extends LabCriterion {
    public static final double MIN_LACTATE = 2.0;

    @Override
    public CriterionType getType() {
        return CriterionType.LACTATE;
    }

    @Override
    public LabCategory getLabCategory() {
        return LabCategory.LACTATE;
    }

    @Override
    public boolean isApplicable(AnchorContext ctx) {
        return ctx.getSettings().isIncludeLactate();
    }

    @Override
    public boolean matches(double value, Double baseline) {
        return value >= MIN_LACTATE;
    }
}
