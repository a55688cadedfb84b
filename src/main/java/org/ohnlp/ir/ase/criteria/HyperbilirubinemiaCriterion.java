package org.ohnlp.ir.ase.criteria;

import org.ohnlp.ir.ase.structs.LabCategory;

/**
 * Total bilirubin of at least 2.0 mg/dL and at least double the baseline.
 */
public class HyperbilirubinemiaCriterion extends LabCriterion {
    public static final double MIN_BILIRUBIN = 2.0;

    @Override
    public CriterionType getType() {
        return CriterionType.HYPERBILIRUBINEMIA;
    }

    @Override
    public LabCategory getLabCategory() {
        return LabCategory.BILIRUBIN;
    }

    @Override
    public boolean isApplicable(AnchorContext ctx) {
        return ctx.getBaselineValue(LabCategory.BILIRUBIN) != null;
    }

    @Override
    public boolean matches(double value, Double baseline) {
        return baseline != null && value >= MIN_BILIRUBIN && value >= 2 * baseline;
    }
}
