package org.ohnlp.ir.ase.criteria;

import org.joda.time.DateTime;
import org.ohnlp.ir.ase.structs.LabCategory;
import org.ohnlp.ir.ase.structs.LabResult;

/**
 * A criterion met by a single lab result compared against thresholds and the selected baseline.
 */
public abstract class LabCriterion extends Criterion {

    public abstract LabCategory getLabCategory();

    /**
     * @param value    The capped lab value
     * @param baseline The selected baseline, null if none was observed
     */
    public abstract boolean matches(double value, Double baseline);

    @Override
    protected DateTime findEarliest(AnchorContext ctx) {
        Double baseline = ctx.getBaselineValue(getLabCategory());
        DateTime earliest = null;
        for (LabResult lab : ctx.getRecord().getLabs()) {
            if (lab.getCategory() != getLabCategory() || lab.getValue() == null || !ctx.inWindow(lab.getResultDttm())) {
                continue;
            }
            if (matches(lab.getValue(), baseline) && (earliest == null || lab.getResultDttm().isBefore(earliest))) {
                earliest = lab.getResultDttm();
            }
        }
        return earliest;
    }
}
