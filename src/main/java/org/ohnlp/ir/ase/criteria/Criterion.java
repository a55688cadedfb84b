package org.ohnlp.ir.ase.criteria;

import org.joda.time.DateTime;
import org.ohnlp.ir.ase.structs.OrganDysfunctionEvent;

import java.io.Serializable;

public abstract class Criterion implements Serializable {

    public abstract CriterionType getType();

    /**
     * @return false when the data needed to evaluate this criterion is absent for the hospitalization
     */
    public abstract boolean isApplicable(AnchorContext ctx);

    /**
     * @return the earliest qualifying timestamp inside the anchor's window, or null if nothing qualifies
     */
    protected abstract DateTime findEarliest(AnchorContext ctx);

    public OrganDysfunctionEvent evaluate(AnchorContext ctx) {
        if (!isApplicable(ctx)) {
            return null;
        }
        DateTime earliest = findEarliest(ctx);
        if (earliest == null) {
            return null;
        }
        return new OrganDysfunctionEvent(ctx.getRecord().getHospitalizationId(), getType(), earliest, true);
    }
}
