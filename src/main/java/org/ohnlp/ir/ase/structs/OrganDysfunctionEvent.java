package org.ohnlp.ir.ase.structs;

import org.joda.time.DateTime;
import org.ohnlp.ir.ase.criteria.CriterionType;

import java.io.Serializable;

public final class OrganDysfunctionEvent implements Serializable {
    private final String hospitalizationId;
    private final CriterionType criterion;
    private final DateTime eventDttm;
    private final boolean qualifies;

    public OrganDysfunctionEvent(String hospitalizationId, CriterionType criterion, DateTime eventDttm, boolean qualifies) {
        this.hospitalizationId = hospitalizationId;
        this.criterion = criterion;
        this.eventDttm = eventDttm;
        this.qualifies = qualifies;
    }

    public String getHospitalizationId() {
        return hospitalizationId;
    }

    public CriterionType getCriterion() {
        return criterion;
    }

    public DateTime getEventDttm() {
        return eventDttm;
    }

    public boolean isQualifies() {
        return qualifies;
    }
}
