package org.ohnlp.ir.ase.engine;

import org.ohnlp.ir.ase.criteria.CriterionType;
import org.ohnlp.ir.ase.structs.OrganDysfunctionEvent;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

/**
 * The earliest qualifying event of every criterion that fired around one blood culture, kept in
 * criterion priority order.
 */
public class OrganDysfunctionResult implements Serializable {
    private final List<OrganDysfunctionEvent> events;

    public OrganDysfunctionResult(List<OrganDysfunctionEvent> events) {
        this.events = Collections.unmodifiableList(events);
    }

    /**
     * @param includeLactate whether the lactate criterion may win
     * @return the earliest event, ties going to the higher priority criterion; null if none qualified
     */
    public OrganDysfunctionEvent earliest(boolean includeLactate) {
        OrganDysfunctionEvent ret = null;
        for (OrganDysfunctionEvent e : events) {
            if (!includeLactate && e.getCriterion() == CriterionType.LACTATE) {
                continue;
            }
            if (ret == null || e.getEventDttm().isBefore(ret.getEventDttm())) {
                ret = e;
            }
        }
        return ret;
    }

    public List<OrganDysfunctionEvent> getEvents() {
        return events;
    }
}
