package org.ohnlp.ir.ase.criteria;

import org.joda.time.DateTime;
import org.ohnlp.ir.ase.structs.RespiratoryEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Initiation of invasive mechanical ventilation: the device category changes into IMV.
 */
public class VentilationCriterion extends Criterion {

    @Override
    public CriterionType getType() {
        return CriterionType.IMV;
    }

    @Override
    public boolean isApplicable(AnchorContext ctx) {
        return ctx.getRecord().isVentilationDataAvailable();
    }

    @Override
    protected DateTime findEarliest(AnchorContext ctx) {
        List<RespiratoryEvent> events = new ArrayList<>();
        for (RespiratoryEvent e : ctx.getRecord().getRespiratorySupport()) {
            // Rows without a device carry no information about the ventilation state
            if (e.getRecordedDttm() != null && e.getDeviceCategory() != null) {
                events.add(e);
            }
        }
        events.sort(Comparator.comparing(RespiratoryEvent::getRecordedDttm));
        boolean ventilated = false;
        for (RespiratoryEvent e : events) {
            boolean imv = e.isInvasiveVentilation();
            if (imv && !ventilated && ctx.inWindow(e.getRecordedDttm())) {
                return e.getRecordedDttm();
            }
            ventilated = imv;
        }
        return null;
    }
}
