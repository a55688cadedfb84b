package org.ohnlp.ir.ase.criteria;

import org.joda.time.DateTime;
import org.ohnlp.ir.ase.structs.VasopressorEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Initiation of a vasopressor infusion: a positive dose for an agent that was not already running.
 * Administrations documented in procedural locations, and rows without a dose, are ignored.
 */
public class VasopressorCriterion extends Criterion {

    @Override
    public CriterionType getType() {
        return CriterionType.VASOPRESSOR;
    }

    @Override
    public boolean isApplicable(AnchorContext ctx) {
        return ctx.getRecord().isVasopressorDataAvailable();
    }

    @Override
    protected DateTime findEarliest(AnchorContext ctx) {
        for (DateTime initiation : initiations(ctx.getRecord().getVasopressors())) {
            if (ctx.inWindow(initiation)) {
                return initiation;
            }
        }
        return null;
    }

    /**
     * @return initiation times in chronological order
     */
    static List<DateTime> initiations(List<VasopressorEvent> events) {
        Map<String, List<VasopressorEvent>> byAgent = new HashMap<>();
        for (VasopressorEvent e : events) {
            if (e.getAdminDttm() == null || e.getMedDose() == null || e.isProcedural()) {
                continue;
            }
            String agent = e.getMedCategory() == null ? "" : e.getMedCategory().trim().toLowerCase(Locale.ROOT);
            byAgent.computeIfAbsent(agent, k -> new ArrayList<>()).add(e);
        }
        List<DateTime> ret = new ArrayList<>();
        for (List<VasopressorEvent> agentEvents : byAgent.values()) {
            agentEvents.sort(Comparator.comparing(VasopressorEvent::getAdminDttm));
            boolean running = false;
            for (VasopressorEvent e : agentEvents) {
                if (e.isRunning() && !running) {
                    ret.add(e.getAdminDttm());
                }
                running = e.isRunning();
            }
        }
        ret.sort(Comparator.naturalOrder());
        return ret;
    }
}
