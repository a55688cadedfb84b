package org.ohnlp.ir.ase.engine;

import org.ohnlp.ir.ase.criteria.AkiCriterion;
import org.ohnlp.ir.ase.criteria.AnchorContext;
import org.ohnlp.ir.ase.criteria.Criterion;
import org.ohnlp.ir.ase.criteria.HyperbilirubinemiaCriterion;
import org.ohnlp.ir.ase.criteria.LactateCriterion;
import org.ohnlp.ir.ase.criteria.ThrombocytopeniaCriterion;
import org.ohnlp.ir.ase.criteria.VasopressorCriterion;
import org.ohnlp.ir.ase.criteria.VentilationCriterion;
import org.ohnlp.ir.ase.structs.OrganDysfunctionEvent;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

public class OrganDysfunctionDetector implements Serializable {

    // Evaluation order doubles as the tie-break priority
    private final List<Criterion> criteria = List.of(
            new VasopressorCriterion(),
            new VentilationCriterion(),
            new AkiCriterion(),
            new HyperbilirubinemiaCriterion(),
            new ThrombocytopeniaCriterion(),
            new LactateCriterion()
    );

    public OrganDysfunctionResult detect(AnchorContext ctx) {
        List<OrganDysfunctionEvent> events = new ArrayList<>();
        for (Criterion criterion : criteria) {
            OrganDysfunctionEvent e = criterion.evaluate(ctx);
            if (e != null) {
                events.add(e);
            }
        }
        return new OrganDysfunctionResult(events);
    }
}
