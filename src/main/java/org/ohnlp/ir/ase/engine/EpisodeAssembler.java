package org.ohnlp.ir.ase.engine;

import org.ohnlp.ir.ase.config.AseSettings;
import org.ohnlp.ir.ase.structs.AseEpisode;
import org.ohnlp.ir.ase.structs.BloodCultureAnchor;
import org.ohnlp.ir.ase.structs.Hospitalization;
import org.ohnlp.ir.ase.structs.NoSepsisReason;
import org.ohnlp.ir.ase.structs.OnsetType;
import org.ohnlp.ir.ase.structs.OrganDysfunctionEvent;
import org.ohnlp.ir.ase.structs.QadWindow;

import java.io.Serializable;

/**
 * Combines presumed infection (component A) and organ dysfunction (component B) for one blood culture.
 */
public class EpisodeAssembler implements Serializable {
    private final AseSettings settings;

    public EpisodeAssembler(AseSettings settings) {
        this.settings = settings;
    }

    public AseEpisode assemble(BloodCultureAnchor anchor, Hospitalization hospitalization, QadWindow qad,
                               OrganDysfunctionResult organDysfunction, OnsetType provisionalType) {
        boolean presumedInfection = qad.satisfies(settings.getRequiredQad());
        OrganDysfunctionEvent withLactate = organDysfunction.earliest(settings.isIncludeLactate());
        OrganDysfunctionEvent withoutLactate = organDysfunction.earliest(false);
        boolean sepsis = presumedInfection && withLactate != null;
        boolean sepsisWoLactate = presumedInfection && withoutLactate != null;

        OnsetType type = withLactate == null
                ? provisionalType
                : BaselineSelector.classify(withLactate.getEventDttm(), hospitalization, settings);

        NoSepsisReason reason = null;
        if (!sepsis) {
            reason = presumedInfection ? NoSepsisReason.NO_ORGAN_DYSFUNCTION : NoSepsisReason.NO_PRESUMED_INFECTION;
        }
        return new AseEpisode(anchor, qad, presumedInfection, withLactate, withoutLactate, type,
                sepsis, sepsisWoLactate, reason, null, false);
    }
}
