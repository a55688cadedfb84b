package org.ohnlp.ir.ase.criteria;

import org.joda.time.DateTime;
import org.ohnlp.ir.ase.config.AseSettings;
import org.ohnlp.ir.ase.structs.Baseline;
import org.ohnlp.ir.ase.structs.BloodCultureAnchor;
import org.ohnlp.ir.ase.structs.HospitalizationRecord;
import org.ohnlp.ir.ase.structs.LabCategory;

import java.util.Map;

/**
 * Inputs shared by every criterion when evaluated around one blood culture.
 */
public class AnchorContext {
    private final HospitalizationRecord record;
    private final Map<LabCategory, Baseline> baselines;
    private final boolean thrombocytopeniaEnabled;
    private final AseSettings settings;
    private final DateTime windowStart;
    private final DateTime windowEnd;

    public AnchorContext(HospitalizationRecord record, BloodCultureAnchor anchor, Map<LabCategory, Baseline> baselines,
                         boolean thrombocytopeniaEnabled, AseSettings settings) {
        this.record = record;
        this.baselines = baselines;
        this.thrombocytopeniaEnabled = thrombocytopeniaEnabled;
        this.settings = settings;
        this.windowStart = anchor.getCollectDttm().minusDays(settings.getOrganDysfunctionDays());
        this.windowEnd = anchor.getCollectDttm().plusDays(settings.getOrganDysfunctionDays());
    }

    /**
     * @return true if the timestamp is inside the organ dysfunction window, bounds included
     */
    public boolean inWindow(DateTime dttm) {
        return dttm != null && !dttm.isBefore(windowStart) && !dttm.isAfter(windowEnd);
    }

    /**
     * @return the selected baseline value for a lab, or null when none was observed
     */
    public Double getBaselineValue(LabCategory category) {
        Baseline baseline = baselines.get(category);
        return baseline == null ? null : baseline.getSelectedValue();
    }

    public HospitalizationRecord getRecord() {
        return record;
    }

    public boolean isThrombocytopeniaEnabled() {
        return thrombocytopeniaEnabled;
    }

    public AseSettings getSettings() {
        return settings;
    }
}
