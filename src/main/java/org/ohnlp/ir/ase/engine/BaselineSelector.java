package org.ohnlp.ir.ase.engine;

import org.joda.time.DateTime;
import org.ohnlp.ir.ase.config.AseSettings;
import org.ohnlp.ir.ase.criteria.ThrombocytopeniaCriterion;
import org.ohnlp.ir.ase.structs.Baseline;
import org.ohnlp.ir.ase.structs.BaselineBasis;
import org.ohnlp.ir.ase.structs.BloodCultureAnchor;
import org.ohnlp.ir.ase.structs.Hospitalization;
import org.ohnlp.ir.ase.structs.LabCategory;
import org.ohnlp.ir.ase.structs.LabResult;
import org.ohnlp.ir.ase.structs.OnsetType;

import java.io.Serializable;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Chooses the reference value each lab criterion is compared against.
 * <p>
 * Onset type depends on the organ dysfunction found, which in turn depends on the baseline. The loop is
 * cut by classifying the culture provisionally from its own timestamp: cultures drawn within
 * {@link AseSettings#getOnsetTypeDays()} of admission use the whole-stay ("community") value, later ones
 * the value found around the culture ("hospital"). The reported onset type is derived afterwards from
 * the actual onset and is allowed to disagree with this choice.
 */
public class BaselineSelector implements Serializable {
    private static final LabCategory[] BASELINE_LABS = {LabCategory.CREATININE, LabCategory.BILIRUBIN, LabCategory.PLATELETS};

    private final AseSettings settings;

    public BaselineSelector(AseSettings settings) {
        this.settings = settings;
    }

    public OnsetType provisionalType(BloodCultureAnchor anchor, Hospitalization hospitalization) {
        return classify(anchor.getCollectDttm(), hospitalization, settings);
    }

    /**
     * @return {@link OnsetType#COMMUNITY} when the timestamp is no later than admission plus the onset
     * type window, or when the admission time is unknown
     */
    static OnsetType classify(DateTime dttm, Hospitalization hospitalization, AseSettings settings) {
        DateTime admission = hospitalization.getAdmissionDttm();
        if (admission == null || !dttm.isAfter(admission.plusDays(settings.getOnsetTypeDays()))) {
            return OnsetType.COMMUNITY;
        }
        return OnsetType.HOSPITAL;
    }

    public Map<LabCategory, Baseline> select(List<LabResult> labs, BloodCultureAnchor anchor, OnsetType provisionalType) {
        DateTime windowStart = anchor.getCollectDttm().minusDays(settings.getOrganDysfunctionDays());
        DateTime windowEnd = anchor.getCollectDttm().plusDays(settings.getOrganDysfunctionDays());
        BaselineBasis basis = provisionalType == OnsetType.COMMUNITY ? BaselineBasis.COMMUNITY : BaselineBasis.HOSPITAL;
        Map<LabCategory, Baseline> ret = new EnumMap<>(LabCategory.class);
        for (LabCategory category : BASELINE_LABS) {
            boolean useMax = category == LabCategory.PLATELETS;
            Double community = null;
            Double hospital = null;
            for (LabResult lab : labs) {
                if (lab.getCategory() != category || lab.getValue() == null) {
                    continue;
                }
                community = extremal(community, lab.getValue(), useMax);
                DateTime t = lab.getResultDttm();
                if (t != null && !t.isBefore(windowStart) && !t.isAfter(windowEnd)) {
                    hospital = extremal(hospital, lab.getValue(), useMax);
                }
            }
            ret.put(category, new Baseline(category, community, hospital, basis));
        }
        return ret;
    }

    private static Double extremal(Double current, double value, boolean useMax) {
        if (current == null) {
            return value;
        }
        return useMax ? Math.max(current, value) : Math.min(current, value);
    }

    /**
     * @return true if any platelet count of at least 100 was recorded during the stay; without one the
     * thrombocytopenia criterion is disabled for the hospitalization
     */
    public boolean hasPlateletBaseline(List<LabResult> labs) {
        for (LabResult lab : labs) {
            if (lab.getCategory() == LabCategory.PLATELETS && lab.getValue() != null
                    && lab.getValue() >= ThrombocytopeniaCriterion.PLATELET_THRESHOLD) {
                return true;
            }
        }
        return false;
    }
}
