package org.ohnlp.ir.ase.engine;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.LocalDate;
import org.ohnlp.ir.ase.config.AseSettings;
import org.ohnlp.ir.ase.structs.AntimicrobialEvent;
import org.ohnlp.ir.ase.structs.BloodCulture;
import org.ohnlp.ir.ase.structs.BloodCultureAnchor;
import org.ohnlp.ir.ase.structs.Hospitalization;
import org.ohnlp.ir.ase.structs.HospitalizationRecord;
import org.ohnlp.ir.ase.structs.LabResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Derives the per-hospitalization event attributes the engine relies on: new antimicrobial flags,
 * outlier-capped lab values, blood culture anchors, ESRD status and effective death time.
 */
public class EventNormalizer implements Serializable {
    private static final Logger LOG = LoggerFactory.getLogger(EventNormalizer.class);

    public static final Set<String> ESRD_CODES = Set.of("N186", "Z4931", "Z4901", "I120", "I1311", "I132");

    private final AseSettings settings;

    public EventNormalizer(AseSettings settings) {
        this.settings = settings;
    }

    public void normalize(HospitalizationRecord record) {
        markNewAdministrations(record.getAntimicrobials());
        applyOutlierCaps(record.getLabs());
    }

    /**
     * Flags each administration whose drug was not given on any of the preceding
     * {@link AseSettings#getNewAntimicrobialLookbackDays()} calendar days.
     */
    public void markNewAdministrations(List<AntimicrobialEvent> events) {
        DateTimeZone zone = settings.getZone();
        Map<String, Set<LocalDate>> daysByDrug = new HashMap<>();
        for (AntimicrobialEvent e : events) {
            if (e.getAdminDttm() != null) {
                daysByDrug.computeIfAbsent(e.getDrugKey(), k -> new HashSet<>())
                        .add(e.getAdminDttm().withZone(zone).toLocalDate());
            }
        }
        for (AntimicrobialEvent e : events) {
            if (e.getAdminDttm() == null) {
                e.setNewAdministration(false);
                continue;
            }
            LocalDate day = e.getAdminDttm().withZone(zone).toLocalDate();
            Set<LocalDate> drugDays = daysByDrug.get(e.getDrugKey());
            boolean seenRecently = false;
            for (int i = 1; i <= settings.getNewAntimicrobialLookbackDays(); i++) {
                if (drugDays.contains(day.minusDays(i))) {
                    seenRecently = true;
                    break;
                }
            }
            e.setNewAdministration(!seenRecently);
        }
    }

    public void applyOutlierCaps(List<LabResult> labs) {
        for (LabResult lab : labs) {
            lab.setValue(capOutlier(lab));
        }
    }

    private Double capOutlier(LabResult lab) {
        Double value = lab.getValue();
        if (value == null || lab.getCategory() == null) {
            return null;
        }
        if (value.isNaN() || value < 0 || value > settings.getOutlierCap(lab.getCategory())) {
            return null;
        }
        return value;
    }

    /**
     * Orders the hospitalization's blood cultures by collection time and numbers them from 1. Cultures
     * without a collection or order time cannot be placed and are dropped with a warning.
     */
    public List<BloodCultureAnchor> buildAnchors(String hospitalizationId, List<BloodCulture> cultures) {
        List<DateTime> times = new ArrayList<>();
        int skipped = 0;
        for (BloodCulture bc : cultures) {
            if (bc.getAnchorDttm() == null) {
                skipped++;
            } else {
                times.add(bc.getAnchorDttm());
            }
        }
        if (skipped > 0) {
            LOG.warn("Hospitalization {}: skipped {} blood culture(s) with neither collect_dttm nor order_dttm",
                    hospitalizationId, skipped);
        }
        times.sort(Comparator.naturalOrder());
        List<BloodCultureAnchor> anchors = new ArrayList<>();
        for (int i = 0; i < times.size(); i++) {
            anchors.add(new BloodCultureAnchor(hospitalizationId, i + 1, times.get(i)));
        }
        return anchors;
    }

    /**
     * @param code An ICD-10-CM code, with or without the dot
     */
    public static boolean isEsrdCode(String code) {
        if (code == null) {
            return false;
        }
        return ESRD_CODES.contains(code.trim().replace(".", "").toUpperCase(Locale.ROOT));
    }

    /**
     * @return the death time if it does not fall after discharge, otherwise null
     */
    public static DateTime effectiveDeathDttm(Hospitalization hospitalization, DateTime deathDttm) {
        if (deathDttm == null) {
            return null;
        }
        DateTime discharge = hospitalization.getDischargeDttm();
        return discharge == null || !deathDttm.isAfter(discharge) ? deathDttm : null;
    }
}
