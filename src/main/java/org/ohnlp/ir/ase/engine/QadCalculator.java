package org.ohnlp.ir.ase.engine;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.Days;
import org.joda.time.LocalDate;
import org.ohnlp.ir.ase.config.AseSettings;
import org.ohnlp.ir.ase.structs.AntimicrobialEvent;
import org.ohnlp.ir.ase.structs.BloodCultureAnchor;
import org.ohnlp.ir.ase.structs.CensorReason;
import org.ohnlp.ir.ase.structs.Hospitalization;
import org.ohnlp.ir.ase.structs.QadWindow;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Computes the qualifying antimicrobial day (QAD) run for a blood culture.
 * <p>
 * A run starts on a calendar day ("day 1") within the look-back window and up to
 * {@link AseSettings#getOrganDysfunctionDays()} days after the culture that holds a new IV/IM
 * administration. Every drug newly started on or after day 1 joins the run; a later day counts as a
 * QAD when it holds an administration of one of those drugs. Single-day gaps are bridged without
 * being counted, two missing days in a row end the run. The longest run wins, ties going to the
 * earliest start.
 */
public class QadCalculator implements Serializable {
    public static final String DEATH_CATEGORY = "Expired";
    public static final String HOSPICE_CATEGORY = "Hospice";
    public static final String ACUTE_TRANSFER_CATEGORY = "Acute Care Hospital";

    private final AseSettings settings;

    public QadCalculator(AseSettings settings) {
        this.settings = settings;
    }

    public QadWindow compute(List<AntimicrobialEvent> events, BloodCultureAnchor anchor, Hospitalization hospitalization) {
        DateTimeZone zone = settings.getZone();
        DateTime from = anchor.getCollectDttm().minusDays(settings.getQadLookbackDays());
        DateTime to = anchor.getCollectDttm().plusDays(settings.getQadLookaheadDays());

        TreeMap<LocalDate, List<AntimicrobialEvent>> byDay = new TreeMap<>();
        Set<String> meds = new TreeSet<>();
        for (AntimicrobialEvent e : events) {
            DateTime t = e.getAdminDttm();
            if (t == null || t.isBefore(from) || t.isAfter(to)) {
                continue;
            }
            byDay.computeIfAbsent(t.withZone(zone).toLocalDate(), k -> new ArrayList<>()).add(e);
            if (!e.getDrugKey().isEmpty()) {
                meds.add(e.getDrugKey());
            }
        }
        List<String> medsInWindow = new ArrayList<>(meds);
        if (byDay.isEmpty()) {
            return QadWindow.empty(medsInWindow);
        }

        LocalDate cultureDay = anchor.getCollectDttm().withZone(zone).toLocalDate();
        LocalDate firstStart = cultureDay.minusDays(settings.getQadLookbackDays());
        LocalDate lastStart = cultureDay.plusDays(settings.getOrganDysfunctionDays());
        Run best = null;
        for (LocalDate day : byDay.keySet()) {
            if (day.isBefore(firstStart) || day.isAfter(lastStart) || !startsRun(byDay.get(day))) {
                continue;
            }
            Run run = buildRun(byDay, day);
            if (best == null || run.count > best.count) {
                best = run;
            }
        }
        if (best == null) {
            return QadWindow.empty(medsInWindow);
        }
        QadWindow window = new QadWindow(best.count, best.start, best.end, false, CensorReason.NONE, medsInWindow);
        if (window.getTotalQad() < settings.getRequiredQad()) {
            CensorReason reason = censorReason(hospitalization, window);
            if (reason != CensorReason.NONE) {
                return window.censor(reason);
            }
        }
        return window;
    }

    private static boolean startsRun(List<AntimicrobialEvent> dayEvents) {
        for (AntimicrobialEvent e : dayEvents) {
            if (e.isNewAdministration() && e.isParenteral()) {
                return true;
            }
        }
        return false;
    }

    private static Run buildRun(TreeMap<LocalDate, List<AntimicrobialEvent>> byDay, LocalDate start) {
        Set<String> activeDrugs = new HashSet<>();
        LocalDate last = byDay.lastKey();
        LocalDate end = start;
        int count = 0;
        int missed = 0;
        for (LocalDate day = start; !day.isAfter(last); day = day.plusDays(1)) {
            List<AntimicrobialEvent> dayEvents = byDay.getOrDefault(day, Collections.emptyList());
            for (AntimicrobialEvent e : dayEvents) {
                if (e.isNewAdministration()) {
                    activeDrugs.add(e.getDrugKey());
                }
            }
            boolean qualifies = false;
            for (AntimicrobialEvent e : dayEvents) {
                if (activeDrugs.contains(e.getDrugKey())) {
                    qualifies = true;
                    break;
                }
            }
            if (qualifies) {
                count++;
                end = day;
                missed = 0;
            } else if (++missed > 1) {
                break;
            }
        }
        return new Run(start, end, count);
    }

    /**
     * A short run still satisfies presumed infection when the patient died or left for hospice or
     * another acute care hospital within the censor window of day 1, and antimicrobials were given
     * up to the day of, or the day before, that event.
     */
    CensorReason censorReason(Hospitalization hospitalization, QadWindow window) {
        CensorReason reason;
        DateTime eventDttm;
        if (hospitalization.getDeathDttm() != null) {
            reason = CensorReason.DEATH;
            eventDttm = hospitalization.getDeathDttm();
        } else if (hospitalization.hasDischargeCategory(DEATH_CATEGORY)) {
            reason = CensorReason.DEATH;
            eventDttm = hospitalization.getDischargeDttm();
        } else if (hospitalization.hasDischargeCategory(HOSPICE_CATEGORY)) {
            reason = CensorReason.HOSPICE_TRANSFER;
            eventDttm = hospitalization.getDischargeDttm();
        } else if (hospitalization.hasDischargeCategory(ACUTE_TRANSFER_CATEGORY)) {
            reason = CensorReason.ACUTE_TRANSFER;
            eventDttm = hospitalization.getDischargeDttm();
        } else {
            return CensorReason.NONE;
        }
        if (eventDttm == null || window.getQadStartDate() == null) {
            return CensorReason.NONE;
        }
        LocalDate eventDay = eventDttm.withZone(settings.getZone()).toLocalDate();
        int daysFromStart = Days.daysBetween(window.getQadStartDate(), eventDay).getDays();
        if (daysFromStart < 0 || daysFromStart > settings.getCensorWindowDays()) {
            return CensorReason.NONE;
        }
        if (window.getQadEndDate().isBefore(eventDay.minusDays(1))) {
            return CensorReason.NONE;
        }
        return reason;
    }

    private static class Run {
        private final LocalDate start;
        private final LocalDate end;
        private final int count;

        private Run(LocalDate start, LocalDate end, int count) {
            this.start = start;
            this.end = end;
            this.count = count;
        }
    }
}
