package org.ohnlp.ir.ase.engine;

import org.joda.time.DateTime;
import org.ohnlp.ir.ase.config.AseSettings;
import org.ohnlp.ir.ase.structs.AseEpisode;
import org.ohnlp.ir.ase.structs.OnsetType;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Repeat infection timeframe (RIT) deduplication. ASE-positive episodes are walked in onset order; an
 * episode whose onset falls within {@link AseSettings#getRitDays()} of the last counted episode is
 * suppressed and inherits its episode id. Episodes that are not ASE-positive get no episode id.
 */
public class RitFilter implements Serializable {
    private final AseSettings settings;

    public RitFilter(AseSettings settings) {
        this.settings = settings;
    }

    /**
     * @param episodes All episodes of a single hospitalization
     * @return the same episodes, in blood culture order, with episode ids assigned
     */
    public List<AseEpisode> apply(List<AseEpisode> episodes) {
        List<AseEpisode> positives = new ArrayList<>();
        for (AseEpisode e : episodes) {
            if (e.isSepsis()) {
                positives.add(e);
            }
        }
        positives.sort(Comparator.comparing(AseEpisode::getAseOnsetDttm).thenComparingInt(AseEpisode::getBcId));

        Map<Integer, AseEpisode> assigned = new HashMap<>();
        RitState state = RitState.OPEN;
        DateTime windowOpenedAt = null;
        int episodeId = 0;
        for (AseEpisode e : positives) {
            DateTime onset = e.getAseOnsetDttm();
            if (state == RitState.IN_WINDOW && onset.isAfter(windowOpenedAt.plusDays(settings.getRitDays()))) {
                state = RitState.OPEN;
            }
            boolean exempt = !settings.isApplyRit()
                    || (settings.isRitOnlyHospitalOnset() && e.getType() == OnsetType.COMMUNITY);
            if (state == RitState.IN_WINDOW && !exempt) {
                assigned.put(e.getBcId(), e.withEpisode(episodeId, true));
            } else {
                episodeId++;
                windowOpenedAt = onset;
                state = RitState.IN_WINDOW;
                assigned.put(e.getBcId(), e.withEpisode(episodeId, false));
            }
        }

        List<AseEpisode> ret = new ArrayList<>(episodes.size());
        for (AseEpisode e : episodes) {
            ret.add(assigned.getOrDefault(e.getBcId(), e));
        }
        ret.sort(Comparator.comparingInt(AseEpisode::getBcId));
        return ret;
    }
}
