package org.ohnlp.ir.ase.engine;

import org.ohnlp.ir.ase.config.AseSettings;
import org.ohnlp.ir.ase.criteria.AnchorContext;
import org.ohnlp.ir.ase.structs.AseEpisode;
import org.ohnlp.ir.ase.structs.Baseline;
import org.ohnlp.ir.ase.structs.BloodCultureAnchor;
import org.ohnlp.ir.ase.structs.Hospitalization;
import org.ohnlp.ir.ase.structs.HospitalizationRecord;
import org.ohnlp.ir.ase.structs.LabCategory;
import org.ohnlp.ir.ase.structs.OnsetType;
import org.ohnlp.ir.ase.structs.QadWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs ASE detection for one hospitalization, producing one episode per usable blood culture.
 * Instances hold no per-hospitalization state and may be shared across threads.
 */
public class EpisodeOrchestrator implements Serializable {
    private static final Logger LOG = LoggerFactory.getLogger(EpisodeOrchestrator.class);

    private final AseSettings settings;
    private final EventNormalizer normalizer;
    private final QadCalculator qadCalculator;
    private final BaselineSelector baselineSelector;
    private final OrganDysfunctionDetector detector;
    private final EpisodeAssembler assembler;
    private final RitFilter ritFilter;

    public EpisodeOrchestrator(AseSettings settings) {
        this.settings = settings;
        this.normalizer = new EventNormalizer(settings);
        this.qadCalculator = new QadCalculator(settings);
        this.baselineSelector = new BaselineSelector(settings);
        this.detector = new OrganDysfunctionDetector();
        this.assembler = new EpisodeAssembler(settings);
        this.ritFilter = new RitFilter(settings);
    }

    public List<AseEpisode> process(HospitalizationRecord record) {
        Hospitalization hospitalization = record.getHospitalization();
        normalizer.normalize(record);
        List<BloodCultureAnchor> anchors = normalizer.buildAnchors(record.getHospitalizationId(), record.getBloodCultures());
        boolean plateletBaseline = baselineSelector.hasPlateletBaseline(record.getLabs());
        if (!plateletBaseline) {
            LOG.debug("Hospitalization {}: no platelet count >= 100, thrombocytopenia criterion disabled",
                    record.getHospitalizationId());
        }

        List<AseEpisode> episodes = new ArrayList<>();
        for (BloodCultureAnchor anchor : anchors) {
            QadWindow qad = qadCalculator.compute(record.getAntimicrobials(), anchor, hospitalization);
            OnsetType provisionalType = baselineSelector.provisionalType(anchor, hospitalization);
            Map<LabCategory, Baseline> baselines = baselineSelector.select(record.getLabs(), anchor, provisionalType);
            AnchorContext ctx = new AnchorContext(record, anchor, baselines, plateletBaseline, settings);
            OrganDysfunctionResult organDysfunction = detector.detect(ctx);
            episodes.add(assembler.assemble(anchor, hospitalization, qad, organDysfunction, provisionalType));
        }
        List<AseEpisode> ret = ritFilter.apply(episodes);
        LOG.debug("Hospitalization {}: {} blood culture(s) evaluated", record.getHospitalizationId(), ret.size());
        return ret;
    }
}
