package org.ohnlp.ir.ase.structs;

import org.joda.time.DateTime;
import org.ohnlp.ir.ase.criteria.CriterionType;

import java.io.Serializable;

/**
 * ASE determination for a single blood culture. Instances are immutable; the repeat infection
 * timeframe pass produces copies carrying the episode assignment.
 */
public final class AseEpisode implements Serializable {
    private final BloodCultureAnchor anchor;
    private final QadWindow qad;
    private final boolean presumedInfection;
    private final OrganDysfunctionEvent organDysfunction;
    private final OrganDysfunctionEvent organDysfunctionWoLactate;
    private final OnsetType type;
    private final boolean sepsis;
    private final boolean sepsisWoLactate;
    private final NoSepsisReason noSepsisReason;
    private final Integer episodeId;
    private final boolean ritSuppressed;

    public AseEpisode(BloodCultureAnchor anchor, QadWindow qad, boolean presumedInfection,
                      OrganDysfunctionEvent organDysfunction, OrganDysfunctionEvent organDysfunctionWoLactate,
                      OnsetType type, boolean sepsis, boolean sepsisWoLactate, NoSepsisReason noSepsisReason,
                      Integer episodeId, boolean ritSuppressed) {
        this.anchor = anchor;
        this.qad = qad;
        this.presumedInfection = presumedInfection;
        this.organDysfunction = organDysfunction;
        this.organDysfunctionWoLactate = organDysfunctionWoLactate;
        this.type = type;
        this.sepsis = sepsis;
        this.sepsisWoLactate = sepsisWoLactate;
        this.noSepsisReason = noSepsisReason;
        this.episodeId = episodeId;
        this.ritSuppressed = ritSuppressed;
    }

    public AseEpisode withEpisode(Integer episodeId, boolean ritSuppressed) {
        return new AseEpisode(anchor, qad, presumedInfection, organDysfunction, organDysfunctionWoLactate,
                type, sepsis, sepsisWoLactate, noSepsisReason, episodeId, ritSuppressed);
    }

    public String getHospitalizationId() {
        return anchor.getHospitalizationId();
    }

    public int getBcId() {
        return anchor.getBcId();
    }

    public DateTime getBloodCultureDttm() {
        return anchor.getCollectDttm();
    }

    public BloodCultureAnchor getAnchor() {
        return anchor;
    }

    public QadWindow getQad() {
        return qad;
    }

    public boolean isPresumedInfection() {
        return presumedInfection;
    }

    public CriterionType getOrganDysfunctionCriterion() {
        return organDysfunction == null ? null : organDysfunction.getCriterion();
    }

    public DateTime getAseOnsetDttm() {
        return organDysfunction == null ? null : organDysfunction.getEventDttm();
    }

    public CriterionType getOrganDysfunctionCriterionWoLactate() {
        return organDysfunctionWoLactate == null ? null : organDysfunctionWoLactate.getCriterion();
    }

    public DateTime getAseOnsetWoLactateDttm() {
        return organDysfunctionWoLactate == null ? null : organDysfunctionWoLactate.getEventDttm();
    }

    public OnsetType getType() {
        return type;
    }

    public boolean isSepsis() {
        return sepsis;
    }

    public boolean isSepsisWoLactate() {
        return sepsisWoLactate;
    }

    public NoSepsisReason getNoSepsisReason() {
        return noSepsisReason;
    }

    /**
     * @return the repeat infection timeframe episode this culture belongs to, null when not ASE-positive
     */
    public Integer getEpisodeId() {
        return episodeId;
    }

    public boolean isRitSuppressed() {
        return ritSuppressed;
    }
}
