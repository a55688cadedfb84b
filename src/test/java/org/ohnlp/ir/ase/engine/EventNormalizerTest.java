package org.ohnlp.ir.ase.engine;

import org.junit.jupiter.api.Test;
import org.ohnlp.ir.ase.config.AseSettings;
import org.ohnlp.ir.ase.structs.AntimicrobialEvent;
import org.ohnlp.ir.ase.structs.BloodCulture;
import org.ohnlp.ir.ase.structs.BloodCultureAnchor;
import org.ohnlp.ir.ase.structs.Hospitalization;
import org.ohnlp.ir.ase.structs.LabCategory;
import org.ohnlp.ir.ase.structs.LabResult;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ohnlp.ir.ase.AseFixtures.HOSP;
import static org.ohnlp.ir.ase.AseFixtures.hospitalization;
import static org.ohnlp.ir.ase.AseFixtures.iv;
import static org.ohnlp.ir.ase.AseFixtures.lab;
import static org.ohnlp.ir.ase.AseFixtures.t;

class EventNormalizerTest {
    private final AseSettings settings = new AseSettings();
    private final EventNormalizer normalizer = new EventNormalizer(settings);

    @Test
    void administrationIsNewWithoutSameDrugOnPrecedingTwoDays() {
        List<AntimicrobialEvent> events = new ArrayList<>(List.of(
                iv("2024-01-01T08:00", "Vancomycin"),
                iv("2024-01-01T20:00", "vancomycin"),
                iv("2024-01-03T08:00", "VANCOMYCIN"),
                iv("2024-01-06T08:00", "vancomycin"),
                iv("2024-01-06T09:00", "cefepime")));

        normalizer.markNewAdministrations(events);

        assertThat(events).extracting(AntimicrobialEvent::isNewAdministration)
                .containsExactly(true, true, false, true, true);
    }

    @Test
    void outlierValuesBecomeMissing() {
        List<LabResult> labs = List.of(
                lab(LabCategory.CREATININE, 21, "2024-01-01T00:00"),
                lab(LabCategory.CREATININE, 1.1, "2024-01-01T00:00"),
                lab(LabCategory.LACTATE, -1, "2024-01-01T00:00"),
                lab(LabCategory.PLATELETS, 2000, "2024-01-01T00:00"),
                lab(LabCategory.BILIRUBIN, 80.5, "2024-01-01T00:00"));

        normalizer.applyOutlierCaps(labs);

        assertThat(labs).extracting(LabResult::getValue).containsExactly(null, 1.1, null, 2000.0, null);
    }

    @Test
    void anchorsAreNumberedInCollectionOrder() {
        List<BloodCulture> cultures = List.of(
                new BloodCulture(HOSP, t("2024-01-05T10:00"), null),
                new BloodCulture(HOSP, null, null),
                new BloodCulture(HOSP, null, t("2024-01-02T10:00")),
                new BloodCulture(HOSP, t("2024-01-03T10:00"), t("2024-01-03T09:00")));

        List<BloodCultureAnchor> anchors = normalizer.buildAnchors(HOSP, cultures);

        assertThat(anchors).extracting(BloodCultureAnchor::getBcId).containsExactly(1, 2, 3);
        assertThat(anchors).extracting(BloodCultureAnchor::getCollectDttm)
                .containsExactly(t("2024-01-02T10:00"), t("2024-01-03T10:00"), t("2024-01-05T10:00"));
    }

    @Test
    void esrdCodesMatchWithOrWithoutDots() {
        assertThat(EventNormalizer.isEsrdCode("N18.6")).isTrue();
        assertThat(EventNormalizer.isEsrdCode("z49.31")).isTrue();
        assertThat(EventNormalizer.isEsrdCode("I132")).isTrue();
        assertThat(EventNormalizer.isEsrdCode("N18.5")).isFalse();
        assertThat(EventNormalizer.isEsrdCode(null)).isFalse();
    }

    @Test
    void deathAfterDischargeIsIgnored() {
        Hospitalization h = hospitalization("2024-01-01T00:00", "2024-01-10T00:00", "Home");

        assertThat(EventNormalizer.effectiveDeathDttm(h, t("2024-01-09T00:00"))).isEqualTo(t("2024-01-09T00:00"));
        assertThat(EventNormalizer.effectiveDeathDttm(h, t("2024-02-01T00:00"))).isNull();
        assertThat(EventNormalizer.effectiveDeathDttm(hospitalization("2024-01-01T00:00", null, null),
                t("2024-02-01T00:00"))).isEqualTo(t("2024-02-01T00:00"));
    }
}
