package org.ohnlp.ir.ase.engine;

import org.junit.jupiter.api.Test;
import org.ohnlp.ir.ase.config.AseSettings;
import org.ohnlp.ir.ase.structs.Baseline;
import org.ohnlp.ir.ase.structs.BaselineBasis;
import org.ohnlp.ir.ase.structs.BloodCultureAnchor;
import org.ohnlp.ir.ase.structs.Hospitalization;
import org.ohnlp.ir.ase.structs.LabCategory;
import org.ohnlp.ir.ase.structs.LabResult;
import org.ohnlp.ir.ase.structs.OnsetType;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ohnlp.ir.ase.AseFixtures.HOSP;
import static org.ohnlp.ir.ase.AseFixtures.hospitalization;
import static org.ohnlp.ir.ase.AseFixtures.lab;
import static org.ohnlp.ir.ase.AseFixtures.t;

class BaselineSelectorTest {
    private final AseSettings settings = new AseSettings();
    private final BaselineSelector selector = new BaselineSelector(settings);

    private final List<LabResult> labs = List.of(
            lab(LabCategory.CREATININE, 0.7, "2024-01-01T06:00"),
            lab(LabCategory.CREATININE, 1.2, "2024-01-09T06:00"),
            lab(LabCategory.CREATININE, 2.6, "2024-01-10T06:00"),
            lab(LabCategory.PLATELETS, 310, "2024-01-01T06:00"),
            lab(LabCategory.PLATELETS, 180, "2024-01-09T06:00"),
            lab(LabCategory.PLATELETS, 60, "2024-01-11T06:00"));

    @Test
    void cultureNearAdmissionIsProvisionallyCommunityOnset() {
        Hospitalization h = hospitalization("2024-01-01T00:00", null, null);

        assertThat(selector.provisionalType(new BloodCultureAnchor(HOSP, 1, t("2024-01-03T00:00")), h))
                .isEqualTo(OnsetType.COMMUNITY);
        assertThat(selector.provisionalType(new BloodCultureAnchor(HOSP, 1, t("2024-01-03T00:01")), h))
                .isEqualTo(OnsetType.HOSPITAL);
    }

    @Test
    void unknownAdmissionIsCommunityOnset() {
        Hospitalization h = hospitalization(null, null, null);

        assertThat(selector.provisionalType(new BloodCultureAnchor(HOSP, 1, t("2024-02-01T00:00")), h))
                .isEqualTo(OnsetType.COMMUNITY);
    }

    @Test
    void communityBaselineUsesWholeStay() {
        BloodCultureAnchor anchor = new BloodCultureAnchor(HOSP, 1, t("2024-01-10T00:00"));

        Map<LabCategory, Baseline> baselines = selector.select(labs, anchor, OnsetType.COMMUNITY);

        assertThat(baselines.get(LabCategory.CREATININE).getSelectionBasis()).isEqualTo(BaselineBasis.COMMUNITY);
        assertThat(baselines.get(LabCategory.CREATININE).getSelectedValue()).isEqualTo(0.7);
        assertThat(baselines.get(LabCategory.PLATELETS).getSelectedValue()).isEqualTo(310.0);
        assertThat(baselines.get(LabCategory.BILIRUBIN).getSelectedValue()).isNull();
    }

    @Test
    void hospitalBaselineUsesValuesAroundCulture() {
        BloodCultureAnchor anchor = new BloodCultureAnchor(HOSP, 1, t("2024-01-10T00:00"));

        Map<LabCategory, Baseline> baselines = selector.select(labs, anchor, OnsetType.HOSPITAL);

        assertThat(baselines.get(LabCategory.CREATININE).getSelectedValue()).isEqualTo(1.2);
        assertThat(baselines.get(LabCategory.CREATININE).getCommunityValue()).isEqualTo(0.7);
        assertThat(baselines.get(LabCategory.PLATELETS).getSelectedValue()).isEqualTo(180.0);
    }

    @Test
    void plateletBaselineRequiresCountOfAtLeastOneHundred() {
        assertThat(selector.hasPlateletBaseline(labs)).isTrue();
        assertThat(selector.hasPlateletBaseline(List.of(lab(LabCategory.PLATELETS, 99, "2024-01-01T00:00")))).isFalse();
        assertThat(selector.hasPlateletBaseline(List.of(lab(LabCategory.CREATININE, 150, "2024-01-01T00:00")))).isFalse();
    }
}
