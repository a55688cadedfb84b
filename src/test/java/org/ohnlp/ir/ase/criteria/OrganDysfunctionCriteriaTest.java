package org.ohnlp.ir.ase.criteria;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.ohnlp.ir.ase.config.AseSettings;
import org.ohnlp.ir.ase.engine.BaselineSelector;
import org.ohnlp.ir.ase.engine.OrganDysfunctionDetector;
import org.ohnlp.ir.ase.engine.OrganDysfunctionResult;
import org.ohnlp.ir.ase.structs.BloodCultureAnchor;
import org.ohnlp.ir.ase.structs.HospitalizationRecord;
import org.ohnlp.ir.ase.structs.LabCategory;
import org.ohnlp.ir.ase.structs.OnsetType;
import org.ohnlp.ir.ase.structs.OrganDysfunctionEvent;
import org.ohnlp.ir.ase.structs.VasopressorEvent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ohnlp.ir.ase.AseFixtures.HOSP;
import static org.ohnlp.ir.ase.AseFixtures.device;
import static org.ohnlp.ir.ase.AseFixtures.hospitalization;
import static org.ohnlp.ir.ase.AseFixtures.lab;
import static org.ohnlp.ir.ase.AseFixtures.record;
import static org.ohnlp.ir.ase.AseFixtures.t;
import static org.ohnlp.ir.ase.AseFixtures.vasopressor;

class OrganDysfunctionCriteriaTest {
    private final AseSettings settings = new AseSettings();
    private final BaselineSelector selector = new BaselineSelector(settings);
    private final OrganDysfunctionDetector detector = new OrganDysfunctionDetector();
    private final BloodCultureAnchor anchor = new BloodCultureAnchor(HOSP, 1, t("2024-01-02T10:00"));

    private HospitalizationRecord record;

    @BeforeEach
    void setUp() {
        record = record(hospitalization("2024-01-01T08:00", "2024-01-15T08:00", "Home"));
    }

    private AnchorContext context() {
        return new AnchorContext(record, anchor,
                selector.select(record.getLabs(), anchor, OnsetType.COMMUNITY),
                selector.hasPlateletBaseline(record.getLabs()), settings);
    }

    private OrganDysfunctionEvent only(Criterion criterion) {
        return criterion.evaluate(context());
    }

    @Test
    void windowBoundsAreInclusive() {
        AnchorContext ctx = context();

        assertThat(ctx.inWindow(t("2023-12-31T10:00"))).isTrue();
        assertThat(ctx.inWindow(t("2024-01-04T10:00"))).isTrue();
        assertThat(ctx.inWindow(t("2024-01-04T10:01"))).isFalse();
        assertThat(ctx.inWindow(null)).isFalse();
    }

    @Test
    void vasopressorInitiationInWindow() {
        record.getVasopressors().add(vasopressor("2024-01-02T14:00", "norepinephrine", 0.05));
        record.getVasopressors().add(vasopressor("2024-01-02T15:00", "norepinephrine", 0.1));

        OrganDysfunctionEvent e = only(new VasopressorCriterion());

        assertThat(e.getCriterion()).isEqualTo(CriterionType.VASOPRESSOR);
        assertThat(e.getEventDttm()).isEqualTo(t("2024-01-02T14:00"));
    }

    @Test
    void infusionRunningBeforeWindowIsNotAnInitiation() {
        record.getVasopressors().add(vasopressor("2023-12-30T10:00", "norepinephrine", 0.05));
        record.getVasopressors().add(vasopressor("2024-01-01T10:00", "norepinephrine", 0.05));

        assertThat(only(new VasopressorCriterion())).isNull();
    }

    @Test
    void restartAfterStopIsAnInitiation() {
        record.getVasopressors().add(vasopressor("2023-12-30T10:00", "norepinephrine", 0.05));
        record.getVasopressors().add(vasopressor("2024-01-01T10:00", "norepinephrine", 0.0));
        record.getVasopressors().add(vasopressor("2024-01-03T10:00", "norepinephrine", 0.08));

        assertThat(only(new VasopressorCriterion()).getEventDttm()).isEqualTo(t("2024-01-03T10:00"));
    }

    @Test
    void proceduralAdministrationsAreIgnored() {
        record.getVasopressors().add(new VasopressorEvent(HOSP, t("2024-01-02T14:00"), "phenylephrine", 0.5, "procedural"));

        assertThat(only(new VasopressorCriterion())).isNull();
    }

    @Test
    void missingVasopressorTableSkipsCriterion() {
        record.getVasopressors().add(vasopressor("2024-01-02T14:00", "norepinephrine", 0.05));
        record.setVasopressorDataAvailable(false);

        assertThat(only(new VasopressorCriterion())).isNull();
    }

    @Test
    void ventilationInitiation() {
        record.getRespiratorySupport().add(device("2024-01-02T09:00", "Nasal Cannula"));
        record.getRespiratorySupport().add(device("2024-01-02T18:00", "IMV"));
        record.getRespiratorySupport().add(device("2024-01-02T22:00", "IMV"));

        assertThat(only(new VentilationCriterion()).getEventDttm()).isEqualTo(t("2024-01-02T18:00"));
    }

    @Test
    void ventilationStartedBeforeWindowDoesNotCount() {
        record.getRespiratorySupport().add(device("2023-12-29T09:00", "imv"));
        record.getRespiratorySupport().add(device("2024-01-02T09:00", "imv"));

        assertThat(only(new VentilationCriterion())).isNull();
    }

    @Test
    void creatinineDoublingIsAki() {
        record.getLabs().add(lab(LabCategory.CREATININE, 0.9, "2024-01-01T09:00"));
        record.getLabs().add(lab(LabCategory.CREATININE, 1.7, "2024-01-02T12:00"));
        record.getLabs().add(lab(LabCategory.CREATININE, 1.8, "2024-01-03T12:00"));

        assertThat(only(new AkiCriterion()).getEventDttm()).isEqualTo(t("2024-01-03T12:00"));
    }

    @Test
    void akiDoesNotApplyToEsrdPatients() {
        record.getLabs().add(lab(LabCategory.CREATININE, 0.9, "2024-01-01T09:00"));
        record.getLabs().add(lab(LabCategory.CREATININE, 4.0, "2024-01-03T12:00"));
        record.setEsrd(true);

        assertThat(only(new AkiCriterion())).isNull();
    }

    @Test
    void bilirubinMustDoubleAndReachTwo() {
        record.getLabs().add(lab(LabCategory.BILIRUBIN, 0.6, "2024-01-01T09:00"));
        record.getLabs().add(lab(LabCategory.BILIRUBIN, 1.5, "2024-01-02T12:00"));
        record.getLabs().add(lab(LabCategory.BILIRUBIN, 2.1, "2024-01-03T12:00"));

        assertThat(only(new HyperbilirubinemiaCriterion()).getEventDttm()).isEqualTo(t("2024-01-03T12:00"));
    }

    @Test
    void plateletDropBelowHundredAndHalfOfBaseline() {
        record.getLabs().add(lab(LabCategory.PLATELETS, 240, "2024-01-01T09:00"));
        record.getLabs().add(lab(LabCategory.PLATELETS, 130, "2024-01-02T12:00"));
        record.getLabs().add(lab(LabCategory.PLATELETS, 95, "2024-01-03T12:00"));

        assertThat(only(new ThrombocytopeniaCriterion()).getEventDttm()).isEqualTo(t("2024-01-03T12:00"));
    }

    @Test
    void thrombocytopeniaNeedsAPlateletBaseline() {
        record.getLabs().add(lab(LabCategory.PLATELETS, 90, "2024-01-01T09:00"));
        record.getLabs().add(lab(LabCategory.PLATELETS, 30, "2024-01-03T12:00"));

        assertThat(only(new ThrombocytopeniaCriterion())).isNull();
    }

    @Test
    void lactateThresholdAndSetting() {
        record.getLabs().add(lab(LabCategory.LACTATE, 1.9, "2024-01-02T11:00"));
        record.getLabs().add(lab(LabCategory.LACTATE, 2.0, "2024-01-02T13:00"));

        assertThat(only(new LactateCriterion()).getEventDttm()).isEqualTo(t("2024-01-02T13:00"));

        settings.setIncludeLactate(false);
        assertThat(only(new LactateCriterion())).isNull();
    }

    @Test
    void detectorReportsEveryCriterionAndBreaksTiesByPriority() {
        record.getVasopressors().add(vasopressor("2024-01-02T14:00", "norepinephrine", 0.05));
        record.getLabs().add(lab(LabCategory.LACTATE, 4.2, "2024-01-02T14:00"));
        record.getLabs().add(lab(LabCategory.LACTATE, 3.0, "2024-01-02T11:00"));

        OrganDysfunctionResult result = detector.detect(context());

        assertThat(result.getEvents()).extracting(OrganDysfunctionEvent::getCriterion)
                .containsExactly(CriterionType.VASOPRESSOR, CriterionType.LACTATE);
        assertThat(result.earliest(true).getCriterion()).isEqualTo(CriterionType.LACTATE);
        assertThat(result.earliest(true).getEventDttm()).isEqualTo(t("2024-01-02T11:00"));
        assertThat(result.earliest(false).getCriterion()).isEqualTo(CriterionType.VASOPRESSOR);
    }

    @Test
    void simultaneousEventsGoToHigherPriorityCriterion() {
        record.getVasopressors().add(vasopressor("2024-01-02T14:00", "norepinephrine", 0.05));
        record.getLabs().add(lab(LabCategory.LACTATE, 4.2, "2024-01-02T14:00"));

        assertThat(detector.detect(context()).earliest(true).getCriterion()).isEqualTo(CriterionType.VASOPRESSOR);
    }
}
