package org.ohnlp.ir.ase.ehr.datasource;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.testing.PAssert;
import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.PCollection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.ohnlp.ir.ase.config.AseSettings;
import org.ohnlp.ir.ase.connections.FileBasedDataConnectionImpl;
import org.ohnlp.ir.ase.exceptions.MissingRequiredTableException;
import org.ohnlp.ir.ase.structs.AntimicrobialEvent;
import org.ohnlp.ir.ase.structs.BloodCulture;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ClifDataSourceTest {
    @TempDir
    Path dir;

    private FileBasedDataConnectionImpl connection;

    @BeforeEach
    void setUp() throws IOException {
        connection = new FileBasedDataConnectionImpl();
        connection.loadConfig(new ObjectMapper().createObjectNode().put("path", dir.toAbsolutePath().toString()));
        table("hospitalization", "hospitalization_id,patient_id,admission_dttm,discharge_dttm,discharge_category",
                "H1,P1,2024-01-01 08:00:00,2024-01-10 12:00:00,Home");
        table("blood_cultures", "hospitalization_id,collect_dttm,fluid_category",
                "H1,2024-01-02 10:00:00,Blood/Buffy Coat",
                "H1,2024-01-03 10:00:00,Urine");
        table("antimicrobials", "hospitalization_id,admin_dttm,drug_name,route",
                "H1,2024-01-02 12:00:00,Vancomycin,IV");
        table("labs", "hospitalization_id,lab_category,lab_value_numeric,lab_result_dttm",
                "H1,creatinine,1.1,2024-01-02 06:00:00");
    }

    private void table(String name, String header, String... lines) throws IOException {
        List<String> content = new ArrayList<>();
        content.add(header);
        content.addAll(List.of(lines));
        Files.write(dir.resolve(name + ".csv"), content, StandardCharsets.UTF_8);
    }

    @Test
    void resolvesRequiredTablesAndSkipsAbsentOptionalOnes() {
        ClifDataSource source = new ClifDataSource(connection, new AseSettings());

        assertThat(source.isAvailable(ClifTable.HOSPITALIZATION)).isTrue();
        assertThat(source.isAvailable(ClifTable.LABS)).isTrue();
        assertThat(source.isAvailable(ClifTable.CONTINUOUS_MEDS)).isFalse();
        assertThat(source.isAvailable(ClifTable.RESPIRATORY_SUPPORT)).isFalse();
        assertThat(source.isAvailable(ClifTable.PATIENT)).isFalse();
        assertThat(source.getResolvedTable(ClifTable.BLOOD_CULTURES).hasColumn("order_dttm")).isFalse();
        assertThat(source.getResolvedTable(ClifTable.BLOOD_CULTURES).getSchema().getFieldNames())
                .containsExactly("hospitalization_id", "collect_dttm", "fluid_category");
    }

    @Test
    void missingRequiredTableFailsBeforeAnyPipelineIsBuilt() throws IOException {
        Files.delete(dir.resolve("labs.csv"));

        MissingRequiredTableException e = catchThrowableOfType(
                () -> new ClifDataSource(connection, new AseSettings()), MissingRequiredTableException.class);

        assertThat(e).hasMessageContaining("labs");
        assertThat(e.getTable()).isEqualTo("labs");
    }

    @Test
    void missingRequiredColumnFails() throws IOException {
        table("labs", "hospitalization_id,lab_category,lab_result_dttm", "H1,creatinine,2024-01-02 06:00:00");

        assertThatThrownBy(() -> new ClifDataSource(connection, new AseSettings()))
                .isInstanceOf(MissingRequiredTableException.class)
                .hasMessageContaining("lab_value_numeric");
    }

    @Test
    void cultureWithoutAnyTimestampColumnFails() throws IOException {
        table("blood_cultures", "hospitalization_id,fluid_category", "H1,blood/buffy coat");

        assertThatThrownBy(() -> new ClifDataSource(connection, new AseSettings()))
                .isInstanceOf(MissingRequiredTableException.class)
                .hasMessageContaining("collect_dttm or order_dttm");
    }

    @Test
    void culturesMayCarryOnlyOrderTime() throws IOException {
        table("blood_cultures", "hospitalization_id,order_dttm,fluid_category",
                "H1,2024-01-02 09:30:00,blood/buffy coat");

        ClifDataSource source = new ClifDataSource(connection, new AseSettings());
        assertThat(source.getResolvedTable(ClifTable.BLOOD_CULTURES).hasColumn("collect_dttm")).isFalse();

        Pipeline p = Pipeline.create();
        PAssert.that(source.getBloodCultures(p)).satisfies(it -> {
            List<KV<String, BloodCulture>> all = new ArrayList<>();
            it.forEach(all::add);
            assertThat(all).hasSize(1);
            assertThat(all.get(0).getValue().getCollectDttm()).isNull();
            assertThat(all.get(0).getValue().getAnchorDttm().toString()).isEqualTo("2024-01-02T09:30:00.000Z");
            return null;
        });
        p.run().waitUntilFinish();
    }

    @Test
    void optionalTableWithoutRequiredColumnsIsIgnored() throws IOException {
        table("continuous_meds", "hospitalization_id,admin_dttm,med_category", "H1,2024-01-02 10:00:00,norepinephrine");

        ClifDataSource source = new ClifDataSource(connection, new AseSettings());

        assertThat(source.isAvailable(ClifTable.CONTINUOUS_MEDS)).isFalse();
    }

    @Test
    void acceptsAlternateTableAndColumnNames() throws IOException {
        Files.delete(dir.resolve("antimicrobials.csv"));
        table("medication_admin_intermittent", "HOSPITALIZATION_ID,admin_dttm,med_category,med_route_category,med_group",
                "H1,2024-01-02 12:00:00,vancomycin,iv,CMS_sepsis_qualifying_antibiotics",
                "H1,2024-01-02 13:00:00,acetaminophen,iv,analgesics");

        ClifDataSource source = new ClifDataSource(connection, new AseSettings());
        ResolvedTable antimicrobials = source.getResolvedTable(ClifTable.ANTIMICROBIALS);
        assertThat(antimicrobials.getPhysicalName()).isEqualTo("medication_admin_intermittent");
        assertThat(antimicrobials.getSchema().getFieldNames())
                .containsExactly("HOSPITALIZATION_ID", "admin_dttm", "med_category", "med_route_category", "med_group");

        Pipeline p = Pipeline.create();
        PCollection<KV<String, AntimicrobialEvent>> events = source.getAntimicrobials(p);
        PAssert.that(events).satisfies(it -> {
            List<KV<String, AntimicrobialEvent>> all = new ArrayList<>();
            it.forEach(all::add);
            assertThat(all).hasSize(1);
            assertThat(all.get(0).getKey()).isEqualTo("H1");
            assertThat(all.get(0).getValue().getDrugName()).isEqualTo("vancomycin");
            assertThat(all.get(0).getValue().getRoute()).isEqualTo("iv");
            return null;
        });
        p.run().waitUntilFinish();
    }

    @Test
    void keepsOnlyBloodCultures() {
        ClifDataSource source = new ClifDataSource(connection, new AseSettings());

        Pipeline p = Pipeline.create();
        PCollection<KV<String, BloodCulture>> cultures = source.getBloodCultures(p);
        PAssert.that(cultures).satisfies(it -> {
            List<KV<String, BloodCulture>> all = new ArrayList<>();
            it.forEach(all::add);
            assertThat(all).hasSize(1);
            assertThat(all.get(0).getValue().getCollectDttm().toString()).isEqualTo("2024-01-02T10:00:00.000Z");
            return null;
        });
        PAssert.that(source.getVasopressors(p)).empty();
        p.run().waitUntilFinish();
    }

    @Test
    void bindsColumnsIgnoringCase() {
        assertThat(ResolvedTable.bindColumns(ClifTable.LABS,
                List.of("Hospitalization_Id", "LAB_CATEGORY", "lab_value_numeric", "lab_collect_dttm")))
                .containsEntry("hospitalization_id", "Hospitalization_Id")
                .containsEntry("lab_category", "LAB_CATEGORY")
                .containsEntry("lab_result_dttm", "lab_collect_dttm");
    }
}
