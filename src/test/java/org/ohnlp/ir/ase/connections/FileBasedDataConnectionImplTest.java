package org.ohnlp.ir.ase.connections;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.testing.PAssert;
import org.apache.beam.sdk.transforms.Create;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.joda.time.DateTimeZone;
import org.joda.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileBasedDataConnectionImplTest {
    private static final Schema LAB_SCHEMA = Schema.builder()
            .addFields(
                    Schema.Field.nullable("hospitalization_id", Schema.FieldType.STRING),
                    Schema.Field.nullable("lab_value_numeric", Schema.FieldType.DOUBLE),
                    Schema.Field.nullable("lab_result_dttm", Schema.FieldType.DATETIME)
            ).build();

    @TempDir
    Path dir;

    private FileBasedDataConnectionImpl connection;

    @BeforeEach
    void setUp() throws IOException {
        connection = new FileBasedDataConnectionImpl();
        connection.loadConfig(new ObjectMapper().readTree(
                "{\"path\": \"" + dir.toAbsolutePath().toString().replace("\\", "/") + "\"}"));
    }

    private void table(String name, String content) throws IOException {
        Files.write(dir.resolve(name + ".csv"), content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void listsHeaderColumns() throws IOException {
        table("labs", "hospitalization_id,lab_category,lab_value_numeric,lab_result_dttm\nH1,lactate,2.1,2024-01-01 10:00:00\n");

        assertThat(connection.listColumns("labs"))
                .containsExactly("hospitalization_id", "lab_category", "lab_value_numeric", "lab_result_dttm");
    }

    @Test
    void missingTableHasNoColumns() {
        assertThat(connection.listColumns("respiratory_support")).isEmpty();
    }

    @Test
    void readsTypedRowsIgnoringExtraColumns() throws IOException {
        table("labs", "lab_category,hospitalization_id,lab_value_numeric,lab_result_dttm\n"
                + "lactate,H1,2.1,2024-01-01 10:00:00\n"
                + "creatinine,H2,,2024-01-02T08:30:00Z\n"
                + "platelet_count,H3,NA,\n");
        Pipeline p = Pipeline.create();

        PCollection<Row> rows = connection.read(p, "labs", LAB_SCHEMA);

        PAssert.that(rows).containsInAnyOrder(
                Row.withSchema(LAB_SCHEMA).addValues("H1", 2.1, Instant.parse("2024-01-01T10:00:00Z")).build(),
                Row.withSchema(LAB_SCHEMA).addValues("H2", null, Instant.parse("2024-01-02T08:30:00Z")).build(),
                Row.withSchema(LAB_SCHEMA).addValues("H3", null, null).build());
        p.run().waitUntilFinish();
    }

    @Test
    void malformedCellNamesColumnAndValue() {
        Schema.Field field = Schema.Field.nullable("lab_value_numeric", Schema.FieldType.DOUBLE);

        assertThatThrownBy(() -> FileBasedDataConnectionImpl.convert("high", field, DateTimeZone.UTC))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lab_value_numeric")
                .hasMessageContaining("high");
    }

    @Test
    void writesSingleSortedFileWithHeader() throws IOException {
        Schema schema = Schema.builder()
                .addFields(
                        Schema.Field.of("hospitalization_id", Schema.FieldType.STRING),
                        Schema.Field.of("bc_id", Schema.FieldType.INT32),
                        Schema.Field.nullable("blood_culture_dttm", Schema.FieldType.DATETIME),
                        Schema.Field.nullable("note", Schema.FieldType.STRING)
                ).build();
        Pipeline p = Pipeline.create();
        PCollection<Row> rows = p.apply(Create.of(
                Row.withSchema(schema).addValues("H2", 1, Instant.parse("2024-01-03T10:00:00Z"), null).build(),
                Row.withSchema(schema).addValues("H1", 2, Instant.parse("2024-01-02T10:00:00Z"), "a,b").build(),
                Row.withSchema(schema).addValues("H1", 1, null, "x").build()
        ).withRowSchema(schema));

        connection.write("ase_episodes", rows);
        p.run().waitUntilFinish();

        List<String> lines = Files.readAllLines(dir.resolve("ase_episodes.csv"), StandardCharsets.UTF_8);
        assertThat(lines).containsExactly(
                "hospitalization_id,bc_id,blood_culture_dttm,note",
                "H1,1,,x",
                "H1,2,2024-01-02T10:00:00.000Z,\"a,b\"",
                "H2,1,2024-01-03T10:00:00.000Z,");
    }

    @Test
    void readsQuotedLineBreaksAcrossRecords() throws IOException {
        Schema schema = Schema.builder()
                .addFields(
                        Schema.Field.nullable("hospitalization_id", Schema.FieldType.STRING),
                        Schema.Field.nullable("discharge_category", Schema.FieldType.STRING)
                ).build();
        table("hospitalization", "hospitalization_id,discharge_category\r\nH1,\"Acute Care\nHospital\"\r\nH2,Home");
        Pipeline p = Pipeline.create();

        PAssert.that(connection.read(p, "hospitalization", schema)).containsInAnyOrder(
                Row.withSchema(schema).addValues("H1", "Acute Care\nHospital").build(),
                Row.withSchema(schema).addValues("H2", "Home").build());
        p.run().waitUntilFinish();
    }

    @Test
    void ordersValuesByType() {
        assertThat(FileBasedDataConnectionImpl.compareValues(null, "a")).isNegative();
        assertThat(FileBasedDataConnectionImpl.compareValues(2, 10)).isNegative();
        assertThat(FileBasedDataConnectionImpl.compareValues(
                Instant.parse("2024-01-02T00:00:00Z"), Instant.parse("2024-01-01T00:00:00Z"))).isPositive();
        assertThat(FileBasedDataConnectionImpl.compareValues(false, true)).isNegative();
        assertThat(FileBasedDataConnectionImpl.compareValues("H10", "H2")).isNegative();
    }

    @Test
    void requiresPath() {
        assertThatThrownBy(() -> new FileBasedDataConnectionImpl().loadConfig(new ObjectMapper().readTree("{}")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
