package org.ohnlp.ir.ase.output;

import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.values.Row;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.LocalDate;
import org.ohnlp.ir.ase.criteria.CriterionType;
import org.ohnlp.ir.ase.structs.AseEpisode;
import org.ohnlp.ir.ase.structs.QadWindow;

/**
 * Output table layout, one row per (hospitalization_id, bc_id).
 */
public final class EpisodeRowMapper {

    public static final Schema SCHEMA = Schema.builder()
            .addFields(
                    Schema.Field.of("hospitalization_id", Schema.FieldType.STRING),
                    Schema.Field.of("bc_id", Schema.FieldType.INT32),
                    Schema.Field.nullable("episode_id", Schema.FieldType.INT32),
                    Schema.Field.of("type", Schema.FieldType.STRING),
                    Schema.Field.of("presumed_infection", Schema.FieldType.BOOLEAN),
                    Schema.Field.of("sepsis", Schema.FieldType.BOOLEAN),
                    Schema.Field.of("sepsis_wo_lactate", Schema.FieldType.BOOLEAN),
                    Schema.Field.nullable("no_sepsis_reason", Schema.FieldType.STRING),
                    Schema.Field.of("blood_culture_dttm", Schema.FieldType.DATETIME),
                    Schema.Field.nullable("ase_onset_w_lactate_dttm", Schema.FieldType.DATETIME),
                    Schema.Field.nullable("ase_first_criteria_w_lactate", Schema.FieldType.STRING),
                    Schema.Field.nullable("ase_onset_wo_lactate_dttm", Schema.FieldType.DATETIME),
                    Schema.Field.nullable("ase_first_criteria_wo_lactate", Schema.FieldType.STRING),
                    Schema.Field.of("total_qad", Schema.FieldType.INT32),
                    Schema.Field.nullable("qad_start_date", Schema.FieldType.STRING),
                    Schema.Field.nullable("qad_end_date", Schema.FieldType.STRING),
                    Schema.Field.of("censor_reason", Schema.FieldType.STRING),
                    Schema.Field.of("rit_suppressed", Schema.FieldType.BOOLEAN),
                    Schema.Field.nullable("anchor_meds_in_window", Schema.FieldType.STRING)
            ).build();

    private EpisodeRowMapper() {}

    public static Row toRow(AseEpisode e) {
        QadWindow qad = e.getQad();
        return Row.withSchema(SCHEMA).addValues(
                e.getHospitalizationId(),
                e.getBcId(),
                e.getEpisodeId(),
                e.getType().getLabel(),
                e.isPresumedInfection(),
                e.isSepsis(),
                e.isSepsisWoLactate(),
                e.getNoSepsisReason() == null ? null : e.getNoSepsisReason().getLabel(),
                utc(e.getBloodCultureDttm()),
                utc(e.getAseOnsetDttm()),
                label(e.getOrganDysfunctionCriterion()),
                utc(e.getAseOnsetWoLactateDttm()),
                label(e.getOrganDysfunctionCriterionWoLactate()),
                qad.getTotalQad(),
                date(qad.getQadStartDate()),
                date(qad.getQadEndDate()),
                qad.getCensorReason().getLabel(),
                e.isRitSuppressed(),
                qad.getMedsInWindow().isEmpty() ? null : String.join(",", qad.getMedsInWindow())
        ).build();
    }

    private static DateTime utc(DateTime dttm) {
        return dttm == null ? null : dttm.withZone(DateTimeZone.UTC);
    }

    private static String label(CriterionType type) {
        return type == null ? null : type.getLabel();
    }

    private static String date(LocalDate date) {
        return date == null ? null : date.toString();
    }
}
