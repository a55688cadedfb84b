package org.ohnlp.ir.ase.ehr.datasource;

import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.Row;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.ReadableInstant;
import org.ohnlp.ir.ase.config.AseSettings;
import org.ohnlp.ir.ase.structs.AntimicrobialEvent;
import org.ohnlp.ir.ase.structs.BloodCulture;
import org.ohnlp.ir.ase.structs.Hospitalization;
import org.ohnlp.ir.ase.structs.LabCategory;
import org.ohnlp.ir.ase.structs.LabResult;
import org.ohnlp.ir.ase.structs.PatientDeath;
import org.ohnlp.ir.ase.structs.RespiratoryEvent;
import org.ohnlp.ir.ase.structs.VasopressorEvent;

import java.io.Serializable;
import java.util.Locale;

/**
 * Maps rows of a {@link ResolvedTable} to engine records keyed for grouping. Each method returns null for
 * rows that are filtered out.
 */
public class ClifRowMapper implements Serializable {
    public static final String BLOOD_FLUID_CATEGORY = "blood/buffy coat";
    public static final String QUALIFYING_MED_GROUP = "CMS_sepsis_qualifying_antibiotics";

    private final ResolvedTable table;
    private final AseSettings settings;

    public ClifRowMapper(ResolvedTable table, AseSettings settings) {
        this.table = table;
        this.settings = settings;
    }

    public KV<String, Hospitalization> toHospitalization(Row row) {
        String id = string(row, "hospitalization_id");
        if (id == null) {
            return null;
        }
        return KV.of(id, new Hospitalization(id,
                string(row, "patient_id"),
                dttm(row, "admission_dttm"),
                dttm(row, "discharge_dttm"),
                string(row, "discharge_category")));
    }

    public KV<String, BloodCulture> toBloodCulture(Row row) {
        String id = string(row, "hospitalization_id");
        if (id == null) {
            return null;
        }
        if (table.hasColumn("fluid_category")) {
            String fluid = string(row, "fluid_category");
            if (fluid == null || !fluid.toLowerCase(Locale.ROOT).replace('_', ' ').equals(BLOOD_FLUID_CATEGORY)) {
                return null;
            }
        }
        return KV.of(id, new BloodCulture(id, dttm(row, "collect_dttm"), dttm(row, "order_dttm")));
    }

    public KV<String, AntimicrobialEvent> toAntimicrobial(Row row) {
        String id = string(row, "hospitalization_id");
        String drug = string(row, "drug_name");
        DateTime adminDttm = dttm(row, "admin_dttm");
        if (id == null || drug == null || adminDttm == null) {
            return null;
        }
        if (table.hasColumn("med_group") && !QUALIFYING_MED_GROUP.equalsIgnoreCase(string(row, "med_group"))) {
            return null;
        }
        return KV.of(id, new AntimicrobialEvent(id, adminDttm, drug, string(row, "route")));
    }

    public KV<String, LabResult> toLab(Row row) {
        String id = string(row, "hospitalization_id");
        LabCategory category = LabCategory.fromClifName(string(row, "lab_category"));
        DateTime resultDttm = dttm(row, "lab_result_dttm");
        if (id == null || category == null || resultDttm == null) {
            return null;
        }
        return KV.of(id, new LabResult(id, category, number(row, "lab_value_numeric"), resultDttm));
    }

    public KV<String, VasopressorEvent> toVasopressor(Row row) {
        String id = string(row, "hospitalization_id");
        String category = string(row, "med_category");
        DateTime adminDttm = dttm(row, "admin_dttm");
        if (id == null || adminDttm == null || !settings.isVasopressor(category)) {
            return null;
        }
        return KV.of(id, new VasopressorEvent(id, adminDttm, category.toLowerCase(Locale.ROOT),
                number(row, "med_dose"), string(row, "location_category")));
    }

    public KV<String, RespiratoryEvent> toRespiratory(Row row) {
        String id = string(row, "hospitalization_id");
        DateTime recorded = dttm(row, "recorded_dttm");
        if (id == null || recorded == null) {
            return null;
        }
        return KV.of(id, new RespiratoryEvent(id, recorded, string(row, "device_category")));
    }

    /**
     * Keyed by patient_id rather than hospitalization_id.
     */
    public KV<String, PatientDeath> toPatientDeath(Row row) {
        String patientId = string(row, "patient_id");
        DateTime death = dttm(row, "death_dttm");
        if (patientId == null || death == null) {
            return null;
        }
        return KV.of(patientId, new PatientDeath(patientId, death));
    }

    public KV<String, String> toDiagnosis(Row row) {
        String id = string(row, "hospitalization_id");
        String code = string(row, "diagnosis_code");
        if (id == null || code == null) {
            return null;
        }
        return KV.of(id, code);
    }

    private String string(Row row, String column) {
        Object value = table.value(row, column);
        if (value == null) {
            return null;
        }
        String s = value.toString().trim();
        return s.isEmpty() ? null : s;
    }

    private Double number(Row row, String column) {
        Object value = table.value(row, column);
        return value == null ? null : ((Number) value).doubleValue();
    }

    private DateTime dttm(Row row, String column) {
        Object value = table.value(row, column);
        return value == null ? null : new DateTime(((ReadableInstant) value).getMillis(), DateTimeZone.UTC);
    }
}
