package org.ohnlp.ir.ase.ehr.datasource;

import org.apache.beam.sdk.schemas.Schema;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;

/**
 * The CLIF tables read by the engine. Each logical column lists the physical names it may appear under;
 * the first one present in the source wins.
 */
public enum ClifTable {
    HOSPITALIZATION(true, List.of("hospitalization"),
            Column.required("hospitalization_id", Schema.FieldType.STRING),
            Column.optional("patient_id", Schema.FieldType.STRING),
            Column.optional("admission_dttm", Schema.FieldType.DATETIME),
            Column.optional("discharge_dttm", Schema.FieldType.DATETIME),
            Column.optional("discharge_category", Schema.FieldType.STRING)),
    BLOOD_CULTURES(true, List.of("blood_cultures", "microbiology_culture"),
            Column.required("hospitalization_id", Schema.FieldType.STRING),
            Column.optional("collect_dttm", Schema.FieldType.DATETIME),
            Column.optional("order_dttm", Schema.FieldType.DATETIME),
            Column.optional("fluid_category", Schema.FieldType.STRING)),
    ANTIMICROBIALS(true, List.of("antimicrobials", "medication_admin_intermittent"),
            Column.required("hospitalization_id", Schema.FieldType.STRING),
            Column.required("admin_dttm", Schema.FieldType.DATETIME),
            Column.required("drug_name", Schema.FieldType.STRING, "drug_name", "med_category", "med_name"),
            Column.optional("route", Schema.FieldType.STRING, "route", "med_route_category", "med_route_name"),
            Column.optional("med_group", Schema.FieldType.STRING)),
    LABS(true, List.of("labs"),
            Column.required("hospitalization_id", Schema.FieldType.STRING),
            Column.required("lab_category", Schema.FieldType.STRING),
            Column.required("lab_value_numeric", Schema.FieldType.DOUBLE),
            Column.required("lab_result_dttm", Schema.FieldType.DATETIME, "lab_result_dttm", "lab_collect_dttm")),
    CONTINUOUS_MEDS(false, List.of("continuous_meds", "medication_admin_continuous"),
            Column.required("hospitalization_id", Schema.FieldType.STRING),
            Column.required("admin_dttm", Schema.FieldType.DATETIME),
            Column.required("med_category", Schema.FieldType.STRING),
            Column.required("med_dose", Schema.FieldType.DOUBLE),
            Column.optional("location_category", Schema.FieldType.STRING)),
    RESPIRATORY_SUPPORT(false, List.of("respiratory_support"),
            Column.required("hospitalization_id", Schema.FieldType.STRING),
            Column.required("recorded_dttm", Schema.FieldType.DATETIME),
            Column.required("device_category", Schema.FieldType.STRING)),
    PATIENT(false, List.of("patient"),
            Column.required("patient_id", Schema.FieldType.STRING),
            Column.required("death_dttm", Schema.FieldType.DATETIME)),
    HOSPITAL_DIAGNOSIS(false, List.of("hospital_diagnosis"),
            Column.required("hospitalization_id", Schema.FieldType.STRING),
            Column.required("diagnosis_code", Schema.FieldType.STRING, "diagnosis_code", "icd_code"));

    private final boolean required;
    private final List<String> tableNames;
    private final List<Column> columns;

    ClifTable(boolean required, List<String> tableNames, Column... columns) {
        this.required = required;
        this.tableNames = tableNames;
        this.columns = Arrays.asList(columns);
    }

    public boolean isRequired() {
        return required;
    }

    /**
     * @return accepted physical table names, in order of preference
     */
    public List<String> getTableNames() {
        return tableNames;
    }

    public List<Column> getColumns() {
        return columns;
    }

    public String getLogicalName() {
        return tableNames.get(0);
    }

    public static class Column implements Serializable {
        private final String name;
        private final Schema.FieldType type;
        private final boolean required;
        private final List<String> acceptedNames;

        private Column(String name, Schema.FieldType type, boolean required, String... acceptedNames) {
            this.name = name;
            this.type = type;
            this.required = required;
            this.acceptedNames = acceptedNames.length == 0 ? List.of(name) : Arrays.asList(acceptedNames);
        }

        static Column required(String name, Schema.FieldType type, String... acceptedNames) {
            return new Column(name, type, true, acceptedNames);
        }

        static Column optional(String name, Schema.FieldType type, String... acceptedNames) {
            return new Column(name, type, false, acceptedNames);
        }

        public String getName() {
            return name;
        }

        public Schema.FieldType getType() {
            return type;
        }

        public boolean isRequired() {
            return required;
        }

        public List<String> getAcceptedNames() {
            return acceptedNames;
        }
    }
}
