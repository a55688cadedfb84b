package org.ohnlp.ir.ase.structs;

import org.joda.time.DateTime;

import java.io.Serializable;
import java.util.Locale;

public class Hospitalization implements Serializable {
    private String hospitalizationId;
    private String patientId;
    private DateTime admissionDttm;
    private DateTime dischargeDttm;
    private String dischargeCategory;
    private DateTime deathDttm;

    public Hospitalization() {}

    public Hospitalization(String hospitalizationId, String patientId, DateTime admissionDttm,
                           DateTime dischargeDttm, String dischargeCategory) {
        this.hospitalizationId = hospitalizationId;
        this.patientId = patientId;
        this.admissionDttm = admissionDttm;
        this.dischargeDttm = dischargeDttm;
        this.dischargeCategory = dischargeCategory;
    }

    public boolean hasDischargeCategory(String category) {
        return dischargeCategory != null
                && dischargeCategory.trim().toLowerCase(Locale.ROOT).equals(category.toLowerCase(Locale.ROOT));
    }

    public String getHospitalizationId() {
        return hospitalizationId;
    }

    public void setHospitalizationId(String hospitalizationId) {
        this.hospitalizationId = hospitalizationId;
    }

    public String getPatientId() {
        return patientId;
    }

    public void setPatientId(String patientId) {
        this.patientId = patientId;
    }

    public DateTime getAdmissionDttm() {
        return admissionDttm;
    }

    public void setAdmissionDttm(DateTime admissionDttm) {
        this.admissionDttm = admissionDttm;
    }

    public DateTime getDischargeDttm() {
        return dischargeDttm;
    }

    public void setDischargeDttm(DateTime dischargeDttm) {
        this.dischargeDttm = dischargeDttm;
    }

    public String getDischargeCategory() {
        return dischargeCategory;
    }

    public void setDischargeCategory(String dischargeCategory) {
        this.dischargeCategory = dischargeCategory;
    }

    /**
     * @return the patient's death time when it falls on or before discharge, otherwise null
     */
    public DateTime getDeathDttm() {
        return deathDttm;
    }

    public void setDeathDttm(DateTime deathDttm) {
        this.deathDttm = deathDttm;
    }
}
