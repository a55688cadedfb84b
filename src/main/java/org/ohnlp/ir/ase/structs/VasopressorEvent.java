package org.ohnlp.ir.ase.structs;

import org.joda.time.DateTime;

import java.io.Serializable;
import java.util.Locale;

public class VasopressorEvent implements Serializable {
    private String hospitalizationId;
    private DateTime adminDttm;
    private String medCategory;
    private Double medDose;
    private String locationCategory;

    public VasopressorEvent() {}

    public VasopressorEvent(String hospitalizationId, DateTime adminDttm, String medCategory, Double medDose,
                            String locationCategory) {
        this.hospitalizationId = hospitalizationId;
        this.adminDttm = adminDttm;
        this.medCategory = medCategory;
        this.medDose = medDose;
        this.locationCategory = locationCategory;
    }

    public boolean isRunning() {
        return medDose != null && medDose > 0;
    }

    public boolean isProcedural() {
        return locationCategory != null && locationCategory.trim().toLowerCase(Locale.ROOT).equals("procedural");
    }

    public String getHospitalizationId() {
        return hospitalizationId;
    }

    public void setHospitalizationId(String hospitalizationId) {
        this.hospitalizationId = hospitalizationId;
    }

    public DateTime getAdminDttm() {
        return adminDttm;
    }

    public void setAdminDttm(DateTime adminDttm) {
        this.adminDttm = adminDttm;
    }

    public String getMedCategory() {
        return medCategory;
    }

    public void setMedCategory(String medCategory) {
        this.medCategory = medCategory;
    }

    public Double getMedDose() {
        return medDose;
    }

    public void setMedDose(Double medDose) {
        this.medDose = medDose;
    }

    public String getLocationCategory() {
        return locationCategory;
    }

    public void setLocationCategory(String locationCategory) {
        this.locationCategory = locationCategory;
    }
}
