package org.ohnlp.ir.ase.structs;

import org.joda.time.DateTime;

import java.io.Serializable;

public class LabResult implements Serializable {
    private String hospitalizationId;
    private LabCategory category;
    private Double value;
    private DateTime resultDttm;

    public LabResult() {}

    public LabResult(String hospitalizationId, LabCategory category, Double value, DateTime resultDttm) {
        this.hospitalizationId = hospitalizationId;
        this.category = category;
        this.value = value;
        this.resultDttm = resultDttm;
    }

    public String getHospitalizationId() {
        return hospitalizationId;
    }

    public void setHospitalizationId(String hospitalizationId) {
        this.hospitalizationId = hospitalizationId;
    }

    public LabCategory getCategory() {
        return category;
    }

    public void setCategory(LabCategory category) {
        this.category = category;
    }

    /**
     * @return the numeric result, or null when missing or discarded as an outlier
     */
    public Double getValue() {
        return value;
    }

    public void setValue(Double value) {
        this.value = value;
    }

    public DateTime getResultDttm() {
        return resultDttm;
    }

    public void setResultDttm(DateTime resultDttm) {
        this.resultDttm = resultDttm;
    }
}
