package org.ohnlp.ir.ase.structs;

import org.joda.time.DateTime;

import java.io.Serializable;
import java.util.Locale;

public class RespiratoryEvent implements Serializable {
    private String hospitalizationId;
    private DateTime recordedDttm;
    private String deviceCategory;

    public RespiratoryEvent() {}

    public RespiratoryEvent(String hospitalizationId, DateTime recordedDttm, String deviceCategory) {
        this.hospitalizationId = hospitalizationId;
        this.recordedDttm = recordedDttm;
        this.deviceCategory = deviceCategory;
    }

    public boolean isInvasiveVentilation() {
        return deviceCategory != null && deviceCategory.trim().toLowerCase(Locale.ROOT).equals("imv");
    }

    public String getHospitalizationId() {
        return hospitalizationId;
    }

    public void setHospitalizationId(String hospitalizationId) {
        this.hospitalizationId = hospitalizationId;
    }

    public DateTime getRecordedDttm() {
        return recordedDttm;
    }

    public void setRecordedDttm(DateTime recordedDttm) {
        this.recordedDttm = recordedDttm;
    }

    public String getDeviceCategory() {
        return deviceCategory;
    }

    public void setDeviceCategory(String deviceCategory) {
        this.deviceCategory = deviceCategory;
    }
}
