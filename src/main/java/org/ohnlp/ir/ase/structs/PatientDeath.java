package org.ohnlp.ir.ase.structs;

import org.joda.time.DateTime;

import java.io.Serializable;

public class PatientDeath implements Serializable {
    private String patientId;
    private DateTime deathDttm;

    public PatientDeath() {}

    public PatientDeath(String patientId, DateTime deathDttm) {
        this.patientId = patientId;
        this.deathDttm = deathDttm;
    }

    public String getPatientId() {
        return patientId;
    }

    public void setPatientId(String patientId) {
        this.patientId = patientId;
    }

    public DateTime getDeathDttm() {
        return deathDttm;
    }

    public void setDeathDttm(DateTime deathDttm) {
        this.deathDttm = deathDttm;
    }
}
