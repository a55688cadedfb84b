package org.ohnlp.ir.ase.structs;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything known about a single hospitalization. All engine components read from this record and
 * none of them modify it once the normalizer has run.
 */
public class HospitalizationRecord implements Serializable {
    private Hospitalization hospitalization;
    private List<BloodCulture> bloodCultures = new ArrayList<>();
    private List<AntimicrobialEvent> antimicrobials = new ArrayList<>();
    private List<LabResult> labs = new ArrayList<>();
    private List<VasopressorEvent> vasopressors = new ArrayList<>();
    private List<RespiratoryEvent> respiratorySupport = new ArrayList<>();
    private boolean vasopressorDataAvailable;
    private boolean ventilationDataAvailable;
    private boolean esrd;

    public HospitalizationRecord() {}

    public HospitalizationRecord(Hospitalization hospitalization) {
        this.hospitalization = hospitalization;
    }

    public String getHospitalizationId() {
        return hospitalization.getHospitalizationId();
    }

    public Hospitalization getHospitalization() {
        return hospitalization;
    }

    public void setHospitalization(Hospitalization hospitalization) {
        this.hospitalization = hospitalization;
    }

    public List<BloodCulture> getBloodCultures() {
        return bloodCultures;
    }

    public void setBloodCultures(List<BloodCulture> bloodCultures) {
        this.bloodCultures = bloodCultures;
    }

    public List<AntimicrobialEvent> getAntimicrobials() {
        return antimicrobials;
    }

    public void setAntimicrobials(List<AntimicrobialEvent> antimicrobials) {
        this.antimicrobials = antimicrobials;
    }

    public List<LabResult> getLabs() {
        return labs;
    }

    public void setLabs(List<LabResult> labs) {
        this.labs = labs;
    }

    public List<VasopressorEvent> getVasopressors() {
        return vasopressors;
    }

    public void setVasopressors(List<VasopressorEvent> vasopressors) {
        this.vasopressors = vasopressors;
    }

    public List<RespiratoryEvent> getRespiratorySupport() {
        return respiratorySupport;
    }

    public void setRespiratorySupport(List<RespiratoryEvent> respiratorySupport) {
        this.respiratorySupport = respiratorySupport;
    }

    public boolean isVasopressorDataAvailable() {
        return vasopressorDataAvailable;
    }

    public void setVasopressorDataAvailable(boolean vasopressorDataAvailable) {
        this.vasopressorDataAvailable = vasopressorDataAvailable;
    }

    public boolean isVentilationDataAvailable() {
        return ventilationDataAvailable;
    }

    public void setVentilationDataAvailable(boolean ventilationDataAvailable) {
        this.ventilationDataAvailable = ventilationDataAvailable;
    }

    /**
     * @return true when the hospitalization carries an end-stage renal disease diagnosis
     */
    public boolean isEsrd() {
        return esrd;
    }

    public void setEsrd(boolean esrd) {
        this.esrd = esrd;
    }
}
