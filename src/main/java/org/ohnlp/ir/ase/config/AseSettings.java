package org.ohnlp.ir.ase.config;

import com.fasterxml.jackson.databind.JsonNode;
import org.joda.time.DateTimeZone;
import org.ohnlp.ir.ase.structs.LabCategory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Settings for ASE detection. Defaults are the CDC surveillance toolkit values; every window is
 * expressed in days.
 */
public class AseSettings implements Serializable {

    public static final List<String> DEFAULT_VASOPRESSORS = List.of(
            "norepinephrine", "epinephrine", "phenylephrine", "vasopressin", "dopamine", "angiotensin");

    private boolean applyRit = true;
    private boolean ritOnlyHospitalOnset = false;
    private boolean includeLactate = true;
    private String timezone = "UTC";

    private int organDysfunctionDays = 2;
    private int qadLookbackDays = 2;
    private int qadLookaheadDays = 6;
    private int ritDays = 14;
    private int onsetTypeDays = 2;
    private int censorWindowDays = 3;
    private int newAntimicrobialLookbackDays = 2;
    private int requiredQad = 4;

    private final Map<LabCategory, Double> outlierCaps = new EnumMap<>(LabCategory.class);
    private List<String> vasopressorCategories = new ArrayList<>(DEFAULT_VASOPRESSORS);

    public AseSettings() {
        outlierCaps.put(LabCategory.CREATININE, 20.0);
        outlierCaps.put(LabCategory.BILIRUBIN, 80.0);
        outlierCaps.put(LabCategory.PLATELETS, 2000.0);
        outlierCaps.put(LabCategory.LACTATE, 30.0);
    }

    /**
     * Reads settings from the {@code ase} block of the job configuration. Absent keys keep their defaults.
     * @param node The configuration node, may be null
     * @return the settings
     */
    public static AseSettings fromJson(JsonNode node) {
        AseSettings settings = new AseSettings();
        if (node == null || node.isNull()) {
            return settings;
        }
        settings.applyRit = node.has("applyRit") ? node.get("applyRit").asBoolean() : settings.applyRit;
        settings.ritOnlyHospitalOnset = node.has("ritOnlyHospitalOnset") ? node.get("ritOnlyHospitalOnset").asBoolean() : settings.ritOnlyHospitalOnset;
        settings.includeLactate = node.has("includeLactate") ? node.get("includeLactate").asBoolean() : settings.includeLactate;
        if (node.has("timezone")) {
            settings.setTimezone(node.get("timezone").asText());
        }
        settings.requiredQad = node.has("requiredQad") ? node.get("requiredQad").asInt() : settings.requiredQad;
        JsonNode windows = node.get("windows");
        if (windows != null) {
            settings.organDysfunctionDays = windows.has("organDysfunctionDays") ? windows.get("organDysfunctionDays").asInt() : settings.organDysfunctionDays;
            settings.qadLookbackDays = windows.has("qadLookbackDays") ? windows.get("qadLookbackDays").asInt() : settings.qadLookbackDays;
            settings.qadLookaheadDays = windows.has("qadLookaheadDays") ? windows.get("qadLookaheadDays").asInt() : settings.qadLookaheadDays;
            settings.ritDays = windows.has("ritDays") ? windows.get("ritDays").asInt() : settings.ritDays;
            settings.onsetTypeDays = windows.has("onsetTypeDays") ? windows.get("onsetTypeDays").asInt() : settings.onsetTypeDays;
            settings.censorWindowDays = windows.has("censorWindowDays") ? windows.get("censorWindowDays").asInt() : settings.censorWindowDays;
            settings.newAntimicrobialLookbackDays = windows.has("newAntimicrobialLookbackDays") ? windows.get("newAntimicrobialLookbackDays").asInt() : settings.newAntimicrobialLookbackDays;
        }
        JsonNode caps = node.get("outlierCaps");
        if (caps != null) {
            caps.fields().forEachRemaining(e -> {
                LabCategory category = capCategory(e.getKey());
                if (category == null) {
                    throw new IllegalArgumentException("Unknown outlier cap lab category " + e.getKey());
                }
                settings.outlierCaps.put(category, e.getValue().asDouble());
            });
        }
        JsonNode vasopressors = node.get("vasopressorCategories");
        if (vasopressors != null && vasopressors.isArray()) {
            List<String> categories = new ArrayList<>();
            vasopressors.forEach(v -> categories.add(v.asText().trim().toLowerCase(Locale.ROOT)));
            settings.vasopressorCategories = categories;
        }
        settings.validate();
        return settings;
    }

    private static LabCategory capCategory(String key) {
        switch (key.toLowerCase(Locale.ROOT)) {
            case "creatinine":
                return LabCategory.CREATININE;
            case "bilirubin":
            case "bilirubin_total":
                return LabCategory.BILIRUBIN;
            case "platelets":
            case "platelet_count":
                return LabCategory.PLATELETS;
            case "lactate":
                return LabCategory.LACTATE;
            default:
                return null;
        }
    }

    /**
     * Applies command line overrides. Null arguments leave the configured value untouched.
     */
    public AseSettings applyOverrides(Boolean applyRit, Boolean ritOnlyHospitalOnset, Boolean includeLactate) {
        if (applyRit != null) {
            this.applyRit = applyRit;
        }
        if (ritOnlyHospitalOnset != null) {
            this.ritOnlyHospitalOnset = ritOnlyHospitalOnset;
        }
        if (includeLactate != null) {
            this.includeLactate = includeLactate;
        }
        return this;
    }

    private void validate() {
        if (organDysfunctionDays < 0 || qadLookbackDays < 0 || qadLookaheadDays < 0 || ritDays < 0
                || onsetTypeDays < 0 || censorWindowDays < 0 || newAntimicrobialLookbackDays < 0) {
            throw new IllegalArgumentException("ASE window sizes must not be negative");
        }
        if (requiredQad < 1) {
            throw new IllegalArgumentException("requiredQad must be at least 1, got " + requiredQad);
        }
    }

    public DateTimeZone getZone() {
        return DateTimeZone.forID(timezone);
    }

    /**
     * @return the outlier cap for a lab category; values above it are treated as missing
     */
    public double getOutlierCap(LabCategory category) {
        return outlierCaps.get(category);
    }

    public boolean isVasopressor(String medCategory) {
        return medCategory != null && vasopressorCategories.contains(medCategory.trim().toLowerCase(Locale.ROOT));
    }

    public boolean isApplyRit() {
        return applyRit;
    }

    public void setApplyRit(boolean applyRit) {
        this.applyRit = applyRit;
    }

    public boolean isRitOnlyHospitalOnset() {
        return ritOnlyHospitalOnset;
    }

    public void setRitOnlyHospitalOnset(boolean ritOnlyHospitalOnset) {
        this.ritOnlyHospitalOnset = ritOnlyHospitalOnset;
    }

    public boolean isIncludeLactate() {
        return includeLactate;
    }

    public void setIncludeLactate(boolean includeLactate) {
        this.includeLactate = includeLactate;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        DateTimeZone.forID(timezone); // Fail fast on unknown zone IDs
        this.timezone = timezone;
    }

    public int getOrganDysfunctionDays() {
        return organDysfunctionDays;
    }

    public void setOrganDysfunctionDays(int organDysfunctionDays) {
        this.organDysfunctionDays = organDysfunctionDays;
    }

    public int getQadLookbackDays() {
        return qadLookbackDays;
    }

    public void setQadLookbackDays(int qadLookbackDays) {
        this.qadLookbackDays = qadLookbackDays;
    }

    public int getQadLookaheadDays() {
        return qadLookaheadDays;
    }

    public void setQadLookaheadDays(int qadLookaheadDays) {
        this.qadLookaheadDays = qadLookaheadDays;
    }

    public int getRitDays() {
        return ritDays;
    }

    public void setRitDays(int ritDays) {
        this.ritDays = ritDays;
    }

    public int getOnsetTypeDays() {
        return onsetTypeDays;
    }

    public void setOnsetTypeDays(int onsetTypeDays) {
        this.onsetTypeDays = onsetTypeDays;
    }

    public int getCensorWindowDays() {
        return censorWindowDays;
    }

    public void setCensorWindowDays(int censorWindowDays) {
        this.censorWindowDays = censorWindowDays;
    }

    public int getNewAntimicrobialLookbackDays() {
        return newAntimicrobialLookbackDays;
    }

    public void setNewAntimicrobialLookbackDays(int newAntimicrobialLookbackDays) {
        this.newAntimicrobialLookbackDays = newAntimicrobialLookbackDays;
    }

    public int getRequiredQad() {
        return requiredQad;
    }

    public void setRequiredQad(int requiredQad) {
        this.requiredQad = requiredQad;
    }

    public List<String> getVasopressorCategories() {
        return vasopressorCategories;
    }

    public void setVasopressorCategories(List<String> vasopressorCategories) {
        this.vasopressorCategories = vasopressorCategories;
    }
}
