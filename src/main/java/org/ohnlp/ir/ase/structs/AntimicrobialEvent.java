package org.ohnlp.ir.ase.structs;

import org.joda.time.DateTime;

import java.io.Serializable;
import java.util.Locale;
import java.util.Set;

public class AntimicrobialEvent implements Serializable {
    private static final Set<String> PARENTERAL_ROUTES = Set.of("iv", "im", "intravenous", "intramuscular");

    private String hospitalizationId;
    private DateTime adminDttm;
    private String drugName;
    private String route;
    private boolean newAdministration;

    public AntimicrobialEvent() {}

    public AntimicrobialEvent(String hospitalizationId, DateTime adminDttm, String drugName, String route) {
        this.hospitalizationId = hospitalizationId;
        this.adminDttm = adminDttm;
        this.drugName = drugName;
        this.route = route;
    }

    /**
     * @return true for IV/IM administrations. Route-less rows are treated as parenteral.
     */
    public boolean isParenteral() {
        return route == null || route.isBlank() || PARENTERAL_ROUTES.contains(route.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * @return the drug name in the case-insensitive form used to compare administrations
     */
    public String getDrugKey() {
        return drugName == null ? "" : drugName.trim().toLowerCase(Locale.ROOT);
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

    public String getDrugName() {
        return drugName;
    }

    public void setDrugName(String drugName) {
        this.drugName = drugName;
    }

    public String getRoute() {
        return route;
    }

    public void setRoute(String route) {
        this.route = route;
    }

    /**
     * @return true when the same drug was not administered on either of the two preceding calendar days
     */
    public boolean isNewAdministration() {
        return newAdministration;
    }

    public void setNewAdministration(boolean newAdministration) {
        this.newAdministration = newAdministration;
    }
}
