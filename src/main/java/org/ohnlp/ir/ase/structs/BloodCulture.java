package org.ohnlp.ir.ase.structs;

import org.joda.time.DateTime;

import java.io.Serializable;

/**
 * A raw blood culture row as read from the source table, before anchor sequencing.
 */
public class BloodCulture implements Serializable {
    private String hospitalizationId;
    private DateTime collectDttm;
    private DateTime orderDttm;

    public BloodCulture() {}

    public BloodCulture(String hospitalizationId, DateTime collectDttm, DateTime orderDttm) {
        this.hospitalizationId = hospitalizationId;
        this.collectDttm = collectDttm;
        this.orderDttm = orderDttm;
    }

    /**
     * @return the collection time, falling back to the order time; null when neither was recorded
     */
    public DateTime getAnchorDttm() {
        return collectDttm != null ? collectDttm : orderDttm;
    }

    public String getHospitalizationId() {
        return hospitalizationId;
    }

    public void setHospitalizationId(String hospitalizationId) {
        this.hospitalizationId = hospitalizationId;
    }

    public DateTime getCollectDttm() {
        return collectDttm;
    }

    public void setCollectDttm(DateTime collectDttm) {
        this.collectDttm = collectDttm;
    }

    public DateTime getOrderDttm() {
        return orderDttm;
    }

    public void setOrderDttm(DateTime orderDttm) {
        this.orderDttm = orderDttm;
    }
}
