package org.ohnlp.ir.ase.structs;

import org.joda.time.DateTime;

import java.io.Serializable;

public final class BloodCultureAnchor implements Serializable {
    private final String hospitalizationId;
    private final int bcId;
    private final DateTime collectDttm;

    public BloodCultureAnchor(String hospitalizationId, int bcId, DateTime collectDttm) {
        this.hospitalizationId = hospitalizationId;
        this.bcId = bcId;
        this.collectDttm = collectDttm;
    }

    public String getHospitalizationId() {
        return hospitalizationId;
    }

    /**
     * @return 1-based position of this culture within its hospitalization, ordered by collection time
     */
    public int getBcId() {
        return bcId;
    }

    public DateTime getCollectDttm() {
        return collectDttm;
    }
}
