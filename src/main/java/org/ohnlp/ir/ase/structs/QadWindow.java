package org.ohnlp.ir.ase.structs;

import org.joda.time.LocalDate;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

/**
 * Qualifying antimicrobial day run found for one blood culture.
 */
public final class QadWindow implements Serializable {
    private final int totalQad;
    private final LocalDate qadStartDate;
    private final LocalDate qadEndDate;
    private final boolean censored;
    private final CensorReason censorReason;
    private final List<String> medsInWindow;

    public QadWindow(int totalQad, LocalDate qadStartDate, LocalDate qadEndDate, boolean censored,
                     CensorReason censorReason, List<String> medsInWindow) {
        this.totalQad = totalQad;
        this.qadStartDate = qadStartDate;
        this.qadEndDate = qadEndDate;
        this.censored = censored;
        this.censorReason = censorReason;
        this.medsInWindow = Collections.unmodifiableList(medsInWindow);
    }

    public static QadWindow empty(List<String> medsInWindow) {
        return new QadWindow(0, null, null, false, CensorReason.NONE, medsInWindow);
    }

    public QadWindow censor(CensorReason reason) {
        return new QadWindow(totalQad, qadStartDate, qadEndDate, true, reason, medsInWindow);
    }

    /**
     * @param requiredQad the number of qualifying days needed without censoring
     * @return whether this window satisfies the presumed infection component
     */
    public boolean satisfies(int requiredQad) {
        return totalQad >= requiredQad || censored;
    }

    public int getTotalQad() {
        return totalQad;
    }

    public LocalDate getQadStartDate() {
        return qadStartDate;
    }

    public LocalDate getQadEndDate() {
        return qadEndDate;
    }

    public boolean isCensored() {
        return censored;
    }

    public CensorReason getCensorReason() {
        return censorReason;
    }

    public List<String> getMedsInWindow() {
        return medsInWindow;
    }
}
