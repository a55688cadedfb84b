package org.ohnlp.ir.ase.engine;

/**
 * States of the repeat infection timeframe pass over one hospitalization.
 */
public enum RitState {
    /** No counted episode is active. */
    OPEN,
    /** Within the timeframe opened by the last counted episode. */
    IN_WINDOW
}
