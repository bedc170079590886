package de.icepolcka.catalog.product;

/**
 * How a time window selects datasets.
 */
public enum RangeMode {
    /** Start time within the window. */
    START_TIME,
    /** Start time within the window and end time no later than the window end. */
    CONTAINED
}
