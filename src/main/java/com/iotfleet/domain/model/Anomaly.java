package com.iotfleet.domain.model;

import lombok.Value;

/**
 * Result of evaluating one reading against the thresholds: which threshold was crossed
 * and the reason carried on the alert.
 */
@Value
public class Anomaly {

    Kind kind;
    String reason;

    public enum Kind {
        HIGH_TEMPERATURE("high_temperature"),
        LOW_HUMIDITY("low_humidity");

        private final String tag;

        Kind(String tag) {
            this.tag = tag;
        }

        /** Metric tag value. */
        public String tag() {
            return tag;
        }
    }
}
