package com.samsung.ees.infra.sli.model;

import com.samsung.ees.infra.sli.exception.InvalidSampleException;
import com.samsung.ees.infra.sli.util.BucketKeys;

import java.math.BigDecimal;

/**
 * One compacted entry: minutes since the bucket's midnight and the normalized value.
 */
public record ValueUnit(int offset, BigDecimal value) {

    public ValueUnit {
        if (offset < 0 || offset >= BucketKeys.MINUTES_PER_DAY) {
            throw new InvalidSampleException("Offset out of range 0.." + (BucketKeys.MINUTES_PER_DAY - 1) + ": " + offset);
        }
        if (value == null) {
            throw new InvalidSampleException("Value cannot be null at offset " + offset);
        }
    }
}
