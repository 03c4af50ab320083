package com.samsung.ees.infra.sli.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Represents a single row from the 'indicatorvaluecompact' table: one day of samples for one indicator.
 * {@code values} holds the encoded entries, e.g. {@code "0:1.0,953:3.5,"}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IndicatorValueCompact {
    private LocalDateTime timebucket; // midnight of the bucket day
    private String values;
    private Integer indicatorId;
}
