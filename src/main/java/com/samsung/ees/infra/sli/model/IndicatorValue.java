package com.samsung.ees.infra.sli.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Represents a single row from the 'indicatorvalue' table.
 * Primary key is (timestamp, indicatorId).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IndicatorValue {
    private LocalDateTime timestamp;
    private BigDecimal value;
    private Integer indicatorId;
}
