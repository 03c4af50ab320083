package com.samsung.ees.infra.sli.codec;

import com.samsung.ees.infra.sli.exception.InvalidSampleException;
import com.samsung.ees.infra.sli.exception.MalformedEncodingException;
import com.samsung.ees.infra.sli.model.ValueUnit;
import com.samsung.ees.infra.sli.util.BucketKeys;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Encodes one day of samples into the compact text form {@code "<offset>:<value>,..."} and back,
 * and applies the numeric floor/rounding policy to values before they are compacted.
 * <p>
 * Values are rounded to {@value #SCALE} fractional digits with {@link RoundingMode#HALF_EVEN} and rendered
 * without trailing zeros, keeping at least one fractional digit ({@code 2.0}, {@code 0.1}, {@code 12.346}).
 */
public class ValueCodec {

    public static final int SCALE = 3;

    private static final char ENTRY_SEPARATOR = ',';
    private static final char FIELD_SEPARATOR = ':';
    private static final Pattern DECIMAL_LITERAL = Pattern.compile("-?[0-9]+(\\.[0-9]+)?");

    private final BigDecimal minValue;

    /**
     * @param minValue smallest magnitude a non-zero value is stored with. Must be positive
     *                 and representable with {@value #SCALE} fractional digits.
     */
    public ValueCodec(BigDecimal minValue) {
        if (minValue == null || minValue.signum() <= 0) {
            throw new IllegalArgumentException("minValue must be positive: " + minValue);
        }
        if (minValue.stripTrailingZeros().scale() > SCALE) {
            throw new IllegalArgumentException("minValue cannot have more than " + SCALE + " fractional digits: " + minValue);
        }
        this.minValue = minValue;
    }

    public BigDecimal getMinValue() {
        return minValue;
    }

    /**
     * Raises the magnitude of non-zero values to at least {@code minValue}, keeping the sign,
     * then rounds to {@value #SCALE} fractional digits. Zero stays zero.
     */
    public BigDecimal clampAndRound(BigDecimal value) {
        BigDecimal clamped = value;
        if (value.signum() > 0) {
            clamped = value.max(minValue);
        } else if (value.signum() < 0) {
            clamped = value.min(minValue.negate());
        }
        return normalize(clamped.setScale(SCALE, RoundingMode.HALF_EVEN));
    }

    /**
     * Converts a sample value produced by a computation, rejecting null and non-finite doubles.
     */
    public static BigDecimal toDecimal(Double value) {
        if (value == null) {
            throw new InvalidSampleException("Sample value cannot be null.");
        }
        if (value.isNaN() || value.isInfinite()) {
            throw new InvalidSampleException("Sample value must be finite: " + value);
        }
        return BigDecimal.valueOf(value);
    }

    /**
     * Serializes the units in the given order, each followed by a separator. No sorting and no
     * de-duplication is applied. An empty list encodes to an empty string.
     */
    public String encode(List<ValueUnit> units) {
        StringBuilder sb = new StringBuilder(units.size() * 10);
        for (ValueUnit unit : units) {
            sb.append(unit.offset())
                    .append(FIELD_SEPARATOR)
                    .append(unit.value().toPlainString())
                    .append(ENTRY_SEPARATOR);
        }
        return sb.toString();
    }

    /**
     * Parses a blob into its entries, in stored order, duplicates included.
     *
     * @throws MalformedEncodingException if any non-empty token is not a valid entry.
     */
    public List<ValueUnit> parse(String blob) {
        if (blob == null) {
            throw new MalformedEncodingException("Compact values cannot be null.");
        }
        List<ValueUnit> units = new ArrayList<>();
        for (String token : blob.split(String.valueOf(ENTRY_SEPARATOR))) {
            if (!token.isEmpty()) {
                units.add(parseToken(token));
            }
        }
        return units;
    }

    /**
     * Decodes a blob into timestamps anchored at {@code timebucket}. When an offset occurs more than
     * once, the entry that appears last in the blob wins.
     *
     * @throws MalformedEncodingException if any non-empty token is not a valid entry.
     */
    public Map<LocalDateTime, BigDecimal> decode(LocalDateTime timebucket, String blob) {
        Map<LocalDateTime, BigDecimal> values = new LinkedHashMap<>();
        for (ValueUnit unit : parse(blob)) {
            values.put(BucketKeys.timestampAt(timebucket, unit.offset()), unit.value());
        }
        return values;
    }

    private static ValueUnit parseToken(String token) {
        int separator = token.indexOf(FIELD_SEPARATOR);
        if (separator < 0 || separator != token.lastIndexOf(FIELD_SEPARATOR)) {
            throw new MalformedEncodingException("Expected exactly one '" + FIELD_SEPARATOR + "' in entry: '" + token + "'");
        }
        String offsetPart = token.substring(0, separator);
        String valuePart = token.substring(separator + 1);

        if (offsetPart.isEmpty() || !offsetPart.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new MalformedEncodingException("Invalid offset in entry: '" + token + "'");
        }
        if (!DECIMAL_LITERAL.matcher(valuePart).matches()) {
            throw new MalformedEncodingException("Invalid value in entry: '" + token + "'");
        }
        try {
            return new ValueUnit(Integer.parseInt(offsetPart), new BigDecimal(valuePart));
        } catch (NumberFormatException | InvalidSampleException e) {
            throw new MalformedEncodingException("Invalid entry: '" + token + "'", e);
        }
    }

    private static BigDecimal normalize(BigDecimal rounded) {
        BigDecimal stripped = rounded.stripTrailingZeros();
        return stripped.scale() < 1 ? stripped.setScale(1) : stripped;
    }
}
