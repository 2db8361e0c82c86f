package com.blogview.analytics.domain.filter;

import com.blogview.analytics.domain.exception.AnalyticsValidationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;

/**
 * Converts filter values from JSON scalars to the Java type of the field they are compared with.
 *
 * Integral fields only accept integral numbers. A plain date string is read as UTC midnight;
 * {@link FilterExpressionEvaluator} binds expression dates to the configured zone beforehand.
 */
public final class ValueCoercion {

    private ValueCoercion() {
    }

    public static Object coerce(Object raw, Class<?> target) {
        if (raw == null) {
            throw new AnalyticsValidationException("Filter value must not be null.");
        }
        if (target.isInstance(raw)) {
            return raw;
        }
        try {
            if (target == String.class) {
                if (raw instanceof Number || raw instanceof Boolean) {
                    return String.valueOf(raw);
                }
                if (raw instanceof ZonedDateTime) {
                    return ((ZonedDateTime) raw).toLocalDate().toString();
                }
            } else if (target == Long.class || target == long.class) {
                return raw instanceof Number ? exactLong((Number) raw) : Long.parseLong(raw.toString().trim());
            } else if (target == Integer.class || target == int.class) {
                return raw instanceof Number ? Math.toIntExact(exactLong((Number) raw)) : Integer.parseInt(raw.toString().trim());
            } else if (target == Double.class || target == double.class) {
                return raw instanceof Number ? ((Number) raw).doubleValue() : Double.parseDouble(raw.toString().trim());
            } else if (target == Boolean.class || target == boolean.class) {
                if (raw instanceof String && ("true".equalsIgnoreCase((String) raw) || "false".equalsIgnoreCase((String) raw))) {
                    return Boolean.parseBoolean((String) raw);
                }
            } else if (target == Instant.class) {
                return toInstant(raw);
            } else if (target == LocalDate.class) {
                if (raw instanceof Instant) {
                    return LocalDate.ofInstant((Instant) raw, ZoneOffset.UTC);
                }
                if (raw instanceof ZonedDateTime) {
                    return ((ZonedDateTime) raw).toLocalDate();
                }
                if (raw instanceof String) {
                    String text = ((String) raw).trim();
                    return text.length() > 10 ? LocalDate.ofInstant(toInstant(text), ZoneOffset.UTC) : LocalDate.parse(text);
                }
            } else {
                throw new AnalyticsValidationException("Fields of type " + target.getSimpleName() + " cannot be filtered.");
            }
        } catch (NumberFormatException | ArithmeticException | DateTimeParseException e) {
            throw new AnalyticsValidationException(
                    "Value '" + raw + "' is not a valid " + target.getSimpleName() + ".", e);
        }
        throw new AnalyticsValidationException("Value '" + raw + "' is not a valid " + target.getSimpleName() + ".");
    }

    /**
     * @throws ArithmeticException for fractional or out-of-range values
     */
    private static long exactLong(Number number) {
        if (number instanceof Double || number instanceof Float) {
            return new BigDecimal(number.toString()).longValueExact();
        }
        if (number instanceof BigDecimal) {
            return ((BigDecimal) number).longValueExact();
        }
        if (number instanceof BigInteger) {
            return ((BigInteger) number).longValueExact();
        }
        return number.longValue();
    }

    /**
     * Parses an instant, an offset date-time or a plain date (start of day, UTC).
     */
    private static Instant toInstant(Object raw) {
        if (raw instanceof Instant) {
            return (Instant) raw;
        }
        if (raw instanceof ZonedDateTime) {
            return ((ZonedDateTime) raw).toInstant();
        }
        if (raw instanceof LocalDate) {
            return ((LocalDate) raw).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (raw instanceof String) {
            String text = ((String) raw).trim();
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return OffsetDateTime.parse(text).toInstant();
        }
        throw new AnalyticsValidationException("Value '" + raw + "' is not a valid timestamp.");
    }
}
