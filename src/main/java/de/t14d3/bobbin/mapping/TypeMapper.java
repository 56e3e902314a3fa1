package de.t14d3.bobbin.mapping;

import de.t14d3.bobbin.exceptions.OrmException;

import java.math.BigDecimal;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.UUID;

/**
 * Centralized conversion of database values: normalizing raw JDBC values into the
 * types stored in model attributes, and coercing attribute values to a requested Java type.
 */
public class TypeMapper {

    /**
     * Normalize a raw JDBC value for storage in a model's attribute map.
     * Timestamps become {@link LocalDateTime}, SQL dates {@link LocalDate}, LOBs are read eagerly.
     */
    public static Object normalize(Object value) {
        if (value == null) return null;

        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime();
        } else if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        } else if (value instanceof Time) {
            return ((Time) value).toLocalTime();
        } else if (value instanceof Clob clob) {
            try {
                String text = clob.getSubString(1, (int) clob.length());
                clob.free();
                return text;
            } catch (SQLException e) {
                throw new OrmException("Failed to read clob", e);
            }
        } else if (value instanceof Blob blob) {
            try {
                byte[] bytes = blob.getBytes(1, (int) blob.length());
                blob.free();
                return bytes;
            } catch (SQLException e) {
                throw new OrmException("Failed to read blob", e);
            }
        }
        return value;
    }

    /**
     * Normalize a key value so that keys read from columns of different integral
     * widths compare equal ({@code Integer 1} and {@code Long 1} both become {@code 1L}).
     */
    public static Object normalizeKey(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        // NUMERIC keys beyond the long range stay decimal
        if (value instanceof BigDecimal decimal && decimal.scale() <= 0
                && decimal.toBigInteger().bitLength() < Long.SIZE) {
            return decimal.longValue();
        }
        return value;
    }

    /**
     * Convert an attribute value to the target Java type.
     * Handles type coercion where appropriate (e.g., Number -> int, long, float, double).
     */
    public static Object convertToJavaType(Object value, Class<?> targetType) {
        if (value == null) return null;

        if (targetType == Long.class || targetType == long.class) {
            if (value instanceof Number) return ((Number) value).longValue();
            if (value instanceof String) return Long.parseLong((String) value);
        } else if (targetType == Integer.class || targetType == int.class) {
            if (value instanceof Number) return ((Number) value).intValue();
            if (value instanceof String) return Integer.parseInt((String) value);
        } else if (targetType == Double.class || targetType == double.class) {
            if (value instanceof Number) return ((Number) value).doubleValue();
        } else if (targetType == Float.class || targetType == float.class) {
            if (value instanceof Number) return ((Number) value).floatValue();
        } else if (targetType == Short.class || targetType == short.class) {
            if (value instanceof Number) return ((Number) value).shortValue();
        } else if (targetType == UUID.class) {
            if (value instanceof String) {
                return UUID.fromString((String) value);
            }
        } else if (targetType == String.class) {
            return value.toString();
        } else if (targetType == Boolean.class || targetType == boolean.class) {
            if (value instanceof Boolean) return value;
            if (value instanceof Number) return ((Number) value).intValue() != 0;
            return Boolean.parseBoolean(value.toString());
        } else if (targetType == LocalDate.class) {
            if (value instanceof java.sql.Date) {
                return ((java.sql.Date) value).toLocalDate();
            } else if (value instanceof LocalDateTime) {
                return ((LocalDateTime) value).toLocalDate();
            }
        } else if (targetType == LocalDateTime.class) {
            if (value instanceof Timestamp) {
                return ((Timestamp) value).toLocalDateTime();
            } else if (value instanceof OffsetDateTime) {
                return ((OffsetDateTime) value).atZoneSameInstant(ZoneId.systemDefault()).toLocalDateTime();
            } else if (value instanceof LocalDate) {
                return ((LocalDate) value).atStartOfDay();
            }
        } else if (targetType == BigDecimal.class) {
            if (value instanceof BigDecimal) {
                return value;
            } else if (value instanceof Number) {
                return new BigDecimal(value.toString());
            } else if (value instanceof String) {
                return new BigDecimal((String) value);
            }
        } else if (targetType.isEnum() && value instanceof String) {
            @SuppressWarnings({"unchecked", "rawtypes"})
            Class<? extends Enum> enumType = (Class<? extends Enum>) targetType;
            //noinspection unchecked
            return Enum.valueOf(enumType, (String) value);
        }

        if (targetType.isInstance(value)) {
            return value;
        }
        throw new OrmException("Unsupported conversion from " + value.getClass().getName() + " to " + targetType.getName());
    }
}
