/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.runtime.normalization;

import com.lexis.activation.api.exceptions.NormalizationException;
import com.lexis.activation.api.model.VariableType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Coerces raw extracted values to their declared {@link VariableType}.
 *
 * <p>Extraction output is loosely typed: booleans arrive as {@code "TRUE"} or {@code 1},
 * amounts as {@code "R$ 250.000,00"}, dates as {@code "05/03/2024"}. This class turns
 * them into comparable values or fails with {@link NormalizationException}, which the
 * evaluator maps to an indeterminate condition.
 *
 * <h2>Number formats</h2>
 * After stripping {@code R$}, {@code $} and whitespace:
 * <ul>
 *   <li>both {@code .} and {@code ,} present: the right-most one is the decimal separator</li>
 *   <li>only {@code ,}: decimal when it occurs once and is followed by 1-2 digits,
 *       otherwise a thousands separator</li>
 *   <li>only {@code .}: thousands separators when it occurs more than once, decimal
 *       point otherwise</li>
 * </ul>
 *
 * <p>Stateless and thread-safe.
 */
public final class VariableNormalizer {

    private static final DateTimeFormatter BRAZILIAN_DATE =
            DateTimeFormatter.ofPattern("dd/MM/uuuu").withResolverStyle(ResolverStyle.STRICT);
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");
    private static final Pattern TWO_DECIMALS_AFTER_COMMA = Pattern.compile("^[^,]*,\\d{1,2}$");

    public NormalizedValue normalize(Object raw, VariableType type) throws NormalizationException {
        if (raw == null) {
            throw new NormalizationException(null, type, "value is null");
        }
        return switch (type) {
            case BOOLEAN -> new NormalizedValue(type, toBoolean(raw));
            case STRING -> new NormalizedValue(type, toText(raw));
            case NUMBER -> new NormalizedValue(type, toNumber(raw));
            case DATE -> new NormalizedValue(type, toDate(raw));
            case LIST_OF_STRING -> new NormalizedValue(type, toList(raw));
        };
    }

    /**
     * True for null, blank strings and empty collections. Presence checks use this and never
     * normalize.
     */
    public static boolean isEmptyValue(Object raw) {
        if (raw == null) return true;
        if (raw instanceof CharSequence text) return text.toString().isBlank();
        if (raw instanceof Collection<?> collection) return collection.isEmpty();
        return false;
    }

    private static boolean toBoolean(Object raw) throws NormalizationException {
        if (raw instanceof Boolean b) {
            return b;
        }
        if (raw instanceof Number n) {
            BigDecimal value;
            try {
                value = new BigDecimal(n.toString());
            } catch (NumberFormatException e) {
                throw new NormalizationException(raw, VariableType.BOOLEAN, "not a finite number");
            }
            if (value.compareTo(BigDecimal.ONE) == 0) return true;
            if (value.signum() == 0) return false;
            throw new NormalizationException(raw, VariableType.BOOLEAN, "only 1 and 0 are boolean numbers");
        }
        String text = raw.toString().trim().toLowerCase(Locale.ROOT);
        return switch (text) {
            case "true", "1" -> true;
            case "false", "0" -> false;
            default -> throw new NormalizationException(raw, VariableType.BOOLEAN, "not a boolean literal");
        };
    }

    private static String toText(Object raw) {
        return raw.toString().trim().toLowerCase(Locale.ROOT);
    }

    private static BigDecimal toNumber(Object raw) throws NormalizationException {
        if (raw instanceof BigDecimal d) {
            return d;
        }
        if (raw instanceof BigInteger i) {
            return new BigDecimal(i);
        }
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new NormalizationException(raw, VariableType.NUMBER, "not a finite number");
            }
            return BigDecimal.valueOf(d);
        }
        if (raw instanceof Number n) {
            return BigDecimal.valueOf(n.longValue());
        }
        if (raw instanceof Boolean) {
            throw new NormalizationException(raw, VariableType.NUMBER, "booleans are not numbers");
        }
        String text = WHITESPACE.matcher(raw.toString().replace("R$", "").replace("$", "")).replaceAll("");
        if (text.isEmpty()) {
            throw new NormalizationException(raw, VariableType.NUMBER, "empty after stripping currency markers");
        }
        try {
            return new BigDecimal(canonicalDecimal(text));
        } catch (NumberFormatException e) {
            throw new NormalizationException(raw, VariableType.NUMBER, "not numeric");
        }
    }

    /**
     * Rewrites a localized number so that {@code .} is the only, decimal, separator.
     */
    static String canonicalDecimal(String text) {
        int lastDot = text.lastIndexOf('.');
        int lastComma = text.lastIndexOf(',');

        if (lastDot >= 0 && lastComma >= 0) {
            if (lastComma > lastDot) {
                return text.replace(".", "").replace(',', '.');
            }
            return text.replace(",", "");
        }
        if (lastComma >= 0) {
            if (TWO_DECIMALS_AFTER_COMMA.matcher(text).matches()) {
                return text.replace(',', '.');
            }
            return text.replace(",", "");
        }
        if (lastDot >= 0 && text.indexOf('.') != lastDot) {
            return text.replace(".", "");
        }
        return text;
    }

    private static LocalDate toDate(Object raw) throws NormalizationException {
        if (raw instanceof LocalDate date) {
            return date;
        }
        if (raw instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        String text = raw.toString().trim();
        try {
            if (text.contains("/")) {
                return LocalDate.parse(text, BRAZILIAN_DATE);
            }
            // ISO date, optionally followed by a time part
            return LocalDate.parse(text.length() > 10 && text.charAt(10) == 'T' ? text.substring(0, 10) : text);
        } catch (DateTimeParseException e) {
            throw new NormalizationException(raw, VariableType.DATE, "expected yyyy-MM-dd or dd/MM/yyyy");
        }
    }

    private static List<String> toList(Object raw) {
        if (raw instanceof Collection<?> collection) {
            List<String> values = new ArrayList<>(collection.size());
            for (Object element : collection) {
                if (element != null) {
                    values.add(toText(element));
                }
            }
            return Collections.unmodifiableList(values);
        }
        return List.of(toText(raw));
    }
}
