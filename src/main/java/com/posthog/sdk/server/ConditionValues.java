package com.posthog.sdk.server;

import com.google.common.primitives.Doubles;
import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Conversions between JSON attribute values and the types the condition operators work with. Every
 * method returns null, rather than throwing, when a value cannot be converted.
 */
abstract class ConditionValues {
  private ConditionValues() {}

  private static final long DAYS_PER_MONTH = 30;
  private static final long DAYS_PER_YEAR = 365;

  static boolean isString(JsonElement value) {
    return value != null && value.isJsonPrimitive() && value.getAsJsonPrimitive().isString();
  }

  // Strings as-is; numbers and booleans as their JSON text; anything else as serialized JSON.
  static String valueToString(JsonElement value) {
    if (isString(value)) {
      return value.getAsString();
    }
    return String.valueOf(value);
  }

  static Double valueToDouble(JsonElement value) {
    if (value == null || !value.isJsonPrimitive()) {
      return null;
    }
    JsonPrimitive p = value.getAsJsonPrimitive();
    if (p.isNumber()) {
      return p.getAsDouble();
    }
    if (p.isString()) {
      return parseNumber(p.getAsString());
    }
    return null;
  }

  // Decimal or exponent notation, or "inf", "infinity" or "nan" in any case, each with an optional
  // sign. Hexadecimal and surrounding whitespace are rejected.
  static Double parseNumber(String s) {
    boolean negative = s.startsWith("-");
    String unsigned = negative || s.startsWith("+") ? s.substring(1) : s;
    if (unsigned.equalsIgnoreCase("inf") || unsigned.equalsIgnoreCase("infinity")) {
      return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }
    if (unsigned.equalsIgnoreCase("nan")) {
      return Double.NaN;
    }
    if (unsigned.startsWith("0x") || unsigned.startsWith("0X")) {
      return null;
    }
    return Doubles.tryParse(s);
  }

  static Pattern valueToRegex(JsonElement value) {
    try {
      return Pattern.compile(valueToString(value));
    } catch (PatternSyntaxException e) {
      return null;
    }
  }

  /**
   * Parses a date condition value. Accepted forms, tried in this order: a relative offset into the
   * past such as {@code -7d} (units h, d, w, m = 30 days, y = 365 days), an RFC 3339 date-time, or a
   * plain {@code yyyy-MM-dd} date meaning midnight UTC.
   *
   * @param value the value; must be a JSON string
   * @param now the instant that relative dates count back from
   * @return the instant, or null if the value is not a recognizable date
   */
  static Instant valueToDate(JsonElement value, Instant now) {
    if (!isString(value)) {
      return null;
    }
    String s = value.getAsString();
    if (s.startsWith("-") && s.length() > 1) {
      Instant relative = parseRelativeDate(s, now);
      if (relative != null) {
        return relative;
      }
    }
    Instant dateTime = parseDateTime(s);
    return dateTime != null ? dateTime : parsePlainDate(s);
  }

  private static Instant parseDateTime(String s) {
    try {
      return OffsetDateTime.parse(s).toInstant();
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static Instant parsePlainDate(String s) {
    try {
      return LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant();
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  static Instant parseRelativeDate(String s, Instant now) {
    String trimmed = s.trim();
    if (trimmed.length() < 3 || !trimmed.startsWith("-")) {
      return null;
    }
    long amount;
    try {
      amount = Long.parseLong(trimmed.substring(1, trimmed.length() - 1));
    } catch (NumberFormatException e) {
      return null;
    }
    Duration offset;
    try {
      switch (trimmed.charAt(trimmed.length() - 1)) {
      case 'h':
        offset = Duration.ofHours(amount);
        break;
      case 'd':
        offset = Duration.ofDays(amount);
        break;
      case 'w':
        offset = Duration.ofDays(Math.multiplyExact(amount, 7));
        break;
      case 'm':
        offset = Duration.ofDays(Math.multiplyExact(amount, DAYS_PER_MONTH));
        break;
      case 'y':
        offset = Duration.ofDays(Math.multiplyExact(amount, DAYS_PER_YEAR));
        break;
      default:
        return null;
      }
      return now.minus(offset);
    } catch (ArithmeticException | DateTimeException e) {
      return null; // out of range
    }
  }
}
