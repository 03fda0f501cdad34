/**
 * cryostar: STAR metadata interchange for cryo-EM image processing.
 *
 * Copyright (C) 2015 The cryostar authors
 *
 * This file is part of cryostar.
 *
 * cryostar is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.cryostar.star;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Semantic type of a STAR column.
 * 
 * <p>
 * Values held in memory are always of the Java type of their {@link LabelType}: {@link Long} for {@link #INT},
 * {@link Double} for {@link #FLOAT}, {@link String} for {@link #STRING} and {@link Boolean} for {@link #BOOL} (which is
 * written as 0 or 1).
 */
public enum LabelType {
  INT(Long.class, 0L) {
    @Override
    public Object parse(String token) throws StarTypeException {
      if (!INT_PATTERN.matcher(token).matches())
        throw new StarTypeException("Value '" + token + "' is not an integer.");
      try {
        return Long.valueOf(token.startsWith("+") ? token.substring(1) : token);
      } catch (NumberFormatException e) {
        throw new StarTypeException("Value '" + token + "' is not a valid integer.", e);
      }
    }

    @Override
    public Object coerce(Object value) {
      if (value instanceof Long)
        return value;
      if (value instanceof Integer || value instanceof Short || value instanceof Byte)
        return ((Number) value).longValue();
      if (value instanceof Number) {
        double d = ((Number) value).doubleValue();
        if (d == Math.rint(d) && !Double.isInfinite(d))
          return (long) d;
      }
      if (value instanceof Boolean)
        return ((Boolean) value) ? 1L : 0L;
      if (value instanceof String)
        return parseUnchecked(this, (String) value);
      throw new IllegalArgumentException("Cannot use '" + value + "' as integer value.");
    }
  },

  FLOAT(Double.class, 0.) {
    @Override
    public Object parse(String token) throws StarTypeException {
      String lower = token.toLowerCase();
      if (lower.equals("nan"))
        return Double.NaN;
      if (lower.equals("inf") || lower.equals("+inf") || lower.equals("infinity"))
        return Double.POSITIVE_INFINITY;
      if (lower.equals("-inf") || lower.equals("-infinity"))
        return Double.NEGATIVE_INFINITY;
      if (!FLOAT_PATTERN.matcher(token).matches())
        throw new StarTypeException("Value '" + token + "' is not a floating point number.");
      return Double.valueOf(token);
    }

    @Override
    public Object coerce(Object value) {
      if (value instanceof Double)
        return value;
      if (value instanceof Number)
        return ((Number) value).doubleValue();
      if (value instanceof String)
        return parseUnchecked(this, (String) value);
      throw new IllegalArgumentException("Cannot use '" + value + "' as floating point value.");
    }
  },

  STRING(String.class, LabelType.MISSING_STRING) {
    @Override
    public Object parse(String token) {
      return token;
    }

    @Override
    public Object coerce(Object value) {
      if (value instanceof String)
        return value;
      return LabelType.format(value);
    }
  },

  BOOL(Boolean.class, Boolean.FALSE) {
    @Override
    public Object parse(String token) throws StarTypeException {
      switch (token) {
      case "0":
        return Boolean.FALSE;
      case "1":
        return Boolean.TRUE;
      default:
        throw new StarTypeException("Value '" + token + "' is not a boolean (0 or 1).");
      }
    }

    @Override
    public Object coerce(Object value) {
      if (value instanceof Boolean)
        return value;
      if (value instanceof Number) {
        double d = ((Number) value).doubleValue();
        if (d == 0.)
          return Boolean.FALSE;
        if (d == 1.)
          return Boolean.TRUE;
      }
      if (value instanceof String)
        return parseUnchecked(this, (String) value);
      throw new IllegalArgumentException("Cannot use '" + value + "' as boolean value.");
    }
  };

  private static final Pattern INT_PATTERN = Pattern.compile("[+-]?[0-9]+");
  private static final Pattern FLOAT_PATTERN =
      Pattern.compile("[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");

  /** Plain (non-scientific) notation is used for absolute values in [PLAIN_MIN, PLAIN_MAX). */
  private static final double PLAIN_MIN = 1e-6;
  private static final double PLAIN_MAX = 1e12;

  /** Written for string cells that have no value. */
  public static final String MISSING_STRING = "None";

  private final Class<?> javaType;
  private final Object fillValue;

  private LabelType(Class<?> javaType, Object fillValue) {
    this.javaType = javaType;
    this.fillValue = fillValue;
  }

  /**
   * @return The Java type of in-memory values of this type.
   */
  public Class<?> getJavaType() {
    return javaType;
  }

  /**
   * @return The value written to cells of this type for which a row has no value: 0, 0.0, false or
   *         {@link #MISSING_STRING}.
   */
  public Object getFillValue() {
    return fillValue;
  }

  /**
   * @return true if the value is the {@link #MISSING_STRING} placeholder.
   */
  public static boolean isMissingString(Object value) {
    return MISSING_STRING.equals(value);
  }

  /**
   * Parse a token of a STAR file.
   * 
   * @throws StarTypeException
   *           If the token is not valid for this type. No coercion is done, e.g. "1.5" is no valid {@link #INT}.
   */
  public abstract Object parse(String token) throws StarTypeException;

  /**
   * Convert a Java value into the in-memory representation of this type.
   * 
   * @throws IllegalArgumentException
   *           If the value cannot be represented without losing information.
   */
  public abstract Object coerce(Object value) throws IllegalArgumentException;

  /**
   * Format an in-memory value into a STAR token (without any quoting).
   * 
   * <p>
   * Floating point values are formatted in the shortest decimal representation that parses to the same double again.
   */
  public static String format(Object value) {
    if (value == null)
      throw new IllegalArgumentException("Cannot format null value.");
    if (value instanceof Boolean)
      return ((Boolean) value) ? "1" : "0";
    if (value instanceof Double || value instanceof Float)
      return formatDouble(((Number) value).doubleValue());
    return value.toString();
  }

  private static String formatDouble(double d) {
    if (Double.isNaN(d))
      return "nan";
    if (Double.isInfinite(d))
      return d > 0 ? "inf" : "-inf";
    double abs = Math.abs(d);
    if (abs == 0. || (abs >= PLAIN_MIN && abs < PLAIN_MAX)) {
      String res = BigDecimal.valueOf(d).toPlainString();
      // "-0.0" would otherwise be written as "0.0"
      if (d == 0. && 1. / d < 0)
        return "-0.0";
      return res;
    }
    return Double.toString(d);
  }

  private static Object parseUnchecked(LabelType type, String token) {
    try {
      return type.parse(token);
    } catch (StarTypeException e) {
      throw new IllegalArgumentException(e.getMessage(), e);
    }
  }
}
