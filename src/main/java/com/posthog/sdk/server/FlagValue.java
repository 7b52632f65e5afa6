package com.posthog.sdk.server;

import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.Objects;

/**
 * The result of evaluating a feature flag: either a boolean, or the key of a variant of a
 * multivariate flag.
 * <p>
 * In JSON a value is written without a type tag, as {@code true}/{@code false} or as a string.
 */
@JsonAdapter(FlagValue.FlagValueTypeAdapter.class)
public final class FlagValue {
  /**
   * Distinguishes the two kinds of {@link FlagValue}.
   */
  public enum Type {
    /** The flag is simply on or off. */
    BOOLEAN,
    /** The flag resolved to a variant key. */
    VARIANT
  }

  private static final FlagValue TRUE = new FlagValue(Type.BOOLEAN, true, null);
  private static final FlagValue FALSE = new FlagValue(Type.BOOLEAN, false, null);

  private final Type type;
  private final boolean booleanValue;
  private final String variant;

  private FlagValue(Type type, boolean booleanValue, String variant) {
    this.type = type;
    this.booleanValue = booleanValue;
    this.variant = variant;
  }

  /**
   * Returns a boolean value.
   *
   * @param value true or false
   * @return a flag value
   */
  public static FlagValue ofBoolean(boolean value) {
    return value ? TRUE : FALSE;
  }

  /**
   * Returns a variant value.
   *
   * @param variant the variant key; must not be null
   * @return a flag value
   */
  public static FlagValue ofVariant(String variant) {
    return new FlagValue(Type.VARIANT, false, Objects.requireNonNull(variant, "variant"));
  }

  public Type getType() {
    return type;
  }

  /**
   * Returns the boolean value, or false for a variant.
   *
   * @return the boolean value
   */
  public boolean booleanValue() {
    return booleanValue;
  }

  /**
   * Returns the variant key, or null for a boolean value.
   *
   * @return the variant key
   */
  public String getVariant() {
    return variant;
  }

  /**
   * True if the flag counts as enabled: boolean {@code true}, or any variant.
   *
   * @return true if enabled
   */
  public boolean isEnabled() {
    return type == Type.VARIANT || booleanValue;
  }

  /**
   * Returns the value as a JSON primitive.
   *
   * @return a JSON boolean or string
   */
  public JsonPrimitive toJson() {
    return type == Type.VARIANT ? new JsonPrimitive(variant) : new JsonPrimitive(booleanValue);
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof FlagValue) {
      FlagValue o = (FlagValue)other;
      return type == o.type && booleanValue == o.booleanValue && Objects.equals(variant, o.variant);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, booleanValue, variant);
  }

  @Override
  public String toString() {
    return type == Type.VARIANT ? variant : String.valueOf(booleanValue);
  }

  static final class FlagValueTypeAdapter extends TypeAdapter<FlagValue> {
    @Override
    public void write(JsonWriter out, FlagValue value) throws IOException {
      if (value == null) {
        out.nullValue();
      } else if (value.type == Type.VARIANT) {
        out.value(value.variant);
      } else {
        out.value(value.booleanValue);
      }
    }

    @Override
    public FlagValue read(JsonReader in) throws IOException {
      JsonToken token = in.peek();
      switch (token) {
      case NULL:
        in.nextNull();
        return null;
      case BOOLEAN:
        return ofBoolean(in.nextBoolean());
      case STRING:
        return ofVariant(in.nextString());
      default:
        throw new IOException("expected a boolean or a string for a flag value, got " + token);
      }
    }
  }
}
