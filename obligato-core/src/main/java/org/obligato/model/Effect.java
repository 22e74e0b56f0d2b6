package org.obligato.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * A named computational effect, optionally carrying a payload type name (for example {@code IO}
 * or {@code State[Int]}).
 */
@Immutable
public final class Effect implements Comparable<Effect> {

  /** The payload type every payload is a subtype of. */
  public static final String TOP_PAYLOAD = "Any";

  /** The payload type that is a subtype of every payload. */
  public static final String BOTTOM_PAYLOAD = "Never";

  private final String name;
  private final Optional<String> payload;

  private Effect(String name, Optional<String> payload) {
    checkArgument(!name.isEmpty(), "empty effect name");
    this.name = name;
    this.payload = payload;
  }

  public static Effect of(String name) {
    return new Effect(name, Optional.empty());
  }

  public static Effect of(String name, String payload) {
    return new Effect(name, Optional.of(payload));
  }

  public String name() {
    return name;
  }

  public Optional<String> payload() {
    return payload;
  }

  /**
   * Returns true if this effect is covered by {@code other}. Effects are covariant in their
   * payload; an effect without a payload covers every payload of the same name.
   */
  public boolean isSubEffectOf(Effect other) {
    if (!name.equals(other.name)) {
      return false;
    }
    if (other.payload.isEmpty()) {
      return true;
    }
    if (payload.isEmpty()) {
      return false;
    }
    return isSubPayload(payload.get(), other.payload.get());
  }

  private static boolean isSubPayload(String sub, String sup) {
    return sub.equals(sup) || sup.equals(TOP_PAYLOAD) || sub.equals(BOTTOM_PAYLOAD);
  }

  @Override
  public int compareTo(Effect o) {
    return toString().compareTo(o.toString());
  }

  @Override
  public String toString() {
    return payload.map(p -> name + "[" + p + "]").orElse(name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, payload);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof Effect)) {
      return false;
    }
    Effect that = (Effect) obj;
    return name.equals(that.name) && payload.equals(that.payload);
  }
}
