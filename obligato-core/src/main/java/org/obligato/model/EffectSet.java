package org.obligato.model;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSortedSet;
import com.google.errorprone.annotations.Immutable;
import java.util.Collection;
import org.jspecify.annotations.Nullable;

/** An immutable, canonically ordered set of effects. The empty set is the pure computation. */
@Immutable
public final class EffectSet {

  public static final EffectSet PURE = new EffectSet(ImmutableSortedSet.of());

  private final ImmutableSortedSet<Effect> effects;

  private EffectSet(ImmutableSortedSet<Effect> effects) {
    this.effects = effects;
  }

  public static EffectSet of(Effect... effects) {
    return new EffectSet(ImmutableSortedSet.copyOf(effects));
  }

  public static EffectSet copyOf(Collection<Effect> effects) {
    return new EffectSet(ImmutableSortedSet.copyOf(effects));
  }

  public ImmutableSortedSet<Effect> effects() {
    return effects;
  }

  public boolean isPure() {
    return effects.isEmpty();
  }

  /** Returns true if every effect in this set is covered by some effect of {@code allowed}. */
  public boolean isSubsetOf(EffectSet allowed) {
    return missingFrom(allowed).isPure();
  }

  /** The effects of this set that {@code allowed} does not cover. */
  public EffectSet missingFrom(EffectSet allowed) {
    ImmutableSortedSet.Builder<Effect> missing = ImmutableSortedSet.naturalOrder();
    for (Effect e : effects) {
      boolean covered = false;
      for (Effect a : allowed.effects) {
        if (e.isSubEffectOf(a)) {
          covered = true;
          break;
        }
      }
      if (!covered) {
        missing.add(e);
      }
    }
    return new EffectSet(missing.build());
  }

  public EffectSet union(EffectSet other) {
    return new EffectSet(
        ImmutableSortedSet.<Effect>naturalOrder().addAll(effects).addAll(other.effects).build());
  }

  public int size() {
    return effects.size();
  }

  @Override
  public String toString() {
    return "{" + Joiner.on(", ").join(effects) + "}";
  }

  @Override
  public int hashCode() {
    return effects.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return obj instanceof EffectSet && effects.equals(((EffectSet) obj).effects);
  }
}
