package org.obligato.binder;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.Immutable;
import org.obligato.type.Type;

/**
 * The bindings and facts an obligation may use, frozen at the obligation's site.
 *
 * <p>{@link #termTypes} gives the base type of every compound term (field access, call, element
 * access) that occurs in the goal or the facts, keyed by its canonical text, so that a solver
 * can choose a sort for it without re-typing the program.
 */
@Immutable
public final class ContextSnapshot {

  public static final ContextSnapshot EMPTY =
      new ContextSnapshot(ImmutableList.of(), ImmutableList.of(), ImmutableMap.of());

  private final ImmutableList<Binding> bindings;

  private final ImmutableList<Fact> facts;

  private final ImmutableMap<String, Type> termTypes;

  public ContextSnapshot(
      ImmutableList<Binding> bindings,
      ImmutableList<Fact> facts,
      ImmutableMap<String, Type> termTypes) {
    this.bindings = bindings;
    this.facts = facts;
    this.termTypes = termTypes;
  }

  public ImmutableList<Binding> bindings() {
    return bindings;
  }

  public ImmutableList<Fact> facts() {
    return facts;
  }

  public ImmutableMap<String, Type> termTypes() {
    return termTypes;
  }

  /** The facts' canonical texts, in order. */
  public ImmutableList<String> factTexts() {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (Fact fact : facts) {
      result.add(fact.text());
    }
    return result.build();
  }

  @Override
  public String toString() {
    return "bindings=" + bindings + ", facts=" + facts;
  }
}
