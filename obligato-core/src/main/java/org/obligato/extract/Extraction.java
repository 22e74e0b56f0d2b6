package org.obligato.extract;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** The obligations and holes found in one pass, in pre-order. */
@AutoValue
public abstract class Extraction {

  public abstract ImmutableList<Obligation> obligations();

  public abstract ImmutableList<TypedHole> holes();

  static Extraction create(ImmutableList<Obligation> obligations, ImmutableList<TypedHole> holes) {
    return new AutoValue_Extraction(obligations, holes);
  }
}
