package org.obligato.extract;

import com.google.auto.value.AutoValue;
import org.obligato.tree.NodeId;
import org.obligato.type.Type;

/** An open {@code ?name} hole and the type of value expected in its place. */
@AutoValue
public abstract class TypedHole {

  /** The hole's node id, which is also its id. */
  public abstract NodeId id();

  public abstract String name();

  public abstract Type expectedType();

  static TypedHole create(NodeId id, String name, Type expectedType) {
    return new AutoValue_TypedHole(id, name, expectedType);
  }
}
