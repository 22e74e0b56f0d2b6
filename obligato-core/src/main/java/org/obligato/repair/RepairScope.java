package org.obligato.repair;

import com.google.auto.value.AutoValue;

/** The extent of the tree a repair touches. */
@AutoValue
public abstract class RepairScope {

  /** The number of existing nodes the edits replace, wrap or delete, plus the nodes they add. */
  public abstract int nodeCount();

  /** Whether the edits reach outside the function containing the target. */
  public abstract boolean crossesFunction();

  public static RepairScope create(int nodeCount, boolean crossesFunction) {
    return new AutoValue_RepairScope(nodeCount, crossesFunction);
  }
}
