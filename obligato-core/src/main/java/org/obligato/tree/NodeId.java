package org.obligato.tree;

import static com.google.common.base.Preconditions.checkArgument;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/**
 * A stable node identity, unique within a compilation session.
 *
 * <p>Ids are pure functions of structural position: the id of a node is derived from its
 * parent's id, the slot it occupies and its index in that slot (or, for the root, from the
 * session seed). Nodes introduced by a patch derive their id from the patch target instead, so
 * re-applying the same patch re-creates the same ids.
 */
@Immutable
public final class NodeId implements Comparable<NodeId> {

  /** The id of a detached node that has not been placed in an {@link Ast} yet. */
  public static final NodeId UNASSIGNED = new NodeId("");

  private final String value;

  private NodeId(String value) {
    this.value = value;
  }

  /** Parses an id previously produced by {@link #toString()}. */
  public static NodeId parse(String value) {
    checkArgument(!value.isEmpty(), "empty node id");
    return new NodeId(value);
  }

  /** The id of the root of a compilation unit in the given session. */
  public static NodeId root(String seed) {
    return new NodeId(fingerprint(h -> h.putString("root", UTF_8).putString(seed, UTF_8)));
  }

  /** Derives the id of the {@code index}th child in {@code slot} of {@code parent}. */
  public static NodeId derive(NodeId parent, String slot, int index) {
    checkArgument(parent.isAssigned(), "cannot derive from an unassigned id");
    return new NodeId(
        fingerprint(
            h ->
                h.putString(parent.value, UTF_8)
                    .putChar('/')
                    .putString(slot, UTF_8)
                    .putChar('#')
                    .putInt(index)));
  }

  /** Disambiguates a colliding derived id with a session-scoped counter. */
  NodeId withCollisionCounter(int counter) {
    return new NodeId(value + "~" + counter);
  }

  private interface HashInput {
    Hasher feed(Hasher hasher);
  }

  private static String fingerprint(HashInput input) {
    long hash = input.feed(Hashing.farmHashFingerprint64().newHasher()).hash().asLong();
    return "n" + String.format("%016x", hash);
  }

  public boolean isAssigned() {
    return !value.isEmpty();
  }

  @Override
  public int compareTo(NodeId o) {
    return value.compareTo(o.value);
  }

  @Override
  public String toString() {
    return isAssigned() ? value : "<unassigned>";
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return obj instanceof NodeId && value.equals(((NodeId) obj).value);
  }
}
