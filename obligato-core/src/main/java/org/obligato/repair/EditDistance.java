package org.obligato.repair;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Edit distance counting insertions and deletions only; replacing a character costs two. With
 * this metric {@code helo} is one edit from {@code hello} and two from {@code help}.
 */
public final class EditDistance {

  public static int distance(String a, String b) {
    int[] previous = new int[b.length() + 1];
    int[] current = new int[b.length() + 1];
    for (int j = 0; j <= b.length(); j++) {
      previous[j] = j;
    }
    for (int i = 1; i <= a.length(); i++) {
      current[0] = i;
      for (int j = 1; j <= b.length(); j++) {
        if (a.charAt(i - 1) == b.charAt(j - 1)) {
          current[j] = previous[j - 1];
        } else {
          current[j] = Math.min(previous[j], current[j - 1]) + 1;
        }
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[b.length()];
  }

  /** A name within reach of a misspelling. */
  public static final class Suggestion {
    private final String name;
    private final int distance;

    Suggestion(String name, int distance) {
      this.name = name;
      this.distance = distance;
    }

    public String name() {
      return name;
    }

    public int distance() {
      return distance;
    }

    @Override
    public String toString() {
      return name + "(" + distance + ")";
    }
  }

  /**
   * The candidates at most {@code maxDistance} edits from {@code name}, nearest first and then by
   * name, at most {@code limit} of them. The name itself is never suggested.
   */
  public static ImmutableList<Suggestion> suggest(
      String name, Iterable<String> candidates, int maxDistance, int limit) {
    List<Suggestion> result = new ArrayList<>();
    for (String candidate : candidates) {
      if (candidate.isEmpty() || candidate.equals(name)) {
        continue;
      }
      int d = distance(name, candidate);
      if (d <= maxDistance) {
        result.add(new Suggestion(candidate, d));
      }
    }
    result.sort(
        Comparator.comparingInt(Suggestion::distance).thenComparing(Suggestion::name));
    return ImmutableList.copyOf(result.subList(0, Math.min(limit, result.size())));
  }

  private EditDistance() {}
}
