package nfa2dfa;

import java.util.Arrays;
import java.util.Collection;
import java.util.TreeSet;
import java.util.stream.IntStream;
import java.util.stream.Collectors;

/**
 * Immutable set of state indices.
 *
 * Indices point into the state arena of an {@link EpsilonNfa}. Elements are
 * kept sorted and distinct, so two sets built from the same indices in any
 * order are equal and hash the same.
 */
public final class StateSet {

  public static final StateSet EMPTY = new StateSet(new int[0]);

  // Sorted and distinct elements
  private final int[] elements;

  private StateSet(int[] sortedElements) {
    this.elements = sortedElements;
  }

  public static StateSet of(int... elems) {
    return new StateSet(Arrays.stream(elems).sorted().distinct().toArray());
  }

  public StateSet(Collection<Integer> elems) {
    this.elements = new TreeSet<Integer>(elems).stream().mapToInt((Integer i) -> i.intValue()).toArray();
  }

  public IntStream stream() {
    return Arrays.stream(elements);
  }

  public int size() {
    return elements.length;
  }

  public boolean isEmpty() {
    return elements.length == 0;
  }

  public boolean contains(int element) {
    return Arrays.binarySearch(elements, element) >= 0;
  }

  /**
   * Check whether every element of this set is also in another set.
   *
   * @param other candidate superset
   * @return whether this set is a subset of {@code other}
   */
  public boolean isSubsetOf(StateSet other) {
    return stream().allMatch(other::contains);
  }

  /**
   * Check whether this set shares at least one element with another set.
   *
   * @param other set to compare against
   * @return whether the intersection is non-empty
   */
  public boolean intersects(StateSet other) {
    int i = 0;
    int j = 0;
    while (i < elements.length && j < other.elements.length) {
      final int cmp = Integer.compare(elements[i], other.elements[j]);
      if (cmp == 0) {
        return true;
      } else if (cmp < 0) {
        i++;
      } else {
        j++;
      }
    }
    return false;
  }

  public StateSet union(StateSet other) {
    if (other.isEmpty()) {
      return this;
    } else if (isEmpty()) {
      return other;
    }
    return new StateSet(IntStream.concat(stream(), other.stream()).sorted().distinct().toArray());
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(elements);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof StateSet)) {
      return false;
    } else {
      return Arrays.equals(elements, ((StateSet) obj).elements);
    }
  }

  @Override
  public String toString() {
    return Arrays
      .stream(elements)
      .mapToObj(Integer::toString)
      .collect(Collectors.joining(",", "{", "}"));
  }
}
