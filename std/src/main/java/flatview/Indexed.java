//
// Flatview - lazy flattened views over nested collections
//

package flatview;

import java.util.Optional;

/**
 * A multi-pass collection whose elements are addressed by positions of type {@code I}. Valid
 * positions run from {@link #startIndex} to {@link #endIndex}, which is one past the last element
 * and cannot be dereferenced. Positions only move forward; see {@link BiIndexed} for collections
 * that can also step backward.
 */
public interface Indexed<E, I extends Comparable<? super I>> extends Iterable<E> {

  /** Returns the position of the first element, or {@link #endIndex} if this is empty. */
  I startIndex ();

  /** Returns the past-the-end position. */
  I endIndex ();

  /**
   * Returns the position immediately after {@code index}.
   * @throws IndexOutOfBoundsException if {@code index} is the end index.
   */
  I indexAfter (I index);

  /**
   * Returns the element at {@code index}.
   * @throws IndexOutOfBoundsException if {@code index} is the end index.
   */
  E at (I index);

  /** Returns true if this collection has no elements. */
  default boolean isEmpty () {
    return startIndex().equals(endIndex());
  }

  /** Returns the number of elements. Walks the whole collection unless overridden. */
  default int count () {
    return distance(startIndex(), endIndex());
  }

  /** Returns a lower bound on the number of elements, computed without walking them where that
    * would be costly. */
  default int underestimatedCount () {
    return count();
  }

  /**
   * Returns the number of steps from {@code from} to {@code to}, negative if {@code to} precedes
   * {@code from}.
   */
  default int distance (I from, I to) {
    I cur = from, end = to;
    int step = 1;
    if (from.compareTo(to) > 0) {
      cur = to;
      end = from;
      step = -1;
    }
    int count = 0;
    while (!cur.equals(end)) {
      count += step;
      cur = indexAfter(cur);
    }
    return count;
  }

  /**
   * Returns the position {@code n} steps from {@code index}.
   * @throws UnsupportedOperationException if {@code n} is negative; this collection is
   * forward-only.
   */
  default I offset (I index, int n) {
    if (n < 0) throw Indexes.backwardUnsupported(this);
    I cur = index;
    for (int ii = 0; ii < n; ii++) cur = indexAfter(cur);
    return cur;
  }

  /**
   * Returns the position {@code n} steps from {@code index}, or empty if {@code limit} is reached
   * before all {@code n} steps are taken. Landing exactly on {@code limit} with the last step
   * counts as success.
   * @throws UnsupportedOperationException if {@code n} is negative; this collection is
   * forward-only.
   */
  default Optional<I> offset (I index, int n, I limit) {
    if (n < 0) throw Indexes.backwardUnsupported(this);
    I cur = index;
    for (int ii = 0; ii < n; ii++) {
      if (cur.equals(limit)) return Optional.empty();
      cur = indexAfter(cur);
    }
    return Optional.of(cur);
  }

  /**
   * Like {@link #offset(Comparable,int,Comparable)} but reports where the walk stopped: the
   * advanced position if all {@code n} steps were taken, {@code limit} otherwise.
   */
  default Offset<I> formOffset (I index, int n, I limit) {
    Optional<I> moved = offset(index, n, limit);
    return moved.isPresent() ? Offset.completed(moved.get()) : Offset.limited(limit);
  }
}
