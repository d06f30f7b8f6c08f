//
// Flatview - lazy flattened views over nested collections
//

package flatview;

import java.util.Optional;

/**
 * An immutable, random access sequence. Positions are the ints {@code 0} through {@code size()},
 * so every offset and distance is computed in constant time.
 */
public interface Seq<E> extends Countable<E>, BiIndexed<E, Integer> {

  /**
   * Returns the element at {@code index}.
   * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0,size)}.
   */
  E get (int index);

  @Override default Integer startIndex () { return 0; }
  @Override default Integer endIndex () { return size(); }

  @Override default Integer indexAfter (Integer index) {
    Indexes.checkIndex(index, size());
    return index + 1;
  }

  @Override default Integer indexBefore (Integer index) {
    Indexes.checkIndex(index - 1, size());
    return index - 1;
  }

  @Override default E at (Integer index) { return get(index); }

  @Override default boolean isEmpty () { return size() == 0; }
  @Override default int count () { return size(); }
  @Override default int underestimatedCount () { return size(); }

  @Override default int distance (Integer from, Integer to) {
    Indexes.checkPosition(from, size());
    Indexes.checkPosition(to, size());
    return to - from;
  }

  @Override default Integer offset (Integer index, int n) {
    int target = index + n;
    Indexes.checkPosition(target, size());
    return target;
  }

  @Override default Optional<Integer> offset (Integer index, int n, Integer limit) {
    int toLimit = limit - index;
    boolean hitsLimit = (n > 0) ? (toLimit >= 0 && toLimit < n) : (toLimit <= 0 && toLimit > n);
    return hitsLimit ? Optional.empty() : Optional.of(offset(index, n));
  }
}
