//
// Flatview - lazy flattened views over nested collections
//

package flatview;

import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * An {@link Indexed} collection whose positions can also step backward.
 */
public interface BiIndexed<E, I extends Comparable<? super I>> extends Indexed<E, I> {

  /**
   * Returns the position immediately before {@code index}.
   * @throws IndexOutOfBoundsException if {@code index} is the start index.
   */
  I indexBefore (I index);

  /**
   * Returns the last element of this collection.
   * @throws NoSuchElementException if this collection is empty.
   */
  default E last () {
    if (isEmpty()) throw new NoSuchElementException("last() of empty collection");
    return at(indexBefore(endIndex()));
  }

  @Override default I offset (I index, int n) {
    if (n >= 0) return Indexed.super.offset(index, n);
    I cur = index;
    for (int ii = 0; ii > n; ii--) cur = indexBefore(cur);
    return cur;
  }

  @Override default Optional<I> offset (I index, int n, I limit) {
    if (n >= 0) return Indexed.super.offset(index, n, limit);
    I cur = index;
    for (int ii = 0; ii > n; ii--) {
      if (cur.equals(limit)) return Optional.empty();
      cur = indexBefore(cur);
    }
    return Optional.of(cur);
  }
}
