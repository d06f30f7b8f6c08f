//
// Flatview - lazy flattened views over nested collections
//

package flatview;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Iterates over the elements of each iterable produced by an outer iterator, in turn. Inner
 * iterators are created only as they are reached, and empty inner iterables are skipped.
 *
 * <p>Once the outer iterator reports no further elements, this iterator is exhausted for good: the
 * outer iterator is released and never consulted again.</p>
 *
 * <p>Separate iterators obtained from the same view enumerate independently. A single iterator
 * must not be advanced from more than one thread.</p>
 */
public class CompositeIterator<E> extends Iterables.ImmIterator<E> {

  /** Creates an iterator over the concatenation of the iterables yielded by {@code outer}. */
  public CompositeIterator (Iterator<? extends Iterable<? extends E>> outer) {
    if (outer == null) throw new IllegalArgumentException("Outer iterator must not be null.");
    _outer = outer;
  }

  @Override public boolean hasNext () {
    while (true) {
      if (_inner != null) {
        if (_inner.hasNext()) return true;
        _inner = null;
      }
      if (_outer == null) return false;
      if (!_outer.hasNext()) {
        _outer = null;
        return false;
      }
      _inner = _outer.next().iterator();
    }
  }

  @Override public E next () {
    if (!hasNext()) throw new NoSuchElementException();
    return _inner.next();
  }

  /**
   * Advances to the next element and returns it, or returns empty if there are no more elements.
   * Unlike {@link #next}, a {@code null} element is consumed and reported as empty, which is
   * indistinguishable from exhaustion; use {@link #hasNext} and {@link #next} to iterate over
   * collections that contain nulls.
   */
  public Optional<E> poll () {
    if (!hasNext()) return Optional.empty();
    E elem = _inner.next();
    return Optional.ofNullable(elem);
  }

  /** Returns true once this iterator has been found to be exhausted. */
  public boolean isExhausted () {
    return _outer == null;
  }

  private Iterator<? extends Iterable<? extends E>> _outer;
  private Iterator<? extends E> _inner;
}
