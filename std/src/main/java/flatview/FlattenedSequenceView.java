//
// Flatview - lazy flattened views over nested collections
//

package flatview;

import java.util.function.Consumer;

/**
 * A single-pass view of the concatenation of the iterables in some base iterable. Nothing is
 * copied: each call to {@link #iterator} walks the base afresh.
 *
 * <p>Use this view when the base can only be iterated; {@link FlattenedCollectionView} adds
 * positions for bases that are {@link Indexed}.</p>
 */
public class FlattenedSequenceView<E> implements Iterable<E> {

  public FlattenedSequenceView (Iterable<? extends Iterable<? extends E>> base) {
    if (base == null) throw new IllegalArgumentException("Base must not be null.");
    _base = base;
  }

  /** Returns the iterable of iterables this view flattens. */
  public Iterable<? extends Iterable<? extends E>> base () {
    return _base;
  }

  @Override public CompositeIterator<E> iterator () {
    return new CompositeIterator<E>(_base.iterator());
  }

  /** Always zero: a better estimate would require walking the inner iterables. */
  public int underestimatedCount () {
    return 0;
  }

  @Override public void forEach (Consumer<? super E> body) {
    for (Iterable<? extends E> inner : _base) inner.forEach(body);
  }

  /**
   * Applies {@code body} to every element in order. An exception thrown by {@code body} stops the
   * traversal and reaches the caller unchanged.
   */
  public <X extends Exception> void forEachChecked (ThrowingConsumer<? super E, X> body)
    throws X {
    for (Iterable<? extends E> inner : _base) {
      for (E elem : inner) body.accept(elem);
    }
  }

  @Override public String toString () {
    return Iterables.toString(this);
  }

  private final Iterable<? extends Iterable<? extends E>> _base;
}
