//
// Flatview - lazy flattened views over nested collections
//

package flatview;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * A multi-pass view of the concatenation of the inner collections of an {@link Indexed} base.
 * Positions are {@link FlattenedIndex}es pairing an outer position in the base with an inner
 * position in the collection found there. Nothing is copied; every element read goes through the
 * base.
 *
 * <p>The cost of {@link #startIndex} and of {@link #indexAfter} grows with the number of empty
 * inner collections that must be skipped, so neither is constant time in general. {@link #distance}
 * and the offset methods walk one element at a time.</p>
 *
 * <p>Backward offsets are accepted only if the base and its inner collections can actually step
 * backward; the base is probed before the first backward step, and a forward-only base fails with
 * {@link UnsupportedOperationException}. Use {@link BidirectionalFlattenedCollectionView} when both
 * levels are statically known to be {@link BiIndexed}.</p>
 */
public class FlattenedCollectionView<E, O extends Comparable<? super O>,
                                     I extends Comparable<? super I>>
  implements Indexed<E, FlattenedIndex<O, I>> {

  public FlattenedCollectionView (Indexed<? extends Indexed<E, I>, O> base) {
    if (base == null) throw new IllegalArgumentException("Base must not be null.");
    _base = base;
  }

  /** Returns the collection of collections this view flattens. */
  public Indexed<? extends Indexed<E, I>, O> base () {
    return _base;
  }

  @Override public FlattenedIndex<O, I> startIndex () {
    return firstElementFrom(_base.startIndex());
  }

  @Override public FlattenedIndex<O, I> endIndex () {
    return FlattenedIndex.pastEnd(_base.endIndex());
  }

  @Override public FlattenedIndex<O, I> indexAfter (FlattenedIndex<O, I> index) {
    I inner = innerIndex(index, "advance past the end");
    Indexed<E, I> innerColl = _base.at(index.outer());
    I nextInner = innerColl.indexAfter(inner);
    if (!nextInner.equals(innerColl.endIndex())) return FlattenedIndex.at(index.outer(), nextInner);
    return firstElementFrom(_base.indexAfter(index.outer()));
  }

  /**
   * @throws IndexOutOfBoundsException if {@code index} is the end index.
   */
  @Override public E at (FlattenedIndex<O, I> index) {
    I inner = innerIndex(index, "read an element");
    return _base.at(index.outer()).at(inner);
  }

  /** Always zero: a better estimate would require counting every inner collection. */
  @Override public int underestimatedCount () {
    return 0;
  }

  @Override public FlattenedIndex<O, I> offset (FlattenedIndex<O, I> index, int n) {
    int step = Integer.signum(n);
    ensureBidirectional(step);
    FlattenedIndex<O, I> cur = index;
    // counts toward zero so that Integer.MIN_VALUE walks rather than overflowing
    for (int ii = n; ii != 0; ii -= step) cur = advance(cur, step);
    return cur;
  }

  @Override public Optional<FlattenedIndex<O, I>> offset (
    FlattenedIndex<O, I> index, int n, FlattenedIndex<O, I> limit) {
    int step = Integer.signum(n);
    ensureBidirectional(step);
    FlattenedIndex<O, I> cur = index;
    for (int ii = n; ii != 0; ii -= step) {
      if (cur.equals(limit)) return Optional.empty();
      cur = advance(cur, step);
    }
    return Optional.of(cur);
  }

  @Override public CompositeIterator<E> iterator () {
    return new CompositeIterator<E>(_base.iterator());
  }

  /**
   * Applies {@code body} to every element in order, handing each inner collection its own
   * traversal rather than building a position per element.
   */
  @Override public void forEach (Consumer<? super E> body) {
    for (Indexed<E, I> inner : _base) inner.forEach(body);
  }

  /**
   * Like {@link #forEach} for a {@code body} that may throw a checked exception. The exception
   * stops the traversal and reaches the caller unchanged.
   */
  public <X extends Exception> void forEachChecked (ThrowingConsumer<? super E, X> body)
    throws X {
    for (Indexed<E, I> inner : _base) {
      for (E elem : inner) body.accept(elem);
    }
  }

  @Override public String toString () {
    return Iterables.toString(this);
  }

  /**
   * Returns the position just before {@code index}, skipping back over empty inner collections.
   * @throws IndexOutOfBoundsException if {@code index} is the start index.
   * @throws UnsupportedOperationException if the base or an inner collection is forward-only.
   */
  protected FlattenedIndex<O, I> stepBack (FlattenedIndex<O, I> index) {
    O outer = index.outer();
    if (index.isPastEnd()) outer = outerBefore(outer);
    Indexed<E, I> innerColl = _base.at(outer);
    I inner = index.isPastEnd() ? innerColl.endIndex() : innerIndex(index, "step back");
    while (inner.equals(innerColl.startIndex())) {
      outer = outerBefore(outer);
      innerColl = _base.at(outer);
      inner = innerColl.endIndex();
    }
    return FlattenedIndex.at(outer, innerColl.offset(inner, -1));
  }

  private FlattenedIndex<O, I> advance (FlattenedIndex<O, I> index, int step) {
    return (step < 0) ? stepBack(index) : indexAfter(index);
  }

  // returns the first element position at or after outer, or the end index
  private FlattenedIndex<O, I> firstElementFrom (O outer) {
    O end = _base.endIndex();
    for (O cur = outer; !cur.equals(end); cur = _base.indexAfter(cur)) {
      Indexed<E, I> inner = _base.at(cur);
      if (!inner.isEmpty()) return FlattenedIndex.at(cur, inner.startIndex());
    }
    return endIndex();
  }

  private O outerBefore (O outer) {
    if (outer.equals(_base.startIndex())) throw new IndexOutOfBoundsException(
      "Cannot step before the start of " + getClass().getSimpleName());
    return _base.offset(outer, -1);
  }

  private void ensureBidirectional (int step) {
    // a forward-only base rejects this bounded backward offset without walking anything
    if (step < 0) _base.offset(_base.endIndex(), step, _base.startIndex());
  }

  private static <I extends Comparable<? super I>> I innerIndex (
    FlattenedIndex<?, I> index, String action) {
    Optional<I> inner = index.inner();
    if (!inner.isPresent()) throw new IndexOutOfBoundsException(
      "Cannot " + action + " at end index " + index);
    return inner.get();
  }

  private final Indexed<? extends Indexed<E, I>, O> _base;
}
