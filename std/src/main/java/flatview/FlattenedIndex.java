//
// Flatview - lazy flattened views over nested collections
//

package flatview;

import java.util.Objects;
import java.util.Optional;

/**
 * A position in a {@link FlattenedCollectionView}. Either an {@link AtElement}, which names an
 * outer position and a dereferenceable position within the inner collection found there, or the
 * single {@link PastEnd} position, whose outer position is the end index of the base.
 *
 * <p>Positions are ordered by outer position, then by inner position. The past-the-end position
 * shares its outer position with no element position, so comparing a {@code PastEnd} against an
 * {@code AtElement} at the same outer position means one of them did not come from the view that
 * is comparing them.</p>
 */
public abstract class FlattenedIndex<O extends Comparable<? super O>,
                                     I extends Comparable<? super I>>
  implements Comparable<FlattenedIndex<O, I>> {

  /** The position of an element: {@code inner} within the inner collection at {@code outer}. */
  public static final class AtElement<O extends Comparable<? super O>,
                                      I extends Comparable<? super I>>
    extends FlattenedIndex<O, I> {

    /** Returns the position within the inner collection. */
    public I innerIndex () { return inner; }

    @Override public Optional<I> inner () { return Optional.of(inner); }
    @Override public boolean isPastEnd () { return false; }

    @Override public String toString () { return "(" + outer() + ", " + inner + ")"; }

    private AtElement (O outer, I inner) {
      super(outer);
      if (inner == null) throw new IllegalArgumentException("Inner index must not be null.");
      this.inner = inner;
    }

    private final I inner;
  }

  /** The past-the-end position of a flattened view. */
  public static final class PastEnd<O extends Comparable<? super O>,
                                    I extends Comparable<? super I>>
    extends FlattenedIndex<O, I> {

    @Override public Optional<I> inner () { return Optional.empty(); }
    @Override public boolean isPastEnd () { return true; }

    @Override public String toString () { return "(" + outer() + ", end)"; }

    private PastEnd (O outer) {
      super(outer);
    }
  }

  /** Returns the position of the element at {@code inner} in the inner collection at
    * {@code outer}. */
  public static <O extends Comparable<? super O>, I extends Comparable<? super I>>
  FlattenedIndex<O, I> at (O outer, I inner) {
    return new AtElement<O, I>(outer, inner);
  }

  /**
   * Returns the past-the-end position for a base whose end index is {@code baseEnd}. Only a view
   * mints these, from its base's end index; any other outer position would name a past-the-end
   * position that no view produces.
   */
  static <O extends Comparable<? super O>, I extends Comparable<? super I>>
  FlattenedIndex<O, I> pastEnd (O baseEnd) {
    return new PastEnd<O, I>(baseEnd);
  }

  /** Returns the position in the outer collection. */
  public O outer () { return outer; }

  /** Returns the position in the inner collection, or empty if this is the past-the-end
    * position. */
  public abstract Optional<I> inner ();

  /** Returns true if this is the past-the-end position. */
  public abstract boolean isPastEnd ();

  /**
   * @throws IllegalStateException if this and {@code other} share an outer position but only one
   * of them is past the end.
   */
  @Override public int compareTo (FlattenedIndex<O, I> other) {
    int cmp = outer.compareTo(other.outer);
    if (cmp != 0) return cmp;
    if (isPastEnd() && other.isPastEnd()) return 0;
    if (isPastEnd() || other.isPastEnd()) throw new IllegalStateException(
      "Inconsistent positions at outer " + outer + ": " + this + " vs " + other);
    return ((AtElement<O, I>)this).inner.compareTo(((AtElement<O, I>)other).inner);
  }

  @Override public boolean equals (Object other) {
    if (other == this) return true;
    if (!(other instanceof FlattenedIndex)) return false;
    FlattenedIndex<?, ?> oidx = (FlattenedIndex<?, ?>)other;
    return outer.equals(oidx.outer) && inner().equals(oidx.inner());
  }

  @Override public int hashCode () {
    return 31 * outer.hashCode() + Objects.hashCode(inner().orElse(null));
  }

  private FlattenedIndex (O outer) {
    if (outer == null) throw new IllegalArgumentException("Outer index must not be null.");
    this.outer = outer;
  }

  private final O outer;
}
