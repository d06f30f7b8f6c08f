//
// Flatview - lazy flattened views over nested collections
//

package flatview;

/**
 * A simple functional list class, built from cons cells as God and John McCarthy intended.
 *
 * <p>A list is a forward-only {@link Indexed} collection: its positions are {@link Cursor}s that
 * can only move toward the tail.</p>
 */
public interface List<E> extends Countable<E>, Indexed<E, List.Cursor<E>> {

  /**
   * A position in a list: the ordinal of an element together with the sublist that starts there.
   * The end cursor holds the {@code nil} list; all end cursors are equal and order after every
   * other cursor.
   */
  final class Cursor<E> implements Comparable<Cursor<E>> {

    Cursor (int ordinal, List<E> rest) {
      this.ordinal = ordinal;
      this.rest = rest;
    }

    /** Returns true if this cursor is past the end of its list. */
    public boolean isEnd () {
      return rest == Data.<E>nil();
    }

    @Override public int compareTo (Cursor<E> other) {
      if (isEnd()) return other.isEnd() ? 0 : 1;
      if (other.isEnd()) return -1;
      return Integer.compare(ordinal, other.ordinal);
    }

    @Override public boolean equals (Object other) {
      if (!(other instanceof Cursor)) return false;
      Cursor<?> oc = (Cursor<?>)other;
      return isEnd() ? oc.isEnd() : (!oc.isEnd() && ordinal == oc.ordinal);
    }

    @Override public int hashCode () {
      return isEnd() ? -1 : ordinal;
    }

    @Override public String toString () {
      return isEnd() ? "end" : ("@" + ordinal);
    }

    final int ordinal;
    final List<E> rest;
  }

  /**
   * Returns the head of this list.
   * @throws NoSuchElementException if called on the {@code nil} list.
   */
  E head ();

  /**
   * Returns the tail of this list.
   * @throws NoSuchElementException if called on the {@code nil} list.
   */
  List<E> tail ();

  /**
   * Returns a new list with {@code elem} consed onto its head. Note: due to limitations of Java's
   * type system, this method is invariant. Use the static {@code Data.cons} if you need the proper
   * contravariance.
   */
  List<E> cons (E elem);

  @Override default Cursor<E> startIndex () {
    return new Cursor<E>(0, this);
  }

  @Override default Cursor<E> endIndex () {
    return new Cursor<E>(-1, Data.nil());
  }

  @Override default Cursor<E> indexAfter (Cursor<E> index) {
    if (index.isEnd()) throw new IndexOutOfBoundsException("Cannot advance past end of list");
    return new Cursor<E>(index.ordinal + 1, index.rest.tail());
  }

  @Override default E at (Cursor<E> index) {
    if (index.isEnd()) throw new IndexOutOfBoundsException("No element at end of list");
    return index.rest.head();
  }

  @Override default boolean isEmpty () { return this == Data.<E>nil(); }
  @Override default int count () { return size(); }
}
