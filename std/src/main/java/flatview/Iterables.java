//
// Flatview - lazy flattened views over nested collections
//

package flatview;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

public class Iterables {

  /** An iterator over an immutable collection; {@link #remove} is not supported. */
  public static abstract class ImmIterator<E> implements Iterator<E> {
    @Override public void remove () {
      throw new UnsupportedOperationException("remove");
    }
  }

  /**
   * Returns true if the elements in {@code a1s} and {@code a2s} are pairwise equal, per {@link
   * Objects#equals}. If either iterable contains more elements than the other, they are not equal.
   */
  public static boolean equals (Iterable<?> a1s, Iterable<?> a2s) {
    Iterator<?> iter1 = a1s.iterator(), iter2 = a2s.iterator();
    while (iter1.hasNext()) {
      if (!iter2.hasNext() || !Objects.equals(iter1.next(), iter2.next())) return false;
    }
    return !iter2.hasNext();
  }

  /**
   * Returns a hash code computed from the elements of {@code as}. This is equivalent to {@link
   * java.util.Arrays#hashCode} applied to an array of the same elements.
   */
  public static int hashCode (Iterable<?> as) {
    int result = 1;
    for (Object elem : as) result = 31 * result + (elem == null ? 0 : elem.hashCode());
    return result;
  }

  /** Copies the elements of {@code as} into a new {@link java.util.List}. */
  public static <A> java.util.List<A> toJava (Iterable<? extends A> as) {
    java.util.List<A> list = new ArrayList<>();
    for (A a : as) list.add(a);
    return list;
  }

  /** Formats {@code as} as {@code [a, b, c]}. */
  static String toString (Iterable<?> as) {
    StringBuilder sb = new StringBuilder("[");
    for (Object a : as) {
      if (sb.length() > 1) sb.append(", ");
      sb.append(a);
    }
    return sb.append("]").toString();
  }

  static final Iterator<Object> EMPTY_ITER = new ImmIterator<Object>() {
    public boolean hasNext () { return false; }
    public Object next () { throw new NoSuchElementException(); }
  };
}
