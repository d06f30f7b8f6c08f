//
// Flatview - lazy flattened views over nested collections
//

package flatview;

/**
 * Represents a collection with a countable number of elements.
 */
public interface Countable<E> extends Iterable<E> {

  /** Returns the number of elements in this countable collection. */
  int size ();
}
