//
// Flatview - lazy flattened views over nested collections
//

package flatview;

/**
 * Lazy flattening of collections of collections. None of these methods copy elements; each returns
 * a view that reads through to its argument.
 *
 * <pre>{@code
 * Seq<Seq<Integer>> ranges = Data.seq(Data.seq(0, 1, 2), Data.seq(8, 9), Data.seq(15, 16));
 * for (int ii : Flattens.joined(ranges)) System.out.print(ii + " ");
 * // prints: 0 1 2 8 9 15 16
 * }</pre>
 */
public class Flattens {

  /** Returns a single-pass view of the concatenation of the iterables in {@code base}. */
  public static <A> FlattenedSequenceView<A> joined (
    Iterable<? extends Iterable<? extends A>> base) {
    return new FlattenedSequenceView<A>(base);
  }

  /** Returns an indexed view of the concatenation of the collections in {@code base}. */
  public static <A, O extends Comparable<? super O>, I extends Comparable<? super I>>
  FlattenedCollectionView<A, O, I> joinedCollection (Indexed<? extends Indexed<A, I>, O> base) {
    return new FlattenedCollectionView<A, O, I>(base);
  }

  /** Returns a bidirectional indexed view of the concatenation of the collections in
    * {@code base}. */
  public static <A, O extends Comparable<? super O>, I extends Comparable<? super I>>
  BidirectionalFlattenedCollectionView<A, O, I> joinedBidirectional (
    BiIndexed<? extends BiIndexed<A, I>, O> base) {
    return new BidirectionalFlattenedCollectionView<A, O, I>(base);
  }
}
