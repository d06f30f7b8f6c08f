//
// Flatview - lazy flattened views over nested collections
//

package flatview;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Optional;
import org.junit.*;
import static org.junit.Assert.*;

public class FlattenedCollectionViewTest {

  static <E, I extends Comparable<? super I>> java.util.List<E> walk (Indexed<E, I> coll) {
    java.util.List<E> out = new ArrayList<>();
    for (I idx = coll.startIndex(); !idx.equals(coll.endIndex()); idx = coll.indexAfter(idx)) {
      out.add(coll.at(idx));
    }
    return out;
  }

  // forward-only at both levels
  private final List<List<Integer>> lists = Data.list(
    Data.list(1, 2), Data.<Integer>nil(), Data.list(3));

  // random access at both levels, viewed through the forward-only view
  private final Seq<Seq<Integer>> seqs = Data.seq(
    Data.seq(1, 2), Data.<Integer>seq(), Data.seq(3));

  @Test public void testEnumerationMatchesTraversal () {
    FlattenedCollectionView<Integer, List.Cursor<List<Integer>>, List.Cursor<Integer>> view =
      Flattens.joinedCollection(lists);
    assertEquals(Arrays.asList(1, 2, 3), Iterables.toJava(view));
    assertEquals(Arrays.asList(1, 2, 3), walk(view));
    assertSame(lists, view.base());
  }

  @Test public void testStartSkipsLeadingEmpties () {
    Seq<Seq<Integer>> base = Data.seq(
      Data.<Integer>seq(), Data.<Integer>seq(), Data.<Integer>seq(), Data.seq(7, 8));
    FlattenedCollectionView<Integer, Integer, Integer> view = Flattens.joinedCollection(base);
    assertEquals(FlattenedIndex.<Integer, Integer>at(3, 0), view.startIndex());
    assertEquals((Integer)7, view.at(view.startIndex()));
  }

  @Test public void testAllEmptyInners () {
    Seq<Seq<Integer>> base = Data.seq(Data.<Integer>seq(), Data.<Integer>seq());
    FlattenedCollectionView<Integer, Integer, Integer> view = Flattens.joinedCollection(base);
    assertEquals(view.endIndex(), view.startIndex());
    assertTrue(view.isEmpty());
    assertEquals(0, view.count());
  }

  @Test public void testEmptyOuter () {
    FlattenedCollectionView<Integer, List.Cursor<List<Integer>>, List.Cursor<Integer>> view =
      Flattens.joinedCollection(Data.<List<Integer>>nil());
    assertEquals(view.endIndex(), view.startIndex());
    assertFalse(view.iterator().hasNext());
    assertTrue(walk(view).isEmpty());
  }

  @Test public void testEndIndex () {
    FlattenedCollectionView<Integer, Integer, Integer> view = Flattens.joinedCollection(seqs);
    FlattenedIndex<Integer, Integer> end = view.endIndex();
    assertTrue(end.isPastEnd());
    assertEquals((Integer)3, end.outer());
    assertEquals(end, view.indexAfter(FlattenedIndex.<Integer, Integer>at(2, 0)));
  }

  @Test public void testIndexAfterSkipsEmpties () {
    FlattenedCollectionView<Integer, Integer, Integer> view = Flattens.joinedCollection(seqs);
    FlattenedIndex<Integer, Integer> second = view.indexAfter(view.startIndex());
    assertEquals(FlattenedIndex.<Integer, Integer>at(0, 1), second);
    assertEquals(FlattenedIndex.<Integer, Integer>at(2, 0), view.indexAfter(second));
  }

  @Test public void testDistance () {
    FlattenedCollectionView<Integer, Integer, Integer> view = Flattens.joinedCollection(seqs);
    FlattenedIndex<Integer, Integer> start = view.startIndex(), end = view.endIndex();
    assertEquals(3, view.distance(start, end));
    assertEquals(-3, view.distance(end, start));
    assertEquals(0, view.distance(end, end));
    FlattenedIndex<Integer, Integer> a = FlattenedIndex.at(0, 1), b = FlattenedIndex.at(2, 0);
    assertEquals(1, view.distance(a, b));
    assertEquals(-1, view.distance(b, a));
    assertEquals(3, view.count());
  }

  @Test public void testDistanceOverLists () {
    FlattenedCollectionView<Integer, List.Cursor<List<Integer>>, List.Cursor<Integer>> view =
      Flattens.joinedCollection(lists);
    assertEquals(3, view.distance(view.startIndex(), view.endIndex()));
    assertEquals(-3, view.distance(view.endIndex(), view.startIndex()));
  }

  @Test public void testOffset () {
    FlattenedCollectionView<Integer, Integer, Integer> view = Flattens.joinedCollection(seqs);
    FlattenedIndex<Integer, Integer> start = view.startIndex();
    assertEquals(start, view.offset(start, 0));
    assertEquals(FlattenedIndex.<Integer, Integer>at(2, 0), view.offset(start, 2));
    assertEquals(view.endIndex(), view.offset(start, 3));
  }

  @Test public void testBoundedOffset () {
    FlattenedCollectionView<Integer, Integer, Integer> view = Flattens.joinedCollection(seqs);
    FlattenedIndex<Integer, Integer> start = view.startIndex(), end = view.endIndex();
    assertEquals(Optional.of(FlattenedIndex.<Integer, Integer>at(2, 0)),
                 view.offset(start, 2, end));
    assertEquals(Optional.of(end), view.offset(start, 3, end));
    assertEquals(Optional.empty(), view.offset(start, 4, end));
    assertEquals(Optional.empty(), view.offset(view.indexAfter(start), 3, end));
  }

  @Test public void testFormOffset () {
    FlattenedCollectionView<Integer, Integer, Integer> view = Flattens.joinedCollection(seqs);
    FlattenedIndex<Integer, Integer> start = view.startIndex(), end = view.endIndex();
    Offset<FlattenedIndex<Integer, Integer>> done = view.formOffset(start, 1, end);
    assertTrue(done.isCompleted());
    assertEquals(FlattenedIndex.<Integer, Integer>at(0, 1), done.index());
    Offset<FlattenedIndex<Integer, Integer>> stopped = view.formOffset(start, 5, end);
    assertFalse(stopped.isCompleted());
    assertEquals(end, stopped.index());
  }

  @Test public void testBackwardOffsetOverRandomAccess () {
    // the base can step back even though the view's static type is forward-only
    FlattenedCollectionView<Integer, Integer, Integer> view = Flattens.joinedCollection(seqs);
    FlattenedIndex<Integer, Integer> end = view.endIndex();
    assertEquals(FlattenedIndex.<Integer, Integer>at(2, 0), view.offset(end, -1));
    assertEquals(FlattenedIndex.<Integer, Integer>at(0, 1), view.offset(end, -2));
    assertEquals(Optional.empty(), view.offset(end, -3, view.indexAfter(view.startIndex())));
  }

  @Test(expected=UnsupportedOperationException.class) public void testBackwardOffsetOverList () {
    FlattenedCollectionView<Integer, List.Cursor<List<Integer>>, List.Cursor<Integer>> view =
      Flattens.joinedCollection(lists);
    view.offset(view.endIndex(), -1);
  }

  @Test(expected=UnsupportedOperationException.class) public void testBackwardLimitedOverList () {
    FlattenedCollectionView<Integer, List.Cursor<List<Integer>>, List.Cursor<Integer>> view =
      Flattens.joinedCollection(lists);
    view.offset(view.endIndex(), -1, view.startIndex());
  }

  @Test(expected=UnsupportedOperationException.class) public void testBackwardOverForwardInners () {
    Seq<List<Integer>> base = Data.seq(Data.list(1, 2), Data.list(3));
    FlattenedCollectionView<Integer, Integer, List.Cursor<Integer>> view =
      Flattens.joinedCollection(base);
    view.offset(view.endIndex(), -1);
  }

  @Test(expected=IndexOutOfBoundsException.class) public void testAtEnd () {
    FlattenedCollectionView<Integer, Integer, Integer> view = Flattens.joinedCollection(seqs);
    view.at(view.endIndex());
  }

  @Test(expected=IndexOutOfBoundsException.class) public void testIndexAfterEnd () {
    FlattenedCollectionView<Integer, Integer, Integer> view = Flattens.joinedCollection(seqs);
    view.indexAfter(view.endIndex());
  }

  @Test(expected=IndexOutOfBoundsException.class) public void testBackwardPastStart () {
    FlattenedCollectionView<Integer, Integer, Integer> view = Flattens.joinedCollection(seqs);
    view.offset(view.startIndex(), -1);
  }

  @Test public void testUnderestimatedCount () {
    assertEquals(0, Flattens.joinedCollection(seqs).underestimatedCount());
    assertEquals(0, Flattens.joinedCollection(lists).underestimatedCount());
  }

  @Test public void testForEach () {
    java.util.List<Integer> seen = new ArrayList<>();
    Flattens.joinedCollection(lists).forEach(seen::add);
    assertEquals(Arrays.asList(1, 2, 3), seen);
  }

  @Test public void testForEachCheckedPropagates () {
    Exception boom = new Exception("boom");
    java.util.List<Integer> seen = new ArrayList<>();
    try {
      Flattens.joinedCollection(seqs).forEachChecked(elem -> {
        if (elem == 3) throw boom;
        seen.add(elem);
      });
      fail("expected the body's exception");
    } catch (Exception e) {
      assertSame(boom, e);
    }
    assertEquals(Arrays.asList(1, 2), seen);
  }

  @Test public void testToString () {
    assertEquals("[1, 2, 3]", Flattens.joinedCollection(lists).toString());
  }
}
