package me.tonsky.persistent_btree;

import java.util.*;
import org.junit.jupiter.api.Test;

import static me.tonsky.persistent_btree.TestUtil.*;
import static org.junit.jupiter.api.Assertions.*;

class CursorTest {

  @Test
  void appendingAtTheEndOfAnEmptyTree() {
    for (int order: new int[] {2, 3}) {
      BTree<Integer, String> tree = empty(order);
      Cursor<Integer, String> cursor = tree.cursorAtEnd();
      for (int i = 0; i < 30; ++i) {
        cursor.insert(i, String.valueOf(i));
        assertTrue(cursor.isAtEnd());
        assertEquals(i + 1, cursor.offset());
      }
      assertSame(tree, cursor.finish());
      assertKeys(ints(0, 30), tree);
    }
  }

  @Test
  void walkingAndRemovingAcrossEmptyLeaves() {
    BTree<Integer, String> tree = empty(2);
    for (int i = 0; i < 64; ++i)
      tree.insert(i, String.valueOf(i));
    Cursor<Integer, String> cursor = tree.cursorAtStart();
    for (int i = 0; i < 64; ++i) {
      assertEquals(Integer.valueOf(i), cursor.key());
      cursor.moveForward();
    }
    assertTrue(cursor.isAtEnd());
    for (int i = 63; i >= 0; --i) {
      cursor.moveBackward();
      assertEquals(Integer.valueOf(i), cursor.key());
    }
    cursor.moveTo(Integer.valueOf(40), Selector.FIRST);
    assertEquals(40, cursor.offset());
    while (!cursor.isAtEnd())
      cursor.remove();
    cursor.moveTo(10);
    cursor.remove();
    assertEquals(Integer.valueOf(11), cursor.key());
    cursor.finish();
    List<Integer> expected = ints(0, 40);
    expected.remove(Integer.valueOf(10));
    assertKeys(expected, tree);
  }

  @Test
  void insertBeforeEveryElement() {
    for (int order: new int[] {2, 3, 4, 5}) {
      int[] evens = new int[100];
      for (int i = 0; i < 100; ++i)
        evens[i] = 2 * i;
      BTree<Integer, String> tree = tree(order, evens);
      Cursor<Integer, String> cursor = tree.cursorAtStart();
      while (!cursor.isAtEnd()) {
        int key = cursor.key();
        cursor.insert(key - 1, String.valueOf(key - 1));
        assertEquals(Integer.valueOf(key), cursor.key());
        cursor.moveForward();
      }
      cursor.insert(199, "199");
      cursor.finish();
      assertKeys(ints(-1, 200), tree);
    }
  }

  @Test
  void insertAfterEveryElement() {
    for (int order: new int[] {2, 3, 4, 5}) {
      int[] evens = new int[100];
      for (int i = 0; i < 100; ++i)
        evens[i] = 2 * i;
      BTree<Integer, String> tree = tree(order, evens);
      Cursor<Integer, String> cursor = tree.cursorAtStart();
      while (!cursor.isAtEnd()) {
        int key = cursor.key();
        cursor.insertAfter(key + 1, String.valueOf(key + 1));
        assertEquals(Integer.valueOf(key + 1), cursor.key());
        cursor.moveForward();
      }
      assertThrows(IllegalStateException.class, () -> cursor.insertAfter(500, "500"));
      cursor.finish();
      assertKeys(ints(0, 200), tree);
    }
  }

  @Test
  void removeEveryOtherElement() {
    for (int order: new int[] {2, 3, 4, 5, 6}) {
      BTree<Integer, String> tree = range(order, 0, 200);
      Cursor<Integer, String> cursor = tree.cursorAtStart();
      int expected = 0;
      while (!cursor.isAtEnd()) {
        assertEquals(Integer.valueOf(expected), cursor.remove().getKey());
        assertEquals(expected / 2, cursor.offset());
        if (!cursor.isAtEnd())
          cursor.moveForward();
        expected += 2;
      }
      cursor.finish();
      List<Integer> odds = new ArrayList<>();
      for (int i = 1; i < 200; i += 2)
        odds.add(i);
      assertKeys(odds, tree);
    }
  }

  @Test
  void removeEveryElementFromTheBack() {
    BTree<Integer, String> tree = maximalTree(2, 4);
    Cursor<Integer, String> cursor = tree.cursorAtEnd();
    for (int i = 62; i >= 0; --i) {
      cursor.moveBackward();
      assertEquals(Integer.valueOf(i), cursor.remove().getKey());
      assertTrue(cursor.isAtEnd());
    }
    cursor.finish();
    assertTrue(tree.isEmpty());
  }

  @Test
  void removeRangesOfAMaximalTree() {
    for (int order: new int[] {3, 4}) {
      int count = maximalTree(2, order).count();
      for (int from = 0; from <= count; ++from) {
        for (int n = 0; from + n <= count; ++n) {
          BTree<Integer, String> tree = maximalTree(2, order);
          Cursor<Integer, String> cursor = tree.cursorAt(from);
          cursor.remove(n);
          assertEquals(from, cursor.offset());
          assertEquals(count - n, cursor.count());
          if (from + n < count)
            assertEquals(Integer.valueOf(from + n), cursor.key());
          cursor.finish();
          assertKeys(concat(ints(0, from), ints(from + n, count)), tree);
        }
      }
    }
  }

  @Test
  void extractRangesOfAMaximalTree() {
    for (int order: new int[] {3, 5}) {
      int count = maximalTree(2, order).count();
      for (int from = 0; from <= count; from += (order == 3 ? 1 : 7)) {
        for (int n = 0; from + n <= count; n += (order == 3 ? 1 : 5)) {
          BTree<Integer, String> tree = maximalTree(2, order);
          Cursor<Integer, String> cursor = tree.cursorAt(from);
          BTree<Integer, String> extracted = cursor.extract(n);
          assertEquals(from, cursor.offset());
          cursor.finish();
          assertKeys(ints(from, from + n), extracted);
          assertKeys(concat(ints(0, from), ints(from + n, count)), tree);

          // The extracted run and the rest no longer share anything editable
          extracted.insert(-1, "-1");
          extracted.removeLast();
          tree.insert(count, String.valueOf(count));
          tree.removeFirst();
          assertEquals(n, extracted.count());
          assertValid(extracted);
          assertValid(tree);
        }
      }
    }
  }

  @Test
  void extractKeepsOtherCopiesIntact() {
    BTree<Integer, String> tree = range(4, 0, 100);
    BTree<Integer, String> copy = tree.copy();
    Cursor<Integer, String> cursor = tree.cursorAt(30);
    assertKeys(ints(30, 70), cursor.extract(40));
    cursor.finish();
    assertKeys(concat(ints(0, 30), ints(70, 100)), tree);
    assertKeys(ints(0, 100), copy);
  }

  @Test
  void removeAllBeforeAndAfter() {
    BTree<Integer, String> tree = range(5, 0, 100);
    tree.withCursorAt(40, cursor -> cursor.removeAllBefore(false));
    assertKeys(ints(40, 100), tree);

    tree = range(5, 0, 100);
    tree.withCursorAt(40, cursor -> cursor.removeAllBefore(true));
    assertKeys(ints(41, 100), tree);

    tree = range(5, 0, 100);
    tree.withCursorAt(40, cursor -> cursor.removeAllAfter(false));
    assertKeys(ints(0, 41), tree);

    tree = range(5, 0, 100);
    tree.withCursorAt(40, cursor -> cursor.removeAllAfter(true));
    assertKeys(ints(0, 40), tree);

    tree = range(5, 0, 100);
    tree.withCursorAt(99, cursor -> cursor.removeAllAfter(false));
    assertKeys(ints(0, 100), tree);

    tree = range(5, 0, 100);
    tree.withCursorAt(0, cursor -> cursor.removeAllBefore(false));
    assertKeys(ints(0, 100), tree);

    tree = range(5, 0, 100);
    tree.withCursorAt(17, Cursor::removeAll);
    assertKeys(list(), tree);

    BTree<Integer, String> full = range(5, 0, 100);
    assertThrows(IllegalStateException.class, () -> full.withCursorAt(100, cursor -> cursor.removeAllBefore(true)));
  }

  @Test
  void removeRejectsTooManyElements() {
    BTree<Integer, String> tree = range(5, 0, 10);
    Cursor<Integer, String> cursor = tree.cursorAt(7);
    assertThrows(IllegalArgumentException.class, () -> cursor.remove(4));
    assertThrows(IllegalArgumentException.class, () -> cursor.extract(4));
    assertThrows(IllegalArgumentException.class, () -> cursor.remove(-1));
    cursor.remove(3);
    assertTrue(cursor.isAtEnd());
    assertThrows(IllegalStateException.class, cursor::remove);
    cursor.finish();
    assertKeys(ints(0, 7), tree);
  }

  @Test
  void insertWholeTrees() {
    for (int order: new int[] {2, 3, 4}) {
      for (int gapStart: new int[] {0, 1, 13, 64, 120}) {
        for (int gapLength: new int[] {0, 1, 2, 5, 40, 80}) {
          List<Integer> outside = concat(ints(0, gapStart), ints(gapStart + gapLength, 200));
          int[] keys = new int[outside.size()];
          for (int i = 0; i < keys.length; ++i)
            keys[i] = outside.get(i);
          BTree<Integer, String> tree = tree(order, keys);
          BTree<Integer, String> gap = range(order, gapStart, gapStart + gapLength);

          Cursor<Integer, String> cursor = tree.cursorAt(gapStart);
          cursor.insert(gap);
          assertEquals(gapStart + gapLength, cursor.offset());
          assertEquals(200, cursor.count());
          if (gapStart + gapLength < 200)
            assertEquals(Integer.valueOf(gapStart + gapLength), cursor.key());
          cursor.finish();
          assertKeys(ints(0, 200), tree);

          tree.clear();
          assertKeys(ints(gapStart, gapStart + gapLength), gap);
        }
      }
    }
  }

  @Test
  void insertAscendingEntries() {
    BTree<Integer, String> tree = tree(4, 0, 1, 2, 8, 9);
    List<Map.Entry<Integer, String>> entries = new ArrayList<>();
    for (int i = 3; i < 8; ++i)
      entries.add(entry(i, String.valueOf(i)));
    tree.withCursorAt(8, Selector.FIRST, cursor -> {
      cursor.insert(entries);
      assertEquals(Integer.valueOf(8), cursor.key());
    });
    assertKeys(ints(0, 10), tree);
  }

  @Test
  void setValueAndSetKey() {
    BTree<Integer, String> tree = range(4, 0, 50);
    BTree<Integer, String> copy = tree.copy();
    tree.withCursorAt(10, cursor -> {
      assertEquals("10", cursor.setValue("x"));
      assertEquals(Integer.valueOf(10), cursor.setKey(10));
      cursor.moveTo(30);
      assertEquals(Integer.valueOf(30), cursor.setKey(31));
      assertEquals("30", cursor.value());
    });
    assertEquals("x", tree.get(10, null));
    assertEquals("30", tree.get(31, Selector.FIRST, null));
    assertFalse(tree.contains(30));
    assertValid(tree);
    assertEquals("10", copy.get(10, null));
    assertKeys(ints(0, 50), copy);
  }

  @Test
  void navigation() {
    BTree<Integer, String> tree = tree(3, 0, 1, 2, 2, 2, 3, 4, 5, 6, 7, 8, 9);
    Cursor<Integer, String> cursor = tree.cursorAt(2, Selector.LAST);
    assertEquals(4, cursor.offset());
    cursor.moveTo(2, Selector.FIRST);
    assertEquals(2, cursor.offset());
    cursor.moveTo(2, Selector.AFTER);
    assertEquals(Integer.valueOf(3), cursor.key());
    cursor.moveTo(100, Selector.ANY);
    assertTrue(cursor.isAtEnd());
    assertThrows(IllegalStateException.class, cursor::moveForward);
    assertThrows(IllegalStateException.class, cursor::key);
    cursor.moveToStart();
    assertTrue(cursor.isAtStart());
    assertThrows(IllegalStateException.class, cursor::moveBackward);
    cursor.moveTo(7);
    assertEquals(Integer.valueOf(5), cursor.key());
    cursor.moveBackward();
    assertEquals(Integer.valueOf(4), cursor.key());
    assertThrows(IndexOutOfBoundsException.class, () -> cursor.moveTo(13));
    cursor.moveToEnd();
    assertEquals(12, cursor.offset());
    cursor.finish();
    assertThrows(IllegalStateException.class, () -> cursor.moveTo(0));
  }

  @Test
  void withCursorFinishesOnFailure() {
    BTree<Integer, String> tree = range(5, 0, 100);
    assertThrows(RuntimeException.class, () -> tree.withCursorAt(0, cursor -> {
      cursor.remove();
      throw new RuntimeException("boom");
    }));
    assertKeys(ints(1, 100), tree);
  }

  @Test
  void finishingInvalidatesIndices() {
    BTree<Integer, String> tree = range(5, 0, 10);
    Index<Integer, String> index = tree.indexAt(3);
    tree.cursorAtStart().finish();
    assertThrows(IllegalStateException.class, index::key);
  }

  // Every element has key 0, so any edit keeps the tree ordered
  @Test
  void randomEditsMatchAListModel() {
    for (int order: new int[] {2, 3, 4, 5, 7}) {
      Random random = new Random(order * 31);
      BTree<Integer, String> tree = empty(order);
      List<String> model = new ArrayList<>();
      Cursor<Integer, String> cursor = tree.cursorAtStart();
      int next = 0;
      for (int op = 0; op < 3000; ++op) {
        int offset = cursor.offset();
        int remaining = model.size() - offset;
        switch (random.nextInt(8)) {
        case 0:
          cursor.moveTo(random.nextInt(model.size() + 1));
          break;
        case 1:
        case 2:
          cursor.insert(0, "v" + next);
          model.add(offset, "v" + next++);
          assertEquals(offset + 1, cursor.offset());
          break;
        case 3:
          if (remaining > 0) {
            cursor.insertAfter(0, "v" + next);
            model.add(offset + 1, "v" + next++);
            assertEquals(offset + 1, cursor.offset());
          }
          break;
        case 4:
          if (remaining > 0)
            assertEquals(model.remove(offset), cursor.remove().getValue());
          break;
        case 5: {
          int n = random.nextInt(Math.min(remaining, 20) + 1);
          cursor.remove(n);
          model.subList(offset, offset + n).clear();
          break;
        }
        case 6: {
          int n = random.nextInt(Math.min(remaining, 20) + 1);
          BTree<Integer, String> extracted = cursor.extract(n);
          List<String> run = model.subList(offset, offset + n);
          assertEquals(run, extracted.values());
          assertValid(extracted);
          run.clear();
          break;
        }
        default:
          if (remaining > 0) {
            cursor.setValue("s" + next);
            model.set(offset, "s" + next++);
          }
        }
        assertEquals(model.size(), cursor.count());
        assertTrue(cursor.offset() <= model.size());
        if (cursor.offset() < model.size())
          assertEquals(model.get(cursor.offset()), cursor.value());

        if (op % 250 == 0) {
          int at = cursor.offset();
          cursor.finish();
          assertValid(tree);
          assertEquals(model, tree.values());
          cursor = tree.cursorAt(at);
        }
      }
      cursor.finish();
      assertValid(tree);
      assertEquals(model, tree.values());
    }
  }
}
