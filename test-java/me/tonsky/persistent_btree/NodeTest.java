package me.tonsky.persistent_btree;

import java.util.*;
import java.util.concurrent.atomic.*;
import org.junit.jupiter.api.Test;

import static me.tonsky.persistent_btree.TestUtil.*;
import static org.junit.jupiter.api.Assertions.*;

class NodeTest {

  static Node<Integer, String> leaf(int order, Integer... keys) {
    return new Node<Integer, String>(order, 0, keys.length, keys, new String[keys.length], null, keys.length, null);
  }

  static Node<Integer, String> maximal(int depth, int order, AtomicBoolean edit) {
    return maximalNode(depth, order, new int[] {0}, edit);
  }

  static List<Integer> keysOf(Node<Integer, String> node) {
    List<Integer> keys = new ArrayList<>();
    node.forEach((k, v) -> keys.add(k));
    return keys;
  }

  @Test
  void limits() {
    assertEquals(4, leaf(5).maxKeys());
    assertEquals(2, leaf(5).minKeys());
    assertEquals(1, leaf(3).minKeys());
    assertEquals(1, leaf(4).minKeys());
    assertTrue(leaf(5, 1).isTooSmall());
    assertFalse(leaf(5, 1, 2).isTooSmall());
    assertTrue(leaf(3, 1, 2, 3).isTooLarge());
    assertTrue(leaf(5).isEmpty());
    assertEquals(1, leaf(2).maxKeys());
    assertEquals(0, leaf(2).minKeys());
    assertFalse(leaf(2).isTooSmall());
    assertTrue(leaf(2, 1, 2).isTooLarge());
  }

  @Test
  void emptySubtreesOfOrderTwo() {
    Node<Integer, String> emptyFirst = new Node<Integer, String>(leaf(2), 5, "5", leaf(2, 6), null);
    assertEquals(Integer.valueOf(5), emptyFirst.first().getKey());
    assertEquals(Integer.valueOf(6), emptyFirst.last().getKey());
    assertEquals(0, emptyFirst.slotOfOffset(0));
    assertEquals(Integer.valueOf(6), emptyFirst.elementAt(1).getKey());

    Node<Integer, String> emptyLast = new Node<Integer, String>(leaf(2, 1), 2, "2", leaf(2), null);
    assertEquals(Integer.valueOf(1), emptyLast.first().getKey());
    assertEquals(Integer.valueOf(2), emptyLast.last().getKey());
    assertNull(new Node<Integer, String>(leaf(2), 0, "0", leaf(2), null).child(1).last());

    AtomicBoolean edit = new AtomicBoolean(true);
    Node<Integer, String> node = emptyLast.clone(edit);
    assertEquals(Integer.valueOf(2), node.removeLast(edit).getKey());
    assertEquals(0, node._len);
    assertEquals(1, node._count);
    Node<Integer, String> unwrapped = Node.unwrap(node, edit);
    assertTrue(unwrapped.isLeaf());
    assertEquals(list(1), keysOf(unwrapped));
    assertEquals(list(1, 2), keysOf(emptyLast));

    node = emptyFirst.clone(edit);
    assertEquals(Integer.valueOf(5), node.removeFirst(edit).getKey());
    assertEquals(list(6), keysOf(Node.unwrap(node, edit)));
    node = emptyFirst.clone(edit);
    assertEquals(Integer.valueOf(5), node.removeAt(0, edit).getKey());
    assertEquals(list(6), keysOf(node));
  }

  @Test
  void search() {
    Node<Integer, String> node = leaf(8, 1, 2, 2, 2, 3);
    assertEquals(1, node.searchFirst(2, CMP));
    assertEquals(3, node.searchLast(2, CMP));
    assertEquals(1, node.slotOf(2, Selector.FIRST, CMP));
    assertEquals(3, node.slotOf(2, Selector.LAST, CMP));
    assertEquals(4, node.slotOf(2, Selector.AFTER, CMP));
    int any = node.slotOf(2, Selector.ANY, CMP);
    assertTrue(any >= 1 && any <= 3);

    assertEquals(-1, node.slotOf(0, Selector.FIRST, CMP));
    assertEquals(-6, node.slotOf(4, Selector.FIRST, CMP));
    assertEquals(-6, node.slotOf(4, Selector.LAST, CMP));
    assertEquals(-6, node.slotOf(3, Selector.AFTER, CMP));
    assertEquals(0, node.slotOf(0, Selector.AFTER, CMP));
  }

  @Test
  void splitMovesTheUpperHalfToASibling() {
    AtomicBoolean edit = new AtomicBoolean(true);
    Node<Integer, String> node = maximal(0, 5, edit);
    node.insertElement(4, 4, "4");
    assertTrue(node.isTooLarge());

    Splinter<Integer, String> splinter = node.split(edit);
    assertEquals(Integer.valueOf(2), splinter._key);
    assertEquals("2", splinter._value);
    assertEquals(list(0, 1), keysOf(node));
    assertEquals(2, node._count);
    assertEquals(list(3, 4), keysOf(splinter._node));
    assertEquals(2, splinter._node._count);
    assertTrue(splinter._node.editable(edit));
  }

  @Test
  void splitOfABranchMovesChildren() {
    AtomicBoolean edit = new AtomicBoolean(true);
    Node<Integer, String> node = maximal(1, 3, edit);
    Node<Integer, String> lastChild = node.child(2);
    Splinter<Integer, String> splinter = node.split(1, edit);
    assertEquals(Integer.valueOf(5), splinter._key);
    assertEquals(list(0, 1, 2, 3, 4), keysOf(node));
    assertEquals(5, node._count);
    assertEquals(list(6, 7), keysOf(splinter._node));
    assertEquals(2, splinter._node._count);
    assertSame(lastChild, splinter._node.child(0));
  }

  @Test
  void slice() {
    Node<Integer, String> branch = maximal(1, 3, null);
    // child0 [0 1] 2 child1 [3 4] 5 child2 [6 7]
    Node<Integer, String> upper = Node.slice(branch, 1, 2, null);
    assertEquals(list(3, 4, 5, 6, 7), keysOf(upper));
    assertEquals(5, upper._count);
    assertSame(branch.child(1), upper.child(0));

    Node<Integer, String> single = Node.slice(branch, 1, 1, null);
    assertNotSame(branch.child(1), single);
    assertEquals(list(3, 4), keysOf(single));
    assertTrue(single.isLeaf());

    Node<Integer, String> leaf = branch.child(2);
    assertEquals(list(7), keysOf(Node.slice(leaf, 1, 2, null)));
    assertEquals(list(), keysOf(Node.slice(leaf, 1, 1, null)));
    assertEquals(list(0, 1, 2, 3, 4, 5, 6, 7), keysOf(branch));
  }

  @Test
  void joinGraftsTheShallowerTree() {
    for (int order: new int[] {3, 4, 5}) {
      for (int small: new int[] {0, 1, 5, 30}) {
        BTree<Integer, String> big = range(order, 0, 300);
        BTree<Integer, String> tail = range(order, 301, 301 + small);
        AtomicBoolean edit = new AtomicBoolean(true);
        Node<Integer, String> joined = Node.join(big._root, 300, "300", tail._root, edit);
        assertKeys(ints(0, 301 + small), new BTree<Integer, String>(joined, CMP, new Settings(order), edit));
        assertKeys(ints(0, 300), big);
        assertKeys(ints(301, 301 + small), tail);

        BTree<Integer, String> head = range(order, -small - 1, -1);
        edit = new AtomicBoolean(true);
        joined = Node.join(head._root, -1, "-1", big._root, edit);
        assertKeys(ints(-small - 1, 300), new BTree<Integer, String>(joined, CMP, new Settings(order), edit));
        assertKeys(ints(0, 300), big);
      }
    }
  }

  @Test
  void joinRejectsMixedOrders() {
    assertThrows(IllegalArgumentException.class,
                 () -> Node.join(range(4, 0, 10)._root, 10, "10", range(5, 11, 20)._root, new AtomicBoolean(true)));
  }

  @Test
  void offsets() {
    Node<Integer, String> root = maximal(2, 4, null);
    assertEquals(63, root._count);
    for (int offset = 0; offset < root._count; ++offset)
      assertEquals(Integer.valueOf(offset), root.elementAt(offset).getKey());
    for (int slot = 0; slot < root._len; ++slot)
      assertEquals(root.key(slot), root.elementAt(root.offsetOfSlot(slot)).getKey());
    assertEquals(root._count, root.offsetOfSlot(root._len));
    assertEquals(root._len, root.slotOfOffset(root._count));
    assertEquals(-1, root.slotOfOffset(0));
    assertEquals(0, root.slotOfOffset(15));
    assertEquals(-2, root.slotOfOffset(16));
    assertEquals(-4, root.slotOfOffset(62));
  }

  @Test
  void ownership() {
    AtomicBoolean edit = new AtomicBoolean(true);
    Node<Integer, String> node = new Node<Integer, String>(4, edit);
    assertTrue(node.editable(edit));
    assertFalse(node.editable(new AtomicBoolean(true)));
    assertFalse(node.editable(null));
    assertSame(node, node.isolate(edit));
    node.insertElement(0, 1, "1");

    edit.set(false);
    assertFalse(node.editable(edit));
    AtomicBoolean next = new AtomicBoolean(true);
    Node<Integer, String> copy = node.isolate(next);
    assertNotSame(node, copy);
    assertTrue(copy.editable(next));
    copy.insertElement(1, 2, "2");
    assertEquals(list(1), keysOf(node));
    assertEquals(list(1, 2), keysOf(copy));
  }

  @Test
  void isolateChildClonesOnlyFrozenChildren() {
    AtomicBoolean old = new AtomicBoolean(false);
    Node<Integer, String> root = maximal(1, 3, old);
    AtomicBoolean edit = new AtomicBoolean(true);
    Node<Integer, String> copy = root.isolate(edit);
    Node<Integer, String> child = copy.isolateChild(1, edit);
    assertNotSame(root.child(1), child);
    assertSame(child, copy.child(1));
    assertSame(child, copy.isolateChild(1, edit));
    assertSame(root.child(0), copy.child(0));
  }

  @Test
  void traversal() {
    Node<Integer, String> root = maximal(2, 3, null);
    assertEquals(ints(0, 26), keysOf(root));

    List<Integer> seen = new ArrayList<>();
    assertFalse(root.forEachWhile((k, v) -> {
      seen.add(k);
      return k < 10;
    }));
    assertEquals(ints(0, 11), seen);
    assertTrue(root.forEachWhile((k, v) -> true));

    assertEquals(Node.entry(0, "0"), root.first());
    assertEquals(Node.entry(25, "25"), root.last());
    assertNull(leaf(3).first());
  }

  @Test
  void printsItsShape() {
    assertEquals("Leaf{count=3, keys=[1 2 3]}", leaf(4, 1, 2, 3).toString());
    assertEquals("Branch{count=8, keys=[2 5]}\n"
                 + "  Leaf{count=2, keys=[0 1]}\n"
                 + "  Leaf{count=2, keys=[3 4]}\n"
                 + "  Leaf{count=2, keys=[6 7]}",
                 maximal(1, 3, null).toString());
  }
}
