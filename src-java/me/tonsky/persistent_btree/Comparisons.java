package me.tonsky.persistent_btree;

import java.util.*;
import java.util.function.*;

/**
 * Comparisons of two trees that skip the subtrees they share by identity.
 * Subset and disjointness look at keys only, not at how often they occur.
 */
@SuppressWarnings("unchecked")
class Comparisons {

  // Climbs both paths out of the nodes they share at the same slot. Returns the last node climbed out of
  private static <Key, Value> Node<Key, Value> skipShared(Path<Key, Value> a, Path<Key, Value> b) {
    Node<Key, Value> shared;
    do {
      shared = a.node();
      a.ascendOneLevel();
      b.ascendOneLevel();
    } while (!a.isAtEnd() && !b.isAtEnd() && a.node() == b.node() && a.slot() == b.slot());
    if (!a.isAtEnd())
      a.ascendToKey();
    if (!b.isAtEnd())
      b.ascendToKey();
    return shared;
  }

  static <Key, Value> boolean elementsEqual(BTree<Key, Value> first, BTree<Key, Value> second, BiPredicate<Map.Entry<Key, Value>, Map.Entry<Key, Value>> equivalence) {
    first.checkNoCursor();
    second.checkNoCursor();
    if (first._root == second._root)
      return true;
    if (first._root._count != second._root._count)
      return false;
    Path<Key, Value> a = Path.startOf(first._root, first._cmp);
    Path<Key, Value> b = Path.startOf(second._root, second._cmp);
    while (!a.isAtEnd()) {
      if (a.node() == b.node() && a.slot() == b.slot()) {
        skipShared(a, b);
        if (a.isAtEnd())
          break;
      }
      if (!equivalence.test(a.element(), b.element()))
        return false;
      a.moveForward();
      b.moveForward();
    }
    return true;
  }

  static <Key, Value> boolean isDisjoint(BTree<Key, Value> first, BTree<Key, Value> second) {
    first.checkNoCursor();
    second.checkNoCursor();
    Comparator<Key> cmp = first._cmp;
    Path<Key, Value> a = Path.startOf(first._root, cmp);
    Path<Key, Value> b = Path.startOf(second._root, cmp);
    if (a.isAtEnd() || b.isAtEnd())
      return true;
    while (true) {
      if (cmp.compare(a.key(), b.key()) == 0)
        return false;
      while (cmp.compare(a.key(), b.key()) < 0) {
        a.nextPart(b.key(), false, null);
        if (a.isAtEnd())
          return true;
      }
      while (cmp.compare(b.key(), a.key()) < 0) {
        b.nextPart(a.key(), false, null);
        if (b.isAtEnd())
          return true;
      }
    }
  }

  /** True iff every key of first occurs in second; with strict, second must also have a key first lacks. */
  static <Key, Value> boolean isSubset(BTree<Key, Value> first, BTree<Key, Value> second, boolean strict) {
    first.checkNoCursor();
    second.checkNoCursor();
    Comparator<Key> cmp = first._cmp;
    Path<Key, Value> a = Path.startOf(first._root, cmp);
    Path<Key, Value> b = Path.startOf(second._root, cmp);
    boolean knownStrict = false;
    outer:
    while (!a.isAtEnd() && !b.isAtEnd()) {
      if (cmp.compare(a.key(), b.key()) < 0)
        return false;
      while (cmp.compare(a.key(), b.key()) == 0) {
        if (a.node() == b.node() && a.slot() == b.slot()) {
          Key last = skipShared(a, b).last().getKey();
          a.skipEqual(last, null);
          b.skipEqual(last, null);
          if (a.isAtEnd() || b.isAtEnd())
            break outer;
          continue;
        }
        Key key = a.key();
        a.skipEqual(key, null);
        b.skipEqual(key, null);
        if (a.isAtEnd() || b.isAtEnd())
          break outer;
      }
      while (cmp.compare(b.key(), a.key()) < 0) {
        knownStrict = true;
        b.nextPart(a.key(), false, null);
        if (b.isAtEnd())
          break outer;
      }
    }
    // A shared subtree may end in the middle of a run of equal keys
    if (!a.isAtEnd() && b.isAtEnd() && second._root._count > 0)
      a.skipEqual(second._root.last().getKey(), null);
    if (a.isAtEnd() && !b.isAtEnd() && first._root._count > 0)
      b.skipEqual(first._root.last().getKey(), null);
    if (!a.isAtEnd())
      return false;
    return !strict || knownStrict || !b.isAtEnd();
  }
}
