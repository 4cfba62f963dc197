package me.tonsky.persistent_btree;

import java.util.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks two trees in key order and assembles the result of a set operation.
 * Whole runs of elements below the other tree's next key are moved in one
 * step, and subtrees both trees share by identity are spliced in without
 * looking at their elements.
 *
 * <p>A merger is good for a single operation.
 */
@SuppressWarnings("unchecked")
class Merger<Key, Value> {
  private static final Logger logger = LoggerFactory.getLogger(Merger.class);

  final Path<Key, Value> _a;
  final Path<Key, Value> _b;
  final Builder<Key, Value> _builder;
  final Comparator<Key> _cmp;
  final BTree<Key, Value> _first;
  boolean _done;
  int _shared;

  Merger(BTree<Key, Value> first, BTree<Key, Value> second) {
    first._settings.checkCompatible(second._settings);
    _first   = first;
    _cmp     = first._cmp;
    _a       = Path.startOf(first.share(), _cmp);
    _b       = Path.startOf(second.share(), _cmp);
    _builder = new Builder<Key, Value>(first._settings, _cmp, false, first._settings.maxKeys());
    _done    = _a.isAtEnd() || _b.isAtEnd();
  }

  BTree<Key, Value> finish() {
    BTree<Key, Value> result = _builder.finish();
    logger.trace("Merged {} and {} elements into {}, {} shared subtree(s) spliced", _a.count(), _b.count(), result._root._count, _shared);
    return result;
  }

  // Operations

  BTree<Key, Value> union(MatchStrategy strategy) {
    while (!_done) {
      if (strategy == MatchStrategy.COUNTING_MATCHES) {
        copyFromFirst(true);
        copyFromSecond(false);
      } else {
        copyFromFirst(false);
        copyFromSecond(false);
        copyCommonElementsFromSecond();
      }
    }
    appendFirst();
    appendSecond();
    return finish();
  }

  BTree<Key, Value> subtracting(MatchStrategy strategy) {
    while (!_done) {
      copyFromFirst(false);
      skipFromSecond(false);
      if (strategy == MatchStrategy.COUNTING_MATCHES)
        skipMatchingNumberOfCommonElements();
      else
        skipCommonElements();
    }
    appendFirst();
    return finish();
  }

  BTree<Key, Value> symmetricDifference(MatchStrategy strategy) {
    while (!_done) {
      copyFromFirst(false);
      copyFromSecond(false);
      if (strategy == MatchStrategy.COUNTING_MATCHES)
        skipMatchingNumberOfCommonElements();
      else
        skipCommonElements();
    }
    appendFirst();
    appendSecond();
    return finish();
  }

  BTree<Key, Value> intersection(MatchStrategy strategy) {
    while (!_done) {
      skipFromFirst(false);
      skipFromSecond(false);
      if (strategy == MatchStrategy.COUNTING_MATCHES)
        copyMatchingNumberOfCommonElementsFromSecond();
      else
        copyCommonElementsFromSecond();
    }
    return finish();
  }

  // Steps

  private boolean below(Key key, Key other, boolean inclusive) {
    int d = _cmp.compare(key, other);
    return inclusive ? d <= 0 : d < 0;
  }

  private boolean sameKey() {
    return _cmp.compare(_a.key(), _b.key()) == 0;
  }

  private void appendRest(Path<Key, Value> path) {
    if (path.isAtEnd())
      return;
    _builder.append(path.key(), path.value());
    _builder.appendWithoutCloning(path.suffix(_builder._edit));
    path.moveToEnd();
    _done = true;
  }

  void appendFirst() {
    appendRest(_a);
  }

  void appendSecond() {
    appendRest(_b);
  }

  void copyFromFirst(boolean inclusive) {
    while (!_done && below(_a.key(), _b.key(), inclusive)) {
      _a.nextPart(_b.key(), inclusive, _builder);
      _done = _a.isAtEnd();
    }
  }

  void copyFromSecond(boolean inclusive) {
    while (!_done && below(_b.key(), _a.key(), inclusive)) {
      _b.nextPart(_a.key(), inclusive, _builder);
      _done = _b.isAtEnd();
    }
  }

  void skipFromFirst(boolean inclusive) {
    while (!_done && below(_a.key(), _b.key(), inclusive)) {
      _a.nextPart(_b.key(), inclusive, null);
      _done = _a.isAtEnd();
    }
  }

  void skipFromSecond(boolean inclusive) {
    while (!_done && below(_b.key(), _a.key(), inclusive)) {
      _b.nextPart(_a.key(), inclusive, null);
      _done = _b.isAtEnd();
    }
  }

  // Both paths at the first slot of the same leaf
  private boolean atSharedLeaf() {
    return _a.node() == _b.node() && _a.node().isLeaf() && _a.slot() == 0 && _b.slot() == 0;
  }

  /**
   * Climbs both paths out of the largest subtree they share, starting from a
   * shared leaf. Returns that subtree, optionally copying it to the result.
   */
  private Node<Key, Value> climbSharedSubtree(boolean copy) {
    Node<Key, Value> shared;
    do {
      shared = _b.node();
      if (_a.ascendOneLevel()) _done = true;
      if (_b.ascendOneLevel()) _done = true;
    } while (!_done && _a.node() == _b.node() && _a.slot() == 0 && _b.slot() == 0);
    if (copy)
      _builder.append(shared);
    if (!_a.isAtEnd()) _a.ascendToKey();
    if (!_b.isAtEnd()) _b.ascendToKey();
    _shared += 1;
    return shared;
  }

  // Both trees may hold more elements equal to the last key of a spliced subtree
  private void finishGroup(Key key, boolean copyFromSecond) {
    _a.skipEqual(key, null);
    _b.skipEqual(key, copyFromSecond ? _builder : null);
    _done = _a.isAtEnd() || _b.isAtEnd();
  }

  void copyCommonElementsFromSecond() {
    while (!_done && sameKey()) {
      if (atSharedLeaf()) {
        Node<Key, Value> shared = climbSharedSubtree(true);
        finishGroup(shared.last().getKey(), true);
      } else {
        // Skip the run of equal keys in the first tree and copy it from the second.
        // Neither tree may keep elements of the run, even when the other one ends.
        Key key = _a.key();
        _a.skipEqual(key, null);
        _b.skipEqual(key, _builder);
        _done = _a.isAtEnd() || _b.isAtEnd();
      }
    }
  }

  void copyMatchingNumberOfCommonElementsFromSecond() {
    while (!_done && sameKey()) {
      if (atSharedLeaf()) {
        climbSharedSubtree(true);
      } else {
        _builder.append(_b.key(), _b.value());
        _a.moveForward();
        _b.moveForward();
        _done = _a.isAtEnd() || _b.isAtEnd();
      }
    }
  }

  void skipCommonElements() {
    while (!_done && sameKey()) {
      if (_a.node() == _b.node() && _a.slot() == _b.slot()) {
        Node<Key, Value> shared = null;
        while (!_done && _a.node() == _b.node() && _a.slot() == _b.slot()) {
          shared = _a.node();
          if (_a.ascendOneLevel()) _done = true;
          if (_b.ascendOneLevel()) _done = true;
        }
        if (!_a.isAtEnd()) _a.ascendToKey();
        if (!_b.isAtEnd()) _b.ascendToKey();
        _shared += 1;
        finishGroup(shared.last().getKey(), false);
      } else {
        Key key = _a.key();
        _a.skipEqual(key, null);
        _b.skipEqual(key, null);
        _done = _a.isAtEnd() || _b.isAtEnd();
      }
    }
  }

  void skipMatchingNumberOfCommonElements() {
    while (!_done && sameKey()) {
      if (atSharedLeaf()) {
        climbSharedSubtree(false);
      } else {
        _a.moveForward();
        _b.moveForward();
        _done = _a.isAtEnd() || _b.isAtEnd();
      }
    }
  }

  // Operations against an ascending sequence of keys

  private static <Key> Key checkAscending(Key key, Key last, boolean hasLast, Comparator<Key> cmp) {
    if (hasLast && cmp.compare(last, key) > 0)
      throw new IllegalArgumentException("Keys must be in ascending order: " + key + " after " + last);
    return key;
  }

  static <Key, Value> BTree<Key, Value> subtracting(BTree<Key, Value> tree, Iterable<? extends Key> sortedKeys, MatchStrategy strategy) {
    Comparator<Key> cmp = tree._cmp;
    Path<Key, Value> path = Path.startOf(tree.share(), cmp);
    Builder<Key, Value> builder = new Builder<Key, Value>(tree._settings, cmp, false, tree._settings.maxKeys());
    Key last = null;
    boolean hasLast = false;
    if (!path.isAtEnd()) {
      outer:
      for (Key key: sortedKeys) {
        last = checkAscending(key, last, hasLast, cmp);
        hasLast = true;
        while (cmp.compare(path.key(), key) < 0) {
          path.nextPart(key, false, builder);
          if (path.isAtEnd()) break outer;
        }
        if (strategy == MatchStrategy.COUNTING_MATCHES) {
          if (cmp.compare(path.key(), key) == 0) {
            path.moveForward();
            if (path.isAtEnd()) break;
          }
        } else {
          path.skipEqual(key, null);
          if (path.isAtEnd()) break;
        }
      }
    }
    if (!path.isAtEnd()) {
      builder.append(path.key(), path.value());
      builder.appendWithoutCloning(path.suffix(builder._edit));
    }
    return builder.finish();
  }

  static <Key, Value> BTree<Key, Value> intersection(BTree<Key, Value> tree, Iterable<? extends Key> sortedKeys, MatchStrategy strategy) {
    Comparator<Key> cmp = tree._cmp;
    Path<Key, Value> path = Path.startOf(tree.share(), cmp);
    Builder<Key, Value> builder = new Builder<Key, Value>(tree._settings, cmp, false, tree._settings.maxKeys());
    Key last = null;
    boolean hasLast = false;
    if (!path.isAtEnd()) {
      outer:
      for (Key key: sortedKeys) {
        last = checkAscending(key, last, hasLast, cmp);
        hasLast = true;
        while (cmp.compare(path.key(), key) < 0) {
          path.nextPart(key, false, null);
          if (path.isAtEnd()) break outer;
        }
        if (strategy == MatchStrategy.COUNTING_MATCHES) {
          if (cmp.compare(path.key(), key) == 0) {
            builder.append(path.key(), path.value());
            path.moveForward();
            if (path.isAtEnd()) break;
          }
        } else {
          path.skipEqual(key, builder);
          if (path.isAtEnd()) break;
        }
      }
    }
    return builder.finish();
  }
}
