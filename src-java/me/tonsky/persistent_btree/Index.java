package me.tonsky.persistent_btree;

import java.util.*;

/**
 * Position in a tree: one of its elements, or the end. Valid until the tree
 * changes; using an index after that throws IllegalStateException.
 */
@SuppressWarnings("unchecked")
public class Index<Key, Value> implements Comparable<Index<Key, Value>> {
  final BTree<Key, Value> _tree;
  final int _version;
  final Path<Key, Value> _path;

  Index(BTree<Key, Value> tree, Path<Key, Value> path) {
    _tree    = tree;
    _version = tree._version;
    _path    = path;
  }

  void checkValid() {
    _tree.checkNoCursor();
    if (_tree._version != _version)
      throw new IllegalStateException("Index is stale: the tree has changed since it was created");
  }

  void checkValid(BTree<Key, Value> tree) {
    if (_tree != tree)
      throw new IllegalArgumentException("Index belongs to a different tree");
    checkValid();
  }

  public BTree<Key, Value> tree() {
    return _tree;
  }

  public int offset() {
    checkValid();
    return _path.offset();
  }

  public boolean isAtStart() {
    checkValid();
    return _path.isAtStart();
  }

  public boolean isAtEnd() {
    checkValid();
    return _path.isAtEnd();
  }

  public Key key() {
    checkValid();
    return _path.key();
  }

  public Value value() {
    checkValid();
    return _path.value();
  }

  /** Throws IllegalStateException at the end, see {@link #optionalElement()}. */
  public Map.Entry<Key, Value> element() {
    checkValid();
    return _path.element();
  }

  /** The element at this position, or empty at the end. */
  public Optional<Map.Entry<Key, Value>> optionalElement() {
    checkValid();
    return _path.optionalElement();
  }

  // In-place moves

  public void moveForward() {
    checkValid();
    _path.moveForward();
  }

  public void moveBackward() {
    checkValid();
    _path.moveBackward();
  }

  public void moveTo(int offset) {
    checkValid();
    _path.moveTo(offset);
  }

  // Copying moves

  /** The next position, or empty when this one is the end. */
  public Optional<Index<Key, Value>> successor() {
    checkValid();
    if (_path.isAtEnd())
      return Optional.empty();
    Path<Key, Value> path = _path.copy();
    path.moveForward();
    return Optional.of(new Index<Key, Value>(_tree, path));
  }

  /** The previous position, or empty when this one is the start. */
  public Optional<Index<Key, Value>> predecessor() {
    checkValid();
    if (_path.isAtStart())
      return Optional.empty();
    Path<Key, Value> path = _path.copy();
    path.moveBackward();
    return Optional.of(new Index<Key, Value>(_tree, path));
  }

  public Index<Key, Value> advancedBy(int n) {
    checkValid();
    Path<Key, Value> path = _path.copy();
    path.moveTo(_path.offset() + n);
    return new Index<Key, Value>(_tree, path);
  }

  /** Like advancedBy(n), but empty when the move would pass {@code limit}. */
  public Optional<Index<Key, Value>> advancedBy(int n, Index<Key, Value> limit) {
    limit.checkValid(_tree);
    int offset = offset();
    int bound = limit.offset();
    if (n >= 0 ? (offset <= bound && offset + n > bound) : (offset >= bound && offset + n < bound))
      return Optional.empty();
    return Optional.of(advancedBy(n));
  }

  public int distanceTo(Index<Key, Value> other) {
    other.checkValid(_tree);
    return other.offset() - offset();
  }

  @Override
  public int compareTo(Index<Key, Value> other) {
    other.checkValid(_tree);
    return Integer.compare(offset(), other.offset());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof Index))
      return false;
    Index<Key, Value> other = (Index<Key, Value>) o;
    return _tree == other._tree && _version == other._version && _path.offset() == other._path.offset();
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(_tree) + _path.offset();
  }

  @Override
  public String toString() {
    return "Index{offset=" + _path.offset() + ", version=" + _version + "}";
  }
}
