package me.tonsky.persistent_btree;

import java.util.*;

// Fails fast once the tree changes under it
class JavaIter<Key, Value> implements Iterator<Map.Entry<Key, Value>> {
  final BTree<Key, Value> _tree;
  final int _version;
  final Path<Key, Value> _path;

  JavaIter(BTree<Key, Value> tree, Path<Key, Value> path) {
    _tree    = tree;
    _version = tree._version;
    _path    = path;
  }

  public boolean hasNext() {
    return !_path.isAtEnd();
  }

  public Map.Entry<Key, Value> next() {
    if (_tree._version != _version || _tree._cursor != null)
      throw new ConcurrentModificationException();
    if (_path.isAtEnd())
      throw new NoSuchElementException();
    Map.Entry<Key, Value> res = _path.element();
    _path.moveForward();
    return res;
  }
}
