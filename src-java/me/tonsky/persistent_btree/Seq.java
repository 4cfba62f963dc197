package me.tonsky.persistent_btree;

import java.util.*;
import clojure.lang.*;

// Over frozen nodes only, so it never sees later changes to the tree
@SuppressWarnings("unchecked")
class Seq<Key, Value> extends ASeq implements IReduce, Counted {
  final Path<Key, Value> _path;

  Seq(IPersistentMap meta, Path<Key, Value> path) {
    super(meta);
    assert !path.isAtEnd();
    _path = path;
  }

  // ASeq
  public Object first() {
    return _path.element();
  }

  public Seq<Key, Value> next() {
    Path<Key, Value> path = _path.copy();
    path.moveForward();
    return path.isAtEnd() ? null : new Seq<Key, Value>(meta(), path);
  }

  public Obj withMeta(IPersistentMap meta) {
    if (meta() == meta) return this;
    return new Seq<Key, Value>(meta, _path);
  }

  // Counted
  public int count() {
    return _path.count() - _path.offset();
  }

  // IReduce
  public Object reduce(IFn f) {
    Path<Key, Value> path = _path.copy();
    Object ret = path.element();
    path.moveForward();
    while (!path.isAtEnd()) {
      ret = f.invoke(ret, path.element());
      if (ret instanceof Reduced)
        return ((Reduced) ret).deref();
      path.moveForward();
    }
    return ret;
  }

  public Object reduce(IFn f, Object start) {
    Path<Key, Value> path = _path.copy();
    Object ret = start;
    do {
      ret = f.invoke(ret, path.element());
      if (ret instanceof Reduced)
        return ((Reduced) ret).deref();
      path.moveForward();
    } while (!path.isAtEnd());
    return ret;
  }

  // Iterable
  public Iterator iterator() {
    Path<Key, Value> path = _path.copy();
    return new Iterator() {
      public boolean hasNext() { return !path.isAtEnd(); }
      public Object next() {
        if (path.isAtEnd())
          throw new NoSuchElementException();
        Object res = path.element();
        path.moveForward();
        return res;
      }
    };
  }
}
