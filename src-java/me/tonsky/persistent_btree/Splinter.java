package me.tonsky.persistent_btree;

/**
 * Separator element and new right sibling produced by {@link Node#split(java.util.concurrent.atomic.AtomicBoolean)}.
 */
public class Splinter<Key, Value> {
  public final Key _key;
  public final Value _value;
  public final Node<Key, Value> _node;

  public Splinter(Key key, Value value, Node<Key, Value> node) {
    _key   = key;
    _value = value;
    _node  = node;
  }
}
