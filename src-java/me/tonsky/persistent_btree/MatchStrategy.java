package me.tonsky.persistent_btree;

/**
 * How set operations treat elements with equal keys.
 */
public enum MatchStrategy {
  /**
   * All elements sharing a key form one group. Groups match as a whole,
   * regardless of how many elements each side holds.
   */
  GROUPING_MATCHES,

  /**
   * Keys are a multiset. Each element on one side matches at most one
   * element with the same key on the other side.
   */
  COUNTING_MATCHES
}
