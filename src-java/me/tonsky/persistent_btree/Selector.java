package me.tonsky.persistent_btree;

/**
 * Tie-break rule among elements with equal keys.
 */
public enum Selector {
  // Leftmost matching element
  FIRST,
  // Rightmost matching element
  LAST,
  // Whichever matching element the search hits first
  ANY,
  // First element with a strictly greater key
  AFTER
}
