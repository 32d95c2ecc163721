package com.github.smc;

/**
 * This represents the order in which the printer lays out declarations. Either policy is stable:
 * dumping the re-parsed dump gives back the very same text.
 */
public enum OrderingPolicy {
  // keep the order in which declarations were written, transitions grouped under their source
  DECLARATION,
  // sort events, commands, states and transitions by name
  ALPHABETICAL;
}
