package com.flamingo.ai.extraction.domain.model;

/** How the field schema of a document was discovered. */
public enum DiscoveryMethod {
  /** One discovery agent over a small page sample (short documents). */
  SINGLE_AGENT,

  /** A chain of dependent discovery agents, each refining the previous findings. */
  SEQUENTIAL_CHAIN,

  /** Schema supplied by the caller; no discovery ran. */
  PROVIDED
}
