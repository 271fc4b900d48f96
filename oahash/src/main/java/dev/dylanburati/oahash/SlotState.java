package dev.dylanburati.oahash;

public enum SlotState {
  /** Never used, or freed by a PACK removal. Terminates probe sequences. */
  UNOCCUPIED,
  OCCUPIED,
  /** Tombstone left by a MARK removal. Probes walk past it; inserts may reuse it. */
  DELETED
}
