package dev.dylanburati.oahash;

/**
 * Reported by {@link OAHashTable} operations that cannot complete. The table is
 * left as it was before the call, apart from its probe counter.
 */
public class OAHashTableException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public enum ErrorCode {
    /** Insert was given a null key, or one longer than the configured limit. */
    INVALID_KEY,
    /** The key is null, too long, or not in the table. */
    NOT_FOUND,
    /** No slot could be found or allocated for a new entry. */
    OUT_OF_MEMORY
  }

  private final ErrorCode code;

  public OAHashTableException(ErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public ErrorCode getCode() {
    return this.code;
  }
}
