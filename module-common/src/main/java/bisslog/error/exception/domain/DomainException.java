package bisslog.error.exception.domain;

import lombok.Getter;

/**
 * Business-rule failure raised inside the system's own logic.
 *
 * <p>The category is carried by the subtype ({@link NotFound}, {@link NotAllowed}); {@code keyname}
 * is a stable machine-readable key, {@code message} the human-readable text. Callers catch the
 * subtype they care about, or this base when the category is irrelevant.
 */
@Getter
public sealed class DomainException extends RuntimeException permits NotFound, NotAllowed {

  private final String keyname;
  private final String message;

  public DomainException(String keyname, String message) {
    super(message);
    this.keyname = keyname;
    this.message = message;
  }

  // 원인 예외 체이닝
  public DomainException(String keyname, String message, Throwable cause) {
    super(message, cause);
    this.keyname = keyname;
    this.message = message;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + keyname + "]: " + message;
  }
}
