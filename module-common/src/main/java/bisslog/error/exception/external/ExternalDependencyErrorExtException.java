package bisslog.error.exception.external;

/**
 * The dependency on the other side of the boundary reported or caused the failure.
 *
 * <p>Subtypes split the failure the way database drivers classically do: data, operational,
 * integrity, programming and not-supported errors.
 */
public sealed class ExternalDependencyErrorExtException extends ErrorExtException
    permits DataErrorExtException, OperationalErrorExtException, IntegrityErrorExtException,
        ProgrammingErrorExtException, NotSupportedErrorExtException, InvalidDataExtException {

  public ExternalDependencyErrorExtException(String message) {
    super(message);
  }

  public ExternalDependencyErrorExtException(String message, Throwable cause) {
    super(message, cause);
  }
}
