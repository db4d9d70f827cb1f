package ca.gc.cra.tether.application.stage;

import ca.gc.cra.tether.application.port.TransportException;

/**
 * The provisioning service answered a registration request with a non-success status. Throttling ({@code 429})
 * and server errors ({@code 5xx}) are transient, so the retry stage re-issues the registration.
 *
 * @since 0.1.0
 */
public final class RegistrationFailedException extends TransportException {
  private static final long serialVersionUID = 1L;

  private final int status;
  private final String responseBody;

  /**
   * Creates the exception.
   *
   * @param status status code from the response topic
   * @param responseBody response body as text; may be empty
   */
  public RegistrationFailedException(int status, String responseBody) {
    super("registration rejected with status " + status, status == 429 || status >= 500);
    this.status = status;
    this.responseBody = responseBody == null ? "" : responseBody;
  }

  public int status() {
    return status;
  }

  public String responseBody() {
    return responseBody;
  }
}
