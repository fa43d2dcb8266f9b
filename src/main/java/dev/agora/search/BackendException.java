package dev.agora.search;

/** An engine failed to deliver results; reported as an unresponsive engine. */
public class BackendException extends Exception {

  private final String errorType;
  private final boolean suspended;

  /**
   * @param errorType short classification shown to the user ("HTTP error", "CAPTCHA", ...)
   * @param message details for the log
   * @param suspended whether the engine has been suspended because of this failure
   */
  public BackendException(String errorType, String message, boolean suspended) {
    super(message);
    this.errorType = errorType;
    this.suspended = suspended;
  }

  public BackendException(String errorType, String message, Throwable cause) {
    super(message, cause);
    this.errorType = errorType;
    this.suspended = false;
  }

  public String getErrorType() {
    return errorType;
  }

  public boolean isSuspended() {
    return suspended;
  }
}
