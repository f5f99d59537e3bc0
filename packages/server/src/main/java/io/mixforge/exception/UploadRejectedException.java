package io.mixforge.exception;

/** An upload session could not be created. No session state exists after this is thrown. */
public class UploadRejectedException extends MixForgeException {

  /** Why the upload was refused. */
  public enum Reason {
    FILE_TOO_LARGE,
    UNSUPPORTED_FORMAT,
    INVALID_REQUEST
  }

  private final Reason reason;

  public UploadRejectedException(Reason reason, String message) {
    super(MixForgeErrorCode.UPLOAD_REJECTED, message);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
