package com.scholary.subtitle.editor.edit;

/**
 * Exception thrown when extracted parameters cannot be turned into a mutation.
 *
 * <p>Surfaced to the user as the failure of that one request; no timeline is touched.
 */
public class EditCompileException extends RuntimeException {

  public EditCompileException(String message) {
    super(message);
  }

  public EditCompileException(String message, Throwable cause) {
    super(message, cause);
  }
}
