package roptim;

import java.util.List;

/** Basic error class in this project. */
public class RoptimError extends RuntimeException {

  public RoptimError(Exception wrapped) {
    super(wrapped);
  }

  public RoptimError(String message) {
    super(message);
  }

  public String getSourceReferencingMessage(List<String> sourceFile) {
    return getMessage();
  }
}
