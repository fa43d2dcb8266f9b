package dev.agora.aggregation;

import dev.agora.result.Result;

/**
 * Thrown when an engine hands over a typed result the container has no ingestion route for. This
 * signals a programming error in the engine or in an extension, not bad input.
 */
public class UnsupportedResultTypeException extends RuntimeException {

  private final transient Result result;

  public UnsupportedResultTypeException(Result result) {
    super("No handler implemented to process the result of type " + result.kind() + ": " + result);
    this.result = result;
  }

  public Result getResult() {
    return result;
  }
}
