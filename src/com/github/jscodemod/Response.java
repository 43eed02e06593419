package com.github.jscodemod;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * The outcome of one facade call. An ok response carries the payload, an error
 * response carries the message of the failure. Both are tagged with the
 * operation that produced them.
 */
public final class Response<T> {

  public enum Status {
    OK, ERROR
  }

  private final Status status;

  private final Operation operation;

  private final T payload;

  private final String message;


  private Response(Status status, Operation operation, T payload, String message) {
    this.status = status;
    this.operation = Preconditions.checkNotNull(operation);
    this.payload = payload;
    this.message = message;
  }


  public static <T> Response<T> ok(Operation operation, T payload) {
    return new Response<T>(Status.OK, operation, Preconditions.checkNotNull(payload), null);
  }


  public static <T> Response<T> error(Operation operation, String message) {
    return new Response<T>(Status.ERROR, operation, null, Preconditions.checkNotNull(message));
  }


  public Status getStatus() {
    return status;
  }


  public boolean isOk() {
    return status == Status.OK;
  }


  public Operation getOperation() {
    return operation;
  }


  /**
   * @return the payload of an ok response.
   * @throws IllegalStateException if this is an error response.
   */
  public T getPayload() {
    Preconditions.checkState(isOk(), "%s failed: %s", operation.getName(), message);
    return payload;
  }


  public String getMessage() {
    return message;
  }


  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("status", status)
        .add("operation", operation.getName())
        .add("payload", payload)
        .add("message", message)
        .omitNullValues()
        .toString();
  }
}
