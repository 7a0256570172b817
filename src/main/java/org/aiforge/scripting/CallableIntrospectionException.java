package org.aiforge.scripting;

/** The number of arguments accepted by a callable cannot be determined */
public class CallableIntrospectionException extends RuntimeException {
  public CallableIntrospectionException(String message) {
    super(message);
  }
}
