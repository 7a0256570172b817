package org.aiforge.scripting;

import java.nio.file.Path;
import java.util.Set;

/**
 * A bound entry point, treated as an opaque namespace of named callables. Units make no thread
 * safety guarantees
 */
public interface ExecutableUnit {
  /** @return The script the unit was bound from */
  Path getSource();

  /** @return `true` if the unit exposes a callable with the specified name */
  boolean hasCallable(String name);

  /**
   * @return The number of positional arguments the callable accepts. For overloaded methods, the
   *     largest parameter count
   * @throws CallableIntrospectionException If the arity is indeterminate, e.g. for varargs
   * @throws IllegalArgumentException If the unit has no callable with this name
   */
  int arity(String name);

  /**
   * Invokes the named callable with positional arguments
   *
   * @return The callable's result, which may be null
   * @throws Exception Whatever the user code throws
   */
  Object invoke(String name, Object... args) throws Exception;

  /** @return The names of every callable, sorted */
  Set<String> getCallableNames();
}
