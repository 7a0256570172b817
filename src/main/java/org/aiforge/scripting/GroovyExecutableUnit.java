package org.aiforge.scripting;

import groovy.lang.Closure;
import groovy.lang.GroovyObject;
import groovy.lang.Script;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.codehaus.groovy.runtime.InvokerHelper;
import org.codehaus.groovy.runtime.InvokerInvocationException;

/**
 * An {@link ExecutableUnit} over a Groovy script or object. Callables are the public methods
 * declared by the target's own classes and, for scripts, the closures stored in the script binding
 */
class GroovyExecutableUnit implements ExecutableUnit {
  private static final Set<String> GROOVY_OBJECT_METHODS = new HashSet<>();

  static {
    for (Method method : GroovyObject.class.getMethods()) {
      GROOVY_OBJECT_METHODS.add(method.getName());
    }
    GROOVY_OBJECT_METHODS.add("main");
  }

  private final Path source;
  private final Object target;
  private final Map<String, List<Method>> methods = new LinkedHashMap<>();
  private final Map<String, Closure<?>> closures = new LinkedHashMap<>();

  GroovyExecutableUnit(Path source, Object target) {
    this.source = source;
    this.target = target;
    collectMethods(target.getClass());
    if (target instanceof Script) {
      collectClosures((Script) target);
    }
  }

  private void collectMethods(Class<?> targetClass) {
    for (Class<?> current = targetClass;
        current != null && current != Script.class && current != Object.class;
        current = current.getSuperclass()) {
      for (Method method : current.getDeclaredMethods()) {
        if (isCallable(method)) {
          methods.computeIfAbsent(method.getName(), name -> new ArrayList<>()).add(method);
        }
      }
    }
  }

  private boolean isCallable(Method method) {
    String name = method.getName();
    if (!Modifier.isPublic(method.getModifiers()) || method.isSynthetic()) {
      return false;
    }
    if (name.startsWith("$") || name.startsWith("super$") || GROOVY_OBJECT_METHODS.contains(name)) {
      return false;
    }
    // The body of a script
    return !(target instanceof Script && name.equals("run") && method.getParameterCount() == 0);
  }

  private void collectClosures(Script script) {
    for (Object entry : script.getBinding().getVariables().entrySet()) {
      Map.Entry<?, ?> variable = (Map.Entry<?, ?>) entry;
      if (variable.getValue() instanceof Closure && !methods.containsKey(variable.getKey())) {
        closures.put(String.valueOf(variable.getKey()), (Closure<?>) variable.getValue());
      }
    }
  }

  @Override
  public Path getSource() {
    return source;
  }

  @Override
  public boolean hasCallable(String name) {
    return methods.containsKey(name) || closures.containsKey(name);
  }

  @Override
  public int arity(String name) {
    Closure<?> closure = closures.get(name);
    if (closure != null) {
      Class<?>[] parameterTypes = closure.getParameterTypes();
      if (parameterTypes.length > 0 && parameterTypes[parameterTypes.length - 1].isArray()) {
        throw new CallableIntrospectionException(
            String.format("Closure `%s` accepts a variable number of arguments", name));
      }
      return closure.getMaximumNumberOfParameters();
    }
    List<Method> overloads = methods.get(name);
    if (overloads == null) {
      throw new IllegalArgumentException(
          String.format("`%s` does not define a callable named `%s`", source, name));
    }
    int arity = 0;
    for (Method method : overloads) {
      if (method.isVarArgs()) {
        throw new CallableIntrospectionException(
            String.format(
                "Method `%s` accepts a variable number of arguments: %s",
                name, Arrays.toString(method.getParameterTypes())));
      }
      arity = Math.max(arity, method.getParameterCount());
    }
    return arity;
  }

  @Override
  public Object invoke(String name, Object... args) throws Exception {
    Closure<?> closure = closures.get(name);
    try {
      if (closure != null) {
        return closure.call(args);
      }
      return InvokerHelper.invokeMethod(target, name, args);
    } catch (InvokerInvocationException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception) {
        throw (Exception) cause;
      }
      throw e;
    } catch (AssertionError e) {
      // A failed `assert` inside a closure is not wrapped by the Groovy runtime
      throw new InvokerInvocationException(e);
    }
  }

  @Override
  public Set<String> getCallableNames() {
    Set<String> names = new TreeSet<>(methods.keySet());
    names.addAll(closures.keySet());
    return names;
  }

  @Override
  public String toString() {
    return String.format("GroovyExecutableUnit(%s)", source);
  }
}
