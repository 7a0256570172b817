package org.aiforge.scripting;

import groovy.lang.Binding;
import groovy.lang.GroovyClassLoader;
import groovy.lang.GroovyShell;
import groovy.lang.Script;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collections;
import org.codehaus.groovy.control.CompilerConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds Groovy entry points. Every bind compiles into a fresh class loader whose classpath holds
 * the script's directory, so helper scripts beside the entry point resolve and classes from
 * different bundles never collide
 */
public class GroovyEntryPointBinder implements EntryPointBinder {
  private static final Logger logger = LoggerFactory.getLogger(GroovyEntryPointBinder.class);

  private final ClassLoader parentClassLoader;

  public GroovyEntryPointBinder() {
    this(GroovyEntryPointBinder.class.getClassLoader());
  }

  public GroovyEntryPointBinder(ClassLoader parentClassLoader) {
    this.parentClassLoader = parentClassLoader;
  }

  @Override
  public ExecutableUnit bind(Path script) {
    Path scriptPath = requireScript(script);
    try {
      GroovyShell shell =
          new GroovyShell(parentClassLoader, new Binding(), configurationFor(scriptPath));
      Script parsed = shell.parse(scriptPath.toFile());
      parsed.run();
      GroovyExecutableUnit unit = new GroovyExecutableUnit(scriptPath, parsed);
      logger.info(
          String.format("Bound script %s with callables %s", scriptPath, unit.getCallableNames()));
      return unit;
    } catch (Exception | LinkageError | AssertionError e) {
      throw new EntryPointBindException(scriptPath, e);
    }
  }

  @Override
  public ExecutableUnit bindClass(Path script, String className) {
    Path scriptPath = requireScript(script);
    GroovyClassLoader classLoader =
        new GroovyClassLoader(parentClassLoader, configurationFor(scriptPath));
    try {
      Class<?> parsedClass = classLoader.parseClass(scriptPath.toFile());
      Class<?> targetClass =
          parsedClass.getName().equals(className)
              ? parsedClass
              : classLoader.loadClass(className);
      Object instance = targetClass.getDeclaredConstructor().newInstance();
      GroovyExecutableUnit unit = new GroovyExecutableUnit(scriptPath, instance);
      logger.info(
          String.format(
              "Bound class %s from %s with callables %s",
              className, scriptPath, unit.getCallableNames()));
      return unit;
    } catch (InvocationTargetException e) {
      throw new EntryPointBindException(scriptPath, e.getCause());
    } catch (Exception | LinkageError | AssertionError e) {
      throw new EntryPointBindException(scriptPath, e);
    }
  }

  private static Path requireScript(Path script) {
    Path scriptPath = script.toAbsolutePath().normalize();
    if (!Files.isRegularFile(scriptPath)) {
      throw new EntryPointBindException(
          scriptPath, new NoSuchFileException(scriptPath.toString()));
    }
    return scriptPath;
  }

  private static CompilerConfiguration configurationFor(Path scriptPath) {
    CompilerConfiguration configuration = new CompilerConfiguration();
    configuration.setClasspathList(
        Collections.singletonList(scriptPath.getParent().toString()));
    return configuration;
  }
}
