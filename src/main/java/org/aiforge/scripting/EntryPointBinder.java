package org.aiforge.scripting;

import java.nio.file.Path;

/** Binds entry-point scripts as isolated {@link ExecutableUnit ExecutableUnits} */
public interface EntryPointBinder {
  /**
   * Compiles a script and runs its top-level code once. The script's functions become the unit's
   * callables
   *
   * @throws EntryPointBindException For any failure while compiling or running the script
   */
  ExecutableUnit bind(Path script);

  /**
   * Compiles a script, then instantiates the named class with its no-argument constructor. The
   * instance's public methods become the unit's callables
   *
   * @throws EntryPointBindException For any failure while compiling, resolving or constructing
   */
  ExecutableUnit bindClass(Path script, String className);
}
