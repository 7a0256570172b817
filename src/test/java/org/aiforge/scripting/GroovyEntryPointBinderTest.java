package org.aiforge.scripting;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class GroovyEntryPointBinderTest {
  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private final GroovyEntryPointBinder binder = new GroovyEntryPointBinder();

  private Path writeScript(String fileName, String... lines) throws IOException {
    Path script = temporaryFolder.getRoot().toPath().resolve(fileName);
    Files.write(script, Arrays.asList(lines), StandardCharsets.UTF_8);
    return script;
  }

  @Test
  public void testModuleFunctionsAreExposedWithTheirArity() throws Exception {
    Path script =
        writeScript(
            "inference.groovy",
            "def load_model(String path) { [path: path] }",
            "def predict(model, input) { [model.path, input] }",
            "def ready() { true }");

    ExecutableUnit unit = binder.bind(script);

    Assert.assertEquals(
        new HashSet<>(Arrays.asList("load_model", "predict", "ready")), unit.getCallableNames());
    Assert.assertEquals(1, unit.arity("load_model"));
    Assert.assertEquals(2, unit.arity("predict"));
    Assert.assertEquals(0, unit.arity("ready"));
    Assert.assertFalse(unit.hasCallable("run"));
    Assert.assertFalse(unit.hasCallable("main"));

    Object model = unit.invoke("load_model", "/models/m.bin");
    Assert.assertEquals(Arrays.asList("/models/m.bin", 3), unit.invoke("predict", model, 3));
    Assert.assertEquals(script.toAbsolutePath().normalize(), unit.getSource());
  }

  @Test
  public void testTopLevelCodeRunsOnceAtBindTime() throws Exception {
    Path script =
        writeScript(
            "stateful.groovy",
            "counter = 10",
            "def increment() { counter += 1; counter }");
    ExecutableUnit unit = binder.bind(script);
    Assert.assertEquals(11, unit.invoke("increment"));
    Assert.assertEquals(12, unit.invoke("increment"));
  }

  @Test
  public void testClosuresInTheBindingAreCallable() throws Exception {
    Path script = writeScript("closures.groovy", "predict = { x -> x * 2 }");
    ExecutableUnit unit = binder.bind(script);
    Assert.assertTrue(unit.hasCallable("predict"));
    Assert.assertEquals(1, unit.arity("predict"));
    Assert.assertEquals(8, unit.invoke("predict", 4));
  }

  @Test
  public void testVarargsCallablesHaveIndeterminateArity() throws Exception {
    Path script =
        writeScript(
            "varargs.groovy",
            "def predict(Object... args) { args.length }",
            "forward = { Object[] args -> args.length }");
    ExecutableUnit unit = binder.bind(script);
    try {
      unit.arity("predict");
      Assert.fail("Expected the arity of a varargs method to be indeterminate");
    } catch (CallableIntrospectionException e) {
      // Success
    }
    try {
      unit.arity("forward");
      Assert.fail("Expected the arity of a varargs closure to be indeterminate");
    } catch (CallableIntrospectionException e) {
      // Success
    }
  }

  @Test
  public void testArityOfAnUnknownNameIsRejected() throws Exception {
    ExecutableUnit unit = binder.bind(writeScript("empty.groovy", "def a() { 1 }"));
    try {
      unit.arity("b");
      Assert.fail("Expected an unknown callable name to be rejected");
    } catch (IllegalArgumentException e) {
      // Success
    }
  }

  @Test
  public void testExceptionsFromUserCodePropagateUnwrapped() throws Exception {
    ExecutableUnit unit =
        binder.bind(
            writeScript(
                "failing.groovy",
                "def predict(input) { throw new IllegalStateException(\"bad input: \" + input) }"));
    try {
      unit.invoke("predict", 7);
      Assert.fail("Expected the user exception to propagate");
    } catch (IllegalStateException e) {
      Assert.assertEquals("bad input: 7", e.getMessage());
    }
  }

  @Test
  public void testClassEntryPointIsInstantiated() throws Exception {
    Path script =
        writeScript(
            "sentiment_model.groovy",
            "class SentimentModel {",
            "  def load(String directory) { directory.length() }",
            "  def predict(model, input) { input * model }",
            "}");
    ExecutableUnit unit = binder.bindClass(script, "SentimentModel");
    Assert.assertTrue(unit.hasCallable("load"));
    Assert.assertTrue(unit.hasCallable("predict"));
    Assert.assertFalse(unit.hasCallable("getMetaClass"));
    Assert.assertEquals(6, unit.invoke("predict", 3, 2));
  }

  @Test
  public void testUnknownClassNameFailsToBind() throws Exception {
    Path script = writeScript("model.groovy", "class Model { def predict(x) { x } }");
    try {
      binder.bindClass(script, "OtherModel");
      Assert.fail("Expected an unknown class name to fail");
    } catch (EntryPointBindException e) {
      Assert.assertTrue(e.getCause() instanceof ClassNotFoundException);
    }
  }

  @Test
  public void testConstructorFailureIsReportedWithItsCause() throws Exception {
    Path script =
        writeScript(
            "broken_model.groovy",
            "class BrokenModel {",
            "  BrokenModel() { throw new IllegalStateException(\"no weights\") }",
            "}");
    try {
      binder.bindClass(script, "BrokenModel");
      Assert.fail("Expected a failing constructor to fail the bind");
    } catch (EntryPointBindException e) {
      Assert.assertTrue(e.getCause() instanceof IllegalStateException);
      Assert.assertTrue(e.getMessage().contains("no weights"));
    }
  }

  @Test
  public void testSyntaxErrorFailsToBind() throws Exception {
    Path script = writeScript("syntax.groovy", "def predict(x) { x +* }");
    try {
      binder.bind(script);
      Assert.fail("Expected a syntax error to fail the bind");
    } catch (EntryPointBindException e) {
      Assert.assertEquals(script.toAbsolutePath().normalize(), e.getPath());
    }
  }

  @Test
  public void testTopLevelExceptionFailsToBind() throws Exception {
    Path script =
        writeScript("raising.groovy", "throw new IllegalStateException(\"import failed\")");
    try {
      binder.bind(script);
      Assert.fail("Expected an exception in top-level code to fail the bind");
    } catch (EntryPointBindException e) {
      Assert.assertTrue(e.getMessage().contains("import failed"));
    }
  }

  @Test
  public void testFailedTopLevelAssertionFailsToBind() throws Exception {
    Path script = writeScript("guarded.groovy", "assert 1 == 2", "def predict(x) { x }");
    try {
      binder.bind(script);
      Assert.fail("Expected a failed assertion in top-level code to fail the bind");
    } catch (EntryPointBindException e) {
      Assert.assertTrue(e.getCause() instanceof AssertionError);
    }
  }

  @Test
  public void testFailedAssertionInAClosureIsRaisedAsAnException() throws Exception {
    Path script = writeScript("asserting.groovy", "predict = { x -> assert x > 0; x }");
    ExecutableUnit unit = binder.bind(script);
    Assert.assertEquals(1, unit.invoke("predict", 1));
    try {
      unit.invoke("predict", -1);
      Assert.fail("Expected the failed assertion to be raised");
    } catch (Exception e) {
      Assert.assertTrue(e.getCause() instanceof AssertionError);
    }
  }

  @Test
  public void testMissingScriptFailsToBind() {
    Path missing = temporaryFolder.getRoot().toPath().resolve("missing.groovy");
    try {
      binder.bind(missing);
      Assert.fail("Expected a missing script to fail the bind");
    } catch (EntryPointBindException e) {
      Assert.assertTrue(e.getCause() instanceof NoSuchFileException);
    }
  }

  @Test
  public void testHelperScriptsBesideTheEntryPointResolve() throws Exception {
    writeScript(
        "TextHelper.groovy",
        "class TextHelper {",
        "  static List<String> tokens(String text) { text.toLowerCase().split(/\\s+/) as List }",
        "}");
    Path script =
        writeScript("inference.groovy", "def predict(String input) { TextHelper.tokens(input) }");
    ExecutableUnit unit = binder.bind(script);
    List<?> tokens = (List<?>) unit.invoke("predict", "Great Movie");
    Assert.assertEquals(Arrays.asList("great", "movie"), tokens);
  }

  @Test
  public void testEachBindUsesAFreshNamespace() throws Exception {
    Path first = temporaryFolder.newFolder("first").toPath().resolve("model.groovy");
    Files.write(
        first,
        Collections.singletonList("def predict(x) { 'first' }"),
        StandardCharsets.UTF_8);
    Path second = temporaryFolder.newFolder("second").toPath().resolve("model.groovy");
    Files.write(
        second,
        Collections.singletonList("def predict(x) { 'second' }"),
        StandardCharsets.UTF_8);

    ExecutableUnit firstUnit = binder.bind(first);
    ExecutableUnit secondUnit = binder.bind(second);
    Assert.assertEquals("first", firstUnit.invoke("predict", 0));
    Assert.assertEquals("second", secondUnit.invoke("predict", 0));
  }
}
