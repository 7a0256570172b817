package org.aiforge.serving;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.aiforge.FrameworkAdapters;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ModelFileLocatorTest {
  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private final ModelFileLocator locator = new ModelFileLocator();

  private Path touch(Path file) throws Exception {
    Files.createDirectories(file.getParent());
    Files.write(file, new byte[] {1});
    return file;
  }

  @Test
  public void testRegularFileIsReturnedAsIs() throws Exception {
    Path file = touch(temporaryFolder.getRoot().toPath().resolve("anything.bin"));
    Assert.assertEquals(Optional.of(file), locator.locate(file));
  }

  @Test
  public void testSavedModelDirectoryIsReturnedAsIs() throws Exception {
    Path directory = temporaryFolder.newFolder("saved").toPath();
    touch(directory.resolve(FrameworkAdapters.SAVED_MODEL_MARKER));
    touch(directory.resolve("model.pkl"));
    Assert.assertEquals(Optional.of(directory), locator.locate(directory));
  }

  @Test
  public void testConventionalNameWinsOverExtensionOrder() throws Exception {
    Path directory = temporaryFolder.newFolder("bundle").toPath();
    touch(directory.resolve("classifier.pkl"));
    Path conventional = touch(directory.resolve("model.onnx"));
    Assert.assertEquals(Optional.of(conventional), locator.locate(directory));
  }

  @Test
  public void testRecursiveSearchFollowsExtensionOrderAndSkipsAuxiliaryFiles() throws Exception {
    Path directory = temporaryFolder.newFolder("bundle").toPath();
    touch(directory.resolve("label_encoder.pkl"));
    touch(directory.resolve("tfidf_vectorizer.pkl"));
    touch(directory.resolve("weights/net.onnx"));
    Path classifier = touch(directory.resolve("weights/classifier.pt"));
    Assert.assertEquals(Optional.of(classifier), locator.locate(directory));
  }

  @Test
  public void testDirectoryWithoutModelFilesYieldsNothing() throws Exception {
    Path directory = temporaryFolder.newFolder("bundle").toPath();
    touch(directory.resolve("README.md"));
    touch(directory.resolve("scaler.pkl"));
    Assert.assertFalse(locator.locate(directory).isPresent());
  }

  @Test
  public void testMissingPathYieldsNothing() throws Exception {
    Assert.assertFalse(
        locator.locate(temporaryFolder.getRoot().toPath().resolve("missing")).isPresent());
  }

  @Test
  public void testAuxiliaryMarkers() {
    Assert.assertTrue(ModelFileLocator.isAuxiliary("label_encoder.pkl"));
    Assert.assertTrue(ModelFileLocator.isAuxiliary("bert_tokenizer.pt"));
    Assert.assertFalse(ModelFileLocator.isAuxiliary("model.pkl"));
  }
}
