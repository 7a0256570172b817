package org.aiforge.serving;

import java.util.List;
import org.aiforge.utils.SerializationUtils;
import org.junit.Assert;
import org.junit.Test;

public class ResolutionTraceTest {
  @Test
  public void testEntriesAreRecordedInOrder() {
    ResolutionTrace trace = new ResolutionTrace();
    trace.skipped(LoadStrategy.MANIFEST, "model_config.json", "absent");
    trace.failed(LoadStrategy.AUTO_DETECT, "load", "raised");
    trace.succeeded(LoadStrategy.FRAMEWORK, "load", "sklearn adapter");

    List<ResolutionTrace.Entry> entries = trace.getEntries();
    Assert.assertEquals(3, entries.size());
    Assert.assertEquals(ResolutionTrace.Outcome.SKIPPED, entries.get(0).getOutcome());
    Assert.assertEquals(LoadStrategy.AUTO_DETECT, entries.get(1).getStrategy());
    Assert.assertEquals("sklearn adapter", entries.get(2).getReason());
  }

  @Test
  public void testFrozenTraceRejectsNewEntries() {
    ResolutionTrace trace = new ResolutionTrace();
    trace.succeeded(LoadStrategy.MANIFEST, "validate", "ok");
    List<ResolutionTrace.Entry> snapshot = trace.getEntries();
    trace.freeze();
    Assert.assertTrue(trace.isFrozen());
    try {
      trace.failed(LoadStrategy.MANIFEST, "bind", "late");
      Assert.fail("Expected a frozen trace to reject entries");
    } catch (IllegalStateException e) {
      // Success
    }
    Assert.assertEquals(snapshot.size(), trace.getEntries().size());
  }

  @Test
  public void testEntriesSerializeWithWireNames() throws Exception {
    ResolutionTrace trace = new ResolutionTrace();
    trace.skipped(LoadStrategy.CUSTOM_SCRIPT, "-", "no custom inference script was specified");
    String json = SerializationUtils.toJson(trace.getEntries());
    Assert.assertTrue(json.contains("\"strategy\":\"custom_script\""));
    Assert.assertTrue(json.contains("\"outcome\":\"SKIPPED\""));
  }
}
