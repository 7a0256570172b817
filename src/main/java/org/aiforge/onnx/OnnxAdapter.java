package org.aiforge.onnx;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtSession;
import java.nio.FloatBuffer;
import java.nio.file.Path;
import java.util.Collections;
import org.aiforge.Framework;
import org.aiforge.FrameworkAdapter;
import org.aiforge.Tensor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads `.onnx` models into ONNX Runtime sessions. The input is coerced to a float tensor and fed
 * to the session's first input; the value of the first output is returned as a Java array. ONNX
 * Runtime sessions support concurrent runs
 */
public class OnnxAdapter extends FrameworkAdapter<OrtSession> {
  private static final Logger logger = LoggerFactory.getLogger(OnnxAdapter.class);

  @Override
  public Framework getFramework() {
    return Framework.ONNX;
  }

  @Override
  protected OrtSession loadHandle(Path modelPath) throws Exception {
    OrtEnvironment environment = OrtEnvironment.getEnvironment();
    OrtSession.SessionOptions options = new OrtSession.SessionOptions();
    OrtSession session = environment.createSession(modelPath.toString(), options);
    logger.info(
        String.format(
            "Created ONNX Runtime session for %s with inputs %s and outputs %s",
            modelPath, session.getInputNames(), session.getOutputNames()));
    return session;
  }

  @Override
  public Object predict(OrtSession session, Object input) throws Exception {
    Tensor tensor = Tensor.fromNested(input);
    String inputName = session.getInputNames().iterator().next();
    OrtEnvironment environment = OrtEnvironment.getEnvironment();
    try (OnnxTensor inputTensor =
            OnnxTensor.createTensor(
                environment, FloatBuffer.wrap(tensor.toFloatArray()), tensor.getShape());
        OrtSession.Result result =
            session.run(Collections.singletonMap(inputName, inputTensor))) {
      // getValue copies the output into the Java heap, so it outlives the result
      OnnxValue output = result.get(0);
      return output.getValue();
    }
  }

  @Override
  public boolean isThreadSafe() {
    return true;
  }
}
