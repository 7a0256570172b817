package org.aiforge.djl;

import ai.djl.ndarray.NDArray;
import ai.djl.ndarray.NDList;
import ai.djl.ndarray.NDManager;
import ai.djl.ndarray.types.DataType;
import ai.djl.ndarray.types.Shape;
import ai.djl.repository.zoo.Criteria;
import ai.djl.repository.zoo.ZooModel;
import ai.djl.translate.NoopTranslator;
import java.nio.file.Path;
import org.aiforge.FrameworkAdapter;
import org.aiforge.Tensor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for adapters backed by a Deep Java Library engine. The raw input is coerced to a
 * float tensor, wrapped in an {@link NDList} and run through the model; the first output array is
 * returned as a {@link Tensor}. DJL predictors are not thread-safe
 */
public abstract class DjlAdapter extends FrameworkAdapter<DjlModelHandle> {
  private static final Logger logger = LoggerFactory.getLogger(DjlAdapter.class);

  /** @return The name of the DJL engine, as understood by {@link Criteria.Builder#optEngine} */
  protected abstract String getEngineName();

  @Override
  protected DjlModelHandle loadHandle(Path modelPath) throws Exception {
    Criteria<NDList, NDList> criteria =
        Criteria.builder()
            .setTypes(NDList.class, NDList.class)
            .optModelPath(modelPath)
            .optEngine(getEngineName())
            .optTranslator(new NoopTranslator())
            .build();
    ZooModel<NDList, NDList> model = criteria.loadModel();
    logger.info(
        String.format("Loaded %s model from %s with engine %s",
            getFramework().getValue(), modelPath, getEngineName()));
    return new DjlModelHandle(model);
  }

  @Override
  public Object predict(DjlModelHandle handle, Object input) throws Exception {
    Tensor tensor = Tensor.fromNested(input);
    try (NDManager manager = handle.getModel().getNDManager().newSubManager()) {
      NDArray inputArray = manager.create(tensor.toFloatArray(), new Shape(tensor.getShape()));
      NDList output = handle.getPredictor().predict(new NDList(inputArray));
      NDArray first = output.get(0);
      return Tensor.ofFloats(
          first.getShape().getShape(), first.toType(DataType.FLOAT32, false).toFloatArray());
    }
  }
}
