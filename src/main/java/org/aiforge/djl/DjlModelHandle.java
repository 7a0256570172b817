package org.aiforge.djl;

import ai.djl.inference.Predictor;
import ai.djl.ndarray.NDList;
import ai.djl.repository.zoo.ZooModel;

/** A DJL model together with the single predictor used to run it */
public class DjlModelHandle {
  private final ZooModel<NDList, NDList> model;
  private final Predictor<NDList, NDList> predictor;

  DjlModelHandle(ZooModel<NDList, NDList> model) {
    this.model = model;
    this.predictor = model.newPredictor();
  }

  public ZooModel<NDList, NDList> getModel() {
    return model;
  }

  Predictor<NDList, NDList> getPredictor() {
    return predictor;
  }
}
