package org.aiforge.djl;

import org.aiforge.Framework;

/** Loads TorchScript `.pt` / `.pth` files through the DJL PyTorch engine */
public class PyTorchAdapter extends DjlAdapter {
  @Override
  public Framework getFramework() {
    return Framework.PYTORCH;
  }

  @Override
  protected String getEngineName() {
    return "PyTorch";
  }
}
