package com.scholary.podfeed.acquire;

/** Receives progress events while media is being acquired. Called from the tool's output thread. */
@FunctionalInterface
public interface ProgressListener {

  void onProgress(AcquisitionProgress progress);

  static ProgressListener none() {
    return progress -> {};
  }
}
