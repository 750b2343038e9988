package com.flamingo.ai.pdftools.testutil;

import java.util.concurrent.Executor;

/** Runs tasks on the calling thread so OCR tests are deterministic. */
public class SyncExecutor implements Executor {
  @Override
  public void execute(Runnable command) {
    command.run();
  }
}
