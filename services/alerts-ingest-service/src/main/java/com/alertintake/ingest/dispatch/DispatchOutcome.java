package com.alertintake.ingest.dispatch;

public record DispatchOutcome(int enqueued, int failed) {

  public boolean allFailed() {
    return failed > 0 && enqueued == 0;
  }
}
