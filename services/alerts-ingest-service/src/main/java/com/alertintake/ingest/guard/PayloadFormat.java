package com.alertintake.ingest.guard;

/** Body encodings an integration endpoint may accept. */
public enum PayloadFormat {
  JSON,
  FORM,
  // Amazon SNS posts its JSON envelope as text/plain
  TEXT
}
