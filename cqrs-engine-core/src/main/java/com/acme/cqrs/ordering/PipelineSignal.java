package com.acme.cqrs.ordering;

/** Completion signal a version leaves behind for its successor. */
public enum PipelineSignal {
  SUCCEEDED,
  FAILED
}
