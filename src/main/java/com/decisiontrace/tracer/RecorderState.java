package com.decisiontrace.tracer;

public enum RecorderState {
    OPEN,
    FINALIZED
}
