package com.dcruver.regmetrics.history;

public enum WalkState {
    AT_LATEST,
    WALKING,
    DONE
}
