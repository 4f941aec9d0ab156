package com.example.render_tracker.util;

public enum DispatchStatus {
    PENDING,
    SUCCEEDED,
    FAILED
}
