package com.example.render_tracker.util;

public enum DispatchKind {
    AUTO_PUBLISH,
    SESSION_STAGE
}
