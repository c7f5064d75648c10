package com.anthem.csrfp.core.model;

public enum Verdict {
    ALLOWED,
    DENIED
}
