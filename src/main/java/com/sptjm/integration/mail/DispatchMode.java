package com.sptjm.integration.mail;

public enum DispatchMode {
    /** Compose every message and report DRY-RUN without opening a connection. */
    DRY_RUN,
    LIVE
}
