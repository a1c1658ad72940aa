package com.sptjm.integration.mail;

public enum DispatchState {
    ARMED,
    CONFIRMED,
    DISPATCHING,
    DONE
}
