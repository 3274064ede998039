package com.harvestlink.provenance.event;

public enum SynchronizerState {
    STOPPED,
    STARTING,
    LISTENING
}
