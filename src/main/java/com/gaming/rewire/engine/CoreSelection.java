package com.gaming.rewire.engine;

/** Which side of the core/periphery split a repair pass may touch. */
public enum CoreSelection {
    NONE,
    CORE_ONLY,
    PERIPHERY_ONLY
}
