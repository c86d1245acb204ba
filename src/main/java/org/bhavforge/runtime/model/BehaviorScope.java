package org.bhavforge.runtime.model;

/**
 * Visibility class of a behavior, derived from its id.
 */
public enum BehaviorScope {
    /** Ids below 4096: shared by every object in the game. */
    GLOBAL,
    /** Ids 4096-8191: private to one object. */
    PRIVATE,
    /** Ids 8192 and above: shared by the objects of one semi-global group. */
    SEMI_GLOBAL;

    public static final int PRIVATE_BASE = 0x1000;
    public static final int SEMI_GLOBAL_BASE = 0x2000;

    public static BehaviorScope fromId(int id) {
        if (id < PRIVATE_BASE) {
            return GLOBAL;
        }
        if (id < SEMI_GLOBAL_BASE) {
            return PRIVATE;
        }
        return SEMI_GLOBAL;
    }
}
