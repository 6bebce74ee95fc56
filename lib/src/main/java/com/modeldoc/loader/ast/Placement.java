package com.modeldoc.loader.ast;

/** Optional modifier after {@code ADDEQ}: where TROLL inserts the equations in the model. */
public enum Placement {
    TOP,
    BOTTOM,
    DEFAULT
}
