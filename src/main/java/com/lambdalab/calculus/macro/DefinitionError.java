package com.lambdalab.calculus.macro;

/** Why a macro definition was rejected. The table is unchanged in every case. */
public enum DefinitionError {
    /** The body refers to a macro that is not defined. */
    UNBOUND_MACRO,
    /** The body has a free variable. */
    NON_CLOSED,
    /** The definition would make macros depend on each other in a cycle. */
    CYCLIC,
    /** The name is not an identifier starting with an uppercase letter. */
    INVALID_NAME,
    /** The definition text does not parse. */
    SYNTAX
}
