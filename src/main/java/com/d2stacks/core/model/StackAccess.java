package com.d2stacks.core.model;

/**
 * Who may see and act on a stack.
 */
public enum StackAccess {
    /** Every control-plane user. */
    PUBLIC,
    /** Only the listed teams and users. */
    RESTRICTED,
    /** Administrators only. */
    ADMIN
}
