package com.d2stacks.core.model;

/**
 * Links to the control-plane statistics page of each service container of a stack.
 * A service without a container has an empty URL.
 */
public record D2StackStats(String core, String db, String gateway) {}
