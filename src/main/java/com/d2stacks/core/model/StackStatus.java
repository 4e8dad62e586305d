package com.d2stacks.core.model;

public enum StackStatus { RUNNING, STOPPED }
