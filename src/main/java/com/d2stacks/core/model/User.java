package com.d2stacks.core.model;

public record User(int id, String username) {}
