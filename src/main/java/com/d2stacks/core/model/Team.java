package com.d2stacks.core.model;

public record Team(int id, String name) {}
