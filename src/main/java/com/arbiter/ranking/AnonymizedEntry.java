package com.arbiter.ranking;

public record AnonymizedEntry(String label, String content, int originalIndex) {}
