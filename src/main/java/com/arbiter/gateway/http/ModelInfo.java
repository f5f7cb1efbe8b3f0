package com.arbiter.gateway.http;

public record ModelInfo(String id, String name, String adapter) {}
