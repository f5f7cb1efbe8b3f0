package com.arbiter.providers;

/**
 * Where a logical model id goes: which adapter, and the name that backend knows it by.
 */
public record ModelRoute(String modelId, AdapterKind adapter, String nativeModel, String displayName) {}
