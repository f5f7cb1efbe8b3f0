package com.arbiter.gateway.http;

import com.arbiter.shared.model.Message;

import java.util.List;

/**
 * {@code originalModel} is the logical id or display name that produced the answer
 * being evaluated; {@code history} is the conversation before {@code question}.
 */
public record SingleRankRequest(String question, List<Message> history, String originalModel) {}
