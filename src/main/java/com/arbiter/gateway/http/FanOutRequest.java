package com.arbiter.gateway.http;

import com.arbiter.shared.model.Message;

import java.util.List;

public record FanOutRequest(List<Message> messages) {}
