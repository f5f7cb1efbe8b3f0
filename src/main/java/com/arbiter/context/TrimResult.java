package com.arbiter.context;

import com.arbiter.shared.model.Message;

import java.util.List;

public record TrimResult(List<Message> messages, boolean wasTrimmed) {}
