package com.arbiter.orchestration;

import java.util.List;

public record FanOutResponse(List<FanOutEntry> entries, boolean wasTrimmed) {}
