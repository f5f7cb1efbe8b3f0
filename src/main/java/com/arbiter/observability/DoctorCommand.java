package com.arbiter.observability;

import com.arbiter.providers.StreamingProvider;

import java.util.ArrayList;
import java.util.Map;

public class DoctorCommand {

    private final Map<String, StreamingProvider> providers;

    public DoctorCommand(Map<String, StreamingProvider> providers) {
        this.providers = providers;
    }

    public String run() {
        var results = new ArrayList<String>();
        providers.forEach((name, provider) -> results.add(checkCredentials(name, provider)));
        results.add(checkJavaVersion());
        return String.join("\n", results);
    }

    private String checkCredentials(String name, StreamingProvider provider) {
        return provider.hasCredentials()
                ? "[OK] " + name + " credentials configured"
                : "[FAIL] " + name + ": credentials not configured";
    }

    private String checkJavaVersion() {
        var ver = Runtime.version().feature();
        return ver >= 17
                ? "[OK] Java " + ver
                : "[WARN] Java " + ver + " (17+ required)";
    }
}
