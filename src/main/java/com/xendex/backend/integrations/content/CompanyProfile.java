package com.xendex.backend.integrations.content;

import java.util.List;

public record CompanyProfile(String name, String positioning, List<String> services, List<String> proofPoints) {

    public CompanyProfile {
        services = services == null ? List.of() : List.copyOf(services);
        proofPoints = proofPoints == null ? List.of() : List.copyOf(proofPoints);
    }
}
