package io.fleetgate.security;

import io.fleetgate.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bearer-token table for the HTTP API, loaded from {@code auth.json}:
 * <pre>{"principals":[{"id":"alice","role":"operator","tokens":["..."]}]}</pre>
 * An empty table disables authentication and every request runs as a local admin.
 */
public final class OperatorAuth {
    private final Map<String, OperatorPrincipal> tokenToPrincipal;

    private OperatorAuth(Map<String, OperatorPrincipal> tokenToPrincipal) {
        this.tokenToPrincipal = Map.copyOf(tokenToPrincipal);
    }

    public static OperatorAuth disabled() {
        return new OperatorAuth(Map.of());
    }

    public static OperatorAuth of(Map<String, OperatorPrincipal> tokens) {
        return new OperatorAuth(tokens == null ? Map.of() : tokens);
    }

    public static OperatorAuth load(Path file) {
        if (file == null || !Files.exists(file)) {
            return disabled();
        }
        AuthFile body;
        try {
            body = Jsons.mapper().readValue(file.toFile(), AuthFile.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load auth file: " + file, e);
        }
        LinkedHashMap<String, OperatorPrincipal> tokens = new LinkedHashMap<>();
        if (body == null || body.principals() == null) {
            return new OperatorAuth(tokens);
        }
        for (PrincipalFile principal : body.principals()) {
            if (principal == null || principal.id() == null || principal.id().isBlank() || principal.tokens() == null) {
                continue;
            }
            OperatorPrincipal model = new OperatorPrincipal(principal.id(), OperatorRole.parse(principal.role()));
            for (String token : principal.tokens()) {
                if (token != null && !token.isBlank()) {
                    tokens.put(token.trim(), model);
                }
            }
        }
        return new OperatorAuth(tokens);
    }

    public boolean enabled() {
        return !tokenToPrincipal.isEmpty();
    }

    public OperatorPrincipal resolve(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        return tokenToPrincipal.get(token.trim());
    }

    private record AuthFile(List<PrincipalFile> principals) {
    }

    private record PrincipalFile(String id, String role, List<String> tokens) {
    }
}
