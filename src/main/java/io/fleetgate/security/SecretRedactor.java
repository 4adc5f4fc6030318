package io.fleetgate.security;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Scrubs known secret values out of free text (process stderr, exception messages) before the
 * text is stored or logged. Multi-line secrets such as private keys are matched line by line as
 * well as whole.
 */
public final class SecretRedactor {
    private static final String MASK = "***";
    private static final int MIN_FRAGMENT_LENGTH = 8;
    private static final Pattern PEM_BLOCK = Pattern.compile(
            "-----BEGIN [A-Z0-9 ]*PRIVATE KEY-----.*?(-----END [A-Z0-9 ]*PRIVATE KEY-----|$)",
            Pattern.DOTALL
    );

    private final List<String> fragments;

    private SecretRedactor(List<String> fragments) {
        this.fragments = fragments;
    }

    public static SecretRedactor of(String... secrets) {
        List<String> out = new ArrayList<>();
        for (String secret : secrets) {
            if (secret == null || secret.isEmpty()) {
                continue;
            }
            out.add(secret);
            String trimmed = secret.trim();
            if (!trimmed.isEmpty() && !trimmed.equals(secret)) {
                out.add(trimmed);
            }
            if (secret.indexOf('\n') >= 0) {
                for (String line : secret.split("\\r?\\n")) {
                    String l = line.trim();
                    if (l.length() >= MIN_FRAGMENT_LENGTH) {
                        out.add(l);
                    }
                }
            }
        }
        // Longest first so a whole secret is replaced before any of its lines.
        out.sort(Comparator.comparingInt(String::length).reversed());
        return new SecretRedactor(List.copyOf(out));
    }

    public String redact(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String out = PEM_BLOCK.matcher(text).replaceAll(MASK);
        for (String fragment : fragments) {
            out = out.replace(fragment, MASK);
        }
        return out;
    }
}
