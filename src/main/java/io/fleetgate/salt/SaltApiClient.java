package io.fleetgate.salt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.fleetgate.command.CommandBackend;
import io.fleetgate.command.CommandCallback;
import io.fleetgate.command.SubmissionHandle;
import io.fleetgate.config.FleetSettings;
import io.fleetgate.error.ConnectivityException;
import io.fleetgate.trust.TrustBackend;
import io.fleetgate.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Trust and command backend speaking the salt-api REST interface.
 *
 * <p>Key operations go through the {@code wheel} client. Commands are submitted with
 * {@code local_async cmd.run_all}; the returned job id is acknowledged at once and then polled on
 * {@code /jobs/{jid}} until the minion reports or the execution deadline plus a grace period has
 * passed. After that the dispatcher's watchdog owns the execution. Jobs submitted by another
 * process, or before a restart, are picked up again through {@link #resume}.
 */
public final class SaltApiClient implements TrustBackend, CommandBackend, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SaltApiClient.class);
    private static final Duration TOKEN_TTL = Duration.ofHours(11);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final long POLL_GRACE_MS = 30_000L;

    private final String baseUrl;
    private final String username;
    private final String password;
    private final String eauth;
    private final long pollIntervalMs;
    private final HttpClient http;
    private final Clock clock;
    private final ScheduledExecutorService poller;
    private final Set<String> polledJobs = ConcurrentHashMap.newKeySet();
    private final AtomicReference<SessionToken> session = new AtomicReference<>();

    public SaltApiClient(String baseUrl, String username, String password, String eauth, long pollIntervalMs, HttpClient http, Clock clock) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("salt api url cannot be empty");
        }
        this.baseUrl = baseUrl.trim().endsWith("/") ? baseUrl.trim().substring(0, baseUrl.trim().length() - 1) : baseUrl.trim();
        this.username = username;
        this.password = password == null ? "" : password;
        this.eauth = eauth;
        this.pollIntervalMs = Math.max(100L, pollIntervalMs);
        this.http = http;
        this.clock = clock;
        this.poller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "fleetgate-salt-job-poller");
            thread.setDaemon(true);
            return thread;
        });
    }

    public static SaltApiClient fromSettings(FleetSettings settings, Clock clock) {
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        return new SaltApiClient(
                settings.saltApiUrl(),
                settings.saltApiUsername(),
                settings.saltApiPassword(),
                settings.saltApiEauth(),
                settings.saltPollIntervalMs(),
                http,
                clock
        );
    }

    @Override
    public Optional<String> lookupFingerprint(String minionId) {
        JsonNode response = call(wheel("key.finger", minionId));
        JsonNode data = response.path("return").path(0).path("data").path("return");
        String pending = data.path("minions_pre").path(minionId).asText("");
        if (!pending.isBlank()) {
            return Optional.of(pending);
        }
        String accepted = data.path("minions").path(minionId).asText("");
        return accepted.isBlank() ? Optional.empty() : Optional.of(accepted);
    }

    @Override
    public void admitToFleet(String minionId) {
        JsonNode response = call(wheel("key.accept", minionId));
        JsonNode data = response.path("return").path(0).path("data");
        if (!data.path("success").asBoolean(false)) {
            throw new ConnectivityException("salt-api did not confirm key.accept for " + minionId);
        }
        log.info("salt-api accepted key for {}", minionId);
    }

    @Override
    public SubmissionHandle submit(String targetMinionId, String payload, long timeoutMs, CommandCallback callback) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("client", "local_async");
        body.put("tgt", targetMinionId);
        body.put("fun", "cmd.run_all");
        body.put("arg", List.of(payload));
        body.put("timeout", Math.max(1L, timeoutMs / 1000L));
        JsonNode response = call(body);
        String jid = response.path("return").path(0).path("jid").asText("");
        if (jid.isBlank()) {
            throw new ConnectivityException("salt-api returned no job id for target " + targetMinionId);
        }
        callback.onAck();
        long pollUntilMs = clock.millis() + timeoutMs + POLL_GRACE_MS;
        if (polledJobs.add(jid)) {
            schedulePoll(new JobPoll(jid, targetMinionId, callback, pollUntilMs));
        }
        return new SubmissionHandle(jid);
    }

    @Override
    public void resume(String targetMinionId, SubmissionHandle handle, long deadlineMs, CommandCallback callback) {
        String jid = handle.value();
        if (jid == null || jid.isBlank() || !polledJobs.add(jid)) {
            return;
        }
        log.info("Resuming poll of salt job {} for {}", jid, targetMinionId);
        schedulePoll(new JobPoll(jid, targetMinionId, callback, deadlineMs + POLL_GRACE_MS));
    }

    @Override
    public void close() {
        poller.shutdownNow();
    }

    private void schedulePoll(JobPoll poll) {
        try {
            poller.schedule(poll, pollIntervalMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            polledJobs.remove(poll.jid);
            log.debug("Salt job poller stopped, leaving job {} to the next resume", poll.jid);
        }
    }

    /**
     * Extracts a minion's {@code cmd.run_all} result from a {@code /jobs/{jid}} response, or
     * empty while the minion has not reported.
     */
    static Optional<JobResult> parseJobResult(JsonNode response, String minionId) {
        JsonNode entry = response.path("return").path(0).path(minionId);
        if (entry.isMissingNode() || entry.isNull()) {
            return Optional.empty();
        }
        if (!entry.isObject()) {
            // Minion answered with a plain string, typically a salt error message.
            return Optional.of(new JobResult(1, entry.asText("")));
        }
        int retcode = entry.path("retcode").asInt(1);
        String stdout = entry.path("stdout").asText("");
        String stderr = entry.path("stderr").asText("");
        String output = stderr.isBlank() ? stdout : (stdout.isBlank() ? stderr : stdout + "\n" + stderr);
        return Optional.of(new JobResult(retcode, output));
    }

    private Map<String, Object> wheel(String fun, String minionId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("client", "wheel");
        body.put("fun", fun);
        body.put("match", minionId);
        return body;
    }

    private JsonNode call(Map<String, Object> body) {
        String json;
        try {
            json = Jsons.mapper().writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode salt-api request", e);
        }
        HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(baseUrl + "/"))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8)), true);
        return readTree(response.body());
    }

    private JsonNode getJob(String jid) {
        String path = "/jobs/" + URLEncoder.encode(jid, StandardCharsets.UTF_8);
        HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json")
                .GET(), true);
        return readTree(response.body());
    }

    private HttpResponse<String> send(HttpRequest.Builder request, boolean retryOnUnauthorized) {
        SessionToken current = token();
        HttpResponse<String> response;
        try {
            response = http.send(request.copy().header("X-Auth-Token", current.value()).build(),
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConnectivityException("salt-api request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectivityException("salt-api request interrupted", e);
        }
        if (response.statusCode() == 401 && retryOnUnauthorized) {
            session.compareAndSet(current, null);
            return send(request, false);
        }
        if (response.statusCode() / 100 != 2) {
            throw new ConnectivityException("salt-api returned status " + response.statusCode());
        }
        return response;
    }

    /**
     * Returns the cached session token, logging in when it is missing or expired. The login runs
     * without a lock; concurrent refreshes each get a valid token and the last one is cached.
     */
    private SessionToken token() {
        long now = clock.millis();
        SessionToken cached = session.get();
        if (cached != null && now < cached.expiresAtMs()) {
            return cached;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("username", username);
        body.put("password", password);
        body.put("eauth", eauth);
        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/login"))
                    .timeout(REQUEST_TIMEOUT)
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(Jsons.mapper().writeValueAsString(body), StandardCharsets.UTF_8))
                    .build();
            response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConnectivityException("salt-api login failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectivityException("salt-api login interrupted", e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new ConnectivityException("salt-api login returned status " + response.statusCode());
        }
        String issued = readTree(response.body()).path("return").path(0).path("token").asText("");
        if (issued.isBlank()) {
            throw new ConnectivityException("salt-api login returned no token");
        }
        SessionToken fresh = new SessionToken(issued, now + TOKEN_TTL.toMillis());
        session.set(fresh);
        return fresh;
    }

    private static JsonNode readTree(String body) {
        try {
            return Jsons.mapper().readTree(body == null || body.isBlank() ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw new ConnectivityException("salt-api returned malformed JSON", e);
        }
    }

    record JobResult(int exitCode, String output) {
    }

    private record SessionToken(String value, long expiresAtMs) {
    }

    private final class JobPoll implements Runnable {
        private final String jid;
        private final String minionId;
        private final CommandCallback callback;
        private final long pollUntilMs;

        private JobPoll(String jid, String minionId, CommandCallback callback, long pollUntilMs) {
            this.jid = jid;
            this.minionId = minionId;
            this.callback = callback;
            this.pollUntilMs = pollUntilMs;
        }

        @Override
        public void run() {
            try {
                Optional<JobResult> result = parseJobResult(getJob(jid), minionId);
                if (result.isPresent()) {
                    callback.onResult(result.get().exitCode(), result.get().output());
                    polledJobs.remove(jid);
                    return;
                }
            } catch (ConnectivityException e) {
                log.warn("Polling salt job {} failed: {}", jid, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Handling salt job {} for {} failed, polling again", jid, minionId, e);
            }
            if (clock.millis() >= pollUntilMs) {
                polledJobs.remove(jid);
                log.info("Stopped polling salt job {} for {}: deadline passed", jid, minionId);
                return;
            }
            schedulePoll(this);
        }
    }
}
