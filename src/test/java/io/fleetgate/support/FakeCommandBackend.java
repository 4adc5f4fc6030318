package io.fleetgate.support;

import io.fleetgate.command.CommandBackend;
import io.fleetgate.command.CommandCallback;
import io.fleetgate.command.SubmissionHandle;
import io.fleetgate.error.ConnectivityException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Records submissions and hands the callback back to the test, which decides when (and whether)
 * the ack and result arrive.
 */
public final class FakeCommandBackend implements CommandBackend {
    private final List<Submission> submissions = new CopyOnWriteArrayList<>();
    private final Map<String, CommandCallback> callbacksByPayload = new ConcurrentHashMap<>();
    private final List<Resumption> resumptions = new CopyOnWriteArrayList<>();
    private final AtomicInteger sequence = new AtomicInteger();
    private volatile boolean failSubmit;
    private volatile boolean ackImmediately;

    public void setFailSubmit(boolean failSubmit) {
        this.failSubmit = failSubmit;
    }

    public void setAckImmediately(boolean ackImmediately) {
        this.ackImmediately = ackImmediately;
    }

    public List<Submission> submissions() {
        return List.copyOf(submissions);
    }

    public CommandCallback callbackFor(String payload) {
        return callbacksByPayload.get(payload);
    }

    public List<Resumption> resumptions() {
        return List.copyOf(resumptions);
    }

    @Override
    public SubmissionHandle submit(String targetMinionId, String payload, long timeoutMs, CommandCallback callback) {
        if (failSubmit) {
            throw new ConnectivityException("salt-api returned status 503");
        }
        String jid = "2026101900000" + sequence.incrementAndGet();
        submissions.add(new Submission(targetMinionId, payload, timeoutMs, jid));
        callbacksByPayload.put(payload, callback);
        if (ackImmediately) {
            callback.onAck();
        }
        return new SubmissionHandle(jid);
    }

    @Override
    public void resume(String targetMinionId, SubmissionHandle handle, long deadlineMs, CommandCallback callback) {
        resumptions.add(new Resumption(targetMinionId, handle.value(), deadlineMs, callback));
    }

    public record Resumption(String target, String jid, long deadlineMs, CommandCallback callback) {
    }

    public record Submission(String target, String payload, long timeoutMs, String jid) {
    }
}
