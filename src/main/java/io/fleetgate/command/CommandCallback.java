package io.fleetgate.command;

/** Backend notifications for one execution. Late or duplicate calls are tolerated. */
public interface CommandCallback {
    void onAck();

    void onResult(int exitCode, String output);
}
