package io.github.drompincen.clawgate.runtime.tools;

public interface ToolStream {

    ToolStream NOOP = new ToolStream() {
        @Override public void stdoutDelta(String text) { }
        @Override public void stderrDelta(String text) { }
        @Override public void progress(int percent, String message) { }
    };

    void stdoutDelta(String text);

    void stderrDelta(String text);

    void progress(int percent, String message);
}
