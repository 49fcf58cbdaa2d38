package hydroqc.pipeline;

public enum RunState {
    RUNNING,
    COMPLETED,
    FAILED
}
