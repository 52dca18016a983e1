package common.enums;

// Lifecycle of one exam-taking session
public enum SessionState {
    EMPTY,
    IN_PROGRESS,
    SUBMITTED
}
