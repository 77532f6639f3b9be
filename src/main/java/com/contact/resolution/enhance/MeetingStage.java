package com.contact.resolution.enhance;

/**
 * Stage of a meeting within a contact's meeting sequence.
 */
public enum MeetingStage {
    INITIAL_CONSULTATION("Initial Consultation"),
    FOLLOW_UP("Follow-up"),
    SOLUTION_PRESENTATION("Solution Presentation"),
    DECISION_MEETING("Decision Meeting"),
    IMPLEMENTATION_KICKOFF("Implementation Kickoff"),
    PROGRESS_REVIEW("Progress Review"),
    CANCELED("Canceled");

    private final String label;

    MeetingStage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Stage for the n-th meeting (1-based). Canceled meetings are always {@link #CANCELED}.
     */
    public static MeetingStage forSequence(int sequenceNumber, boolean canceled) {
        if (canceled) {
            return CANCELED;
        }
        return switch (sequenceNumber) {
            case 1 -> INITIAL_CONSULTATION;
            case 2 -> FOLLOW_UP;
            case 3 -> SOLUTION_PRESENTATION;
            case 4 -> DECISION_MEETING;
            case 5 -> IMPLEMENTATION_KICKOFF;
            default -> {
                if (sequenceNumber < 1) {
                    throw new IllegalArgumentException("sequenceNumber must be >= 1");
                }
                yield PROGRESS_REVIEW;
            }
        };
    }
}
