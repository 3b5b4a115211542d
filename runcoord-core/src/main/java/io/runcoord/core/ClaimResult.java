package io.runcoord.core;

/**
 * Result of trying to claim a due schedule.
 *
 * <p>Only {@link Status#CLAIMED} carries an occurrence. A conflict is the normal outcome of losing a
 * race against another coordinator and is not an error.
 */
public record ClaimResult(Status status, Occurrence occurrence) {

    public enum Status {
        CLAIMED,
        CONFLICT,
        ALREADY_RAN,
        NOT_DUE
    }

    private static final ClaimResult CONFLICT = new ClaimResult(Status.CONFLICT, null);
    private static final ClaimResult ALREADY_RAN = new ClaimResult(Status.ALREADY_RAN, null);
    private static final ClaimResult NOT_DUE = new ClaimResult(Status.NOT_DUE, null);

    public static ClaimResult claimed(Occurrence occurrence) {
        return new ClaimResult(Status.CLAIMED, occurrence);
    }

    public static ClaimResult conflict() {
        return CONFLICT;
    }

    public static ClaimResult alreadyRan() {
        return ALREADY_RAN;
    }

    public static ClaimResult notDue() {
        return NOT_DUE;
    }

    public boolean isClaimed() {
        return status == Status.CLAIMED;
    }
}
