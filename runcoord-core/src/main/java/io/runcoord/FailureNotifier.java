package io.runcoord;

import io.runcoord.core.Occurrence;
import io.runcoord.core.OccurrenceOutcome;
import io.runcoord.core.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Called once when an occurrence of a schedule with failure notifications enabled ends as failed.
 */
public interface FailureNotifier {

    void onTerminalFailure(Schedule schedule, Occurrence occurrence, OccurrenceOutcome outcome);

    /**
     * Notifier that only writes a log line.
     */
    static FailureNotifier logging() {
        Logger log = LoggerFactory.getLogger(FailureNotifier.class);
        return (schedule, occurrence, outcome) -> log.warn(
                "runcoord failure notification scheduleId={} userId={} scheduledFor={} kind={} summary={}",
                schedule.id(),
                schedule.userId(),
                occurrence.scheduledFor(),
                outcome.failureKind(),
                outcome.summary());
    }
}
