package org.netpreserve.hubfinder;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.netpreserve.hubfinder.predict.Strategy;
import org.netpreserve.hubfinder.validate.Evidence;
import org.netpreserve.hubfinder.validate.ValidationResult;
import org.netpreserve.hubfinder.validate.ValidationState;
import org.netpreserve.hubfinder.validate.Verdict;

import java.time.Duration;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.netpreserve.hubfinder.TestFixtures.*;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class ProgressTrackerTest {

    private static ValidationResult result(HubTarget target, Verdict verdict, boolean transientFailure,
                                           int articles) {
        var candidate = Candidate.hub(url("/world/" + target.primary().slug()), target,
                Strategy.GAZETTEER_DERIVED, 0.6);
        var urls = IntStream.range(0, articles).mapToObj(i -> url("/2024/05/story-" + i)).toList();
        return new ValidationResult(candidate, verdict, Evidence.of("test"), urls, 1, 10, transientFailure,
                List.of(ValidationState.PENDING));
    }

    @Test
    void countsVerdictsAndAdvancesPhases(Database database) {
        try (var tracker = new ProgressTracker(database.progress(), "run-1", Duration.ofHours(1))) {
            tracker.startSession();
            tracker.proposed(HubTarget.of(FRANCE));
            tracker.proposed(HubTarget.of(FRANCE));
            tracker.proposed(HubTarget.of(GERMANY));
            tracker.proposed(HubTarget.of(CHINA));
            tracker.fetched();
            assertEquals(Progress.Phase.DISCOVERY, tracker.current().phase());

            tracker.validated(result(HubTarget.of(GERMANY), Verdict.REJECTED, false, 0));
            assertEquals(Progress.Phase.VALIDATION, tracker.current().phase());
            tracker.validated(result(HubTarget.of(CHINA), Verdict.INCONCLUSIVE, true, 0));
            tracker.validated(result(HubTarget.of(FRANCE), Verdict.CONFIRMED, false, 3));

            Progress progress = tracker.current();
            assertEquals(Progress.Phase.INDEXING, progress.phase());
            assertEquals(3, progress.entitiesProposed());
            assertEquals(1, progress.entitiesValidated());
            assertEquals(1, progress.confirmed());
            assertEquals(1, progress.rejected());
            assertEquals(1, progress.inconclusive());
            assertEquals(3, progress.articles());
            assertEquals(1, progress.fetches());
            assertEquals(1, tracker.transientFailures());
            assertTrue(progress.isGapEmphasis());

            tracker.stopSession();
            tracker.stopSession();
        }

        Progress saved = database.progress().latest("run-1");
        assertEquals(Progress.Phase.COMPLETION, saved.phase());
        assertEquals(1, database.progress().countSnapshots("run-1"));
    }
}
