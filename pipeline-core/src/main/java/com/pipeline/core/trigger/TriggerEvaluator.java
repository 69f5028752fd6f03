package com.pipeline.core.trigger;

import com.pipeline.core.model.EventKind;
import com.pipeline.core.model.RepositoryEvent;
import com.pipeline.core.model.TriggerSpec;
import com.pipeline.core.util.Globs;
import java.util.Locale;

/**
 * Decides whether a repository event starts a run of a workflow.
 * 
 * Pure and deterministic: the same event and filter always yield the same decision.
 * Order of checks:
 * 1. skip marker in the commit message (case-insensitive)
 * 2. manual dispatch, which bypasses branch and path filters
 * 3. subscribed event kind
 * 4. branch allow-list (base branch for pull requests)
 * 5. ignored paths, when every changed path is ignored
 */
public class TriggerEvaluator {

    public TriggerDecision evaluate(RepositoryEvent event, TriggerSpec spec) {
        String marker = spec.skipMarker();
        if (marker != null && !marker.isEmpty()
                && event.commitMessage().toLowerCase(Locale.ROOT).contains(marker.toLowerCase(Locale.ROOT))) {
            return TriggerDecision.reject("Commit message contains skip marker " + marker);
        }

        if (event.kind() == EventKind.MANUAL_DISPATCH) {
            return spec.manualDispatch()
                ? TriggerDecision.accept("Manual dispatch")
                : TriggerDecision.reject("Manual dispatch is not enabled");
        }

        if (!spec.subscribes(event.kind())) {
            return TriggerDecision.reject("Event " + event.kind().triggerName() + " is not subscribed");
        }

        String branch = event.kind().isPullRequest() ? event.baseBranch() : event.branch();
        if (!spec.branches().isEmpty() && !Globs.matchesAny(spec.branches(), branch)) {
            return TriggerDecision.reject("Branch " + branch + " matches no branch filter " + spec.branches());
        }

        if (Globs.allMatchAny(spec.pathsIgnore(), event.changedPaths())) {
            return TriggerDecision.reject("All changed paths match paths-ignore " + spec.pathsIgnore());
        }

        return TriggerDecision.accept(event.kind().triggerName() + " on " + branch);
    }
}
