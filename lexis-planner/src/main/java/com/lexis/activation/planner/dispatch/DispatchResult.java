package com.lexis.activation.planner.dispatch;

import com.lexis.activation.api.model.EvaluationOutcome;
import com.lexis.activation.api.model.PlanWarning;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Verdicts for the modules of one dispatch.
 *
 * @param verdicts     module id to ACTIVATE or SKIP, one entry per requested module
 * @param warnings     incomplete response or dispatch failure notes for the plan
 * @param fromCache    true when answered from the verdict cache without a reasoner call
 * @param failedClosed true when the reasoner was not heard and every module was skipped
 */
public record DispatchResult(
        Map<String, EvaluationOutcome> verdicts,
        List<PlanWarning> warnings,
        boolean fromCache,
        boolean failedClosed
) {

    private static final DispatchResult EMPTY = new DispatchResult(Map.of(), List.of(), false, false);

    public DispatchResult {
        verdicts = Map.copyOf(verdicts);
        warnings = List.copyOf(warnings);
    }

    public static DispatchResult empty() {
        return EMPTY;
    }

    public static DispatchResult failClosed(Collection<String> moduleIds, PlanWarning warning) {
        Map<String, EvaluationOutcome> skipped = new LinkedHashMap<>();
        moduleIds.forEach(id -> skipped.put(id, EvaluationOutcome.SKIP));
        return new DispatchResult(skipped, List.of(warning), false, true);
    }

    public EvaluationOutcome verdictFor(String moduleId) {
        return verdicts.getOrDefault(moduleId, EvaluationOutcome.SKIP);
    }
}
