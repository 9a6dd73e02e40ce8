package com.ruach.formation.application.service;

import java.util.ArrayList;
import java.util.List;

import com.ruach.formation.domain.entity.FormationGap;
import com.ruach.formation.domain.entity.FormationState;
import com.ruach.formation.domain.entity.ReadinessIndicators;
import com.ruach.formation.domain.event.EventPayload;
import com.ruach.formation.domain.event.FormationGapDetected;
import com.ruach.formation.domain.event.ReadinessLevelChanged;
import com.ruach.formation.domain.valueobject.GapSeverity;
import com.ruach.formation.domain.valueobject.GapType;
import com.ruach.formation.domain.valueobject.ReadinessDimension;
import com.ruach.formation.domain.valueobject.RedFlag;

/**
 * Turns a fresh readiness analysis into events, as a step separate from the
 * analysis itself.
 * <p>
 * One ReadinessLevelChanged per dimension that moved, one
 * FormationGapDetected per red flag that has no gap recorded yet.
 * </p>
 */
public class ReadinessRecommender {

    private static final String REASON = "Derived from formation activity";

    public List<EventPayload> recommend(FormationState state, ReadinessIndicators current) {
        ReadinessIndicators previous = state.getReadiness();
        List<EventPayload> payloads = new ArrayList<>();

        if (previous.getReflectionDepth() != current.getReflectionDepth()) {
            payloads.add(new ReadinessLevelChanged(ReadinessDimension.REFLECTION_DEPTH,
                    previous.getReflectionDepth().name(), current.getReflectionDepth().name(), REASON));
        }
        if (previous.getPace() != current.getPace()) {
            payloads.add(new ReadinessLevelChanged(ReadinessDimension.PACE,
                    previous.getPace().name(), current.getPace().name(), REASON));
        }
        if (previous.getCanonEngagement() != current.getCanonEngagement()) {
            payloads.add(new ReadinessLevelChanged(ReadinessDimension.CANON_ENGAGEMENT,
                    previous.getCanonEngagement().name(), current.getCanonEngagement().name(), REASON));
        }

        for (RedFlag flag : current.getRedFlags()) {
            FormationGapDetected gap = gapFor(flag);
            if (!previous.hasRedFlag(flag) && !isRecorded(state, gap)) {
                payloads.add(gap);
            }
        }
        return payloads;
    }

    private static boolean isRecorded(FormationState state, FormationGapDetected gap) {
        for (FormationGap recorded : state.getFormationGaps()) {
            if (recorded.getType() == gap.getGapType() && recorded.getArea().equals(gap.getArea())) {
                return true;
            }
        }
        return false;
    }

    private static FormationGapDetected gapFor(RedFlag flag) {
        return switch (flag) {
            case SPEED_RUNNING -> new FormationGapDetected(GapType.PRACTICAL, "pace", GapSeverity.MODERATE,
                    "Slow down and stay with each checkpoint for its full pause before moving on");
            case MISSING_REFLECTIONS -> new FormationGapDetected(GapType.PRACTICAL, "reflection",
                    GapSeverity.MODERATE, "Return to the checkpoints you reached and write your reflections");
            case SURFACE_ENGAGEMENT -> new FormationGapDetected(GapType.THEOLOGICAL, "reflection depth",
                    GapSeverity.MINOR, "Answer in your own words and wrestle with the question before responding");
            case DISENGAGED -> new FormationGapDetected(GapType.RELATIONAL, "engagement", GapSeverity.CRITICAL,
                    "Reconnect with your formation community and resume where you left off");
        };
    }
}
