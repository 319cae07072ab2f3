package com.gantry.core.board;

import com.gantry.core.model.Lane;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Derives a task's lane: explicit hint, then area mapping, then priority.
 * Escalation lanes are never assigned here.
 */
@Component
public class LaneRouter {

    private final LaneProperties properties;

    public LaneRouter(LaneProperties properties) {
        this.properties = properties;
    }

    /**
     * @throws IllegalArgumentException for unknown or escalation lane hints
     */
    public Lane route(String laneHint, String area, int priority) {
        if (laneHint != null && !laneHint.isBlank()) {
            Lane hinted = Lane.parse(laneHint);
            if (hinted.escalation()) {
                throw new IllegalArgumentException("Lane " + hinted.key() + " cannot be requested");
            }
            return hinted;
        }
        if (area != null && !area.isBlank()) {
            String mapped = properties.getAreaLanes().get(area.trim().toLowerCase(Locale.ROOT));
            if (mapped != null) {
                Lane lane = Lane.parse(mapped);
                if (!lane.escalation()) {
                    return lane;
                }
            }
        }
        return priority <= properties.getUrgentPriority() ? Lane.FASTLANE : Lane.MAINLANE;
    }

    public int defaultPriority() {
        return properties.getDefaultPriority();
    }
}
