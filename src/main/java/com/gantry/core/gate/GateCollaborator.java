package com.gantry.core.gate;

import com.gantry.core.model.GateResult;

/**
 * External check (CI, policy, hygiene) run against a finished job.
 * Implementations report, they never decide: judging is the verdict engine's job.
 */
public interface GateCollaborator {

    GateResult run(GateProperties.GateDefinition gate, GateContext context);
}
