package com.ruach.formation.application.service;

import com.ruach.formation.domain.catalog.AxiomPrerequisite;

/**
 * Evaluation of a single axiom prerequisite against a user's state.
 */
public record PrerequisiteStatus(AxiomPrerequisite.Kind kind, String description, boolean satisfied) {
}
