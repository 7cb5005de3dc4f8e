package com.example.wizardchess.model.domain;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Where the current turn stands. Each phase carries only the payload it needs.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "phase")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IdleTurn.class, name = "IDLE"),
        @JsonSubTypes.Type(value = SelectedTurn.class, name = "SELECTED"),
        @JsonSubTypes.Type(value = GuardDecisionTurn.class, name = "AWAITING_GUARD_DECISION"),
        @JsonSubTypes.Type(value = WizardAttackChoiceTurn.class, name = "AWAITING_WIZARD_ATTACK_CHOICE"),
        @JsonSubTypes.Type(value = BardSwapTurn.class, name = "AWAITING_BARD_SWAP_TARGET")
})
public abstract class TurnState {

    public abstract TurnPhase getPhase();
}
