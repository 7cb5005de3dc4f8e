package com.example.wizardchess.model.domain;

public enum TurnPhase {
    IDLE,
    SELECTED,
    AWAITING_GUARD_DECISION,
    AWAITING_WIZARD_ATTACK_CHOICE,
    AWAITING_BARD_SWAP_TARGET
}
