package com.example.wizardchess.model.domain;

/**
 * How an attack is carried out once its target is fixed.
 */
public enum AttackMode {
    /** Attacker walks onto the target cell. */
    MELEE,
    /** Wizard fires along its conductor chain and stays where it is. */
    BEAM_SHOT
}
