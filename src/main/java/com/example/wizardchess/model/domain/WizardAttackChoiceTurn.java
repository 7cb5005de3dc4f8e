package com.example.wizardchess.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * The beam target is also a plain neighbour: the player picks a stationary shot or a melee step.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class WizardAttackChoiceTurn extends TurnState {
    private String wizardId;
    private int targetR;
    private int targetC;

    public Point targetCell() {
        return new Point(targetR, targetC);
    }

    @Override
    public TurnPhase getPhase() {
        return TurnPhase.AWAITING_WIZARD_ATTACK_CHOICE;
    }
}
