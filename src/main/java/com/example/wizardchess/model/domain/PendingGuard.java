package com.example.wizardchess.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * An attack suspended until the defending side picks a guardian paladin or declines.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PendingGuard {
    private String attackerId;
    private String targetId;
    private int targetR;
    private int targetC;
    private Side defendingSide;
    private List<String> guardianIds = new ArrayList<>();
    private AttackMode mode;

    public Point targetCell() {
        return new Point(targetR, targetC);
    }
}
