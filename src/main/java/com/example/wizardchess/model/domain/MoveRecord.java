package com.example.wizardchess.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One resolved turn in three redaction variants.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MoveRecord {
    private int turn;
    private Side side;
    private String full;
    private String whiteView;
    private String blackView;
    private long timestamp;

    public String viewFor(Side viewer) {
        switch (viewer) {
            case WHITE:
                return whiteView;
            case BLACK:
                return blackView;
            default:
                return full;
        }
    }
}
