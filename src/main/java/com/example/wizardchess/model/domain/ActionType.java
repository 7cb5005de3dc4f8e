package com.example.wizardchess.model.domain;

public enum ActionType {
    MOVE,
    SWAP,
    ATTACK
}
