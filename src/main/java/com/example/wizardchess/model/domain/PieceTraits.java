package com.example.wizardchess.model.domain;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Archetype-specific payload carried by a {@link Piece}. Only the archetypes that need
 * transient state have one; the rest carry {@code null}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AssassinTraits.class, name = "assassin"),
        @JsonSubTypes.Type(value = BardTraits.class, name = "bard"),
        @JsonSubTypes.Type(value = ApprenticeTraits.class, name = "apprentice"),
        @JsonSubTypes.Type(value = DragonTraits.class, name = "dragon")
})
public abstract class PieceTraits {

    public static PieceTraits initialFor(PieceType type, String pieceId) {
        switch (type) {
            case ASSASSIN:
                return new AssassinTraits();
            case BARD:
                return new BardTraits();
            case APPRENTICE:
                return new ApprenticeTraits();
            case DRAGON:
                return new DragonTraits(pieceId);
            default:
                return null;
        }
    }
}
