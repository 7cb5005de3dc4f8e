package com.example.wizardchess.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class AssassinTraits extends PieceTraits {
    private boolean stealthed;
    // stealth lapses at the handoff that ends this side's turn
    private Side stealthExpiresOn;
}
