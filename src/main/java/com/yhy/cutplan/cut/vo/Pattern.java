package com.yhy.cutplan.cut.vo;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 一根原料上的切割模式。
 * 锯缝按 (段数 - 1) 计：只切一段时不计锯缝。
 */
@Value
@Builder
@Jacksonized
public class Pattern {
    double stockLength;
    double kerf;
    @Singular
    List<PatternItem> items;

    public int getPieceCount() {
        int n = 0;
        for (PatternItem item : items) n += item.getQuantity();
        return n;
    }

    public double getPiecesLength() {
        double s = 0;
        for (PatternItem item : items) s += item.getLength() * item.getQuantity();
        return s;
    }

    public double getKerfLoss() {
        return kerf * Math.max(0, getPieceCount() - 1);
    }

    public double getUsedLength() {
        return getPiecesLength() + getKerfLoss();
    }

    public double getWaste() {
        return stockLength - getUsedLength();
    }

    public double getLongestPiece() {
        double max = 0;
        for (PatternItem item : items) max = Math.max(max, item.getLength());
        return max;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return getPieceCount() == 0;
    }
}
