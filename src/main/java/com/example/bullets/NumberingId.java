package com.example.bullets;

import java.util.Objects;

/** 一对 (numId, abstractNumId) */
public final class NumberingId {
    public final int numId;
    public final int abstractNumId;

    public NumberingId(int numId, int abstractNumId) {
        this.numId = numId;
        this.abstractNumId = abstractNumId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NumberingId)) return false;
        NumberingId that = (NumberingId) o;
        return numId == that.numId && abstractNumId == that.abstractNumId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(numId, abstractNumId);
    }

    @Override
    public String toString() {
        return "numId=" + numId + "/abstractNumId=" + abstractNumId;
    }
}
