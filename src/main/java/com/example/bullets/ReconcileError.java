package com.example.bullets;

/** 单个段落修复失败 */
public final class ReconcileError {
    public final String location;
    public final BulletErrorCategory category;
    public final String message;

    ReconcileError(String location, BulletErrorCategory category, String message) {
        this.location = location;
        this.category = category;
        this.message = message;
    }

    @Override
    public String toString() {
        return category + " at " + location + ": " + message;
    }
}
