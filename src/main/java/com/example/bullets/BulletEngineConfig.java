// File: src/main/java/com/example/bullets/BulletEngineConfig.java
package com.example.bullets;

import java.util.List;

/** 引擎参数：id 区间、分区盐、识别阈值、对账护栏 */
public final class BulletEngineConfig {
    public static final String DEFAULT_BULLET_STYLE_ID = "MR_BulletPoint";

    public final String bulletStyleId;
    public final int numIdBase;                 // 分配游标起点
    public final int numIdCeiling;              // 含
    public final List<int[]> reservedRanges;    // 闭区间，系统 [1,10] 与遗留 [999,1010]
    public final boolean saltEnabled;           // 无共享协调器的多 worker 分区
    public final int partitionKey;
    public final int saltModulus;
    public final int saltStride;
    public final double minConfidence;          // 符号剥离阈值
    public final long reconcileSlowMs;
    public final int reconcileMaxParagraphs;
    public final int reconcileMaxMemoryMb;
    public final int allocationRetentionHours;
    public final boolean failOnReconcileErrors;
    public final LevelFormat levelFormat;

    private BulletEngineConfig(Builder b) {
        this.bulletStyleId = b.bulletStyleId;
        this.numIdBase = b.numIdBase;
        this.numIdCeiling = b.numIdCeiling;
        this.reservedRanges = List.copyOf(b.reservedRanges);
        this.saltEnabled = b.saltEnabled;
        this.partitionKey = b.partitionKey;
        this.saltModulus = b.saltModulus;
        this.saltStride = b.saltStride;
        this.minConfidence = b.minConfidence;
        this.reconcileSlowMs = b.reconcileSlowMs;
        this.reconcileMaxParagraphs = b.reconcileMaxParagraphs;
        this.reconcileMaxMemoryMb = b.reconcileMaxMemoryMb;
        this.allocationRetentionHours = b.allocationRetentionHours;
        this.failOnReconcileErrors = b.failOnReconcileErrors;
        this.levelFormat = b.levelFormat;
        if (numIdBase < 1 || numIdCeiling < numIdBase) {
            throw new IllegalArgumentException("Invalid numId window [" + numIdBase + "," + numIdCeiling + "]");
        }
        if (saltModulus < 1) throw new IllegalArgumentException("saltModulus must be positive");
    }

    public static BulletEngineConfig defaults() {
        return new Builder().build();
    }

    /** 环境变量覆盖默认值，非法值回落默认 */
    public static BulletEngineConfig fromEnv() {
        return new Builder()
            .numIdBase(getEnvInt("BULLETS_NUMID_BASE", 100))
            .numIdCeiling(getEnvInt("BULLETS_NUMID_CEILING", 9999))
            .saltEnabled(getEnvBool("BULLETS_SALT_ENABLED", false))
            .partitionKey(getEnvInt("BULLETS_PARTITION_KEY", 0))
            .saltModulus(getEnvInt("BULLETS_SALT_MODULUS", 8))
            .saltStride(getEnvInt("BULLETS_SALT_STRIDE", 500))
            .minConfidence(getEnvDouble("BULLETS_MIN_CONFIDENCE", 0.7))
            .reconcileSlowMs(getEnvInt("BULLETS_RECONCILE_SLOW_MS", 200))
            .reconcileMaxParagraphs(getEnvInt("BULLETS_RECONCILE_MAX_PARAGRAPHS", 5000))
            .reconcileMaxMemoryMb(getEnvInt("BULLETS_RECONCILE_MAX_MEMORY_MB", 30))
            .failOnReconcileErrors(getEnvBool("BULLETS_FAIL_ON_ERRORS", false))
            .build();
    }

    /** 加盐后的分配起点 */
    public int effectiveBase() {
        if (!saltEnabled) return numIdBase;
        return numIdBase + Math.floorMod(partitionKey, saltModulus) * saltStride;
    }

    public boolean isReserved(int id) {
        for (int[] r : reservedRanges) {
            if (id >= r[0] && id <= r[1]) return true;
        }
        return false;
    }

    private static int getEnvInt(String k, int d){
        try { return Integer.parseInt(System.getenv().getOrDefault(k, String.valueOf(d)).trim()); }
        catch(Exception e){ return d; }
    }

    private static double getEnvDouble(String k, double d){
        try { return Double.parseDouble(System.getenv().getOrDefault(k, String.valueOf(d)).trim()); }
        catch(Exception e){ return d; }
    }

    private static boolean getEnvBool(String k, boolean d){
        String v = System.getenv(k);
        return v == null || v.isBlank() ? d : Boolean.parseBoolean(v.trim());
    }

    public static final class Builder {
        private String bulletStyleId = DEFAULT_BULLET_STYLE_ID;
        private int numIdBase = 100;
        private int numIdCeiling = 9999;
        private List<int[]> reservedRanges = List.of(new int[]{1, 10}, new int[]{999, 1010});
        private boolean saltEnabled = false;
        private int partitionKey = 0;
        private int saltModulus = 8;
        private int saltStride = 500;
        private double minConfidence = 0.7;
        private long reconcileSlowMs = 200;
        private int reconcileMaxParagraphs = 5000;
        private int reconcileMaxMemoryMb = 30;
        private int allocationRetentionHours = 24;
        private boolean failOnReconcileErrors = false;
        private LevelFormat levelFormat = LevelFormat.defaults();

        public Builder bulletStyleId(String v){ this.bulletStyleId=v; return this; }
        public Builder numIdBase(int v){ this.numIdBase=v; return this; }
        public Builder numIdCeiling(int v){ this.numIdCeiling=v; return this; }
        public Builder reservedRanges(List<int[]> v){ this.reservedRanges=v; return this; }
        public Builder saltEnabled(boolean v){ this.saltEnabled=v; return this; }
        public Builder partitionKey(int v){ this.partitionKey=v; return this; }
        public Builder saltModulus(int v){ this.saltModulus=v; return this; }
        public Builder saltStride(int v){ this.saltStride=v; return this; }
        public Builder minConfidence(double v){ this.minConfidence=v; return this; }
        public Builder reconcileSlowMs(long v){ this.reconcileSlowMs=v; return this; }
        public Builder reconcileMaxParagraphs(int v){ this.reconcileMaxParagraphs=v; return this; }
        public Builder reconcileMaxMemoryMb(int v){ this.reconcileMaxMemoryMb=v; return this; }
        public Builder allocationRetentionHours(int v){ this.allocationRetentionHours=v; return this; }
        public Builder failOnReconcileErrors(boolean v){ this.failOnReconcileErrors=v; return this; }
        public Builder levelFormat(LevelFormat v){ this.levelFormat=v; return this; }
        public BulletEngineConfig build(){ return new BulletEngineConfig(this); }
    }
}
