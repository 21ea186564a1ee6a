// File: src/main/java/com/example/bullets/NumIdAllocator.java
package com.example.bullets;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 进程级 numId 分配器。
 * 每个文档一个可移动游标，从（加盐后的）起点向前扫描，跳过保留区间、已占用 id 与文档中已存在的 id。
 * 所有修改在同一把锁下完成。
 */
@Slf4j
public class NumIdAllocator {

    private final BulletEngineConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, DocumentAllocations> documents = new HashMap<>();
    private final List<BulletAllocationRecord> ledger = new ArrayList<>();

    private long totalAllocations;
    private long collisionsDetected;
    private long collisionsResolved;

    /** 单个文档的占用情况 */
    private static final class DocumentAllocations {
        final Map<Integer, BulletAllocationRecord> active = new LinkedHashMap<>();
        final Map<String, Integer> styleIds = new HashMap<>();
        final Set<Integer> existingNumIds = new HashSet<>();
        final Set<Integer> existingAbstractIds = new HashSet<>();
        final Set<Integer> usedAbstractIds = new HashSet<>();
        int cursor;

        DocumentAllocations(int cursor) { this.cursor = cursor; }
    }

    public NumIdAllocator(BulletEngineConfig config) {
        this(config, Clock.systemUTC());
    }

    public NumIdAllocator(BulletEngineConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        if (config.saltEnabled) {
            log.info("NumId salt enabled: partition {} -> base {}", config.partitionKey, config.effectiveBase());
        }
    }

    /**
     * 为 (文档, 分区) 分配编号；styleName 已映射到活跃 id 时直接复用。
     */
    public NumberingId allocate(String documentId, String sectionName, String styleName) {
        lock.lock();
        try {
            DocumentAllocations d = documents.computeIfAbsent(documentId, k -> new DocumentAllocations(config.effectiveBase()));

            if (styleName != null) {
                Integer mapped = d.styleIds.get(styleName);
                BulletAllocationRecord rec = mapped == null ? null : d.active.get(mapped);
                if (rec != null && rec.isActive()) {
                    log.debug("Reusing numId {} for style '{}' in {}", rec.numId, styleName, documentId);
                    return rec.toNumberingId();
                }
            }

            int numId = nextFreeNumId(documentId, d);
            int abstractId = nextFreeAbstractId(documentId, d, numId);
            BulletAllocationRecord rec = new BulletAllocationRecord(
                    documentId, numId, abstractId, sectionName, styleName, clock.instant());
            d.active.put(numId, rec);
            d.usedAbstractIds.add(abstractId);
            if (styleName != null) d.styleIds.put(styleName, numId);
            ledger.add(rec);
            totalAllocations++;
            log.debug("Allocated {} for section '{}' in {}", rec.toNumberingId(), sectionName, documentId);
            return rec.toNumberingId();
        } finally {
            lock.unlock();
        }
    }

    /** 登记文档里已有的 id；游标移到已有 numId 之后 */
    public void reserveExisting(String documentId, Collection<Integer> numIds, Collection<Integer> abstractNumIds) {
        lock.lock();
        try {
            DocumentAllocations d = documents.computeIfAbsent(documentId, k -> new DocumentAllocations(config.effectiveBase()));
            d.existingNumIds.addAll(numIds);
            d.existingAbstractIds.addAll(abstractNumIds);
            int highest = numIds.stream().mapToInt(Integer::intValue).max().orElse(0);
            if (highest >= d.cursor && highest < config.numIdCeiling) d.cursor = highest + 1;
            if (!numIds.isEmpty()) {
                log.debug("Reserved {} existing numIds in {}, cursor at {}", numIds.size(), documentId, d.cursor);
            }
        } finally {
            lock.unlock();
        }
    }

    private int nextFreeNumId(String documentId, DocumentAllocations d) {
        int base = config.effectiveBase();
        int found = scan(d, d.cursor, config.numIdCeiling);
        if (found < 0) found = scan(d, Math.min(base, d.cursor), d.cursor - 1);
        if (found < 0) throw new AllocationExhaustedException(documentId, config.numIdCeiling);
        d.cursor = found + 1;
        return found;
    }

    private int scan(DocumentAllocations d, int from, int to) {
        for (int id = Math.max(from, 1); id <= to; id++) {
            if (config.isReserved(id)) continue;
            if (d.active.containsKey(id) || d.existingNumIds.contains(id)) continue;
            return id;
        }
        return -1;
    }

    private int nextFreeAbstractId(String documentId, DocumentAllocations d, int preferred) {
        for (int id = preferred; id <= config.numIdCeiling; id++) {
            if (!d.usedAbstractIds.contains(id) && !d.existingAbstractIds.contains(id)) return id;
        }
        for (int id = 0; id < preferred; id++) {
            if (!d.usedAbstractIds.contains(id) && !d.existingAbstractIds.contains(id)) return id;
        }
        throw new AllocationExhaustedException(documentId, config.numIdCeiling);
    }

    /** 释放文档全部分配，返回释放条数 */
    public int release(String documentId) {
        lock.lock();
        try {
            DocumentAllocations d = documents.remove(documentId);
            if (d == null) return 0;
            for (BulletAllocationRecord rec : d.active.values()) rec.setStatus(BulletAllocationRecord.Status.RELEASED);
            int n = d.active.size();
            log.debug("Released {} allocations for {}", n, documentId);
            return n;
        } finally {
            lock.unlock();
        }
    }

    public List<AllocationCollision> detectCollisions() {
        lock.lock();
        try {
            List<AllocationCollision> found = new ArrayList<>();

            Map<String, Map<Integer, Integer>> perDoc = new HashMap<>();
            Map<Integer, Set<String>> docsByNumId = new TreeMap<>();
            for (BulletAllocationRecord rec : ledger) {
                if (!rec.isActive()) continue;
                perDoc.computeIfAbsent(rec.documentId, k -> new HashMap<>()).merge(rec.numId, 1, Integer::sum);
                docsByNumId.computeIfAbsent(rec.numId, k -> new HashSet<>()).add(rec.documentId);
                if (config.isReserved(rec.numId)) {
                    found.add(new AllocationCollision(AllocationCollision.Kind.RESERVED_RANGE, rec.numId,
                            List.of(rec.documentId), "numId " + rec.numId + " lies in a reserved range"));
                }
            }
            perDoc.forEach((doc, counts) -> counts.forEach((numId, n) -> {
                if (n > 1) {
                    log.error("Allocator produced duplicate active numId {} in {}", numId, doc);
                    found.add(new AllocationCollision(AllocationCollision.Kind.SAME_DOCUMENT, numId,
                            List.of(doc), n + " active records share numId " + numId));
                }
            }));
            docsByNumId.forEach((numId, docs) -> {
                if (docs.size() > 1) {
                    found.add(new AllocationCollision(AllocationCollision.Kind.CROSS_DOCUMENT, numId,
                            new ArrayList<>(docs), "numId " + numId + " active in " + docs.size() + " documents"));
                }
            });
            collisionsDetected += found.size();
            return found;
        } finally {
            lock.unlock();
        }
    }

    /** 预留区间 → 记录作废；跨文档 → 仅提示；同文档 → 无法自动解决 */
    public boolean resolve(AllocationCollision collision) {
        lock.lock();
        try {
            switch (collision.kind) {
                case RESERVED_RANGE: {
                    for (String docId : collision.documentIds) {
                        DocumentAllocations d = documents.get(docId);
                        if (d == null) continue;
                        BulletAllocationRecord rec = d.active.remove(collision.numId);
                        if (rec != null) {
                            rec.setStatus(BulletAllocationRecord.Status.EXPIRED);
                            d.styleIds.values().removeIf(id -> id == collision.numId);
                        }
                    }
                    collisionsResolved++;
                    log.warn("Expired reserved-range allocation {}", collision.numId);
                    return true;
                }
                case CROSS_DOCUMENT:
                    collisionsResolved++;
                    log.info("numId {} shared across {} documents; keeping all (ids are per document)",
                            collision.numId, collision.documentIds.size());
                    return true;
                default:
                    log.error("Cannot resolve {}", collision);
                    return false;
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isValid(int numId, String documentId) {
        lock.lock();
        try {
            if (config.isReserved(numId) || numId < 1 || numId > config.numIdCeiling) return false;
            DocumentAllocations d = documents.get(documentId);
            return d == null || (!d.active.containsKey(numId) && !d.existingNumIds.contains(numId));
        } finally {
            lock.unlock();
        }
    }

    public List<BulletAllocationRecord> recordsFor(String documentId) {
        lock.lock();
        try {
            List<BulletAllocationRecord> out = new ArrayList<>();
            for (BulletAllocationRecord rec : ledger) {
                if (rec.documentId.equals(documentId)) out.add(rec);
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    /** 清掉保留期外的已释放/作废记录 */
    public int cleanupExpired(Duration retention) {
        lock.lock();
        try {
            Instant cutoff = clock.instant().minus(retention);
            int removed = 0;
            for (Iterator<BulletAllocationRecord> it = ledger.iterator(); it.hasNext(); ) {
                BulletAllocationRecord rec = it.next();
                if (!rec.isActive() && rec.allocatedAt.isBefore(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
            if (removed > 0) log.info("Dropped {} stale allocation records", removed);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public int cleanupExpired() {
        return cleanupExpired(Duration.ofHours(config.allocationRetentionHours));
    }

    public Map<String, Object> summary() {
        lock.lock();
        try {
            Map<String, Object> m = new LinkedHashMap<>();
            long active = ledger.stream().filter(BulletAllocationRecord::isActive).count();
            m.put("totalAllocations", totalAllocations);
            m.put("activeAllocations", active);
            m.put("ledgerSize", ledger.size());
            m.put("documentsTracked", documents.size());
            m.put("collisionsDetected", collisionsDetected);
            m.put("collisionsResolved", collisionsResolved);
            m.put("effectiveBase", config.effectiveBase());
            return m;
        } finally {
            lock.unlock();
        }
    }
}
