package com.example.bullets;

import java.util.List;

/** 修复结果：新的包字节与逐条处理记录 */
public final class RepairReport {

    public enum Outcome { REPAIRED, SKIPPED, FAILED }

    /** 对单个问题的处理 */
    public static final class Action {
        public final StructuralIssue issue;
        public final Outcome outcome;
        public final String message;

        Action(StructuralIssue issue, Outcome outcome, String message) {
            this.issue = issue;
            this.outcome = outcome;
            this.message = message;
        }

        @Override
        public String toString() {
            return outcome + " " + issue.kind + " " + issue.partName + issue.path + ": " + message;
        }
    }

    public final byte[] bytes;
    public final List<Action> actions;

    RepairReport(byte[] bytes, List<Action> actions) {
        this.bytes = bytes;
        this.actions = List.copyOf(actions);
    }

    public long count(Outcome outcome) {
        return actions.stream().filter(a -> a.outcome == outcome).count();
    }
}
