package com.example.bullets;

/** 对账无法开始（文档树不可扫描或修复目标无定义） */
public class ReconciliationException extends BulletEngineException {

    public ReconciliationException(String message) {
        super(message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
