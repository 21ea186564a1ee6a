package com.example.bullets;

/** 引擎异常基类 */
public class BulletEngineException extends RuntimeException {

    public BulletEngineException(String message) {
        super(message);
    }

    public BulletEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
