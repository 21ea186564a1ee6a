package com.example.bullets;

/** 严格模式下文本含字面项目符号或内部换行 */
public class BulletSanitizationException extends BulletEngineException {

    private final String preview;

    public BulletSanitizationException(String message, String preview) {
        super(message + ": " + preview);
        this.preview = preview;
    }

    public String getPreview() {
        return preview;
    }
}
