package com.example.bullets;

/** 天花板以下没有可用 numId */
public class AllocationExhaustedException extends BulletEngineException {

    private final String documentId;
    private final int ceiling;

    public AllocationExhaustedException(String documentId, int ceiling) {
        super(String.format("No free numId below %d for document '%s'", ceiling, documentId));
        this.documentId = documentId;
        this.ceiling = ceiling;
    }

    public String getDocumentId() {
        return documentId;
    }

    public int getCeiling() {
        return ceiling;
    }
}
