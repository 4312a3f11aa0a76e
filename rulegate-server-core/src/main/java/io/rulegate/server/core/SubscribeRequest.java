package io.rulegate.server.core;

/**
 * JSON body of a subscribe call.
 */
public final class SubscribeRequest {
    private String clientId;
    private String collection;
    private String recordId;
    private String filter;

    public SubscribeRequest() {
    }

    public SubscribeRequest(String clientId, String collection, String recordId, String filter) {
        this.clientId = clientId;
        this.collection = collection;
        this.recordId = recordId;
        this.filter = filter;
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public String getCollection() {
        return collection;
    }

    public void setCollection(String collection) {
        this.collection = collection;
    }

    public String getRecordId() {
        return recordId;
    }

    public void setRecordId(String recordId) {
        this.recordId = recordId;
    }

    public String getFilter() {
        return filter;
    }

    public void setFilter(String filter) {
        this.filter = filter;
    }
}
