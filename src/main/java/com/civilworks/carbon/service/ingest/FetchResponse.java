package com.civilworks.carbon.service.ingest;

/** Status code and body text of one completed GET, whatever the status. */
public class FetchResponse {
    private final int status;
    private final String body;

    public FetchResponse(int status, String body) {
        this.status = status;
        this.body = body == null ? "" : body;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    public boolean isOk() {
        return status == 200;
    }
}
