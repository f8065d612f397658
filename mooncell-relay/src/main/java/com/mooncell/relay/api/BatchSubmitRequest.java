package com.mooncell.relay.api;

import com.mooncell.relay.core.batch.BatchRequest;
import lombok.Data;

import java.util.List;

/**
 * links 与 link+count 二选一
 */
@Data
public class BatchSubmitRequest {
    private String owner;
    private List<String> links;
    private String link;
    private Integer count;

    public BatchRequest toBatchRequest() {
        return new BatchRequest(owner, links, link, count);
    }
}
