package com.mooncell.relay.core.batch;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 批量请求：显式给出链接列表，或者给出起始链接与条数
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchRequest {
    private String owner;
    private List<String> links;
    private String link;
    private Integer count;

    public static BatchRequest ofLinks(String owner, List<String> links) {
        return new BatchRequest(owner, links, null, null);
    }

    public static BatchRequest ofRange(String owner, String link, int count) {
        return new BatchRequest(owner, null, link, count);
    }

    public boolean isRange() {
        return (links == null || links.isEmpty()) && link != null && count != null;
    }
}
