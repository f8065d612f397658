package com.mooncell.relay.api;

import lombok.Data;

@Data
public class RelayRequest {
    private String requester;
    private String link;
}
