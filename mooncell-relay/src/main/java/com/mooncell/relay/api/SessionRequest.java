package com.mooncell.relay.api;

import lombok.Data;

@Data
public class SessionRequest {
    private String requester;
    private String credential;
}
