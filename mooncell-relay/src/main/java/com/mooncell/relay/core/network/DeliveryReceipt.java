package com.mooncell.relay.core.network;

import lombok.Value;

@Value
public class DeliveryReceipt {
    String target;
    String deliveredMessageId;
    DeliveryPath path;
}
