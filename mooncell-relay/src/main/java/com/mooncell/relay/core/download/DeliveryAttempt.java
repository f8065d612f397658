package com.mooncell.relay.core.download;

import com.mooncell.relay.core.network.DeliveryPath;
import com.mooncell.relay.core.network.DeliveryReceipt;
import com.mooncell.relay.core.network.UpstreamException;
import lombok.Value;

@Value
public class DeliveryAttempt {
    DeliveryPath path;
    DeliveryReceipt receipt;
    UpstreamException error;

    public static DeliveryAttempt succeeded(DeliveryPath path, DeliveryReceipt receipt) {
        return new DeliveryAttempt(path, receipt, null);
    }

    public static DeliveryAttempt failed(DeliveryPath path, UpstreamException error) {
        return new DeliveryAttempt(path, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
