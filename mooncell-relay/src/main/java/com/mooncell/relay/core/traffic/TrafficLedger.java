package com.mooncell.relay.core.traffic;

/**
 * 用户流量额度。同一用户的并发预留必须是原子的，不能重复扣减。
 */
public interface TrafficLedger {

    QuotaDecision checkAndReserve(String userId, long byteSize);

    /**
     * 结算一次预留：成功计入用量，失败仅释放预留。
     * 无论用量能否落库，预留都会释放，且不抛出异常
     */
    void record(String userId, long byteSize, TrafficOutcome outcome);
}
