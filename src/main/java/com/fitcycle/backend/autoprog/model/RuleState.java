package com.fitcycle.backend.autoprog.model;

/**
 * IDLE → DUE（間隔到了或從未套用）→ APPLIED（runOnce 寫入 ledger 並記下今天）→ 下一輪回到 IDLE。
 */
public enum RuleState {
    IDLE,
    DUE,
    APPLIED
}
