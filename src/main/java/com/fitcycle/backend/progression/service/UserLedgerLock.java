package com.fitcycle.backend.progression.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 每個 userId 一把鎖：手動 override 與 autoprog 同時寫同一個動作時，
 * 後拿到鎖的人勝出（last-write-wins 是明確的，不是碰運氣）。
 *
 * 鎖用參考計數管理，最後一個持有者離開就從 map 移除；計數只在 compute 內異動。
 * 注意：只在單一 process 內有效；多機部署還是靠 DB unique + transaction。
 */
@Component
public class UserLedgerLock {

    private static final class Holder {
        final ReentrantLock lock = new ReentrantLock();
        int users; // 只在 locks.compute 內讀寫
    }

    private final ConcurrentHashMap<Long, Holder> locks = new ConcurrentHashMap<>();

    public <T> T withLock(Long userId, Supplier<T> action) {
        if (userId == null) throw new IllegalArgumentException("USER_ID_REQUIRED");

        Holder h = locks.compute(userId, (k, cur) -> {
            Holder x = (cur == null) ? new Holder() : cur;
            x.users++;
            return x;
        });
        try {
            h.lock.lock();
            try {
                return action.get();
            } finally {
                h.lock.unlock();
            }
        } finally {
            locks.computeIfPresent(userId, (k, cur) -> (--cur.users == 0) ? null : cur);
        }
    }

    public void withLock(Long userId, Runnable action) {
        withLock(userId, () -> {
            action.run();
            return null;
        });
    }

    /** 目前還留在 map 裡的使用者數 */
    int trackedUsers() {
        return locks.size();
    }
}
