package com.fitcycle.backend.users.service;

import com.fitcycle.backend.users.entity.User;
import com.fitcycle.backend.users.repo.UserRepo;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.NoSuchElementException;
import java.util.Objects;

@RequiredArgsConstructor
@Service
public class UserService {

    private final UserRepo users;

    /**
     * 依 Telegram id 取得或建立使用者；名字 / chat_id 有變就順手更新。
     * 兩個請求同時建立時，輸的那個撞 unique 後改讀。
     */
    public User getOrCreate(Long tgId, String name, Long chatId) {
        if (tgId == null) throw new IllegalArgumentException("TG_ID_REQUIRED");

        var existing = users.findByTgId(tgId);
        if (existing.isPresent()) {
            User u = existing.get();
            boolean dirty = false;
            if (name != null && !Objects.equals(name, u.getName())) { u.setName(name); dirty = true; }
            if (chatId != null && !Objects.equals(chatId, u.getChatId())) { u.setChatId(chatId); dirty = true; }
            return dirty ? users.save(u) : u;
        }

        User u = new User();
        u.setTgId(tgId);
        u.setName(name);
        u.setChatId(chatId != null ? chatId : tgId);
        try {
            return users.save(u);
        } catch (DataIntegrityViolationException race) {
            return users.findByTgId(tgId).orElseThrow(() -> race);
        }
    }

    public User getOrThrow(Long userId) {
        return users.findById(userId).orElseThrow(() -> new NoSuchElementException("USER_NOT_FOUND"));
    }
}
