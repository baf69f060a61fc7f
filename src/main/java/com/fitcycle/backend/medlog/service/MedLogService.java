package com.fitcycle.backend.medlog.service;

import com.fitcycle.backend.medlog.dto.AddMedLogRequest;
import com.fitcycle.backend.medlog.dto.MedLogItemDto;
import com.fitcycle.backend.medlog.entity.MedLog;
import com.fitcycle.backend.medlog.repo.MedLogRepo;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import java.util.NoSuchElementException;

@Service
@RequiredArgsConstructor
public class MedLogService {

    public static final int LATEST_LIMIT = 50;
    private static final int NAME_MAX = 120;
    private static final int NOTE_MAX = 500;

    private final MedLogRepo repo;

    @Transactional
    public MedLogItemDto add(Long userId, AddMedLogRequest req, LocalDate today) {
        if (req == null) throw new IllegalArgumentException("BODY_REQUIRED");

        MedLog m = new MedLog();
        m.setUserId(userId);
        m.setLogDate(req.logDate() != null ? req.logDate() : today);
        m.setName(requireName(req.name()));
        m.setAmountMg(amount(req.amountMg(), "AMOUNT_MG"));
        m.setAmountMl(amount(req.amountMl(), "AMOUNT_ML"));
        m.setNote(cleanNote(req.note()));
        return MedLogItemDto.of(repo.save(m));
    }

    @Transactional(readOnly = true)
    public List<MedLogItemDto> latest(Long userId) {
        return repo.findLatest(userId, PageRequest.of(0, LATEST_LIMIT)).stream()
                .map(MedLogItemDto::of)
                .toList();
    }

    @Transactional
    public void delete(Long userId, Long id) {
        MedLog m = repo.findByIdAndUserId(id, userId)
                .orElseThrow(() -> new NoSuchElementException("MED_LOG_NOT_FOUND"));
        repo.delete(m);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("MED_NAME_REQUIRED");
        String t = name.trim();
        if (t.length() > NAME_MAX) throw new IllegalArgumentException("MED_NAME_TOO_LONG");
        return t;
    }

    private static BigDecimal amount(BigDecimal v, String field) {
        if (v == null) return null;
        if (v.signum() < 0) throw new IllegalArgumentException(field + "_INVALID");
        return v.setScale(2, RoundingMode.HALF_UP);
    }

    private static String cleanNote(String note) {
        if (note == null) return null;
        String t = note.trim();
        if (t.isEmpty()) return null;
        if (t.length() > NOTE_MAX) throw new IllegalArgumentException("NOTE_TOO_LONG");
        return t;
    }
}
