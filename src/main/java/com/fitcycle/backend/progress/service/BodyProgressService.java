package com.fitcycle.backend.progress.service;

import com.fitcycle.backend.progress.dto.AddProgressRequest;
import com.fitcycle.backend.progress.dto.ProgressItemDto;
import com.fitcycle.backend.progress.dto.UpdateProgressRequest;
import com.fitcycle.backend.progress.entity.BodyProgressLog;
import com.fitcycle.backend.progress.repo.BodyProgressLogRepo;
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
public class BodyProgressService {

    public static final int LATEST_LIMIT = 50;
    private static final int NOTE_MAX = 500;

    private final BodyProgressLogRepo repo;

    @Transactional
    public ProgressItemDto add(Long userId, AddProgressRequest req, LocalDate today) {
        if (req == null) throw new IllegalArgumentException("BODY_REQUIRED");

        BodyProgressLog p = new BodyProgressLog();
        p.setUserId(userId);
        p.setLogDate(req.logDate() != null ? req.logDate() : today);
        p.setWeight(requirePositive(req.weight(), "WEIGHT"));
        p.setWaist(requirePositive(req.waist(), "WAIST"));
        p.setBelly(requirePositive(req.belly(), "BELLY"));
        p.setBiceps(requirePositive(req.biceps(), "BICEPS"));
        p.setChest(requirePositive(req.chest(), "CHEST"));
        p.setNote(cleanNote(req.note()));
        return ProgressItemDto.of(repo.save(p));
    }

    @Transactional(readOnly = true)
    public List<ProgressItemDto> latest(Long userId) {
        return repo.findLatest(userId, PageRequest.of(0, LATEST_LIMIT)).stream()
                .map(ProgressItemDto::of)
                .toList();
    }

    /** 沒給任何欄位 = 原樣回傳 */
    @Transactional
    public ProgressItemDto update(Long userId, Long id, UpdateProgressRequest req) {
        BodyProgressLog p = repo.findByIdAndUserId(id, userId)
                .orElseThrow(() -> new NoSuchElementException("PROGRESS_NOT_FOUND"));
        if (req == null) return ProgressItemDto.of(p);

        if (req.logDate() != null) p.setLogDate(req.logDate());
        if (req.weight() != null) p.setWeight(requirePositive(req.weight(), "WEIGHT"));
        if (req.waist() != null) p.setWaist(requirePositive(req.waist(), "WAIST"));
        if (req.belly() != null) p.setBelly(requirePositive(req.belly(), "BELLY"));
        if (req.biceps() != null) p.setBiceps(requirePositive(req.biceps(), "BICEPS"));
        if (req.chest() != null) p.setChest(requirePositive(req.chest(), "CHEST"));
        if (req.note() != null) p.setNote(cleanNote(req.note()));

        return ProgressItemDto.of(repo.save(p));
    }

    private static BigDecimal requirePositive(BigDecimal v, String field) {
        if (v == null) throw new IllegalArgumentException(field + "_REQUIRED");
        if (v.signum() <= 0) throw new IllegalArgumentException(field + "_INVALID");
        return v.setScale(1, RoundingMode.HALF_UP);
    }

    private static String cleanNote(String note) {
        if (note == null) return null;
        String t = note.trim();
        if (t.isEmpty()) return null;
        if (t.length() > NOTE_MAX) throw new IllegalArgumentException("NOTE_TOO_LONG");
        return t;
    }
}
