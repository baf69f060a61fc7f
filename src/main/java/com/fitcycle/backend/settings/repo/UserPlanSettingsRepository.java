package com.fitcycle.backend.settings.repo;

import com.fitcycle.backend.settings.entity.UserPlanSettings;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserPlanSettingsRepository extends JpaRepository<UserPlanSettings, Long> {
}
