package com.boundplan.repository;

import com.boundplan.entity.GenerationLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface GenerationLogRepository extends JpaRepository<GenerationLog, UUID> {
}
