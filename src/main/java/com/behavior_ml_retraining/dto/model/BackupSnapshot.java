package com.behavior_ml_retraining.dto.model;

import java.nio.file.Path;
import java.time.Instant;

public record BackupSnapshot(String id, Instant createdAt, Path path) {}
