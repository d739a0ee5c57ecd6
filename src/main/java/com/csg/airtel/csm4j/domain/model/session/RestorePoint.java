package com.csg.airtel.csm4j.domain.model.session;

import java.time.Instant;

public record RestorePoint(String id, Instant timestamp, long size, String checksum) {
}
