package com.csg.airtel.csm4j.domain.model;

public record RestoreRequest(String snapshotId) {
}
