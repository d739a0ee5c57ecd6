package com.csg.airtel.csm4j.domain.model;

import java.util.List;

public record SessionListResponse(List<SessionView> sessions, int total, int limit) {
}
