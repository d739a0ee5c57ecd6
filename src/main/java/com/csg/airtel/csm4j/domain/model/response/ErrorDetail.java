package com.csg.airtel.csm4j.domain.model.response;

public record ErrorDetail(String code, String description) {
}
