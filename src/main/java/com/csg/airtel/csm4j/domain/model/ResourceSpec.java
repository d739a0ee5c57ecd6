package com.csg.airtel.csm4j.domain.model;

/**
 * Requested reservation per resource kind. Memory and disk are in bytes, cpu in
 * cores, gpu in devices. Absent entries keep their current (or default) value.
 */
public record ResourceSpec(Quota cpu, Quota memory, Quota disk, Quota gpu) {

    public record Quota(Double allocated, Double limit) {
    }
}
