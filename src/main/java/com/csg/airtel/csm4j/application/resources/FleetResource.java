package com.csg.airtel.csm4j.application.resources;

import com.csg.airtel.csm4j.application.scheduler.ReconciliationScheduler;
import com.csg.airtel.csm4j.domain.model.FleetMetrics;
import com.csg.airtel.csm4j.domain.model.HealthReport;
import com.csg.airtel.csm4j.domain.model.response.ApiResponse;
import com.csg.airtel.csm4j.domain.service.FleetMetricsService;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import java.util.Map;

@Path("/")
@Produces(MediaType.APPLICATION_JSON)
public class FleetResource {

    private final FleetMetricsService fleetMetricsService;
    private final ReconciliationScheduler reconciliationScheduler;

    @Inject
    public FleetResource(FleetMetricsService fleetMetricsService, ReconciliationScheduler reconciliationScheduler) {
        this.fleetMetricsService = fleetMetricsService;
        this.reconciliationScheduler = reconciliationScheduler;
    }

    @GET
    @Path("metrics")
    public Uni<ApiResponse<FleetMetrics>> metrics() {
        return fleetMetricsService.metrics()
                .onItem().transform(metrics -> ApiResponse.of("Fleet metrics", metrics));
    }

    @POST
    @Path("cleanup")
    public Uni<ApiResponse<Map<String, Integer>>> cleanup() {
        return reconciliationScheduler.runCleanup()
                .onItem().transform(purged -> ApiResponse.of("Cleanup completed", Map.of("purged", purged)));
    }

    @GET
    @Path("health")
    public Uni<ApiResponse<HealthReport>> health() {
        return fleetMetricsService.health()
                .onItem().transform(health -> ApiResponse.of("Health " + health.status(), health));
    }
}
