package com.gantry.dispatch.api;

import com.gantry.core.admission.LaneSnapshot;
import com.gantry.core.health.OpsStatus;
import com.gantry.core.health.OpsStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/ops")
public class OpsController {

    private final OpsStatusService opsStatusService;

    public OpsController(OpsStatusService opsStatusService) {
        this.opsStatusService = opsStatusService;
    }

    @GetMapping("/status")
    public OpsStatus status() {
        return opsStatusService.status();
    }

    @GetMapping("/lanes")
    public List<LaneSnapshot> lanes() {
        return opsStatusService.lanes();
    }
}
