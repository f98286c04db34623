package com.programmersdiary.crondaemon.web;

import com.programmersdiary.crondaemon.command.StatusReport;
import com.programmersdiary.crondaemon.command.StatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/status")
public class StatusController {

    private final StatusService statusService;

    public StatusController(StatusService statusService) {
        this.statusService = statusService;
    }

    @GetMapping
    public StatusReport status() {
        return statusService.status();
    }
}
